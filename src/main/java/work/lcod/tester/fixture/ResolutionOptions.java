package work.lcod.tester.fixture;

import java.util.Objects;

/**
 * Knobs for {@link FixtureResolver}.
 */
public record ResolutionOptions(CachePolicy cachePolicy, boolean detectCycles, int maxDepth) {
    public static final int DEFAULT_MAX_DEPTH = 256;

    public ResolutionOptions {
        Objects.requireNonNull(cachePolicy, "cachePolicy");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
    }

    public static ResolutionOptions defaults() {
        return new ResolutionOptions(CachePolicy.NONE, true, DEFAULT_MAX_DEPTH);
    }

    public ResolutionOptions withCachePolicy(CachePolicy policy) {
        return new ResolutionOptions(policy, detectCycles, maxDepth);
    }

    public ResolutionOptions withDetectCycles(boolean detect) {
        return new ResolutionOptions(cachePolicy, detect, maxDepth);
    }

    public ResolutionOptions withMaxDepth(int depth) {
        return new ResolutionOptions(cachePolicy, detectCycles, depth);
    }
}
