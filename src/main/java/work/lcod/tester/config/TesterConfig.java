package work.lcod.tester.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.tester.fixture.ResolutionOptions;
import work.lcod.tester.module.TestFileDiscovery;

/**
 * Project settings read from {@code tester.toml}; every field has a default.
 */
public record TesterConfig(List<String> patterns, ResolutionOptions resolution, Optional<Path> source) {
    public TesterConfig {
        patterns = patterns == null || patterns.isEmpty() ? TestFileDiscovery.DEFAULT_PATTERNS : List.copyOf(patterns);
        Objects.requireNonNull(resolution, "resolution");
        Objects.requireNonNull(source, "source");
    }

    public static TesterConfig defaults() {
        return new TesterConfig(TestFileDiscovery.DEFAULT_PATTERNS, ResolutionOptions.defaults(), Optional.empty());
    }
}
