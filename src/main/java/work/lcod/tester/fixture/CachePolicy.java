package work.lcod.tester.fixture;

import java.util.Locale;

/**
 * Whether a fixture referenced several times within one test is invoked once or on every reference.
 */
public enum CachePolicy {
    /** Every reference invokes the fixture again. */
    NONE,
    /** One activation per fixture name for the duration of a test. */
    PER_TEST;

    public static CachePolicy from(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return CachePolicy.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported cache policy: " + value);
        }
    }
}
