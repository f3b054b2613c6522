package work.lcod.tester.fixture;

import java.util.Objects;

/**
 * Result of a resource-scoped fixture's setup phase: the value handed to dependents plus the
 * teardown to run once the test is finished with it.
 */
public record Scope(Object value, Teardown teardown) {
    public Scope {
        Objects.requireNonNull(teardown, "teardown");
    }

    public static Scope of(Object value, Teardown teardown) {
        return new Scope(value, teardown);
    }

    /**
     * Scope whose teardown closes the resource itself.
     */
    public static Scope closing(AutoCloseable resource) {
        return new Scope(resource, () -> {
            if (resource != null) {
                resource.close();
            }
        });
    }

    @FunctionalInterface
    public interface Teardown {
        void run() throws Exception;
    }
}
