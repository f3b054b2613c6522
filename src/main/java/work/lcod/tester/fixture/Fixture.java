package work.lcod.tester.fixture;

import java.util.Objects;

/**
 * A named provider that tests and other fixtures request by parameter name.
 */
public final class Fixture {
    private final String name;
    private final Signature signature;
    private final Invocable body;

    public Fixture(String name, Signature signature, Invocable body) {
        this.name = Objects.requireNonNull(name, "name");
        this.signature = signature == null ? Signature.empty() : signature;
        this.body = Objects.requireNonNull(body, "body");
    }

    /**
     * Fixture returning a single value; nothing to tear down.
     */
    public static Fixture simple(String name, Signature signature, Invocable body) {
        return new Fixture(name, signature, body);
    }

    /**
     * Fixture with a setup phase and a deferred teardown phase.
     */
    public static Fixture scoped(String name, Signature signature, ScopedBody body) {
        Objects.requireNonNull(body, "body");
        return new Fixture(name, signature, args -> Objects.requireNonNull(body.setUp(args), "scope"));
    }

    /**
     * Fixture whose value is an {@link AutoCloseable} closed at teardown.
     */
    public static Fixture resource(String name, Signature signature, ResourceBody body) {
        Objects.requireNonNull(body, "body");
        return new Fixture(name, signature, args -> Scope.closing(body.open(args)));
    }

    public String name() {
        return name;
    }

    public Signature signature() {
        return signature;
    }

    Object invoke(Arguments args) throws Exception {
        return body.invoke(args);
    }

    @Override
    public String toString() {
        return name + signature;
    }

    @FunctionalInterface
    public interface ScopedBody {
        Scope setUp(Arguments args) throws Exception;
    }

    @FunctionalInterface
    public interface ResourceBody {
        AutoCloseable open(Arguments args) throws Exception;
    }
}
