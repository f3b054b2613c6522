package work.lcod.tester.fixture;

import java.util.Objects;

/**
 * A named test whose parameters resolve to defaults or fixture outputs.
 */
public final class TestCase {
    private final String name;
    private final Signature signature;
    private final Invocable body;

    public TestCase(String name, Signature signature, Invocable body) {
        this.name = Objects.requireNonNull(name, "name");
        this.signature = signature == null ? Signature.empty() : signature;
        this.body = Objects.requireNonNull(body, "body");
    }

    public static TestCase of(String name, Signature signature, Body body) {
        Objects.requireNonNull(body, "body");
        return new TestCase(name, signature, args -> {
            body.run(args);
            return null;
        });
    }

    public String name() {
        return name;
    }

    public Signature signature() {
        return signature;
    }

    void invoke(Arguments args) throws Exception {
        body.invoke(args);
    }

    @Override
    public String toString() {
        return name + signature;
    }

    @FunctionalInterface
    public interface Body {
        void run(Arguments args) throws Exception;
    }
}
