package work.lcod.tester.fixture;

import java.util.Objects;

/**
 * One function discovered in a test module, in file order. {@code fixture} is the explicit marker;
 * unmarked entries are tests when their name carries the {@value TestModule#TEST_PREFIX} prefix.
 */
public record ModuleEntry(String name, Signature signature, Invocable body, boolean fixture) {
    public ModuleEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        signature = signature == null ? Signature.empty() : signature;
    }

    public static ModuleEntry fixture(String name, Signature signature, Invocable body) {
        return new ModuleEntry(name, signature, body, true);
    }

    public static ModuleEntry function(String name, Signature signature, Invocable body) {
        return new ModuleEntry(name, signature, body, false);
    }
}
