package work.lcod.tester.runtime;

import work.lcod.tester.runtime.fs.FsPrimitives;

/**
 * Shared registry bootstrap so the loader, the runner and the tests use the same function set.
 */
public final class StepFunctions {
    private StepFunctions() {}

    public static FunctionRegistry create() {
        var registry = new FunctionRegistry();
        CorePrimitives.register(registry);
        AssertPrimitives.register(registry);
        FsPrimitives.register(registry);
        return registry;
    }
}
