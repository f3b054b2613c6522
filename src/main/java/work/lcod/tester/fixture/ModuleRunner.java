package work.lcod.tester.fixture;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the tests of one module in declaration order, each with its own activation stack.
 * The first failure (resolution, test body or teardown) ends the run after the failing test's
 * activations have been torn down. Errors other than assertion errors are rethrown as they are,
 * also after teardown.
 */
public final class ModuleRunner {
    private final FixtureResolver resolver;
    private final RunListener listener;

    public ModuleRunner() {
        this(ResolutionOptions.defaults(), RunListener.NONE);
    }

    public ModuleRunner(ResolutionOptions options, RunListener listener) {
        this.listener = listener == null ? RunListener.NONE : listener;
        this.resolver = new FixtureResolver(Objects.requireNonNull(options, "options"), this.listener);
    }

    public ModuleReport run(TestModule module) {
        listener.moduleStarted(module);
        var started = Instant.now();
        List<String> passed = new ArrayList<>();
        for (TestCase test : module.tests()) {
            runTest(module, test);
            passed.add(test.name());
        }
        var report = new ModuleReport(module.name(), passed, Duration.between(started, Instant.now()));
        listener.moduleFinished(module, report);
        return report;
    }

    private void runTest(TestModule module, TestCase test) {
        var stack = new ActivationStack();
        listener.testStarted(test);
        try {
            Arguments args = resolver.resolve(test.name(), test.signature(), module.registry(), stack);
            invoke(test, args);
        } catch (RuntimeException | Error ex) {
            listener.testFailed(test, ex);
            tearDownAfter(stack, ex);
            throw ex;
        }
        try {
            stack.tearDown(listener);
        } catch (RuntimeException ex) {
            listener.testFailed(test, ex);
            throw ex;
        }
        listener.testPassed(test);
    }

    private void tearDownAfter(ActivationStack stack, Throwable original) {
        try {
            stack.tearDown(listener);
        } catch (RuntimeException teardownFailure) {
            // the teardown error wins; keep the test's own failure attached
            teardownFailure.addSuppressed(original);
            throw teardownFailure;
        }
    }

    private static void invoke(TestCase test, Arguments args) {
        try {
            test.invoke(args);
        } catch (TesterException ex) {
            throw ex;
        } catch (Exception | AssertionError ex) {
            throw new TestFailureException(test.name(), ex);
        }
    }
}
