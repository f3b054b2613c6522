package work.lcod.tester.fixture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.tester.support.TesterTestSupport.Trace;

class ModuleRunnerTest {
    @Test
    void tearsDownInReverseActivationOrder() {
        var trace = new Trace();
        var module = TestModule.builder("chain")
            .fixture(trace.scoped("p1", 1))
            .fixture(trace.scoped("p2", 2, "p1"))
            .fixture(trace.scoped("p3", 3, "p2"))
            .test(TestCase.of("test_x", Signature.requiring("p3"), args -> trace.add("test_x " + args.get("p3"))))
            .build();

        var report = new ModuleRunner().run(module);

        assertEquals(List.of("test_x"), report.tests());
        assertEquals(List.of(
            "setup p1", "setup p2", "setup p3",
            "test_x 3",
            "teardown p3", "teardown p2", "teardown p1"
        ), trace.events());
    }

    @Test
    void siblingFixturesTearDownInReverseParameterOrder() {
        var trace = new Trace();
        var module = TestModule.builder("siblings")
            .fixture(trace.scoped("a", "a"))
            .fixture(trace.scoped("b", "b"))
            .fixture(trace.scoped("c", "c"))
            .test(TestCase.of("test_x", Signature.requiring("a", "b", "c"), args -> trace.add("test_x")))
            .build();

        new ModuleRunner().run(module);

        assertEquals(List.of(
            "setup a", "setup b", "setup c",
            "test_x",
            "teardown c", "teardown b", "teardown a"
        ), trace.events());
    }

    @Test
    void eachTestGetsItsOwnActivation() {
        var trace = new Trace();
        var module = TestModule.builder("isolation")
            .fixture(trace.scoped("r", "resource"))
            .test(TestCase.of("test_1", Signature.requiring("r"), args -> trace.add("test_1")))
            .test(TestCase.of("test_2", Signature.requiring("r"), args -> trace.add("test_2")))
            .build();

        new ModuleRunner().run(module);

        assertEquals(List.of(
            "setup r", "test_1", "teardown r",
            "setup r", "test_2", "teardown r"
        ), trace.events());
    }

    @Test
    void passesFixtureValuesThroughToTheTest() {
        var trace = new Trace();
        var module = TestModule.builder("values")
            .fixture(Fixture.scoped("fix_1", Signature.empty(), args -> {
                trace.add("open fix_1");
                return Scope.of("a", () -> trace.add("close fix_1"));
            }))
            .fixture(Fixture.simple("fix_2", Signature.requiring("fix_1"), args -> args.get("fix_1") + "b"))
            .test(TestCase.of("test_x", Signature.requiring("fix_2"), args -> {
                assertEquals("ab", args.get("fix_2"));
                trace.add("test_x");
            }))
            .build();

        new ModuleRunner().run(module);

        assertEquals(List.of("open fix_1", "test_x", "close fix_1"), trace.events());
    }

    @Test
    void failingTestStillTearsDownAndStopsTheRun() {
        var trace = new Trace();
        var cause = new AssertionError("numbers differ");
        var module = TestModule.builder("failing")
            .fixture(trace.scoped("r", "resource"))
            .test(TestCase.of("test_fails", Signature.requiring("r"), args -> {
                throw cause;
            }))
            .test(TestCase.of("test_never_reached", Signature.empty(), args -> trace.add("test_never_reached")))
            .build();

        var error = assertThrows(TestFailureException.class, () -> new ModuleRunner().run(module));

        assertEquals("test_fails", error.test());
        assertEquals("test_failed", error.code());
        assertSame(cause, error.getCause());
        assertEquals(List.of("setup r", "teardown r"), trace.events());
    }

    @Test
    void teardownFailureMasksTheTestFailure() {
        var original = new IllegalStateException("body failed");
        var module = TestModule.builder("masking")
            .fixture(Fixture.scoped("r", Signature.empty(), args -> Scope.of("resource", () -> {
                throw new IllegalStateException("close failed");
            })))
            .test(TestCase.of("test_x", Signature.requiring("r"), args -> {
                throw original;
            }))
            .build();

        var error = assertThrows(FixtureExecutionException.class, () -> new ModuleRunner().run(module));

        assertEquals("r", error.fixture());
        assertEquals(FixtureExecutionException.Phase.TEARDOWN, error.phase());
        assertEquals(1, error.getSuppressed().length);
        var suppressed = assertInstanceOf(TestFailureException.class, error.getSuppressed()[0]);
        assertSame(original, suppressed.getCause());
    }

    @Test
    void remainingTeardownsRunAfterOneFails() {
        var trace = new Trace();
        var module = TestModule.builder("partial")
            .fixture(trace.scoped("p1", 1))
            .fixture(Fixture.scoped("p2", Signature.requiring("p1"), args -> Scope.of(2, () -> {
                throw new IllegalStateException("p2 teardown");
            })))
            .test(TestCase.of("test_x", Signature.requiring("p2"), args -> trace.add("test_x")))
            .test(TestCase.of("test_y", Signature.empty(), args -> trace.add("test_y")))
            .build();

        var error = assertThrows(FixtureExecutionException.class, () -> new ModuleRunner().run(module));

        assertEquals("p2", error.fixture());
        assertEquals(List.of("setup p1", "test_x", "teardown p1"), trace.events());
    }

    @Test
    void errorFromTestBodyStillTearsDown() {
        var trace = new Trace();
        var module = TestModule.builder("overflow")
            .fixture(trace.scoped("r", "resource"))
            .test(TestCase.of("test_recursive", Signature.requiring("r"), args -> {
                throw new StackOverflowError();
            }))
            .build();

        assertThrows(StackOverflowError.class, () -> new ModuleRunner().run(module));

        assertEquals(List.of("setup r", "teardown r"), trace.events());
    }

    @Test
    void errorFromTeardownDoesNotAbandonOlderActivations() {
        var trace = new Trace();
        var module = TestModule.builder("teardown-error")
            .fixture(trace.scoped("p1", 1))
            .fixture(Fixture.scoped("p2", Signature.requiring("p1"), args -> Scope.of(2, () -> {
                throw new ExceptionInInitializerError("static init");
            })))
            .test(TestCase.of("test_x", Signature.requiring("p2"), args -> trace.add("test_x")))
            .build();

        var error = assertThrows(FixtureExecutionException.class, () -> new ModuleRunner().run(module));

        assertEquals("p2", error.fixture());
        assertInstanceOf(ExceptionInInitializerError.class, error.getCause());
        assertEquals(List.of("setup p1", "test_x", "teardown p1"), trace.events());
    }

    @Test
    void setupFailureTearsDownEarlierActivations() {
        var trace = new Trace();
        var module = TestModule.builder("setup")
            .fixture(trace.scoped("a", "a"))
            .fixture(Fixture.simple("b", Signature.empty(), args -> {
                throw new IllegalArgumentException("cannot build b");
            }))
            .test(TestCase.of("test_x", Signature.requiring("a", "b"), args -> trace.add("test_x")))
            .build();

        var error = assertThrows(FixtureExecutionException.class, () -> new ModuleRunner().run(module));

        assertEquals("b", error.fixture());
        assertEquals(FixtureExecutionException.Phase.SETUP, error.phase());
        assertEquals(List.of("setup a", "teardown a"), trace.events());
    }

    @Test
    void unresolvedParameterFailsBeforeAnyActivation() {
        var trace = new Trace();
        var module = TestModule.builder("missing")
            .fixture(trace.scoped("opened", "file"))
            .test(TestCase.of("test_needs_ghost", Signature.requiring("opened", "ghost"), args -> trace.add("body")))
            .build();

        var error = assertThrows(UnresolvedParameterException.class, () -> new ModuleRunner().run(module));

        assertEquals("ghost", error.parameter());
        assertEquals(List.of(), trace.events());
    }

    @Test
    void listenerSeesTheWholeLifecycle() {
        var events = new ArrayList<String>();
        RunListener listener = new RunListener() {
            @Override
            public void moduleStarted(TestModule module) {
                events.add("module " + module.name());
            }

            @Override
            public void testStarted(TestCase test) {
                events.add("start " + test.name());
            }

            @Override
            public void fixtureActivated(String fixture, boolean scoped) {
                events.add((scoped ? "scoped " : "simple ") + fixture);
            }

            @Override
            public void fixtureTornDown(String fixture) {
                events.add("down " + fixture);
            }

            @Override
            public void testPassed(TestCase test) {
                events.add("pass " + test.name());
            }

            @Override
            public void moduleFinished(TestModule module, ModuleReport report) {
                events.add("done " + report.tests().size());
            }
        };
        var trace = new Trace();
        var module = TestModule.builder("listened")
            .fixture(trace.scoped("r", 1))
            .fixture(trace.simple("v", 2, "r"))
            .test(TestCase.of("test_x", Signature.requiring("v"), args -> {}))
            .build();

        new ModuleRunner(ResolutionOptions.defaults(), listener).run(module);

        assertEquals(List.of(
            "module listened", "start test_x", "scoped r", "simple v", "down r", "pass test_x", "done 1"
        ), events);
    }
}
