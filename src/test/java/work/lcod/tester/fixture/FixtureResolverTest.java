package work.lcod.tester.fixture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.tester.support.TesterTestSupport.Trace;

class FixtureResolverTest {
    @Test
    void activatesFixturesInDeclaredParameterOrder() {
        var trace = new Trace();
        var registry = new FixtureRegistry()
            .register(trace.simple("p2", "two"))
            .register(trace.simple("p1", "one"));

        var args = new FixtureResolver().resolve("test_x", Signature.requiring("p1", "p2"), registry, new ActivationStack());

        assertEquals(List.of("call p1", "call p2"), trace.events());
        assertEquals("one", args.get("p1"));
        assertEquals("two", args.get("p2", String.class));
        assertEquals(List.of("p1", "p2"), List.copyOf(args.asMap().keySet()));
    }

    @Test
    void defaultValueWinsOverSameNamedFixture() {
        var trace = new Trace();
        var registry = new FixtureRegistry().register(trace.simple("val", "from fixture"));
        var signature = Signature.of(Parameter.withDefault("val", 1), Parameter.withDefault("none", null));

        var args = new FixtureResolver().resolve("test_x", signature, registry, new ActivationStack());

        assertEquals(1, args.get("val"));
        assertTrue(args.contains("none"));
        assertEquals(null, args.get("none"));
        assertTrue(trace.events().isEmpty());
    }

    @Test
    void missingFixtureActivatesNothing() {
        var trace = new Trace();
        var registry = new FixtureRegistry()
            .register(trace.scoped("opened", "resource"))
            .register(trace.simple("wrapper", "w", "ghost"));
        var stack = new ActivationStack();
        var resolver = new FixtureResolver();

        var direct = assertThrows(UnresolvedParameterException.class,
            () -> resolver.resolve("test_x", Signature.requiring("opened", "ghost"), registry, stack));
        assertEquals("ghost", direct.parameter());
        assertEquals("test_x", direct.requester());
        assertEquals("unresolved_parameter", direct.code());

        var nested = assertThrows(UnresolvedParameterException.class,
            () -> resolver.resolve("test_y", Signature.requiring("opened", "wrapper"), registry, stack));
        assertEquals("wrapper", nested.requester());

        assertTrue(trace.events().isEmpty());
        assertTrue(stack.isEmpty());
    }

    @Test
    void fixtureReferencedTwiceRunsTwice() {
        var trace = new Trace();
        var registry = new FixtureRegistry()
            .register(trace.simple("q", "q"))
            .register(trace.simple("a", "a", "q"))
            .register(trace.simple("b", "b", "q"));

        new FixtureResolver().resolve("test_x", Signature.requiring("a", "b", "q"), registry, new ActivationStack());

        assertEquals(3, trace.count("call q"));
        assertEquals(List.of("call q", "call a", "call q", "call b", "call q"), trace.events());
    }

    @Test
    void perTestCacheSharesOneActivation() {
        var trace = new Trace();
        var registry = new FixtureRegistry()
            .register(trace.scoped("q", "shared"))
            .register(trace.simple("a", "a", "q"));
        var stack = new ActivationStack();
        var resolver = new FixtureResolver(ResolutionOptions.defaults().withCachePolicy(CachePolicy.PER_TEST));

        var args = resolver.resolve("test_x", Signature.requiring("a", "q"), registry, stack);

        assertEquals(1, trace.count("setup q"));
        assertEquals("shared", args.get("q"));
        assertEquals(List.of("q"), stack.fixtures());
    }

    @Test
    void scopedFixturesStayActiveUntilTeardown() {
        var trace = new Trace();
        var registry = new FixtureRegistry()
            .register(trace.scoped("p1", 1))
            .register(trace.scoped("p2", 2, "p1"))
            .register(trace.scoped("p3", 3, "p2"));
        var stack = new ActivationStack();

        var args = new FixtureResolver().resolve("test_x", Signature.requiring("p3"), registry, stack);

        assertEquals(3, args.get("p3"));
        assertEquals(List.of("p1", "p2", "p3"), stack.fixtures());
        assertEquals(List.of("setup p1", "setup p2", "setup p3"), trace.events());

        stack.tearDown(RunListener.NONE);
        assertEquals(List.of("setup p1", "setup p2", "setup p3", "teardown p3", "teardown p2", "teardown p1"), trace.events());
        assertTrue(stack.isEmpty());
    }

    @Test
    void dependentFixtureReceivesResolvedValue() {
        var registry = new FixtureRegistry()
            .register(Fixture.scoped("fix_1", Signature.empty(), args -> Scope.of("a", () -> {})))
            .register(Fixture.simple("fix_2", Signature.requiring("fix_1"), args -> args.get("fix_1", String.class) + "b"));

        var args = new FixtureResolver().resolve("test_x", Signature.requiring("fix_2"), registry, new ActivationStack());

        assertEquals("ab", args.get("fix_2"));
    }

    @Test
    void rejectsCyclesBeforeActivation() {
        var trace = new Trace();
        var registry = new FixtureRegistry()
            .register(trace.scoped("start", "s"))
            .register(trace.simple("a", "a", "b"))
            .register(trace.simple("b", "b", "a"))
            .register(trace.simple("self", "s", "self"));
        var stack = new ActivationStack();
        var resolver = new FixtureResolver();

        var cycle = assertThrows(CircularDependencyException.class,
            () -> resolver.resolve("test_x", Signature.requiring("start", "a"), registry, stack));
        assertEquals(List.of("a", "b", "a"), cycle.cycle());
        assertEquals("circular_dependency", cycle.code());

        var selfCycle = assertThrows(CircularDependencyException.class,
            () -> resolver.resolve("test_y", Signature.requiring("self"), registry, stack));
        assertEquals(List.of("self", "self"), selfCycle.cycle());

        assertTrue(trace.events().isEmpty());
        assertTrue(stack.isEmpty());
    }

    @Test
    void depthGuardStopsCyclesWhenDetectionIsDisabled() {
        var registry = new FixtureRegistry()
            .register(Fixture.simple("a", Signature.requiring("b"), args -> "a"))
            .register(Fixture.simple("b", Signature.requiring("a"), args -> "b"));
        var resolver = new FixtureResolver(ResolutionOptions.defaults().withDetectCycles(false).withMaxDepth(16));

        var error = assertThrows(RecursionLimitExceededException.class,
            () -> resolver.resolve("test_x", Signature.requiring("a"), registry, new ActivationStack()));
        assertEquals(16, error.limit());
    }

    @Test
    void depthLimitCountsNestedFixtures() {
        var registry = new FixtureRegistry()
            .register(Fixture.simple("d1", Signature.empty(), args -> 1))
            .register(Fixture.simple("d2", Signature.requiring("d1"), args -> 2))
            .register(Fixture.simple("d3", Signature.requiring("d2"), args -> 3));

        var withinLimit = new FixtureResolver(ResolutionOptions.defaults().withMaxDepth(3));
        assertEquals(3, withinLimit.resolve("test_x", Signature.requiring("d3"), registry, new ActivationStack()).get("d3"));

        var tooShallow = new FixtureResolver(ResolutionOptions.defaults().withMaxDepth(2));
        assertThrows(RecursionLimitExceededException.class,
            () -> tooShallow.resolve("test_x", Signature.requiring("d3"), registry, new ActivationStack()));
    }

    @Test
    void depthLimitIsCheckedOnEveryPathBeforeActivation() {
        var trace = new Trace();
        var registry = new FixtureRegistry()
            .register(trace.scoped("x", "x"))
            .register(trace.simple("leaf", "leaf"))
            .register(trace.simple("b", "b", "leaf"))
            .register(trace.simple("a", "a", "b"));
        var stack = new ActivationStack();
        var resolver = new FixtureResolver(ResolutionOptions.defaults().withMaxDepth(2));

        // b passes at depth 1 first, then sits one level deeper under a
        assertThrows(RecursionLimitExceededException.class,
            () -> resolver.resolve("test_x", Signature.requiring("x", "b", "a"), registry, stack));

        assertTrue(trace.events().isEmpty());
        assertTrue(stack.isEmpty());
    }

    @Test
    void fixtureFailureIsReportedWithItsName() {
        var cause = new IOException("disk full");
        var registry = new FixtureRegistry()
            .register(Fixture.simple("broken", Signature.empty(), args -> {
                throw cause;
            }))
            .register(Fixture.simple("outer", Signature.requiring("broken"), args -> "outer"));

        var error = assertThrows(FixtureExecutionException.class,
            () -> new FixtureResolver().resolve("test_x", Signature.requiring("outer"), registry, new ActivationStack()));

        assertEquals("broken", error.fixture());
        assertEquals(FixtureExecutionException.Phase.SETUP, error.phase());
        assertSame(cause, error.getCause());
        assertEquals("fixture_failed", error.code());
    }

    @Test
    void resourceFixtureClosesItsValue() throws Exception {
        var closed = new boolean[1];
        AutoCloseable resource = () -> closed[0] = true;
        var registry = new FixtureRegistry().register(Fixture.resource("res", Signature.empty(), args -> resource));
        var stack = new ActivationStack();

        var args = new FixtureResolver().resolve("test_x", Signature.requiring("res"), registry, stack);
        assertSame(resource, args.get("res"));
        assertInstanceOf(AutoCloseable.class, args.get("res"));

        stack.tearDown(RunListener.NONE);
        assertTrue(closed[0]);
    }
}
