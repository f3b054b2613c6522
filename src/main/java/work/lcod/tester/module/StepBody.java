package work.lcod.tester.module;

import java.util.List;
import java.util.Map;
import work.lcod.tester.fixture.Arguments;
import work.lcod.tester.fixture.Invocable;
import work.lcod.tester.fixture.Scope;
import work.lcod.tester.runtime.StepContext;
import work.lcod.tester.runtime.StepRunner;

/**
 * Body of a YAML-declared function: runs its steps with the resolved arguments as initial state.
 */
final class StepBody implements Invocable {
    private final StepContext ctx;
    private final Kind kind;
    private final List<Map<String, Object>> steps;
    private final Object valueExpression;
    private final List<Map<String, Object>> teardown;

    StepBody(StepContext ctx, Kind kind, List<Map<String, Object>> steps, Object valueExpression, List<Map<String, Object>> teardown) {
        this.ctx = ctx;
        this.kind = kind;
        this.steps = steps == null ? List.of() : steps;
        this.valueExpression = valueExpression;
        this.teardown = teardown == null ? List.of() : teardown;
    }

    @Override
    public Object invoke(Arguments args) throws Exception {
        Map<String, Object> state = StepRunner.runSteps(ctx, steps, args.asMap());
        return switch (kind) {
            case SCOPED -> Scope.of(StepRunner.evaluate(valueExpression, state), () -> StepRunner.runSteps(ctx, teardown, state));
            case SIMPLE -> StepRunner.evaluate(valueExpression, state);
            case PLAIN -> null;
        };
    }

    enum Kind {
        /** Tests and helpers; no value. */
        PLAIN,
        /** Fixture with {@code return}. */
        SIMPLE,
        /** Fixture with {@code yield}, optionally followed by {@code teardown}. */
        SCOPED
    }
}
