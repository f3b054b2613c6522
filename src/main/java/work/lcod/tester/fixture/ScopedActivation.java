package work.lcod.tester.fixture;

import java.util.Objects;

/**
 * One in-flight resource-scoped fixture. Moves {@code CREATED -> ACTIVE -> TORN_DOWN}, each step once.
 */
public final class ScopedActivation {
    private final String fixture;
    private final Object value;
    private final Scope.Teardown teardown;
    private State state = State.CREATED;

    ScopedActivation(String fixture, Scope scope) {
        this.fixture = Objects.requireNonNull(fixture, "fixture");
        this.value = scope.value();
        this.teardown = scope.teardown();
    }

    public String fixture() {
        return fixture;
    }

    public Object value() {
        return value;
    }

    public State state() {
        return state;
    }

    void markActive() {
        if (state != State.CREATED) {
            throw new IllegalStateException("Fixture '" + fixture + "' cannot be activated from state " + state);
        }
        state = State.ACTIVE;
    }

    void tearDown() throws Exception {
        if (state != State.ACTIVE) {
            throw new IllegalStateException("Fixture '" + fixture + "' cannot be torn down from state " + state);
        }
        // Marked first so a failing teardown is never resumed again.
        state = State.TORN_DOWN;
        teardown.run();
    }

    @Override
    public String toString() {
        return fixture + "[" + state + "]";
    }

    public enum State {
        CREATED,
        ACTIVE,
        TORN_DOWN
    }
}
