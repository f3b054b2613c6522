package work.lcod.tester.fixture;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Resource-scoped fixtures activated for the current test, torn down last-in first-out.
 */
public final class ActivationStack {
    private final Deque<ScopedActivation> activations = new ArrayDeque<>();

    void push(ScopedActivation activation) {
        activation.markActive();
        activations.push(activation);
    }

    public boolean isEmpty() {
        return activations.isEmpty();
    }

    public int size() {
        return activations.size();
    }

    /**
     * Fixture names in activation order (oldest first).
     */
    public List<String> fixtures() {
        List<String> names = new ArrayList<>(activations.size());
        activations.descendingIterator().forEachRemaining(activation -> names.add(activation.fixture()));
        return names;
    }

    /**
     * Tears down every activation, newest first. All of them are attempted, whatever a teardown throws;
     * the first failure is thrown once the stack is empty, later ones attached to it as suppressed.
     */
    public void tearDown(RunListener listener) {
        FixtureExecutionException failure = null;
        while (!activations.isEmpty()) {
            var activation = activations.pop();
            try {
                activation.tearDown();
                listener.fixtureTornDown(activation.fixture());
            } catch (Throwable ex) {
                var wrapped = new FixtureExecutionException(activation.fixture(), FixtureExecutionException.Phase.TEARDOWN, ex);
                if (failure == null) {
                    failure = wrapped;
                } else {
                    failure.addSuppressed(wrapped);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
