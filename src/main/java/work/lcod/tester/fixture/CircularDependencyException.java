package work.lcod.tester.fixture;

import java.util.List;

/**
 * Fixture dependencies form a cycle. Raised before any fixture of the cycle is activated.
 */
public final class CircularDependencyException extends TesterException {
    private final List<String> cycle;

    public CircularDependencyException(List<String> cycle) {
        super("circular_dependency", "Circular fixture dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
