package work.lcod.tester.fixture;

/**
 * Body of a fixture or test, invoked with its resolved arguments.
 * A fixture body returning a {@link Scope} is resource-scoped; any other result is a plain value.
 */
@FunctionalInterface
public interface Invocable {
    Object invoke(Arguments args) throws Exception;
}
