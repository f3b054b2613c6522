package work.lcod.tester.fixture;

/**
 * Progress callbacks from {@link ModuleRunner} and {@link FixtureResolver}. All methods default to no-ops.
 */
public interface RunListener {
    RunListener NONE = new RunListener() {};

    default void moduleStarted(TestModule module) {}

    default void testStarted(TestCase test) {}

    default void fixtureActivated(String fixture, boolean scoped) {}

    default void fixtureTornDown(String fixture) {}

    default void testPassed(TestCase test) {}

    default void testFailed(TestCase test, Throwable error) {}

    default void moduleFinished(TestModule module, ModuleReport report) {}

    static RunListener composite(RunListener... listeners) {
        return new RunListener() {
            @Override
            public void moduleStarted(TestModule module) {
                for (var listener : listeners) listener.moduleStarted(module);
            }

            @Override
            public void testStarted(TestCase test) {
                for (var listener : listeners) listener.testStarted(test);
            }

            @Override
            public void fixtureActivated(String fixture, boolean scoped) {
                for (var listener : listeners) listener.fixtureActivated(fixture, scoped);
            }

            @Override
            public void fixtureTornDown(String fixture) {
                for (var listener : listeners) listener.fixtureTornDown(fixture);
            }

            @Override
            public void testPassed(TestCase test) {
                for (var listener : listeners) listener.testPassed(test);
            }

            @Override
            public void testFailed(TestCase test, Throwable error) {
                for (var listener : listeners) listener.testFailed(test, error);
            }

            @Override
            public void moduleFinished(TestModule module, ModuleReport report) {
                for (var listener : listeners) listener.moduleFinished(module, report);
            }
        };
    }
}
