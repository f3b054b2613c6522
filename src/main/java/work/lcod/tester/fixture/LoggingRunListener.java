package work.lcod.tester.fixture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes run progress to Log4j: module and test boundaries at INFO, fixture lifecycle and failures at DEBUG.
 * Failures are reported to the user by the caller of the run.
 */
public final class LoggingRunListener implements RunListener {
    private static final Logger log = LogManager.getLogger(LoggingRunListener.class);

    @Override
    public void moduleStarted(TestModule module) {
        log.info("Running module {} ({} tests, {} fixtures)", module.name(), module.tests().size(), module.registry().size());
    }

    @Override
    public void testStarted(TestCase test) {
        log.info("Running {}", test.name());
    }

    @Override
    public void fixtureActivated(String fixture, boolean scoped) {
        log.debug("Activated fixture {}{}", fixture, scoped ? " (scoped)" : "");
    }

    @Override
    public void fixtureTornDown(String fixture) {
        log.debug("Tore down fixture {}", fixture);
    }

    @Override
    public void testPassed(TestCase test) {
        log.info("Passed {}", test.name());
    }

    @Override
    public void testFailed(TestCase test, Throwable error) {
        log.debug("Failed {}", test.name(), error);
    }

    @Override
    public void moduleFinished(TestModule module, ModuleReport report) {
        log.info("Module {} passed {} tests in {} ms", module.name(), report.tests().size(), report.elapsed().toMillis());
    }
}
