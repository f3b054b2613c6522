package work.lcod.tester.cli;

import java.io.PrintWriter;
import work.lcod.tester.fixture.ModuleReport;
import work.lcod.tester.fixture.RunListener;
import work.lcod.tester.fixture.TestModule;

/**
 * Per-file progress lines on the command's standard output.
 */
final class ConsoleRunListener implements RunListener {
    private final PrintWriter out;

    ConsoleRunListener(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void moduleStarted(TestModule module) {
        String location = module.source().map(Object::toString).orElse(module.name());
        out.println("Running tests in file '" + location + "'");
        out.flush();
    }

    @Override
    public void moduleFinished(TestModule module, ModuleReport report) {
        out.println("Passed");
        out.println();
        out.flush();
    }
}
