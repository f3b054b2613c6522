package work.lcod.tester.fixture;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a module whose tests all passed.
 */
public record ModuleReport(String module, List<String> tests, Duration elapsed) {
    public ModuleReport {
        tests = List.copyOf(tests);
    }
}
