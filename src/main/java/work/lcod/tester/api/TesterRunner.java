package work.lcod.tester.api;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.tester.fixture.LoggingRunListener;
import work.lcod.tester.fixture.ModuleReport;
import work.lcod.tester.fixture.ModuleRunner;
import work.lcod.tester.fixture.RunListener;
import work.lcod.tester.fixture.TestCase;
import work.lcod.tester.fixture.TestModule;
import work.lcod.tester.fixture.TesterException;
import work.lcod.tester.module.TestFileDiscovery;
import work.lcod.tester.module.TestModuleLoader;

/**
 * Public entry point for running test modules from a file or directory. Every discovered file is an
 * independent module; the first failure anywhere stops the run.
 */
public final class TesterRunner {
    private static final Logger log = LogManager.getLogger(TesterRunner.class);

    private final RunListener listener;
    private final TestModuleLoader loader;

    public TesterRunner() {
        this(RunListener.NONE);
    }

    public TesterRunner(RunListener listener) {
        this(listener, new TestModuleLoader());
    }

    public TesterRunner(RunListener listener, TestModuleLoader loader) {
        this.listener = listener == null ? RunListener.NONE : listener;
        this.loader = loader;
    }

    public RunResult run(TesterRunConfiguration configuration) {
        var started = Instant.now();
        Path target = resolveTarget(configuration);
        List<String> files = new ArrayList<>();
        List<String> tests = new ArrayList<>();
        var current = new CurrentTest();
        var moduleRunner = new ModuleRunner(
            configuration.resolution(),
            RunListener.composite(current, new LoggingRunListener(), listener)
        );

        try {
            var discovery = new TestFileDiscovery(configuration.patterns());
            for (Path file : discovery.discover(target)) {
                files.add(file.toString());
                current.module = null;
                current.test = null;
                TestModule module = loader.load(file);
                current.module = module.name();
                ModuleReport report = moduleRunner.run(module);
                for (String test : report.tests()) {
                    tests.add(module.name() + "::" + test);
                }
            }
            var metadata = baseMetadata(target, files, tests);
            metadata.put("status", "ok");
            return RunResult.success(metadata, started);
        } catch (RuntimeException | Error ex) {
            log.debug("Run of {} aborted", target, ex);
            var errorMeta = baseMetadata(target, files, tests);
            errorMeta.put("code", ex instanceof TesterException te ? te.code() : "unexpected_error");
            if (current.module != null) {
                errorMeta.put("module", current.module);
            }
            if (current.test != null) {
                errorMeta.put("test", current.test);
            }
            String message = ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getSimpleName()
                : ex.getMessage();
            errorMeta.put("error", message);
            return RunResult.failure(message, errorMeta, started);
        }
    }

    private static Path resolveTarget(TesterRunConfiguration configuration) {
        Path target = configuration.target();
        return target.isAbsolute()
            ? target.normalize()
            : configuration.workingDirectory().resolve(target).toAbsolutePath().normalize();
    }

    private static Map<String, Object> baseMetadata(Path target, List<String> files, List<String> tests) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("target", target.toString());
        metadata.put("files", List.copyOf(files));
        metadata.put("tests", List.copyOf(tests));
        return metadata;
    }

    private static final class CurrentTest implements RunListener {
        private String module;
        private String test;

        @Override
        public void testStarted(TestCase testCase) {
            this.test = testCase.name();
        }
    }
}
