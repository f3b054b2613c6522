package work.lcod.tester.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.tester.api.LogLevel;
import work.lcod.tester.api.RunResult;
import work.lcod.tester.api.TesterRunConfiguration;
import work.lcod.tester.api.TesterRunner;
import work.lcod.tester.config.TesterConfig;
import work.lcod.tester.config.TesterConfigLoader;
import work.lcod.tester.fixture.CachePolicy;
import work.lcod.tester.fixture.ResolutionOptions;
import work.lcod.tester.fixture.RunListener;

@CommandLine.Command(
    name = "lcod-tester",
    description = "Run test modules whose tests receive fixtures by parameter name.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class TesterCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
        index = "0",
        paramLabel = "PATH",
        description = "Test module file, or directory searched recursively for test modules."
    )
    private Path path;

    @CommandLine.Option(
        names = "--config",
        description = "tester.toml to use (default: nearest one above PATH).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configFile;

    @CommandLine.Option(
        names = "--cache",
        description = "Fixture reuse within one test (none|per-test).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String cacheRaw;

    @CommandLine.Option(
        names = "--no-cycle-detection",
        description = "Skip the cycle check; cyclic fixtures then fail on --max-depth."
    )
    private boolean noCycleDetection;

    @CommandLine.Option(
        names = "--max-depth",
        description = "Deepest allowed fixture nesting.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer maxDepth;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--json",
        description = "Print the run result as JSON instead of progress lines."
    )
    private boolean json;

    @Override
    public Integer call() throws Exception {
        LogLevel logLevel = resolveLogLevel();
        logLevel.apply();

        Path target = path.toAbsolutePath().normalize();
        TesterConfig config = configFile != null
            ? TesterConfigLoader.load(configFile.toAbsolutePath().normalize())
            : TesterConfigLoader.discover(target);

        TesterRunConfiguration configuration = TesterRunConfiguration.builder()
            .target(target)
            .workingDirectory(Path.of("").toAbsolutePath())
            .resolution(resolveOptions(config.resolution()))
            .patterns(config.patterns())
            .logLevel(logLevel)
            .build();

        PrintWriter out = spec.commandLine().getOut();
        RunListener listener = json ? RunListener.NONE : new ConsoleRunListener(out);
        RunResult result = new TesterRunner(listener).run(configuration);

        if (json) {
            out.println(result.toPrettyJson());
            out.flush();
        } else if (!result.isSuccess()) {
            ShortErrorHandler.report(
                spec.commandLine(),
                String.valueOf(result.metadata().get("code")),
                String.valueOf(result.metadata().get("error"))
            );
        }
        return result.status().exitCode();
    }

    private LogLevel resolveLogLevel() {
        try {
            return LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private ResolutionOptions resolveOptions(ResolutionOptions base) {
        var options = base;
        try {
            if (cacheRaw != null) {
                options = options.withCachePolicy(CachePolicy.from(cacheRaw));
            }
            if (noCycleDetection) {
                options = options.withDetectCycles(false);
            }
            if (maxDepth != null) {
                options = options.withMaxDepth(maxDepth);
            }
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
        return options;
    }
}
