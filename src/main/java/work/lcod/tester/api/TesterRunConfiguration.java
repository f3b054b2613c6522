package work.lcod.tester.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import work.lcod.tester.fixture.ResolutionOptions;
import work.lcod.tester.module.TestFileDiscovery;

/**
 * Immutable configuration for one {@link TesterRunner} run.
 */
public record TesterRunConfiguration(
    Path target,
    Path workingDirectory,
    ResolutionOptions resolution,
    List<String> patterns,
    LogLevel logLevel
) {
    public TesterRunConfiguration {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(resolution, "resolution");
        Objects.requireNonNull(logLevel, "logLevel");
        patterns = patterns == null || patterns.isEmpty() ? TestFileDiscovery.DEFAULT_PATTERNS : List.copyOf(patterns);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path target;
        private Path workingDirectory;
        private ResolutionOptions resolution = ResolutionOptions.defaults();
        private List<String> patterns = TestFileDiscovery.DEFAULT_PATTERNS;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder target(Path target) {
            this.target = target;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder resolution(ResolutionOptions resolution) {
            this.resolution = resolution;
            return this;
        }

        public Builder patterns(List<String> patterns) {
            this.patterns = patterns;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public TesterRunConfiguration build() {
            Path effectiveWorkingDirectory = workingDirectory != null
                ? workingDirectory
                : Path.of("").toAbsolutePath();
            return new TesterRunConfiguration(target, effectiveWorkingDirectory, resolution, patterns, logLevel);
        }
    }
}
