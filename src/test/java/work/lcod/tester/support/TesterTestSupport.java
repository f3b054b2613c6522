package work.lcod.tester.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;
import work.lcod.tester.fixture.Fixture;
import work.lcod.tester.fixture.Scope;
import work.lcod.tester.fixture.Signature;

/**
 * Shared helpers for the test suites: an event trace and fixtures that write to it.
 */
public final class TesterTestSupport {
    private TesterTestSupport() {}

    public static Path resources(String... segments) {
        return Path.of("src", "test", "resources").resolve(Path.of("", segments)).toAbsolutePath();
    }

    /**
     * Copies a resource directory so tests that write files never touch the source tree.
     */
    public static Path copyResources(String directory, Path target) throws IOException {
        Path source = resources(directory);
        try (Stream<Path> walk = Files.walk(source)) {
            walk.forEach(path -> {
                Path destination = target.resolve(source.relativize(path).toString());
                try {
                    if (Files.isDirectory(path)) {
                        Files.createDirectories(destination);
                    } else {
                        Files.copy(path, destination);
                    }
                } catch (IOException ex) {
                    throw new UncheckedIOException(ex);
                }
            });
        }
        return target;
    }

    public static final class Trace {
        private final List<String> events = new ArrayList<>();

        public void add(String event) {
            events.add(event);
        }

        public List<String> events() {
            return Collections.unmodifiableList(events);
        }

        public long count(String event) {
            return events.stream().filter(event::equals).count();
        }

        /**
         * Scoped fixture recording {@code setup <name>} and {@code teardown <name>}.
         */
        public Fixture scoped(String name, Object value, String... dependencies) {
            return Fixture.scoped(name, Signature.requiring(dependencies), args -> {
                add("setup " + name);
                return Scope.of(value, () -> add("teardown " + name));
            });
        }

        /**
         * Simple fixture recording {@code call <name>}.
         */
        public Fixture simple(String name, Object value, String... dependencies) {
            return Fixture.simple(name, Signature.requiring(dependencies), args -> {
                add("call " + name);
                return value;
            });
        }
    }
}
