package work.lcod.tester.module;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import work.lcod.tester.fixture.DiscoveryException;

/**
 * Turns the CLI target into test module files: a file is taken as is, a directory is searched
 * recursively for file names matching one of the patterns.
 */
public final class TestFileDiscovery {
    public static final List<String> DEFAULT_PATTERNS = List.of("test_*.yaml", "test_*.yml");

    private final List<PathMatcher> matchers;

    public TestFileDiscovery() {
        this(DEFAULT_PATTERNS);
    }

    public TestFileDiscovery(List<String> patterns) {
        var effective = patterns == null || patterns.isEmpty() ? DEFAULT_PATTERNS : patterns;
        this.matchers = effective.stream()
            .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
            .collect(Collectors.toList());
    }

    public List<Path> discover(Path target) {
        Path resolved = target.toAbsolutePath().normalize();
        if (Files.isDirectory(resolved)) {
            try (Stream<Path> walk = Files.walk(resolved)) {
                return walk.filter(Files::isRegularFile)
                    .filter(this::matches)
                    .sorted()
                    .collect(Collectors.toList());
            } catch (IOException ex) {
                throw new DiscoveryException("Failed to scan test directory '" + resolved + "': " + ex.getMessage(), ex);
            }
        }
        if (Files.isRegularFile(resolved)) {
            return List.of(resolved);
        }
        throw new DiscoveryException("Test path '" + target + "' does not exist.");
    }

    public boolean matches(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        for (var matcher : matchers) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }
}
