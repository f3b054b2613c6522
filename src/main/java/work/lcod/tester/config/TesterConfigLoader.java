package work.lcod.tester.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.tester.fixture.CachePolicy;
import work.lcod.tester.fixture.ResolutionOptions;

/**
 * Locates and parses {@code tester.toml}.
 *
 * <pre>
 * [discovery]
 * patterns = ["test_*.yaml"]
 *
 * [resolution]
 * cache = "per-test"
 * detect-cycles = true
 * max-depth = 64
 * </pre>
 */
public final class TesterConfigLoader {
    public static final String FILE_NAME = "tester.toml";

    private static final Logger log = LogManager.getLogger(TesterConfigLoader.class);

    private TesterConfigLoader() {}

    /**
     * Searches {@code start} (or its directory, for a file) and every ancestor for {@value #FILE_NAME}.
     */
    public static TesterConfig discover(Path start) {
        return findConfigFile(start).map(TesterConfigLoader::load).orElseGet(TesterConfig::defaults);
    }

    public static Optional<Path> findConfigFile(Path start) {
        if (start == null) {
            return Optional.empty();
        }
        Path current = start.toAbsolutePath().normalize();
        if (!Files.isDirectory(current)) {
            current = current.getParent();
        }
        while (current != null) {
            Path candidate = current.resolve(FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    public static TesterConfig load(Path file) {
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(file));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Cannot read " + file + ": " + ex.getMessage(), ex);
        }
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid " + file + ": " + errors);
        }
        try {
            var config = new TesterConfig(readPatterns(result.getTable("discovery")), readResolution(result.getTable("resolution")), Optional.of(file));
            log.debug("Loaded configuration from {}", file);
            return config;
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid " + file + ": " + ex.getMessage(), ex);
        }
    }

    private static List<String> readPatterns(TomlTable discovery) {
        if (discovery == null) {
            return List.of();
        }
        TomlArray array = discovery.getArray("patterns");
        if (array == null) {
            return List.of();
        }
        List<String> patterns = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            String pattern = array.getString(i);
            if (pattern != null && !pattern.isBlank()) {
                patterns.add(pattern.trim());
            }
        }
        return patterns;
    }

    private static ResolutionOptions readResolution(TomlTable resolution) {
        var options = ResolutionOptions.defaults();
        if (resolution == null) {
            return options;
        }
        String cache = resolution.getString("cache");
        if (cache != null) {
            options = options.withCachePolicy(CachePolicy.from(cache));
        }
        Boolean detectCycles = resolution.getBoolean("detect-cycles");
        if (detectCycles != null) {
            options = options.withDetectCycles(detectCycles);
        }
        Long maxDepth = resolution.getLong("max-depth");
        if (maxDepth != null) {
            options = options.withMaxDepth(Math.toIntExact(maxDepth));
        }
        return options;
    }
}
