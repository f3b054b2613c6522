package work.lcod.tester.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.tester.fixture.CachePolicy;
import work.lcod.tester.fixture.ResolutionOptions;
import work.lcod.tester.module.TestFileDiscovery;

class TesterConfigLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void findsNearestConfigAboveTarget() throws Exception {
        var config = Files.writeString(tempDir.resolve(TesterConfigLoader.FILE_NAME), """
            [discovery]
            patterns = ["*_check.yaml", " "]

            [resolution]
            cache = "per-test"
            detect-cycles = false
            max-depth = 12
            """);
        var nested = Files.createDirectories(tempDir.resolve("a/b"));
        var module = Files.writeString(nested.resolve("test_x.yaml"), "");

        assertEquals(Optional.of(config), TesterConfigLoader.findConfigFile(module));

        var loaded = TesterConfigLoader.discover(nested);
        assertEquals(List.of("*_check.yaml"), loaded.patterns());
        assertEquals(CachePolicy.PER_TEST, loaded.resolution().cachePolicy());
        assertFalse(loaded.resolution().detectCycles());
        assertEquals(12, loaded.resolution().maxDepth());
        assertEquals(Optional.of(config), loaded.source());
    }

    @Test
    void missingSectionsKeepDefaults() throws Exception {
        var file = Files.writeString(tempDir.resolve(TesterConfigLoader.FILE_NAME), "# nothing configured\n");

        var loaded = TesterConfigLoader.load(file);

        assertEquals(TestFileDiscovery.DEFAULT_PATTERNS, loaded.patterns());
        assertEquals(ResolutionOptions.defaults(), loaded.resolution());
    }

    @Test
    void noConfigMeansDefaults() {
        var loaded = TesterConfigLoader.discover(null);
        assertEquals(TesterConfig.defaults(), loaded);
    }

    @Test
    void rejectsMalformedToml() throws Exception {
        var broken = Files.writeString(tempDir.resolve("broken.toml"), "[resolution\ncache = ");
        assertThrows(IllegalArgumentException.class, () -> TesterConfigLoader.load(broken));

        var wrongType = Files.writeString(tempDir.resolve("typed.toml"), "[resolution]\nmax-depth = \"deep\"\n");
        assertThrows(IllegalArgumentException.class, () -> TesterConfigLoader.load(wrongType));

        var badPolicy = Files.writeString(tempDir.resolve("policy.toml"), "[resolution]\ncache = \"forever\"\n");
        assertThrows(IllegalArgumentException.class, () -> TesterConfigLoader.load(badPolicy));
    }
}
