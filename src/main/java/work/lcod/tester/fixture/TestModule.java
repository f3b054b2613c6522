package work.lcod.tester.fixture;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The fixtures and tests of one test module.
 */
public final class TestModule {
    public static final String TEST_PREFIX = "test_";

    private final String name;
    private final Path source;
    private final FixtureRegistry registry;
    private final List<TestCase> tests;

    public TestModule(String name, Path source, FixtureRegistry registry, List<TestCase> tests) {
        this.name = Objects.requireNonNull(name, "name");
        this.source = source;
        this.registry = Objects.requireNonNull(registry, "registry");
        this.tests = List.copyOf(tests);
    }

    /**
     * Classifies discovered entries: marked entries become fixtures, unmarked entries named
     * {@code test_*} become tests, and the rest are helpers the runner ignores.
     */
    public static TestModule fromEntries(String name, Path source, List<ModuleEntry> entries) {
        var registry = new FixtureRegistry();
        var tests = new ArrayList<TestCase>();
        Set<String> seen = new HashSet<>();
        for (ModuleEntry entry : entries) {
            if (!seen.add(entry.name())) {
                throw new DiscoveryException("Duplicate function '" + entry.name() + "' in module " + name);
            }
            if (entry.fixture()) {
                registry.register(new Fixture(entry.name(), entry.signature(), entry.body()));
            } else if (entry.name().startsWith(TEST_PREFIX)) {
                tests.add(new TestCase(entry.name(), entry.signature(), entry.body()));
            }
        }
        return new TestModule(name, source, registry, tests);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public Optional<Path> source() {
        return Optional.ofNullable(source);
    }

    public FixtureRegistry registry() {
        return registry;
    }

    public List<TestCase> tests() {
        return tests;
    }

    public static final class Builder {
        private final String name;
        private Path source;
        private final FixtureRegistry registry = new FixtureRegistry();
        private final List<TestCase> tests = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder source(Path source) {
            this.source = source;
            return this;
        }

        public Builder fixture(Fixture fixture) {
            registry.register(fixture);
            return this;
        }

        public Builder test(TestCase test) {
            tests.add(test);
            return this;
        }

        public TestModule build() {
            return new TestModule(name, source, registry, tests);
        }
    }
}
