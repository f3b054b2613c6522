package work.lcod.tester.fixture;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixtures of one test module keyed by name. Built before any test runs and only read afterwards.
 */
public final class FixtureRegistry {
    private final Map<String, Fixture> fixtures = new LinkedHashMap<>();

    public FixtureRegistry register(Fixture fixture) {
        var existing = fixtures.putIfAbsent(fixture.name(), fixture);
        if (existing != null) {
            throw new IllegalArgumentException("Fixture already registered: " + fixture.name());
        }
        return this;
    }

    public Optional<Fixture> find(String name) {
        return Optional.ofNullable(fixtures.get(name));
    }

    public boolean contains(String name) {
        return fixtures.containsKey(name);
    }

    public int size() {
        return fixtures.size();
    }
}
