package work.lcod.tester.fixture;

import java.util.Objects;

/**
 * One declared parameter of a fixture or test: a name, optionally bound to a default value.
 * A default of {@code null} is still a default; only {@link #hasDefault()} decides.
 */
public record Parameter(String name, boolean hasDefault, Object defaultValue) {
    public Parameter {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Parameter name must not be blank");
        }
        if (!hasDefault && defaultValue != null) {
            throw new IllegalArgumentException("Parameter '" + name + "' carries a value but no default flag");
        }
    }

    public static Parameter required(String name) {
        return new Parameter(name, false, null);
    }

    public static Parameter withDefault(String name, Object defaultValue) {
        return new Parameter(name, true, defaultValue);
    }
}
