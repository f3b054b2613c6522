package work.lcod.tester.fixture;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Resolved parameter values for one fixture or test invocation, in declaration order.
 */
public final class Arguments {
    private final Map<String, Object> values;

    Arguments(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Arguments of(Map<String, Object> values) {
        return new Arguments(values == null ? Map.of() : values);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new NoSuchElementException("No argument named '" + name + "'");
        }
        return values.get(name);
    }

    public <T> T get(String name, Class<T> type) {
        Object value = get(name);
        if (value != null && !type.isInstance(value)) {
            throw new ClassCastException(
                "Argument '" + name + "' is " + value.getClass().getName() + ", not " + type.getName()
            );
        }
        return type.cast(value);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
