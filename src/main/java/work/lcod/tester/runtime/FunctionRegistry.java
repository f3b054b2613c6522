package work.lcod.tester.runtime;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores step functions by id.
 */
public final class FunctionRegistry {
    private final Map<String, StepFunction> functions = new ConcurrentHashMap<>();

    public FunctionRegistry register(String id, StepFunction fn) {
        functions.put(id, fn);
        return this;
    }

    public StepFunction get(String id) {
        return id == null ? null : functions.get(id);
    }
}
