package work.lcod.tester.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;

/**
 * General-purpose step functions: {@code std/set}, {@code std/concat}, {@code log}.
 */
public final class CorePrimitives {
    static final String MODULE_LOGGER_PREFIX = "work.lcod.tester.module.";

    private CorePrimitives() {}

    public static FunctionRegistry register(FunctionRegistry registry) {
        registry.register("std/set", (ctx, input) -> new LinkedHashMap<>(input));
        registry.register("std/concat", CorePrimitives::concat);
        registry.register("log", CorePrimitives::log);
        return registry;
    }

    private static Object concat(StepContext ctx, Map<String, Object> input) {
        Object raw = input.get("items");
        if (!(raw instanceof List<?> items)) {
            throw new IllegalArgumentException("items must be a list");
        }
        boolean allLists = !items.isEmpty() && items.stream().allMatch(item -> item instanceof List<?>);
        Object value;
        if (allLists) {
            List<Object> merged = new ArrayList<>();
            for (Object item : items) {
                merged.addAll((List<?>) item);
            }
            value = merged;
        } else {
            var text = new StringBuilder();
            for (Object item : items) {
                if (item instanceof List<?>) {
                    throw new IllegalArgumentException("Cannot concatenate a list with non-list items");
                }
                text.append(item == null ? "" : item.toString());
            }
            value = text.toString();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("value", value);
        return result;
    }

    private static Object log(StepContext ctx, Map<String, Object> input) {
        String message = input.get("message") == null ? "" : String.valueOf(input.get("message"));
        Level level = Level.toLevel(String.valueOf(input.getOrDefault("level", "info")).toUpperCase(Locale.ROOT), Level.INFO);
        LogManager.getLogger(MODULE_LOGGER_PREFIX + ctx.module()).log(level, message);
        return Map.of();
    }
}
