package work.lcod.tester.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Interprets step lists sequentially. Each step is {@code {call, in, out}}: {@code in} values are
 * resolved against the state ({@code $.a.b}, list indexes allowed), the function is called and
 * {@code out} copies result fields back into the state ({@code $} for the whole result).
 */
public final class StepRunner {
    private static final String OPTIONAL_FLAG = "optional";

    private StepRunner() {}

    public static Map<String, Object> runSteps(StepContext ctx, List<Map<String, Object>> rawSteps, Map<String, Object> initialState) throws Exception {
        var state = initialState == null ? new LinkedHashMap<String, Object>() : new LinkedHashMap<>(initialState);
        var steps = rawSteps == null ? List.<Map<String, Object>>of() : rawSteps;

        for (int index = 0; index < steps.size(); index++) {
            var step = steps.get(index);
            if (step == null) continue;
            var callId = Objects.toString(step.get("call"), null);
            if (callId == null || callId.isBlank()) {
                throw new IllegalArgumentException("Step " + index + " has no 'call'");
            }
            var input = buildInput(castMap(step.get("in")), state);
            Object result = ctx.call(callId, input);
            applyOutputs(step, state, result);
        }

        return state;
    }

    /**
     * Evaluates a value expression against {@code state}: {@code $.path} references, nested
     * lists/maps of them, or plain literals.
     */
    public static Object evaluate(Object expression, Map<String, Object> state) {
        return resolveValue(expression, state == null ? Map.of() : state);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object obj) {
        if (obj instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    private static Map<String, Object> buildInput(Map<String, Object> bindings, Map<String, Object> state) {
        var result = new LinkedHashMap<String, Object>();
        for (var entry : bindings.entrySet()) {
            var value = entry.getValue();
            var optional = false;
            if (value instanceof Map<?, ?> map && Boolean.TRUE.equals(map.get(OPTIONAL_FLAG)) && map.containsKey("value")) {
                optional = true;
                value = map.get("value");
            }
            var resolved = resolveValue(value, state);
            if (optional && resolved == null) {
                continue;
            }
            result.put(entry.getKey(), resolved);
        }
        return result;
    }

    private static Object resolveValue(Object value, Map<String, Object> state) {
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (var item : list) {
                copy.add(resolveValue(item, state));
            }
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), resolveValue(entry.getValue(), state));
            }
            return copy;
        }
        if (!(value instanceof String str)) {
            return value;
        }
        if ("$".equals(str)) {
            return cloneLiteral(state);
        }
        if (str.startsWith("$.")) {
            return getByPath(Map.of("$", state), str);
        }
        return value;
    }

    private static Object getByPath(Map<String, Object> root, String path) {
        if (path == null || !path.contains(".")) return null;
        var parts = path.split("\\.");
        Object current = root;
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (current instanceof Map<?, ?> map) {
                current = map.get(part);
            } else if (current instanceof List<?> list) {
                int index = parseIndex(part);
                if (index < 0 || index >= list.size()) {
                    return null;
                }
                current = list.get(index);
            } else {
                return null;
            }
            if (current == null) {
                return null;
            }
        }
        return cloneLiteral(current);
    }

    private static int parseIndex(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }

    static Object cloneLiteral(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), cloneLiteral(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (var item : list) {
                copy.add(cloneLiteral(item));
            }
            return copy;
        }
        return value;
    }

    private static void applyOutputs(Map<String, Object> step, Map<String, Object> state, Object result) {
        var outs = castMap(step.get("out"));
        for (var entry : outs.entrySet()) {
            var aliasValue = entry.getValue();
            Object resolved;
            if ("$".equals(aliasValue)) {
                resolved = result;
            } else if (aliasValue instanceof String str && result instanceof Map<?, ?> resMap) {
                resolved = str.startsWith("$.") ? getByPath(Map.of("$", resMap), str) : resMap.get(str);
            } else {
                resolved = null;
            }
            state.put(entry.getKey(), resolved);
        }
    }
}
