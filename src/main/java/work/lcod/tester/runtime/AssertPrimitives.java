package work.lcod.tester.runtime;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assertion step functions. Numbers compare by value regardless of their boxed type.
 */
public final class AssertPrimitives {
    private AssertPrimitives() {}

    public static FunctionRegistry register(FunctionRegistry registry) {
        registry.register("assert/equals", AssertPrimitives::assertEquals);
        registry.register("assert/true", (ctx, input) -> assertBoolean(input, true));
        registry.register("assert/false", (ctx, input) -> assertBoolean(input, false));
        return registry;
    }

    private static Object assertEquals(StepContext ctx, Map<String, Object> input) {
        Object expected = input.get("expected");
        Object actual = input.get("actual");
        if (!valuesEqual(expected, actual)) {
            throw new AssertionFailedException(
                message(input, "expected <" + expected + "> but was <" + actual + ">"),
                expected,
                actual
            );
        }
        return Map.of();
    }

    private static Object assertBoolean(Map<String, Object> input, boolean expected) {
        Object actual = input.get("value");
        if (!(actual instanceof Boolean bool) || bool != expected) {
            throw new AssertionFailedException(
                message(input, "expected " + expected + " but was <" + actual + ">"),
                expected,
                actual
            );
        }
        return Map.of();
    }

    private static String message(Map<String, Object> input, String fallback) {
        Object custom = input.get("message");
        if (custom == null || custom.toString().isBlank()) {
            return fallback;
        }
        return custom + ": " + fallback;
    }

    static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            try {
                return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
            } catch (NumberFormatException ex) {
                // NaN and infinities
                return a.toString().equals(b.toString());
            }
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            if (a.size() != b.size()) return false;
            Iterator<?> ia = a.iterator();
            Iterator<?> ib = b.iterator();
            while (ia.hasNext()) {
                if (!valuesEqual(ia.next(), ib.next())) return false;
            }
            return true;
        }
        if (left instanceof Map<?, ?> a && right instanceof Map<?, ?> b) {
            if (!a.keySet().equals(b.keySet())) return false;
            for (var entry : a.entrySet()) {
                if (!valuesEqual(entry.getValue(), b.get(entry.getKey()))) return false;
            }
            return true;
        }
        return Objects.equals(left, right);
    }
}
