package work.lcod.tester.runtime;

import java.util.Map;

/**
 * A function callable from a step ({@code call: <id>}).
 */
@FunctionalInterface
public interface StepFunction {
    Object invoke(StepContext ctx, Map<String, Object> input) throws Exception;
}
