package work.lcod.tester.runtime.fs;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.tester.runtime.FunctionRegistry;
import work.lcod.tester.runtime.StepContext;

/**
 * File helpers for fixtures that hold a file open across a test: open, write, close, read.
 * Relative paths resolve against the test module's directory.
 */
public final class FsPrimitives {
    private FsPrimitives() {}

    public static FunctionRegistry register(FunctionRegistry registry) {
        registry.register("fs/open", FsPrimitives::open);
        registry.register("fs/write", FsPrimitives::write);
        registry.register("fs/close", FsPrimitives::close);
        registry.register("fs/is_open", (ctx, input) -> Map.of("open", requireHandle(input).isOpen()));
        registry.register("fs/read", FsPrimitives::read);
        return registry;
    }

    private static Object open(StepContext ctx, Map<String, Object> input) throws IOException {
        Path target = ctx.resolvePath(input.get("path"));
        if (target == null) {
            throw new IllegalArgumentException("path is required");
        }
        var handle = FileHandle.open(target, FileHandle.Mode.from(input.get("mode")));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("handle", handle);
        result.put("path", target.toString());
        return result;
    }

    private static Object write(StepContext ctx, Map<String, Object> input) throws IOException {
        var handle = requireHandle(input);
        Object text = input.get("text");
        handle.write(text == null ? "" : text.toString());
        return Map.of();
    }

    private static Object close(StepContext ctx, Map<String, Object> input) throws IOException {
        requireHandle(input).close();
        return Map.of("closed", true);
    }

    private static Object read(StepContext ctx, Map<String, Object> input) throws IOException {
        Path target = ctx.resolvePath(input.get("path"));
        if (target == null) {
            throw new IllegalArgumentException("path is required");
        }
        return Map.of("text", Files.readString(target, StandardCharsets.UTF_8));
    }

    private static FileHandle requireHandle(Map<String, Object> input) {
        if (input.get("handle") instanceof FileHandle handle) {
            return handle;
        }
        throw new IllegalArgumentException("handle must come from fs/open");
    }
}
