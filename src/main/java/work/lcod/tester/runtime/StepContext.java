package work.lcod.tester.runtime;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Execution context passed to step functions: function lookup and the module's base directory.
 */
public final class StepContext {
    private final FunctionRegistry registry;
    private final Path workingDirectory;
    private final String module;

    public StepContext(FunctionRegistry registry) {
        this(registry, null, "inline");
    }

    public StepContext(FunctionRegistry registry, Path workingDirectory, String module) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.workingDirectory = workingDirectory == null
            ? Paths.get("").toAbsolutePath().normalize()
            : workingDirectory.toAbsolutePath().normalize();
        this.module = module == null ? "inline" : module;
    }

    public FunctionRegistry registry() {
        return registry;
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    /**
     * Name of the test module whose steps are running; used as the logger suffix.
     */
    public String module() {
        return module;
    }

    /**
     * Resolves a possibly relative path against {@link #workingDirectory()}.
     */
    public Path resolvePath(Object raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        Path path = Paths.get(text);
        return path.isAbsolute() ? path.normalize() : workingDirectory.resolve(path).normalize();
    }

    public Object call(String id, Map<String, Object> input) throws Exception {
        var fn = registry.get(id);
        if (fn == null) {
            throw new IllegalStateException("Function not registered: " + id);
        }
        return fn.invoke(this, input == null ? new LinkedHashMap<>() : new LinkedHashMap<>(input));
    }
}
