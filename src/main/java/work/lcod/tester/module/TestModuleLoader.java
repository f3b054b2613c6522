package work.lcod.tester.module;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.tester.fixture.DiscoveryException;
import work.lcod.tester.fixture.ModuleEntry;
import work.lcod.tester.fixture.Parameter;
import work.lcod.tester.fixture.Signature;
import work.lcod.tester.fixture.TestModule;
import work.lcod.tester.runtime.FunctionRegistry;
import work.lcod.tester.runtime.StepContext;
import work.lcod.tester.runtime.StepFunctions;

/**
 * Loads YAML test modules into {@link TestModule}s.
 *
 * <pre>
 * functions:
 *   - name: fix_1
 *     fixture: true
 *     yield: [1]
 *     teardown:
 *       - call: log
 *         in: { message: closed }
 *   - name: test_run
 *     params: [fix_1, { name: extra, default: 2 }]
 *     steps:
 *       - call: assert/equals
 *         in: { actual: $.fix_1, expected: [1] }
 * </pre>
 */
public final class TestModuleLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final FunctionRegistry functions;

    public TestModuleLoader() {
        this(StepFunctions.create());
    }

    public TestModuleLoader(FunctionRegistry functions) {
        this.functions = Objects.requireNonNull(functions, "functions");
    }

    public TestModule load(Path path) {
        Path file = path.toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            throw new DiscoveryException("Test file '" + path + "' does not exist.");
        }
        String moduleName = moduleName(file);
        try (var in = Files.newInputStream(file)) {
            var ctx = new StepContext(functions, file.getParent(), moduleName);
            return TestModule.fromEntries(moduleName, file, parseEntries(in, ctx, file));
        } catch (IOException ex) {
            throw new DiscoveryException("Failed to read test module: " + file + " (" + ex.getMessage() + ")", ex);
        }
    }

    static String moduleName(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private List<ModuleEntry> parseEntries(InputStream in, StepContext ctx, Path file) throws IOException {
        var root = YAML_MAPPER.readTree(in);
        if (root == null || root.isNull() || root.isMissingNode()) {
            return List.of();
        }
        if (!root.isObject()) {
            throw new DiscoveryException("Test module must be a mapping: " + file);
        }
        var functionsNode = root.get("functions");
        if (functionsNode == null || functionsNode.isNull()) {
            return List.of();
        }
        if (!functionsNode.isArray()) {
            throw new DiscoveryException("'functions' must be a list: " + file);
        }
        List<ModuleEntry> entries = new ArrayList<>();
        int index = 0;
        for (var node : functionsNode) {
            entries.add(toEntry(node, index++, ctx, file));
        }
        return entries;
    }

    private ModuleEntry toEntry(JsonNode node, int index, StepContext ctx, Path file) throws IOException {
        if (!node.isObject()) {
            throw new DiscoveryException("Function #" + index + " must be a mapping: " + file);
        }
        var nameNode = node.get("name");
        if (nameNode == null || !nameNode.isTextual() || nameNode.asText().isBlank()) {
            throw new DiscoveryException("Function #" + index + " has no name: " + file);
        }
        String name = nameNode.asText().trim();
        boolean fixture = node.path("fixture").asBoolean(false);
        Signature signature = readSignature(node.get("params"), name, file);
        var steps = readSteps(node.get("steps"), name, "steps", file);

        boolean hasYield = node.has("yield");
        boolean hasReturn = node.has("return");
        boolean hasTeardown = node.has("teardown");
        if (!fixture && (hasYield || hasReturn || hasTeardown)) {
            throw invalid(name, file, "yield, return and teardown are only allowed on fixtures");
        }
        if (hasYield && hasReturn) {
            throw invalid(name, file, "yield and return are mutually exclusive");
        }
        if (hasTeardown && !hasYield) {
            throw invalid(name, file, "teardown requires yield");
        }

        StepBody body;
        if (hasYield) {
            var teardown = readSteps(node.get("teardown"), name, "teardown", file);
            body = new StepBody(ctx, StepBody.Kind.SCOPED, steps, convertNode(node.get("yield")), teardown);
        } else if (fixture) {
            Object expression = hasReturn ? convertNode(node.get("return")) : null;
            body = new StepBody(ctx, StepBody.Kind.SIMPLE, steps, expression, null);
        } else {
            body = new StepBody(ctx, StepBody.Kind.PLAIN, steps, null, null);
        }
        return new ModuleEntry(name, signature, body, fixture);
    }

    private Signature readSignature(JsonNode params, String owner, Path file) throws IOException {
        if (params == null || params.isNull()) {
            return Signature.empty();
        }
        if (!params.isArray()) {
            throw invalid(owner, file, "params must be a list");
        }
        List<Parameter> parameters = new ArrayList<>();
        for (var param : params) {
            if (param.isTextual()) {
                parameters.add(Parameter.required(param.asText().trim()));
            } else if (param.isObject() && param.hasNonNull("name")) {
                String paramName = param.get("name").asText().trim();
                parameters.add(param.has("default")
                    ? Parameter.withDefault(paramName, convertNode(param.get("default")))
                    : Parameter.required(paramName));
            } else {
                throw invalid(owner, file, "params entries must be names or {name, default} mappings");
            }
        }
        try {
            return Signature.of(parameters);
        } catch (IllegalArgumentException ex) {
            throw invalid(owner, file, ex.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> readSteps(JsonNode node, String owner, String field, Path file) throws IOException {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw invalid(owner, file, field + " must be a list of steps");
        }
        var steps = new ArrayList<Map<String, Object>>();
        for (var stepNode : node) {
            if (!stepNode.isObject() || !stepNode.hasNonNull("call")) {
                throw invalid(owner, file, field + " entries must be mappings with a 'call'");
            }
            steps.add((Map<String, Object>) convertNode(stepNode));
        }
        return steps;
    }

    private static DiscoveryException invalid(String owner, Path file, String reason) {
        return new DiscoveryException("Invalid function '" + owner + "' in " + file + ": " + reason);
    }

    private static Object convertNode(JsonNode node) throws IOException {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }
}
