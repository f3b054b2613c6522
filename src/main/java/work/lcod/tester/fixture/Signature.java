package work.lcod.tester.fixture;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered parameter declaration attached to a fixture or test at registration time.
 */
public final class Signature {
    private static final Signature EMPTY = new Signature(List.of());

    private final List<Parameter> parameters;

    private Signature(List<Parameter> parameters) {
        Set<String> seen = new HashSet<>();
        for (Parameter parameter : parameters) {
            if (!seen.add(parameter.name())) {
                throw new IllegalArgumentException("Duplicate parameter: " + parameter.name());
            }
        }
        this.parameters = List.copyOf(parameters);
    }

    public static Signature empty() {
        return EMPTY;
    }

    public static Signature of(List<Parameter> parameters) {
        return parameters == null || parameters.isEmpty() ? EMPTY : new Signature(parameters);
    }

    public static Signature of(Parameter... parameters) {
        return of(List.of(parameters));
    }

    /**
     * Signature whose parameters all require a fixture.
     */
    public static Signature requiring(String... names) {
        List<Parameter> parameters = new ArrayList<>(names.length);
        for (String name : names) {
            parameters.add(Parameter.required(name));
        }
        return of(parameters);
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public List<String> names() {
        return parameters.stream().map(Parameter::name).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return parameters.isEmpty();
    }

    @Override
    public String toString() {
        return "(" + String.join(", ", names()) + ")";
    }
}
