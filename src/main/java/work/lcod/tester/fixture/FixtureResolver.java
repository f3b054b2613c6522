package work.lcod.tester.fixture;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes argument values for a signature, activating the fixtures its parameters name.
 *
 * <p>Parameters with a default always take the default. Every other parameter must name a
 * registered fixture, which is resolved the same way and then invoked. Fixtures returning a
 * {@link Scope} are pushed onto the caller's {@link ActivationStack} and stay active until the
 * caller tears the stack down.
 *
 * <p>Before anything is invoked, the dependency graph reachable from the signature is checked,
 * so a missing fixture or a cycle fails the resolution without activating a single fixture.
 */
public final class FixtureResolver {
    private final ResolutionOptions options;
    private final RunListener listener;

    public FixtureResolver() {
        this(ResolutionOptions.defaults(), RunListener.NONE);
    }

    public FixtureResolver(ResolutionOptions options) {
        this(options, RunListener.NONE);
    }

    public FixtureResolver(ResolutionOptions options, RunListener listener) {
        this.options = Objects.requireNonNull(options, "options");
        this.listener = listener == null ? RunListener.NONE : listener;
    }

    /**
     * Resolves {@code signature} on behalf of {@code requester} (a test or fixture name, used in errors).
     */
    public Arguments resolve(String requester, Signature signature, FixtureRegistry registry, ActivationStack stack) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(stack, "stack");
        verify(requester, signature, registry, new HashMap<>(), new ArrayList<>());
        var session = new Session(registry, stack);
        return session.resolve(requester, signature, 0);
    }

    /**
     * {@code verified} maps each checked fixture to the deepest path length it passed at. A fixture
     * reached again on a longer path is checked again, unless the per-test cache reuses it.
     */
    private void verify(String requester, Signature signature, FixtureRegistry registry, Map<String, Integer> verified, List<String> path) {
        for (Parameter parameter : signature.parameters()) {
            if (parameter.hasDefault()) continue;
            String name = parameter.name();
            Fixture fixture = registry.find(name)
                .orElseThrow(() -> new UnresolvedParameterException(name, requester));
            Integer verifiedAt = verified.get(name);
            if (verifiedAt != null && (options.cachePolicy() == CachePolicy.PER_TEST || verifiedAt >= path.size())) continue;
            int seen = path.indexOf(name);
            if (seen >= 0 && options.detectCycles()) {
                List<String> cycle = new ArrayList<>(path.subList(seen, path.size()));
                cycle.add(name);
                throw new CircularDependencyException(cycle);
            }
            if (path.size() >= options.maxDepth()) {
                throw new RecursionLimitExceededException(options.maxDepth(), name);
            }
            path.add(name);
            verify(name, fixture.signature(), registry, verified, path);
            path.remove(path.size() - 1);
            verified.merge(name, path.size(), Math::max);
        }
    }

    private final class Session {
        private final FixtureRegistry registry;
        private final ActivationStack stack;
        private final Map<String, Object> cache;

        Session(FixtureRegistry registry, ActivationStack stack) {
            this.registry = registry;
            this.stack = stack;
            this.cache = options.cachePolicy() == CachePolicy.PER_TEST ? new HashMap<>() : null;
        }

        Arguments resolve(String requester, Signature signature, int depth) {
            Map<String, Object> values = new LinkedHashMap<>();
            List<Parameter> pending = new ArrayList<>();
            for (Parameter parameter : signature.parameters()) {
                if (parameter.hasDefault()) {
                    values.put(parameter.name(), parameter.defaultValue());
                } else {
                    values.put(parameter.name(), null);
                    pending.add(parameter);
                }
            }
            for (Parameter parameter : pending) {
                Fixture fixture = registry.find(parameter.name())
                    .orElseThrow(() -> new UnresolvedParameterException(parameter.name(), requester));
                values.put(parameter.name(), activate(fixture, depth + 1));
            }
            return new Arguments(values);
        }

        private Object activate(Fixture fixture, int depth) {
            String name = fixture.name();
            if (cache != null && cache.containsKey(name)) {
                return cache.get(name);
            }
            if (depth > options.maxDepth()) {
                throw new RecursionLimitExceededException(options.maxDepth(), name);
            }
            Arguments args = resolve(name, fixture.signature(), depth);
            Object output;
            try {
                output = fixture.invoke(args);
            } catch (TesterException ex) {
                throw ex;
            } catch (Exception | AssertionError ex) {
                throw new FixtureExecutionException(name, FixtureExecutionException.Phase.SETUP, ex);
            }
            Object value = output;
            boolean scoped = output instanceof Scope;
            if (scoped) {
                var activation = new ScopedActivation(name, (Scope) output);
                stack.push(activation);
                value = activation.value();
            }
            listener.fixtureActivated(name, scoped);
            if (cache != null) {
                cache.put(name, value);
            }
            return value;
        }
    }
}
