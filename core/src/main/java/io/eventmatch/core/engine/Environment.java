package io.eventmatch.core.engine;

import io.eventmatch.core.engine.cel.CelValues;
import io.eventmatch.core.engine.cel.SafeAccessors;
import io.eventmatch.core.model.Document;
import io.eventmatch.core.model.VariableBinding;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * The declared variables and accessor functions visible to one expression evaluation. Built by
 * {@link EnvironmentBuilder} for a single call and owned exclusively by it.
 */
public final class Environment {

    private final Document document;
    private final Map<String, VariableBinding> bindings;
    private final SafeAccessors accessors;
    private final String signature;

    Environment(Document document, Map<String, VariableBinding> bindings, SafeAccessors accessors) {
        this.document = document;
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        this.accessors = accessors;
        this.signature = computeSignature(bindings);
    }

    /** The document this environment was derived from. */
    public Document document() {
        return document;
    }

    /** All declared variables, document keys first, in declaration order. */
    public Collection<VariableBinding> bindings() {
        return bindings.values();
    }

    /** Looks up a declared variable by name. */
    public Optional<VariableBinding> binding(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    /** The accessor functions, bound to {@link #document()}. */
    public SafeAccessors accessors() {
        return accessors;
    }

    /**
     * The variable-kind signature: {@code name:kind} pairs sorted by name and joined with
     * {@code ,}. Two environments with equal signatures accept exactly the same expressions.
     */
    public String signature() {
        return signature;
    }

    /** Runtime values of all bound variables, converted for the CEL runtime. */
    Map<String, Object> activation() {
        Map<String, Object> activation = new LinkedHashMap<>();
        for (VariableBinding binding : bindings.values()) {
            if (binding.bound()) {
                activation.put(binding.name(), CelValues.toCel(binding.value()));
            }
        }
        return activation;
    }

    private static String computeSignature(Map<String, VariableBinding> bindings) {
        return new TreeMap<>(bindings).values().stream()
                .map(b -> b.name() + ":" + b.kind().displayName())
                .collect(Collectors.joining(","));
    }
}
