package io.eventmatch.core.model;

import java.util.Objects;

/**
 * A declared variable together with its runtime value. Built fresh for every evaluation and never
 * shared between calls.
 *
 * @param name  identifier visible to the expression
 * @param kind  declared kind; equals the kind of {@code value} when the binding was derived from it
 * @param value the runtime value, {@code null} for JSON {@code null}
 * @param bound {@code false} when the variable is declared but no value was supplied
 */
public record VariableBinding(String name, ValueKind kind, Object value, boolean bound) {

    public VariableBinding {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (!bound && value != null) {
            throw new IllegalArgumentException("unbound variable '" + name + "' must not carry a value");
        }
    }

    /** A declared variable carrying a value. */
    public static VariableBinding bound(String name, ValueKind kind, Object value) {
        return new VariableBinding(name, kind, value, true);
    }

    /** A declared variable with no value; referencing it fails at evaluation time. */
    public static VariableBinding declaredOnly(String name, ValueKind kind) {
        return new VariableBinding(name, kind, null, false);
    }
}
