package io.eventmatch.core.model;

/**
 * Caller-supplied variable declaration for host-provided typed values. Declarations take
 * precedence over document keys of the same name.
 *
 * @param name the identifier the expression uses
 * @param kind the declared kind
 */
public record VariableDeclaration(String name, ValueKind kind) {

    public static VariableDeclaration of(String name, ValueKind kind) {
        return new VariableDeclaration(name, kind);
    }
}
