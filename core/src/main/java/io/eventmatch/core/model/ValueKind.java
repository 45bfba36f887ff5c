package io.eventmatch.core.model;

import java.util.Objects;

/**
 * Symbolic type tag assigned to a dynamically typed event value. Every variable declared for an
 * expression carries exactly one kind.
 *
 * <p>
 * The hierarchy is sealed: the fixed tags live in {@link Scalar}, and values whose concrete type is
 * not recognised are tagged with an {@link OpaqueObject} carrying the type name, so that two
 * distinct unknown types never share a kind.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface ValueKind permits ValueKind.Scalar, ValueKind.OpaqueObject {

    /** Human-readable type name, as it appears in error messages and environment signatures. */
    String displayName();

    /** The closed set of well-known kinds. */
    enum Scalar implements ValueKind {
        BOOL("bool"),
        STRING("string"),
        INT("int"),
        UINT("uint"),
        DOUBLE("double"),
        BYTES("bytes"),
        TIMESTAMP("timestamp"),
        /** String-keyed mapping with dynamically typed values. */
        MAPPING("map(string, dyn)"),
        /** List with dynamically typed elements. */
        LIST("list(dyn)"),
        NULL("null_type"),
        /** Host message values resolved at evaluation time. */
        DYN("dyn");

        private final String displayName;

        Scalar(String displayName) {
            this.displayName = displayName;
        }

        @Override
        public String displayName() {
            return displayName;
        }
    }

    /**
     * Kind of a value whose concrete type has no dedicated tag.
     *
     * @param typeName fully qualified name of the value's concrete type
     */
    record OpaqueObject(String typeName) implements ValueKind {
        public OpaqueObject {
            Objects.requireNonNull(typeName, "typeName must not be null");
            if (typeName.isBlank()) {
                throw new IllegalArgumentException("typeName must not be blank");
            }
        }

        @Override
        public String displayName() {
            return typeName;
        }
    }

    /** Creates an opaque kind for the given type name. */
    static ValueKind opaque(String typeName) {
        return new OpaqueObject(typeName);
    }
}
