package io.eventmatch.core.engine.cel;

import dev.cel.common.types.CelType;
import dev.cel.common.types.ListType;
import dev.cel.common.types.MapType;
import dev.cel.common.types.OpaqueType;
import dev.cel.common.types.SimpleType;
import io.eventmatch.core.model.ValueKind;

/** Maps {@link ValueKind} tags to CEL checker types. */
public final class CelTypes {

    private static final CelType MAPPING = MapType.create(SimpleType.STRING, SimpleType.DYN);
    private static final CelType LIST = ListType.create(SimpleType.DYN);

    private CelTypes() {}

    /** Returns the CEL type declared for variables of the given kind. */
    public static CelType of(ValueKind kind) {
        if (kind instanceof ValueKind.OpaqueObject) {
            return OpaqueType.create(((ValueKind.OpaqueObject) kind).typeName());
        }
        return switch ((ValueKind.Scalar) kind) {
            case BOOL -> SimpleType.BOOL;
            case STRING -> SimpleType.STRING;
            case INT -> SimpleType.INT;
            case UINT -> SimpleType.UINT;
            case DOUBLE -> SimpleType.DOUBLE;
            case BYTES -> SimpleType.BYTES;
            case TIMESTAMP -> SimpleType.TIMESTAMP;
            case MAPPING -> MAPPING;
            case LIST -> LIST;
            case NULL -> SimpleType.NULL_TYPE;
            case DYN -> SimpleType.DYN;
        };
    }
}
