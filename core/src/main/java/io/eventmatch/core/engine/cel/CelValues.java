package io.eventmatch.core.engine.cel;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import com.google.protobuf.ByteString;
import com.google.protobuf.NullValue;
import com.google.protobuf.Timestamp;
import io.eventmatch.core.engine.ValueKindClassifier;
import io.eventmatch.core.model.ValueKind;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts plain Java values into the representations the CEL runtime operates on: signed integers
 * become {@link Long}, unsigned integers {@link UnsignedLong}, floating point {@link Double}, bytes
 * {@link ByteString}, instants protobuf {@link Timestamp}, and {@code null} protobuf
 * {@link NullValue}. Maps and lists are converted recursively.
 *
 * <p>
 * The conversion never changes a value's {@link ValueKind}.
 */
public final class CelValues {

    private CelValues() {}

    /** Converts {@code value} for use as a CEL variable value. */
    public static Object toCel(Object value) {
        if (value == null) {
            return NullValue.NULL_VALUE;
        }
        if (value instanceof Boolean || value instanceof String || value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof CharSequence) {
            return value.toString();
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger) {
            return fromBigInteger((BigInteger) value);
        }
        if (value instanceof UnsignedLong) {
            return value;
        }
        if (value instanceof UnsignedInteger) {
            return UnsignedLong.valueOf(((UnsignedInteger) value).longValue());
        }
        if (value instanceof Float || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof byte[]) {
            return ByteString.copyFrom((byte[]) value);
        }
        if (value instanceof Instant) {
            return toTimestamp((Instant) value);
        }
        if (value instanceof OffsetDateTime) {
            return toTimestamp(((OffsetDateTime) value).toInstant());
        }
        if (value instanceof ZonedDateTime) {
            return toTimestamp(((ZonedDateTime) value).toInstant());
        }
        if (value instanceof Map) {
            Map<Object, Object> converted = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> converted.put(k, toCel(v)));
            return converted;
        }
        if (value instanceof Collection) {
            List<Object> converted = new ArrayList<>(((Collection<?>) value).size());
            for (Object element : (Collection<?>) value) {
                converted.add(toCel(element));
            }
            return converted;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> converted = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                converted.add(toCel(Array.get(value, i)));
            }
            return converted;
        }
        // ByteString, Timestamp, NullValue, protobuf messages and opaque host objects pass through
        return value;
    }

    private static Object fromBigInteger(BigInteger value) {
        ValueKind kind = ValueKindClassifier.classify(value);
        if (kind == ValueKind.Scalar.INT) {
            return value.longValue();
        }
        if (kind == ValueKind.Scalar.UINT) {
            return UnsignedLong.valueOf(value);
        }
        return value.doubleValue();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return Timestamp.newBuilder()
                .setSeconds(instant.getEpochSecond())
                .setNanos(instant.getNano())
                .build();
    }
}
