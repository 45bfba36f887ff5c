package io.eventmatch.core.engine;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import com.google.protobuf.ByteString;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.NullValue;
import com.google.protobuf.Timestamp;
import io.eventmatch.core.model.ValueKind;
import io.eventmatch.core.model.ValueKind.Scalar;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Map;

/**
 * Maps a runtime value to its {@link ValueKind}.
 *
 * <p>
 * Rules, in priority order:
 * <ol>
 * <li>{@link Boolean} → BOOL</li>
 * <li>{@link CharSequence} → STRING</li>
 * <li>{@link Byte}, {@link Short}, {@link Integer}, {@link Long}, and {@link BigInteger} within the
 * {@code long} range → INT</li>
 * <li>{@link UnsignedLong}, {@link UnsignedInteger}, and non-negative {@link BigInteger} within 64
 * bits → UINT</li>
 * <li>{@link Float}, {@link Double}, {@link BigDecimal}, and wider {@link BigInteger} → DOUBLE</li>
 * <li>{@code byte[]} and {@link ByteString} → BYTES</li>
 * <li>{@link Instant}, {@link OffsetDateTime}, {@link ZonedDateTime}, protobuf {@link Timestamp} →
 * TIMESTAMP</li>
 * <li>{@link Map} with only string keys → MAPPING</li>
 * <li>{@link Collection} and non-byte arrays → LIST</li>
 * <li>{@code null} and protobuf {@link NullValue} → NULL</li>
 * <li>other protobuf messages → DYN</li>
 * <li>anything else → {@link ValueKind.OpaqueObject} named after the concrete class</li>
 * </ol>
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class ValueKindClassifier {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private ValueKindClassifier() {}

    /**
     * Classifies a value.
     *
     * @param value any value, possibly {@code null}
     * @return the value's kind, never {@code null}
     */
    public static ValueKind classify(Object value) {
        if (value instanceof Boolean) {
            return Scalar.BOOL;
        }
        if (value instanceof CharSequence) {
            return Scalar.STRING;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Scalar.INT;
        }
        if (value instanceof BigInteger) {
            return classifyBigInteger((BigInteger) value);
        }
        if (value instanceof UnsignedLong || value instanceof UnsignedInteger) {
            return Scalar.UINT;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return Scalar.DOUBLE;
        }
        if (value instanceof byte[] || value instanceof ByteString) {
            return Scalar.BYTES;
        }
        if (value instanceof Instant
                || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime
                || value instanceof Timestamp) {
            return Scalar.TIMESTAMP;
        }
        if (value instanceof Map) {
            return isStringKeyed((Map<?, ?>) value) ? Scalar.MAPPING : ValueKind.opaque(value.getClass().getName());
        }
        if (value instanceof Collection || (value != null && value.getClass().isArray())) {
            return Scalar.LIST;
        }
        if (value == null || value instanceof NullValue) {
            return Scalar.NULL;
        }
        if (value instanceof MessageOrBuilder) {
            return Scalar.DYN;
        }
        return ValueKind.opaque(value.getClass().getName());
    }

    private static ValueKind classifyBigInteger(BigInteger value) {
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return Scalar.INT;
        }
        if (value.signum() >= 0 && value.bitLength() <= 64) {
            return Scalar.UINT;
        }
        return Scalar.DOUBLE;
    }

    private static boolean isStringKeyed(Map<?, ?> map) {
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                return false;
            }
        }
        return true;
    }
}
