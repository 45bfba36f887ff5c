package io.eventmatch.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import com.google.protobuf.ByteString;
import com.google.protobuf.NullValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Timestamp;
import io.eventmatch.core.model.ValueKind;
import io.eventmatch.core.model.ValueKind.Scalar;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.api.Test;

/** Tests for {@link ValueKindClassifier}. */
class ValueKindClassifierTest {

    static Stream<Arguments> wellKnownKinds() {
        return Stream.of(
                Arguments.of(true, Scalar.BOOL),
                Arguments.of("text", Scalar.STRING),
                Arguments.of(new StringBuilder("sb"), Scalar.STRING),
                Arguments.of(42, Scalar.INT),
                Arguments.of(42L, Scalar.INT),
                Arguments.of((short) 4, Scalar.INT),
                Arguments.of(BigInteger.valueOf(-7), Scalar.INT),
                Arguments.of(UnsignedLong.MAX_VALUE, Scalar.UINT),
                Arguments.of(UnsignedInteger.ONE, Scalar.UINT),
                Arguments.of(new BigInteger("18446744073709551615"), Scalar.UINT),
                Arguments.of(new BigInteger("18446744073709551616"), Scalar.DOUBLE),
                Arguments.of(1.5, Scalar.DOUBLE),
                Arguments.of(1.5f, Scalar.DOUBLE),
                Arguments.of(new BigDecimal("2.25"), Scalar.DOUBLE),
                Arguments.of(new byte[] {1, 2}, Scalar.BYTES),
                Arguments.of(ByteString.copyFromUtf8("x"), Scalar.BYTES),
                Arguments.of(Instant.EPOCH, Scalar.TIMESTAMP),
                Arguments.of(OffsetDateTime.parse("2024-01-01T00:00:00Z"), Scalar.TIMESTAMP),
                Arguments.of(Timestamp.newBuilder().setSeconds(10).build(), Scalar.TIMESTAMP),
                Arguments.of(Map.of("k", 1), Scalar.MAPPING),
                Arguments.of(Map.of(), Scalar.MAPPING),
                Arguments.of(List.of(1, "mixed"), Scalar.LIST),
                Arguments.of(Set.of(1), Scalar.LIST),
                Arguments.of(new String[] {"a"}, Scalar.LIST),
                Arguments.of(NullValue.NULL_VALUE, Scalar.NULL),
                Arguments.of(Struct.getDefaultInstance(), Scalar.DYN));
    }

    @ParameterizedTest
    @MethodSource("wellKnownKinds")
    void classifiesWellKnownTypes(Object value, ValueKind expected) {
        assertThat(ValueKindClassifier.classify(value)).isEqualTo(expected);
    }

    @Test
    void nullIsNullKind() {
        assertThat(ValueKindClassifier.classify(null)).isEqualTo(Scalar.NULL);
    }

    @Test
    void unknownTypesAreOpaqueByClassName() {
        assertThat(ValueKindClassifier.classify(UUID.randomUUID())).isEqualTo(ValueKind.opaque("java.util.UUID"));
        assertThat(ValueKindClassifier.classify(URI.create("http://x"))).isEqualTo(ValueKind.opaque("java.net.URI"));
    }

    @Test
    void distinctUnknownTypesNeverAlias() {
        assertThat(ValueKindClassifier.classify(UUID.randomUUID()))
                .isNotEqualTo(ValueKindClassifier.classify(URI.create("http://x")));
    }

    @Test
    void mapWithNonStringKeysIsOpaque() {
        ValueKind kind = ValueKindClassifier.classify(Map.of(1, "one"));

        assertThat(kind).isInstanceOf(ValueKind.OpaqueObject.class);
    }
}
