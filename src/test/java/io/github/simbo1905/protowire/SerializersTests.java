// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import org.junit.jupiter.api.*;

import java.util.List;

import static io.github.simbo1905.protowire.ProtoCodec.LOGGER;
import static io.github.simbo1905.protowire.WireFormatTests.bytes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SerializersTests {

  @BeforeAll
  static void setupLogging() {
    io.github.simbo1905.LoggingControl.setupCleanLogging();
  }

  @BeforeEach
  void setUp() {
    LOGGER.fine(() -> "Starting SerializersTests test");
  }

  static <T> byte[] dump(Serializer<T> serializer, T value) {
    serializer.validate(value);
    final WriteBuffer out = WriteBuffer.allocate();
    serializer.dump(value, out);
    return out.toByteArray();
  }

  static <T> T load(Serializer<T> serializer, byte[] bytes) {
    final ReadBuffer in = ReadBuffer.wrap(bytes);
    final T value = serializer.load(in);
    assertThat(in.hasRemaining()).isFalse();
    return value;
  }

  enum Colour {
    RED, GREEN, BLUE
  }

  enum Status implements ProtoEnum {
    ACTIVE(1), UNKNOWN(0), RETIRED(-1);

    final int number;

    Status(int number) {
      this.number = number;
    }

    @Override
    public int number() {
      return number;
    }
  }

  enum Clashing implements ProtoEnum {
    A, B;

    @Override
    public int number() {
      return 7;
    }
  }

  enum Empty {
  }

  @Test
  void testBool() {
    assertThat(dump(Serializers.BOOL, true)).containsExactly(bytes(0x01));
    assertThat(dump(Serializers.BOOL, false)).containsExactly(bytes(0x00));
    assertThat(load(Serializers.BOOL, bytes(0x01))).isTrue();
    assertThat(load(Serializers.BOOL, bytes(0x02))).isTrue();
    assertThat(load(Serializers.BOOL, bytes(0x00))).isFalse();
  }

  @Test
  void testInt32() {
    assertThat(dump(Serializers.INT32, 150)).containsExactly(bytes(0x96, 0x01));
    assertThat(dump(Serializers.INT32, -1)).hasSize(10);
    assertThat(load(Serializers.INT32, dump(Serializers.INT32, -1))).isEqualTo(-1);
    assertThat(load(Serializers.INT32, dump(Serializers.INT32, Integer.MIN_VALUE))).isEqualTo(Integer.MIN_VALUE);
  }

  @Test
  void testInt32RejectsOutOfRangeVarint() {
    final byte[] large = WriteBuffer.allocate().putVarLong(1L << 40).toByteArray();
    assertThatThrownBy(() -> load(Serializers.INT32, large)).isInstanceOf(DecodeException.class);
  }

  @Test
  void testInt64() {
    assertThat(dump(Serializers.INT64, -2L))
        .containsExactly(bytes(0xFE, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0x01));
    assertThat(load(Serializers.INT64, dump(Serializers.INT64, Long.MIN_VALUE))).isEqualTo(Long.MIN_VALUE);
    assertThat(Serializers.SIGNED_VARINT).isSameAs(Serializers.INT64);
  }

  @Test
  void testUnsignedVarint() {
    assertThat(dump(Serializers.UNSIGNED_VARINT, 3L)).containsExactly(bytes(0x03));
    assertThat(load(Serializers.UNSIGNED_VARINT, bytes(0x96, 0x01))).isEqualTo(150L);
    assertThatThrownBy(() -> Serializers.UNSIGNED_VARINT.validate(-1L))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("non-negative");
    assertThatThrownBy(() -> load(Serializers.UNSIGNED_VARINT, dump(Serializers.INT64, -1L)))
        .isInstanceOf(DecodeException.class);
  }

  @Test
  void testUint32() {
    assertThat(dump(Serializers.UINT32, 0xFFFF_FFFFL)).containsExactly(bytes(0xFF, 0xFF, 0xFF, 0xFF, 0x0F));
    assertThat(load(Serializers.UINT32, bytes(0xFF, 0xFF, 0xFF, 0xFF, 0x0F))).isEqualTo(0xFFFF_FFFFL);
    assertThatThrownBy(() -> Serializers.UINT32.validate(0x1_0000_0000L)).isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> Serializers.UINT32.validate(-1L)).isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> load(Serializers.UINT32, bytes(0x80, 0x80, 0x80, 0x80, 0x10)))
        .isInstanceOf(DecodeException.class);
  }

  @Test
  void testUint64UsesTheBitPattern() {
    assertThat(dump(Serializers.UINT64, -1L)).hasSize(10);
    assertThat(load(Serializers.UINT64, dump(Serializers.UINT64, -1L))).isEqualTo(-1L);
  }

  @Test
  void testSint32() {
    assertThat(dump(Serializers.SINT32, 0)).containsExactly(bytes(0x00));
    assertThat(dump(Serializers.SINT32, -1)).containsExactly(bytes(0x01));
    assertThat(dump(Serializers.SINT32, 1)).containsExactly(bytes(0x02));
    assertThat(dump(Serializers.SINT32, -2)).containsExactly(bytes(0x03));
    assertThat(dump(Serializers.SINT32, Integer.MIN_VALUE)).containsExactly(bytes(0xFF, 0xFF, 0xFF, 0xFF, 0x0F));
    assertThat(load(Serializers.SINT32, bytes(0x03))).isEqualTo(-2);
    assertThatThrownBy(() -> load(Serializers.SINT32, bytes(0x80, 0x80, 0x80, 0x80, 0x10)))
        .isInstanceOf(DecodeException.class);
  }

  @Test
  void testSint64() {
    assertThat(dump(Serializers.SINT64, -3L)).containsExactly(bytes(0x05));
    assertThat(load(Serializers.SINT64, dump(Serializers.SINT64, Long.MIN_VALUE))).isEqualTo(Long.MIN_VALUE);
  }

  @Test
  void testFixed() {
    assertThat(dump(Serializers.FIXED32, 0xFFFF_FFFFL)).containsExactly(bytes(0xFF, 0xFF, 0xFF, 0xFF));
    assertThat(load(Serializers.FIXED32, bytes(0xFF, 0xFF, 0xFF, 0xFF))).isEqualTo(0xFFFF_FFFFL);
    assertThatThrownBy(() -> Serializers.FIXED32.validate(-1L)).isInstanceOf(ValidationException.class);
    assertThat(dump(Serializers.SFIXED32, -1)).containsExactly(bytes(0xFF, 0xFF, 0xFF, 0xFF));
    assertThat(load(Serializers.SFIXED32, bytes(0xFE, 0xFF, 0xFF, 0xFF))).isEqualTo(-2);
    assertThat(dump(Serializers.FIXED64, 1L)).containsExactly(bytes(0x01, 0, 0, 0, 0, 0, 0, 0));
    assertThat(load(Serializers.SFIXED64, dump(Serializers.SFIXED64, -5L))).isEqualTo(-5L);
  }

  @Test
  void testFloatingPoint() {
    assertThat(dump(Serializers.FLOAT, 1.0f)).containsExactly(bytes(0x00, 0x00, 0x80, 0x3F));
    assertThat(dump(Serializers.DOUBLE, 1.0d)).containsExactly(bytes(0, 0, 0, 0, 0, 0, 0xF0, 0x3F));
    assertThat(load(Serializers.DOUBLE, dump(Serializers.DOUBLE, -0.5d))).isEqualTo(-0.5d);
    assertThat(load(Serializers.FLOAT, dump(Serializers.FLOAT, Float.NaN))).isNaN();
  }

  @Test
  void testString() {
    assertThat(dump(Serializers.STRING, "Testing")).containsExactly(bytes(0x07, 'T', 'e', 's', 't', 'i', 'n', 'g'));
    assertThat(load(Serializers.STRING, dump(Serializers.STRING, "héllo wörld €"))).isEqualTo("héllo wörld €");
    assertThat(dump(Serializers.STRING, "")).containsExactly(bytes(0x00));
  }

  @Test
  void testStringRejectsMalformedUtf8() {
    assertThatThrownBy(() -> load(Serializers.STRING, bytes(0x02, 0xC3, 0x28)))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("UTF-8");
  }

  @Test
  void testStringRejectsLoneSurrogate() {
    assertThatThrownBy(() -> Serializers.STRING.validate("bad \uD800"))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void testBytes() {
    assertThat(dump(Serializers.BYTES, bytes(0x42))).containsExactly(bytes(0x01, 0x42));
    assertThat(load(Serializers.BYTES, bytes(0x00))).isEmpty();
    assertThat(Serializers.BYTES.defaultValue()).isEmpty();
  }

  @Test
  void testValidationRejectsNullAndWrongType() {
    assertThatThrownBy(() -> Serializers.INT32.validate(null))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("null");
    assertThatThrownBy(() -> Serializers.INT32.validate(1L))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Integer");
    assertThatThrownBy(() -> Serializers.STRING.validate(42)).isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> Serializers.BYTES.validate("text")).isInstanceOf(ValidationException.class);
  }

  @Test
  void testDefaults() {
    assertThat(Serializers.BOOL.defaultValue()).isFalse();
    assertThat(Serializers.INT32.defaultValue()).isZero();
    assertThat(Serializers.UINT64.defaultValue()).isZero();
    assertThat(Serializers.DOUBLE.defaultValue()).isZero();
    assertThat(Serializers.STRING.defaultValue()).isEmpty();
  }

  @Test
  void testPackable() {
    assertThat(Serializers.INT32.packable()).isTrue();
    assertThat(Serializers.FIXED64.packable()).isTrue();
    assertThat(Serializers.STRING.packable()).isFalse();
    assertThat(Serializers.BYTES.packable()).isFalse();
  }

  @Test
  void testEnumByOrdinal() {
    final EnumSerializer<Colour> serializer = EnumSerializer.of(Colour.class);
    assertThat(dump(serializer, Colour.BLUE)).containsExactly(bytes(0x02));
    assertThat(load(serializer, bytes(0x01))).isEqualTo(Colour.GREEN);
    assertThat(serializer.defaultValue()).isEqualTo(Colour.RED);
  }

  @Test
  void testEnumByNumber() {
    final EnumSerializer<Status> serializer = EnumSerializer.of(Status.class);
    assertThat(dump(serializer, Status.ACTIVE)).containsExactly(bytes(0x01));
    assertThat(dump(serializer, Status.RETIRED)).hasSize(10);
    assertThat(load(serializer, dump(serializer, Status.RETIRED))).isEqualTo(Status.RETIRED);
    // the constant numbered zero is the default whatever its position
    assertThat(serializer.defaultValue()).isEqualTo(Status.UNKNOWN);
  }

  @Test
  void testEnumRejectsUnknownNumber() {
    assertThatThrownBy(() -> load(EnumSerializer.of(Colour.class), bytes(0x09)))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("Unknown");
  }

  @Test
  void testEnumRejectsWrongConstant() {
    final EnumSerializer<Colour> serializer = EnumSerializer.of(Colour.class);
    assertThatThrownBy(() -> serializer.validate(Status.ACTIVE)).isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> serializer.validate(null)).isInstanceOf(ValidationException.class);
  }

  @Test
  void testEnumMappingErrors() {
    assertThatThrownBy(() -> EnumSerializer.of(Clashing.class))
        .isInstanceOf(TypeMappingException.class)
        .hasMessageContaining("same number");
    assertThatThrownBy(() -> EnumSerializer.of(Empty.class)).isInstanceOf(TypeMappingException.class);
  }

  @Test
  void testPackingSerializer() {
    final PackingSerializer<Integer> packing = new PackingSerializer<>(Serializers.INT32);
    assertThat(dump(packing, List.of(1, 150, 2))).containsExactly(bytes(0x04, 0x01, 0x96, 0x01, 0x02));
    assertThat(load(packing, bytes(0x04, 0x01, 0x96, 0x01, 0x02))).containsExactly(1, 150, 2);
    assertThat(packing.merge(List.of(1), List.of(2, 3))).containsExactly(1, 2, 3);
    assertThatThrownBy(() -> packing.validate(List.of(1, "two")))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("element 1");
  }
}
