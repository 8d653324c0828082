// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;

import static java.nio.charset.StandardCharsets.UTF_8;

/// The shared scalar serializers, one constant per wire kind.
///
/// Integers travel as `Integer` when the wire kind is 32 bit signed and as `Long` otherwise. The unsigned 64 bit
/// kinds (`uint64`, `fixed64`) use the full bit pattern of a `long`, the unsigned 32 bit kinds use a `Long` that
/// must fit in 32 bits.
public final class Serializers {

  private Serializers() {
  }

  static final long UINT32_MAX = 0xFFFF_FFFFL;

  public static final Serializer<Boolean> BOOL = new ScalarSerializer<>("bool", WireType.VARINT, Boolean.class,
      (out, value) -> out.putByte(value ? 1 : 0),
      in -> in.getVarLong() != 0,
      Boolean.FALSE);

  public static final Serializer<Integer> INT32 = new ScalarSerializer<>("int32", WireType.VARINT, Integer.class,
      WriteBuffer::putSignedVarInt,
      in -> {
        final long value = in.getVarLong();
        if (value != (int) value) {
          throw new DecodeException("int32 varint out of range: " + value);
        }
        return (int) value;
      },
      0);

  public static final Serializer<Long> INT64 = new ScalarSerializer<>("int64", WireType.VARINT, Long.class,
      WriteBuffer::putVarLong,
      ReadBuffer::getVarLong,
      0L);

  /// The plain signed `long`: a two's complement varint, byte for byte the same as `int64`
  public static final Serializer<Long> SIGNED_VARINT = INT64;

  /// Non-standard plain unsigned integer: any non-negative `long` as an unsigned varint
  public static final Serializer<Long> UNSIGNED_VARINT = new ScalarSerializer<>("uint", WireType.VARINT, Long.class,
      value -> value >= 0, "a non-negative long",
      WriteBuffer::putVarLong,
      in -> {
        final long value = in.getVarLong();
        if (value < 0) {
          throw new DecodeException("uint varint overflows a signed long: " + Long.toUnsignedString(value));
        }
        return value;
      },
      0L);

  public static final Serializer<Long> UINT32 = new ScalarSerializer<>("uint32", WireType.VARINT, Long.class,
      value -> value >= 0 && value <= UINT32_MAX, "0 to 4294967295",
      WriteBuffer::putVarLong,
      in -> {
        final long value = in.getVarLong();
        if (value < 0 || value > UINT32_MAX) {
          throw new DecodeException("uint32 varint out of range: " + Long.toUnsignedString(value));
        }
        return value;
      },
      0L);

  public static final Serializer<Long> UINT64 = new ScalarSerializer<>("uint64", WireType.VARINT, Long.class,
      WriteBuffer::putVarLong,
      ReadBuffer::getVarLong,
      0L);

  public static final Serializer<Integer> SINT32 = new ScalarSerializer<>("sint32", WireType.VARINT, Integer.class,
      (out, value) -> out.putVarLong(ZigZagEncoding.encodeInt(value) & UINT32_MAX),
      in -> {
        final long value = in.getVarLong();
        if (value < 0 || value > UINT32_MAX) {
          throw new DecodeException("sint32 varint out of range: " + Long.toUnsignedString(value));
        }
        return ZigZagEncoding.decodeInt((int) value);
      },
      0);

  public static final Serializer<Long> SINT64 = new ScalarSerializer<>("sint64", WireType.VARINT, Long.class,
      (out, value) -> out.putVarLong(ZigZagEncoding.encodeLong(value)),
      in -> ZigZagEncoding.decodeLong(in.getVarLong()),
      0L);

  public static final Serializer<Long> FIXED32 = new ScalarSerializer<>("fixed32", WireType.FIXED32, Long.class,
      value -> value >= 0 && value <= UINT32_MAX, "0 to 4294967295",
      (out, value) -> out.putFixed32((int) (long) value),
      in -> in.getFixed32() & UINT32_MAX,
      0L);

  public static final Serializer<Integer> SFIXED32 = new ScalarSerializer<>("sfixed32", WireType.FIXED32, Integer.class,
      WriteBuffer::putFixed32,
      ReadBuffer::getFixed32,
      0);

  public static final Serializer<Long> FIXED64 = new ScalarSerializer<>("fixed64", WireType.FIXED64, Long.class,
      WriteBuffer::putFixed64,
      ReadBuffer::getFixed64,
      0L);

  public static final Serializer<Long> SFIXED64 = new ScalarSerializer<>("sfixed64", WireType.FIXED64, Long.class,
      WriteBuffer::putFixed64,
      ReadBuffer::getFixed64,
      0L);

  public static final Serializer<Float> FLOAT = new ScalarSerializer<>("float", WireType.FIXED32, Float.class,
      (out, value) -> out.putFixed32(Float.floatToRawIntBits(value)),
      in -> Float.intBitsToFloat(in.getFixed32()),
      0.0f);

  public static final Serializer<Double> DOUBLE = new ScalarSerializer<>("double", WireType.FIXED64, Double.class,
      (out, value) -> out.putFixed64(Double.doubleToRawLongBits(value)),
      in -> Double.longBitsToDouble(in.getFixed64()),
      0.0d);

  public static final Serializer<byte[]> BYTES = new ScalarSerializer<>("bytes", WireType.LENGTH_DELIMITED,
      byte[].class,
      WriteBuffer::putLengthDelimited,
      ReadBuffer::getLengthDelimited,
      new byte[0]);

  public static final Serializer<String> STRING = new ScalarSerializer<>("string", WireType.LENGTH_DELIMITED,
      String.class,
      value -> UTF_8.newEncoder().canEncode(value), "text encodable as UTF-8",
      (out, value) -> out.putLengthDelimited(value.getBytes(UTF_8)),
      in -> decodeUtf8(in.getLengthDelimited()),
      "");

  static String decodeUtf8(byte[] bytes) {
    try {
      final CharBuffer chars = UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes));
      return chars.toString();
    } catch (CharacterCodingException e) {
      throw new DecodeException("Malformed UTF-8 in string field", e);
    }
  }
}
