// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

import static io.github.simbo1905.protowire.ProtoCodec.LOGGER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Tags, wire types and the primitive reads and writes every field is built from
public class WireFormatTests {

  @BeforeAll
  static void setupLogging() {
    io.github.simbo1905.LoggingControl.setupCleanLogging();
  }

  @BeforeEach
  void setUp() {
    LOGGER.fine(() -> "Starting WireFormatTests test");
  }

  static byte[] bytes(int... values) {
    final byte[] result = new byte[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = (byte) values[i];
    }
    return result;
  }

  @Test
  void testWireTypeValues() {
    assertThat(WireType.fromValue(0)).isEqualTo(WireType.VARINT);
    assertThat(WireType.fromValue(1)).isEqualTo(WireType.FIXED64);
    assertThat(WireType.fromValue(2)).isEqualTo(WireType.LENGTH_DELIMITED);
    assertThat(WireType.fromValue(5)).isEqualTo(WireType.FIXED32);
    assertThat(WireType.FIXED32.value()).isEqualTo(5);
  }

  @ParameterizedTest
  @ValueSource(ints = {3, 4})
  void testGroupsRejected(int value) {
    assertThatThrownBy(() -> WireType.fromValue(value))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("Group");
  }

  @ParameterizedTest
  @ValueSource(ints = {6, 7})
  void testUnassignedWireTypesRejected(int value) {
    assertThatThrownBy(() -> WireType.fromValue(value)).isInstanceOf(DecodeException.class);
  }

  @Test
  void testTagEncode() {
    assertThat(new Tag(1, WireType.VARINT).encode()).isEqualTo(0x08);
    assertThat(new Tag(1, WireType.LENGTH_DELIMITED).encode()).isEqualTo(0x0A);
    assertThat(new Tag(3, WireType.LENGTH_DELIMITED).encode()).isEqualTo(0x1A);
    assertThat(new Tag(2, WireType.FIXED32).encode()).isEqualTo(0x15);
  }

  @Test
  void testTagDecode() {
    assertThat(Tag.decode(0x08)).isEqualTo(new Tag(1, WireType.VARINT));
    assertThat(Tag.decode(0x1A)).isEqualTo(new Tag(3, WireType.LENGTH_DELIMITED));
    assertThat(Tag.decode(((long) Tag.MAX_NUMBER << 3) | 1)).isEqualTo(new Tag(Tag.MAX_NUMBER, WireType.FIXED64));
  }

  @Test
  void testTagDecodeRejectsFieldZero() {
    assertThatThrownBy(() -> Tag.decode(0x00)).isInstanceOf(DecodeException.class);
    assertThatThrownBy(() -> Tag.decode(0x02)).isInstanceOf(DecodeException.class);
  }

  @Test
  void testTagDecodeRejectsOversizedNumbers() {
    assertThatThrownBy(() -> Tag.decode((long) (Tag.MAX_NUMBER + 1) << 3)).isInstanceOf(DecodeException.class);
    assertThatThrownBy(() -> Tag.decode(-1L)).isInstanceOf(DecodeException.class);
  }

  @Test
  void testTagDecodeRejectsGroups() {
    assertThatThrownBy(() -> Tag.decode((1 << 3) | 3)).isInstanceOf(DecodeException.class);
    assertThatThrownBy(() -> Tag.decode((1 << 3) | 4)).isInstanceOf(DecodeException.class);
  }

  @Test
  void testTagConstructorChecksNumber() {
    assertThatThrownBy(() -> new Tag(0, WireType.VARINT)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Tag(Tag.MAX_NUMBER + 1, WireType.VARINT))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testReservedNumbers() {
    assertThat(Tag.isReserved(18999)).isFalse();
    assertThat(Tag.isReserved(19000)).isTrue();
    assertThat(Tag.isReserved(19999)).isTrue();
    assertThat(Tag.isReserved(20000)).isFalse();
  }

  @Test
  void testVarintEncoding() {
    assertThat(WriteBuffer.allocate().putVarLong(0).toByteArray()).containsExactly(bytes(0x00));
    assertThat(WriteBuffer.allocate().putVarLong(1).toByteArray()).containsExactly(bytes(0x01));
    assertThat(WriteBuffer.allocate().putVarLong(150).toByteArray()).containsExactly(bytes(0x96, 0x01));
    assertThat(WriteBuffer.allocate().putVarLong(300).toByteArray()).containsExactly(bytes(0xAC, 0x02));
    assertThat(WriteBuffer.allocate().putVarLong(-1L).toByteArray())
        .containsExactly(bytes(0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0x01));
  }

  @Test
  void testSignedVarIntIsSignExtended() {
    assertThat(WriteBuffer.allocate().putSignedVarInt(-1).toByteArray()).hasSize(10);
    assertThat(WriteBuffer.allocate().putSignedVarInt(Integer.MAX_VALUE).toByteArray())
        .containsExactly(bytes(0xFF, 0xFF, 0xFF, 0xFF, 0x07));
  }

  @Test
  void testVarintDecoding() {
    assertThat(ReadBuffer.wrap(bytes(0x96, 0x01)).getVarLong()).isEqualTo(150L);
    assertThat(ReadBuffer.wrap(bytes(0xAC, 0x02)).getVarLong()).isEqualTo(300L);
    assertThat(ReadBuffer.wrap(bytes(0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0x01)).getVarLong())
        .isEqualTo(-1L);
  }

  @Test
  void testVarintDecodingAcceptsRedundantContinuation() {
    // zero written with a redundant continuation byte
    assertThat(ReadBuffer.wrap(bytes(0x80, 0x00)).getVarLong()).isEqualTo(0L);
  }

  @Test
  void testTruncatedVarint() {
    assertThatThrownBy(() -> ReadBuffer.wrap(bytes(0x96)).getVarLong())
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("Truncated");
    assertThatThrownBy(() -> ReadBuffer.wrap(new byte[0]).getVarLong()).isInstanceOf(DecodeException.class);
  }

  @Test
  void testOverlongVarint() {
    assertThatThrownBy(() -> ReadBuffer.wrap(bytes(0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x00))
        .getVarLong()).isInstanceOf(DecodeException.class);
  }

  @Test
  void testVarintOverflowingSixtyFourBits() {
    assertThatThrownBy(() -> ReadBuffer.wrap(bytes(0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0x02))
        .getVarLong()).isInstanceOf(DecodeException.class);
  }

  @Test
  void testFixedWidthLittleEndian() {
    final byte[] written = WriteBuffer.allocate().putFixed32(1).putFixed64(0x0102030405060708L).toByteArray();
    assertThat(written).containsExactly(bytes(0x01, 0x00, 0x00, 0x00, 0x08, 0x07, 0x06, 0x05, 0x04, 0x03, 0x02, 0x01));
    final ReadBuffer in = ReadBuffer.wrap(written);
    assertThat(in.getFixed32()).isEqualTo(1);
    assertThat(in.getFixed64()).isEqualTo(0x0102030405060708L);
    assertThat(in.hasRemaining()).isFalse();
  }

  @Test
  void testTruncatedFixedWidth() {
    assertThatThrownBy(() -> ReadBuffer.wrap(bytes(0x01, 0x02, 0x03)).getFixed32()).isInstanceOf(DecodeException.class);
    assertThatThrownBy(() -> ReadBuffer.wrap(bytes(0x01, 0x02, 0x03, 0x04)).getFixed64())
        .isInstanceOf(DecodeException.class);
  }

  @Test
  void testLengthDelimited() {
    final byte[] written = WriteBuffer.allocate().putLengthDelimited(bytes(0x42, 0x43)).toByteArray();
    assertThat(written).containsExactly(bytes(0x02, 0x42, 0x43));
    assertThat(ReadBuffer.wrap(written).getLengthDelimited()).containsExactly(bytes(0x42, 0x43));
  }

  @Test
  void testLengthBeyondInput() {
    assertThatThrownBy(() -> ReadBuffer.wrap(bytes(0x05, 0x01, 0x02)).getLengthDelimited())
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("exceeds");
  }

  @Test
  void testNestedBufferGrows() {
    final WriteBuffer nested = WriteBuffer.allocate(1);
    for (int i = 0; i < 200; i++) {
      nested.putByte(i);
    }
    final byte[] written = WriteBuffer.allocate(1).putLengthDelimited(nested).toByteArray();
    assertThat(written).hasSize(202);
    assertThat(written[0]).isEqualTo((byte) 0xC8);
    assertThat(written[1]).isEqualTo((byte) 0x01);
    final ReadBuffer payload = ReadBuffer.wrap(written).getNested();
    assertThat(payload.remaining()).isEqualTo(200);
    assertThat(payload.depth()).isEqualTo(1);
  }

  @Test
  void testNestedAdvancesOuterCursor() {
    final ReadBuffer in = ReadBuffer.wrap(bytes(0x02, 0x08, 0x01, 0x10));
    final ReadBuffer nested = in.getNested();
    assertThat(nested.getVarLong()).isEqualTo(8L);
    assertThat(in.position()).isEqualTo(3);
    assertThat(in.getVarLong()).isEqualTo(0x10L);
  }

  @Test
  void testRecursionLimit() {
    final ReadBuffer in = ReadBuffer.wrap(bytes(0x02, 0x01, 0x00), 1);
    final ReadBuffer first = in.getNested();
    assertThatThrownBy(first::getNested)
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("recursion limit");
  }

  @Test
  void testSkip() {
    final byte[] input = WriteBuffer.allocate()
        .putVarLong(300)
        .putFixed64(7L)
        .putFixed32(9)
        .putLengthDelimited(bytes(1, 2, 3))
        .putByte(0x2A)
        .toByteArray();
    final ReadBuffer in = ReadBuffer.wrap(input);
    in.skip(WireType.VARINT);
    in.skip(WireType.FIXED64);
    in.skip(WireType.FIXED32);
    in.skip(WireType.LENGTH_DELIMITED);
    assertThat(in.getVarLong()).isEqualTo(0x2AL);
  }

  @Test
  void testSkipTruncated() {
    assertThatThrownBy(() -> ReadBuffer.wrap(bytes(0x01, 0x02)).skip(WireType.FIXED32))
        .isInstanceOf(DecodeException.class);
    assertThatThrownBy(() -> ReadBuffer.wrap(bytes(0x04, 0x02)).skip(WireType.LENGTH_DELIMITED))
        .isInstanceOf(DecodeException.class);
  }

  @Test
  void testWrapByteBufferReadsRemainingOnly() {
    final ByteBuffer buffer = ByteBuffer.wrap(bytes(0x7F, 0x96, 0x01));
    buffer.get();
    assertThat(ReadBuffer.wrap(buffer).getVarLong()).isEqualTo(150L);
  }

  @Test
  void testWriteTo() throws IOException {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    WriteBuffer.allocate().putTag(1, WireType.VARINT).putVarLong(150).writeTo(out);
    assertThat(out.toByteArray()).containsExactly(bytes(0x08, 0x96, 0x01));
  }
}
