// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static io.github.simbo1905.protowire.ProtoCodec.LOGGER;

final class ReadBufferImpl implements ReadBuffer {

  static final int MAX_VARINT_BYTES = 10;

  final ByteBuffer buffer;
  final int depth;
  final int recursionLimit;

  ReadBufferImpl(ByteBuffer buffer, int depth, int recursionLimit) {
    this.buffer = buffer.order(ByteOrder.LITTLE_ENDIAN);
    this.depth = depth;
    this.recursionLimit = recursionLimit;
  }

  @Override
  public boolean hasRemaining() {
    return buffer.hasRemaining();
  }

  @Override
  public int remaining() {
    return buffer.remaining();
  }

  @Override
  public int position() {
    return buffer.position();
  }

  @Override
  public int depth() {
    return depth;
  }

  void require(int length, String what) {
    if (buffer.remaining() < length) {
      throw new DecodeException("Truncated " + what + ": need " + length + " bytes but " + buffer.remaining()
          + " remain at position " + buffer.position());
    }
  }

  @Override
  public long getVarLong() {
    long value = 0;
    for (int i = 0; i < MAX_VARINT_BYTES; i++) {
      if (!buffer.hasRemaining()) {
        throw new DecodeException("Truncated varint at position " + buffer.position());
      }
      final byte b = buffer.get();
      if (i == MAX_VARINT_BYTES - 1 && (b & 0xFE) != 0) {
        // the tenth byte may only carry bit 63
        throw new DecodeException("Varint overflows 64 bits at position " + buffer.position());
      }
      value |= (long) (b & 0x7F) << (7 * i);
      if ((b & 0x80) == 0) {
        return value;
      }
    }
    throw new DecodeException("Varint longer than " + MAX_VARINT_BYTES + " bytes at position " + buffer.position());
  }

  @Override
  public int getFixed32() {
    require(Integer.BYTES, "fixed32");
    return buffer.getInt();
  }

  @Override
  public long getFixed64() {
    require(Long.BYTES, "fixed64");
    return buffer.getLong();
  }

  @Override
  public byte[] getBytes(int length) {
    require(length, "bytes");
    final byte[] bytes = new byte[length];
    buffer.get(bytes);
    return bytes;
  }

  int getLength() {
    final int at = buffer.position();
    final long length = getVarLong();
    if (length < 0 || length > buffer.remaining()) {
      throw new DecodeException("Length prefix " + Long.toUnsignedString(length) + " at position " + at
          + " exceeds the " + buffer.remaining() + " remaining bytes");
    }
    return (int) length;
  }

  @Override
  public byte[] getLengthDelimited() {
    return getBytes(getLength());
  }

  @Override
  public ReadBuffer getNested() {
    if (depth + 1 > recursionLimit) {
      throw new DecodeException("Nesting exceeds the recursion limit of " + recursionLimit);
    }
    final int length = getLength();
    final ByteBuffer payload = buffer.slice();
    payload.limit(length);
    buffer.position(buffer.position() + length);
    LOGGER.finer(() -> "Nested payload of " + length + " bytes at depth " + (depth + 1));
    return new ReadBufferImpl(payload, depth + 1, recursionLimit);
  }

  @Override
  public void skip(WireType wireType) {
    switch (wireType) {
      case VARINT -> getVarLong();
      case FIXED64 -> advance(Long.BYTES, "fixed64");
      case FIXED32 -> advance(Integer.BYTES, "fixed32");
      case LENGTH_DELIMITED -> advance(getLength(), "length-delimited payload");
    }
  }

  void advance(int length, String what) {
    require(length, what);
    buffer.position(buffer.position() + length);
  }
}
