// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;

import static io.github.simbo1905.protowire.ProtoCodec.LOGGER;

/// Array backed [WriteBuffer] that doubles its capacity as it fills.
final class WriteBufferImpl implements WriteBuffer {

  byte[] bytes;
  int position;

  WriteBufferImpl(int initialCapacity) {
    this.bytes = new byte[Math.max(initialCapacity, 16)];
  }

  void ensureCapacity(int additional) {
    final int required = position + additional;
    if (required < 0) {
      throw new IllegalStateException("Encoded message exceeds 2GB");
    }
    if (required > bytes.length) {
      final int capacity = Math.max(required, bytes.length << 1);
      bytes = Arrays.copyOf(bytes, capacity < 0 ? Integer.MAX_VALUE - 8 : capacity);
    }
  }

  @Override
  public int position() {
    return position;
  }

  @Override
  public WriteBuffer putByte(int value) {
    ensureCapacity(1);
    bytes[position++] = (byte) value;
    return this;
  }

  @Override
  public WriteBuffer putVarLong(long value) {
    ensureCapacity(ZigZagEncoding.varintSize(value));
    while ((value & ~0x7FL) != 0) {
      bytes[position++] = (byte) ((value & 0x7F) | 0x80);
      value >>>= 7;
    }
    bytes[position++] = (byte) value;
    return this;
  }

  @Override
  public WriteBuffer putSignedVarInt(int value) {
    return putVarLong(value);
  }

  @Override
  public WriteBuffer putFixed32(int value) {
    ensureCapacity(Integer.BYTES);
    bytes[position++] = (byte) value;
    bytes[position++] = (byte) (value >>> 8);
    bytes[position++] = (byte) (value >>> 16);
    bytes[position++] = (byte) (value >>> 24);
    return this;
  }

  @Override
  public WriteBuffer putFixed64(long value) {
    ensureCapacity(Long.BYTES);
    for (int i = 0; i < Long.BYTES; i++) {
      bytes[position++] = (byte) (value >>> (8 * i));
    }
    return this;
  }

  @Override
  public WriteBuffer putBytes(byte[] source) {
    return putBytes(source, source.length);
  }

  WriteBuffer putBytes(byte[] source, int length) {
    ensureCapacity(length);
    System.arraycopy(source, 0, bytes, position, length);
    position += length;
    return this;
  }

  @Override
  public WriteBuffer putLengthDelimited(byte[] source) {
    putVarLong(source.length);
    return putBytes(source);
  }

  @Override
  public WriteBuffer putLengthDelimited(WriteBuffer nested) {
    if (nested instanceof WriteBufferImpl impl) {
      LOGGER.finer(() -> "putLengthDelimited length=" + impl.position + " at position " + position);
      putVarLong(impl.position);
      return putBytes(impl.bytes, impl.position);
    }
    return putLengthDelimited(nested.toByteArray());
  }

  @Override
  public WriteBuffer putTag(int number, WireType wireType) {
    return putVarLong(((long) number << 3) | wireType.value);
  }

  @Override
  public byte[] toByteArray() {
    return Arrays.copyOf(bytes, position);
  }

  @Override
  public void writeTo(OutputStream out) throws IOException {
    out.write(bytes, 0, position);
  }
}
