// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.io.IOException;
import java.io.OutputStream;

/// Growable byte sink that the serializers write wire primitives into. Not thread safe: each encode owns one.
public interface WriteBuffer {

  /// @return the number of bytes written so far
  int position();

  WriteBuffer putByte(int value);

  /// Write the 64 bit pattern as an unsigned varint, 1 to 10 bytes
  WriteBuffer putVarLong(long value);

  /// Write an `int` as the varint of its sign extension so that negative values take 10 bytes
  WriteBuffer putSignedVarInt(int value);

  /// Write four bytes little-endian
  WriteBuffer putFixed32(int value);

  /// Write eight bytes little-endian
  WriteBuffer putFixed64(long value);

  WriteBuffer putBytes(byte[] bytes);

  /// Write the unsigned varint of the length followed by the bytes
  WriteBuffer putLengthDelimited(byte[] bytes);

  /// Write the unsigned varint of the nested buffer's length followed by its content
  WriteBuffer putLengthDelimited(WriteBuffer nested);

  WriteBuffer putTag(int number, WireType wireType);

  byte[] toByteArray();

  void writeTo(OutputStream out) throws IOException;

  static WriteBuffer allocate() {
    return new WriteBufferImpl(64);
  }

  static WriteBuffer allocate(int initialCapacity) {
    return new WriteBufferImpl(initialCapacity);
  }
}
