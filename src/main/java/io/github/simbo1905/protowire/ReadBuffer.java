// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.nio.ByteBuffer;

/// Bounds-checked cursor over wire bytes. Every read past the end fails with a [DecodeException].
/// Length-delimited payloads are read through a child cursor that is limited to the payload and one level deeper.
public interface ReadBuffer {

  /// Nesting limit for embedded messages, from the `protowire.recursionLimit` system property
  int DEFAULT_RECURSION_LIMIT = Integer.getInteger("protowire.recursionLimit", 100);

  boolean hasRemaining();

  int remaining();

  int position();

  /// @return how many length-delimited payloads enclose this cursor
  int depth();

  /// Read an unsigned varint of at most 10 bytes as its 64 bit pattern
  long getVarLong();

  /// Read four bytes little-endian
  int getFixed32();

  /// Read eight bytes little-endian
  long getFixed64();

  byte[] getBytes(int length);

  /// Read a length prefix and the payload it covers
  byte[] getLengthDelimited();

  /// Read a length prefix and return a cursor over the payload it covers, advancing this cursor past it
  /// @throws DecodeException if the prefix exceeds the remaining bytes or the nesting limit is reached
  ReadBuffer getNested();

  /// Discard one payload of the given wire type
  void skip(WireType wireType);

  static ReadBuffer wrap(byte[] bytes) {
    return wrap(ByteBuffer.wrap(bytes), DEFAULT_RECURSION_LIMIT);
  }

  static ReadBuffer wrap(byte[] bytes, int recursionLimit) {
    return wrap(ByteBuffer.wrap(bytes), recursionLimit);
  }

  static ReadBuffer wrap(ByteBuffer buffer) {
    return wrap(buffer, DEFAULT_RECURSION_LIMIT);
  }

  static ReadBuffer wrap(ByteBuffer buffer, int recursionLimit) {
    return new ReadBufferImpl(buffer.slice(), 0, recursionLimit);
  }
}
