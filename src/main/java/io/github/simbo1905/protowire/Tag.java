// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.util.Objects;

/// A decoded field key: the field number and the wire type of the payload that follows it.
/// Tags are never stored, they are computed on write and parsed on read.
public record Tag(int number, WireType wireType) {

  public static final int MIN_NUMBER = 1;
  public static final int MAX_NUMBER = (1 << 29) - 1;
  public static final int FIRST_RESERVED_NUMBER = 19000;
  public static final int LAST_RESERVED_NUMBER = 19999;

  public Tag {
    if (number < MIN_NUMBER || number > MAX_NUMBER) {
      throw new IllegalArgumentException("Field number out of range: " + number);
    }
    Objects.requireNonNull(wireType, "wireType");
  }

  /// @return `(number << 3) | wire_type`, the value written as an unsigned varint
  public int encode() {
    return (number << 3) | wireType.value;
  }

  /// Parse the unsigned varint value of a tag
  /// @throws DecodeException if the field number is zero or too large, or the wire type is unsupported
  public static Tag decode(long key) {
    if (key < 0 || key > 0xFFFF_FFFFL) {
      throw new DecodeException("Tag out of range: " + Long.toUnsignedString(key));
    }
    final long number = key >>> 3;
    if (number < MIN_NUMBER || number > MAX_NUMBER) {
      throw new DecodeException("Invalid field number: " + number);
    }
    return new Tag((int) number, WireType.fromValue((int) (key & 0x07)));
  }

  /// True for the numbers 19000 through 19999 which the wire format reserves for its own use
  public static boolean isReserved(int number) {
    return number >= FIRST_RESERVED_NUMBER && number <= LAST_RESERVED_NUMBER;
  }
}
