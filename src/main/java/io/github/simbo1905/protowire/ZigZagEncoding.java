// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

/// ZigZag mapping of signed integers onto unsigned ones so that values of small magnitude, positive or negative,
/// get short varint encodings. Used by `sint32` and `sint64`.
final class ZigZagEncoding {

  private ZigZagEncoding() {
  }

  /// @return `(n << 1) ^ (n >> 31)` as the unsigned 32 bit pattern
  static int encodeInt(int n) {
    return (n << 1) ^ (n >> 31);
  }

  /// @return `(n << 1) ^ (n >> 63)` as the unsigned 64 bit pattern
  static long encodeLong(long n) {
    return (n << 1) ^ (n >> 63);
  }

  static int decodeInt(int n) {
    return (n >>> 1) ^ -(n & 1);
  }

  static long decodeLong(long n) {
    return (n >>> 1) ^ -(n & 1);
  }

  /// Counts the number of bytes needed to varint encode the ZigZag mapping of the given int
  static int sizeOf(int value) {
    return varintSize(encodeInt(value) & 0xFFFF_FFFFL);
  }

  /// Counts the number of bytes needed to varint encode the ZigZag mapping of the given long
  static int sizeOf(long value) {
    return varintSize(encodeLong(value));
  }

  /// Counts the number of bytes of the unsigned varint encoding of the 64 bit pattern
  static int varintSize(long value) {
    if (value >>> 7 == 0) {
      return 1;
    }
    if (value >>> 14 == 0) {
      return 2;
    }
    if (value >>> 21 == 0) {
      return 3;
    }
    if (value >>> 28 == 0) {
      return 4;
    }
    if (value >>> 35 == 0) {
      return 5;
    }
    if (value >>> 42 == 0) {
      return 6;
    }
    if (value >>> 49 == 0) {
      return 7;
    }
    if (value >>> 56 == 0) {
      return 8;
    }
    if (value >>> 63 == 0) {
      return 9;
    }
    return 10;
  }
}
