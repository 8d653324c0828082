// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

/// The low three bits of every tag, selecting how the payload that follows is framed.
/// Group framing (3 and 4) is deprecated on the wire and not supported.
public enum WireType {
  VARINT(0),
  FIXED64(1),
  LENGTH_DELIMITED(2),
  FIXED32(5);

  final int value;

  WireType(int value) {
    this.value = value;
  }

  public int value() {
    return value;
  }

  /// Resolve the three wire type bits read from a tag
  /// @param value the low three bits of a tag
  /// @return the wire type
  /// @throws DecodeException for groups and for the unassigned values 6 and 7
  public static WireType fromValue(int value) {
    return switch (value) {
      case 0 -> VARINT;
      case 1 -> FIXED64;
      case 2 -> LENGTH_DELIMITED;
      case 5 -> FIXED32;
      case 3, 4 -> throw new DecodeException("Group wire types are not supported: " + value);
      default -> throw new DecodeException("Invalid wire type: " + value);
    };
  }
}
