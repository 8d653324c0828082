// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

/// Implemented by enums whose constants carry explicit wire numbers. Enums that do not implement it are written
/// by ordinal.
public interface ProtoEnum {
  int number();
}
