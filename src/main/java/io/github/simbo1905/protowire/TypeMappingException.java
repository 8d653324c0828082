// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

/// A declared field has no serializer mapping or the field map is inconsistent.
/// Only ever thrown while a message type is being registered.
public final class TypeMappingException extends ProtoException {

  public TypeMappingException(String message) {
    super(message);
  }

  public TypeMappingException(String message, Throwable cause) {
    super(message, cause);
  }
}
