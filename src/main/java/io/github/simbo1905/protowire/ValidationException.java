// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

/// A value is not representable by its serializer, or a required field is missing.
/// Thrown before any byte is written.
public final class ValidationException extends ProtoException {

  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }

  /// Prefix the failure of a nested value with the name of the field holding it
  static ValidationException inField(String fieldName, ValidationException e) {
    return new ValidationException("field '" + fieldName + "': " + e.getMessage(), e);
  }
}
