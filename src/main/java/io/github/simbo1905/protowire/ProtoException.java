// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

/// Root of the codec's failures. All are unchecked and surface to the caller unchanged.
public abstract sealed class ProtoException extends RuntimeException
    permits ValidationException, TypeMappingException, DecodeException {

  ProtoException(String message) {
    super(message);
  }

  ProtoException(String message, Throwable cause) {
    super(message, cause);
  }
}
