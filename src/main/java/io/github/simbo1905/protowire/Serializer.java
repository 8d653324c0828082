// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

/// Encodes and decodes one kind of value with a fixed [WireType]. Implementations hold no per-message state and
/// are shared by every field that uses them.
/// @param <T> the Java type of the values handled
public interface Serializer<T> {

  WireType wireType();

  Class<T> javaType();

  /// @throws ValidationException if the value is null, of the wrong type or not representable
  void validate(Object value);

  /// Write the payload only, the caller writes any tag
  void dump(T value, WriteBuffer out);

  /// Read one payload positioned after its tag
  /// @throws DecodeException on malformed or out-of-range input
  T load(ReadBuffer in);

  /// Combine a value already held with a newly read or merged one. The last value wins unless overridden.
  default T merge(T current, T incoming) {
    return incoming;
  }

  /// The value of a required field that never appeared on the wire
  T defaultValue();

  /// Only non length-delimited kinds can be written back-to-back inside a packed block
  default boolean packable() {
    return wireType() != WireType.LENGTH_DELIMITED;
  }
}
