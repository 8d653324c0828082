// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.util.Objects;

/// One numbered, named attribute of a message type. The variants differ in how they handle repetition, never in
/// numbering. Values are passed untyped because the engine holds one `Object` slot per attribute.
public abstract sealed class Field permits NonRepeatedField, RepeatedField, OneOfField {

  final int number;
  final String name;
  final Serializer<Object> serializer;

  @SuppressWarnings("unchecked")
  Field(int number, String name, Serializer<?> serializer) {
    if (number < Tag.MIN_NUMBER || number > Tag.MAX_NUMBER) {
      throw new TypeMappingException("Field '" + name + "' has invalid number " + number);
    }
    if (Tag.isReserved(number)) {
      throw new TypeMappingException("Field '" + name + "' uses reserved number " + number);
    }
    this.number = number;
    this.name = Objects.requireNonNull(name, "name");
    this.serializer = (Serializer<Object>) Objects.requireNonNull(serializer, "serializer");
  }

  public int number() {
    return number;
  }

  public String name() {
    return name;
  }

  /// The serializer of a single value, the element serializer for repeated fields
  public Serializer<?> serializer() {
    return serializer;
  }

  /// Write zero or more tagged occurrences of the value
  public abstract void dump(Object value, WriteBuffer out);

  /// Read one wire occurrence positioned after its tag and fold it into the value decoded so far
  /// @param wireType the wire type parsed from the tag
  /// @param current the value held before this occurrence, the default value for the first one
  /// @return the new value
  public abstract Object loadAndMerge(WireType wireType, ReadBuffer in, Object current);

  /// @throws ValidationException naming this field if the value cannot be written
  public abstract void validate(Object value);

  /// Combine the value held with the value of another record of the same type
  public abstract Object merge(Object current, Object other);

  /// The value held when the field never appears on the wire
  public abstract Object defaultValue();

  /// Freeze a decoded value before it is handed to the record constructor
  Object finish(Object value) {
    return value;
  }

  /// Validate then dump a value on its own, the bytes it contributes to an encoded message
  public byte[] encode(Object value) {
    validate(value);
    final WriteBuffer out = WriteBuffer.allocate();
    dump(value, out);
    return out.toByteArray();
  }

  DecodeException wireTypeMismatch(WireType wireType) {
    return new DecodeException("Field '" + name + "' (" + number + ") does not accept wire type " + wireType);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + number + " " + name + ": " + serializer + "]";
  }
}
