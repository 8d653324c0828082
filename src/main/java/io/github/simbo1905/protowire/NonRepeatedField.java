// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import static io.github.simbo1905.protowire.ProtoCodec.LOGGER;

/// A singular field. Absent values (null) write nothing and are only valid when the field is optional.
/// Decoding keeps the last occurrence, except for embedded messages where occurrences are merged.
public final class NonRepeatedField extends Field {

  final boolean optional;

  public NonRepeatedField(int number, String name, Serializer<?> serializer, boolean optional) {
    super(number, name, serializer);
    this.optional = optional;
  }

  public boolean optional() {
    return optional;
  }

  @Override
  public void dump(Object value, WriteBuffer out) {
    if (value == null) {
      return;
    }
    LOGGER.finer(() -> "Writing field " + number + " '" + name + "' at position " + out.position());
    out.putTag(number, serializer.wireType());
    serializer.dump(value, out);
  }

  @Override
  public Object loadAndMerge(WireType wireType, ReadBuffer in, Object current) {
    if (wireType != serializer.wireType()) {
      throw wireTypeMismatch(wireType);
    }
    final Object value = serializer.load(in);
    return current == null ? value : serializer.merge(current, value);
  }

  @Override
  public void validate(Object value) {
    if (value == null) {
      if (!optional) {
        throw new ValidationException("required field '" + name + "' (" + number + ") is missing");
      }
      return;
    }
    try {
      serializer.validate(value);
    } catch (ValidationException e) {
      throw ValidationException.inField(name, e);
    }
  }

  @Override
  public Object merge(Object current, Object other) {
    if (other == null) {
      return current;
    }
    return current == null ? other : serializer.merge(current, other);
  }

  @Override
  public Object defaultValue() {
    return optional ? null : serializer.defaultValue();
  }
}
