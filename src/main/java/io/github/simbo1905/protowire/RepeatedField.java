// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// A repeated field holding a `List`. The two variants only differ in how they write: both read elements written
/// one per tag and elements packed into length-delimited blocks, and both append across occurrences.
public abstract sealed class RepeatedField extends Field permits PackedRepeatedField, UnpackedRepeatedField {

  final PackingSerializer<Object> packing;

  RepeatedField(int number, String name, Serializer<?> element) {
    super(number, name, element);
    this.packing = new PackingSerializer<>(serializer);
  }

  @Override
  public Object loadAndMerge(WireType wireType, ReadBuffer in, Object current) {
    final List<Object> values = appendable(current);
    if (wireType == serializer.wireType()) {
      values.add(serializer.load(in));
    } else if (wireType == WireType.LENGTH_DELIMITED && serializer.packable()) {
      values.addAll(packing.load(in));
    } else {
      throw wireTypeMismatch(wireType);
    }
    return values;
  }

  @Override
  public void validate(Object value) {
    if (!(value instanceof List<?>)) {
      throw new ValidationException("repeated field '" + name + "' (" + number + ") must be a List but was "
          + (value == null ? "null" : value.getClass().getName()));
    }
    try {
      packing.validate(value);
    } catch (ValidationException e) {
      throw ValidationException.inField(name, e);
    }
  }

  @Override
  public Object merge(Object current, Object other) {
    final List<?> head = (List<?>) current;
    final List<?> tail = (List<?>) other;
    if (tail == null || tail.isEmpty()) {
      return head;
    }
    if (head == null || head.isEmpty()) {
      return tail;
    }
    final List<Object> merged = new ArrayList<>(head.size() + tail.size());
    merged.addAll(head);
    merged.addAll(tail);
    return Collections.unmodifiableList(merged);
  }

  @Override
  public Object defaultValue() {
    return List.of();
  }

  @Override
  Object finish(Object value) {
    return value instanceof ArrayList<?> list ? Collections.unmodifiableList(list) : value;
  }

  /// Decoding starts from an immutable default so the first occurrence copies into a list owned by the decode
  @SuppressWarnings("unchecked")
  static List<Object> appendable(Object current) {
    if (current instanceof ArrayList<?> list) {
      return (List<Object>) list;
    }
    return current == null ? new ArrayList<>() : new ArrayList<>((List<?>) current);
  }
}
