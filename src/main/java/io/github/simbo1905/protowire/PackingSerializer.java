// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Wraps a scalar serializer to read and write a whole list inside one length-delimited block with no
/// per-element tags.
public final class PackingSerializer<E> implements Serializer<List<E>> {

  final Serializer<E> element;

  public PackingSerializer(Serializer<E> element) {
    this.element = Objects.requireNonNull(element);
  }

  @Override
  public WireType wireType() {
    return WireType.LENGTH_DELIMITED;
  }

  @Override
  @SuppressWarnings({"unchecked", "rawtypes"})
  public Class<List<E>> javaType() {
    return (Class) List.class;
  }

  @Override
  public void validate(Object value) {
    if (!(value instanceof List<?> values)) {
      throw new ValidationException("repeated value must be a List but was "
          + (value == null ? "null" : value.getClass().getName()));
    }
    for (int i = 0; i < values.size(); i++) {
      try {
        element.validate(values.get(i));
      } catch (ValidationException e) {
        throw new ValidationException("element " + i + ": " + e.getMessage(), e);
      }
    }
  }

  @Override
  public void dump(List<E> values, WriteBuffer out) {
    final WriteBuffer block = WriteBuffer.allocate(values.size() * 2);
    for (E value : values) {
      element.dump(value, block);
    }
    out.putLengthDelimited(block);
  }

  @Override
  public List<E> load(ReadBuffer in) {
    final ReadBuffer block = in.getNested();
    final List<E> values = new ArrayList<>();
    while (block.hasRemaining()) {
      values.add(element.load(block));
    }
    return values;
  }

  @Override
  public List<E> merge(List<E> current, List<E> incoming) {
    final List<E> merged = new ArrayList<>(current);
    merged.addAll(incoming);
    return merged;
  }

  @Override
  public List<E> defaultValue() {
    return List.of();
  }

  @Override
  public String toString() {
    return "packed " + element;
  }
}
