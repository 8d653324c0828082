// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;

/// A [Serializer] assembled from a writer lambda, a reader lambda and a domain check. All scalar kinds in
/// [Serializers] are instances of this class.
final class ScalarSerializer<T> implements Serializer<T> {

  final String name;
  final WireType wireType;
  final Class<T> javaType;
  final Predicate<T> domain;
  final String domainDescription;
  final BiConsumer<WriteBuffer, T> writer;
  final Function<ReadBuffer, T> reader;
  final T defaultValue;

  ScalarSerializer(String name, WireType wireType, Class<T> javaType, Predicate<T> domain, String domainDescription,
                   BiConsumer<WriteBuffer, T> writer, Function<ReadBuffer, T> reader, T defaultValue) {
    this.name = Objects.requireNonNull(name);
    this.wireType = Objects.requireNonNull(wireType);
    this.javaType = Objects.requireNonNull(javaType);
    this.domain = Objects.requireNonNull(domain);
    this.domainDescription = domainDescription;
    this.writer = Objects.requireNonNull(writer);
    this.reader = Objects.requireNonNull(reader);
    this.defaultValue = defaultValue;
  }

  ScalarSerializer(String name, WireType wireType, Class<T> javaType,
                   BiConsumer<WriteBuffer, T> writer, Function<ReadBuffer, T> reader, T defaultValue) {
    this(name, wireType, javaType, value -> true, null, writer, reader, defaultValue);
  }

  @Override
  public WireType wireType() {
    return wireType;
  }

  @Override
  public Class<T> javaType() {
    return javaType;
  }

  @Override
  public void validate(Object value) {
    if (value == null) {
      throw new ValidationException(name + " value must not be null");
    }
    if (!javaType.isInstance(value)) {
      throw new ValidationException(name + " value must be " + javaType.getSimpleName() + " but was "
          + value.getClass().getName());
    }
    if (!domain.test(javaType.cast(value))) {
      throw new ValidationException(name + " value " + value + " is out of range, expected " + domainDescription);
    }
  }

  @Override
  public void dump(T value, WriteBuffer out) {
    writer.accept(out, value);
  }

  @Override
  public T load(ReadBuffer in) {
    return reader.apply(in);
  }

  @Override
  public T defaultValue() {
    return defaultValue;
  }

  @Override
  public String toString() {
    return name;
  }
}
