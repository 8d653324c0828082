// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.util.Objects;
import java.util.function.Supplier;

/// Embeds a nested message as a length-delimited payload. The engine of the nested type is resolved on first use
/// so that message types can refer to themselves.
final class MessageSerializer<T> implements Serializer<T> {

  final Class<T> type;
  final Supplier<MessageEngine<T>> resolver;
  volatile MessageEngine<T> engine;

  MessageSerializer(Class<T> type, Supplier<MessageEngine<T>> resolver) {
    this.type = Objects.requireNonNull(type);
    this.resolver = Objects.requireNonNull(resolver);
  }

  MessageSerializer(MessageEngine<T> engine) {
    this(engine.type(), () -> engine);
    this.engine = engine;
  }

  MessageEngine<T> engine() {
    MessageEngine<T> resolved = engine;
    if (resolved == null) {
      resolved = Objects.requireNonNull(resolver.get(), () -> "No message engine for " + type.getName());
      engine = resolved;
    }
    return resolved;
  }

  @Override
  public WireType wireType() {
    return WireType.LENGTH_DELIMITED;
  }

  @Override
  public Class<T> javaType() {
    return type;
  }

  @Override
  public void validate(Object value) {
    if (value == null) {
      throw new ValidationException(type.getSimpleName() + " value must not be null");
    }
    if (!type.isInstance(value)) {
      throw new ValidationException("value must be " + type.getName() + " but was " + value.getClass().getName());
    }
    engine().validate(type.cast(value));
  }

  @Override
  public void dump(T value, WriteBuffer out) {
    final WriteBuffer nested = WriteBuffer.allocate();
    engine().dump(value, nested);
    out.putLengthDelimited(nested);
  }

  @Override
  public T load(ReadBuffer in) {
    return engine().decode(in.getNested());
  }

  @Override
  public T merge(T current, T incoming) {
    return engine().merge(current, incoming);
  }

  @Override
  public T defaultValue() {
    return engine().defaultInstance();
  }

  @Override
  public String toString() {
    return "message " + type.getSimpleName();
  }
}
