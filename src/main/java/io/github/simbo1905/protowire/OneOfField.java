// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.util.Objects;
import java.util.function.Function;

/// One alternative of a tagged union. All the alternatives of a union share a single slot of the message which holds
/// an instance of exactly one alternative type, or null. Each alternative wraps one singular value.
///
/// An alternative only writes when the slot holds its own type. Reading any alternative replaces the slot, so the
/// last alternative on the wire wins and the others are cleared.
public final class OneOfField extends Field {

  final NonRepeatedField value;
  final Class<?> armType;
  final Function<Object, Object> wrap;
  final Function<Object, Object> unwrap;

  @SuppressWarnings("unchecked")
  <V, A> OneOfField(int number, String name, Serializer<V> serializer, Class<A> armType,
                    Function<? super V, ? extends A> wrap, Function<? super A, ? extends V> unwrap) {
    super(number, name, serializer);
    this.value = new NonRepeatedField(number, name, serializer, true);
    this.armType = Objects.requireNonNull(armType, "armType");
    this.wrap = (Function<Object, Object>) Objects.requireNonNull(wrap, "wrap");
    this.unwrap = (Function<Object, Object>) Objects.requireNonNull(unwrap, "unwrap");
  }

  /// Declare one alternative of a union
  /// @param number the field number of the alternative
  /// @param name the name of the alternative's value
  /// @param serializer the serializer of the wrapped value
  /// @param armType the type the union slot holds when this alternative is selected
  /// @param wrap builds the alternative from a decoded value
  /// @param unwrap extracts the value to write from the alternative
  public static <V, A> OneOfField of(int number, String name, Serializer<V> serializer, Class<A> armType,
                                     Function<? super V, ? extends A> wrap, Function<? super A, ? extends V> unwrap) {
    return new OneOfField(number, name, serializer, armType, wrap, unwrap);
  }

  public Class<?> armType() {
    return armType;
  }

  boolean holds(Object slot) {
    return armType.isInstance(slot);
  }

  @Override
  public void dump(Object slot, WriteBuffer out) {
    if (holds(slot)) {
      value.dump(unwrap.apply(slot), out);
    }
  }

  @Override
  public Object loadAndMerge(WireType wireType, ReadBuffer in, Object current) {
    final Object held = holds(current) ? unwrap.apply(current) : null;
    final Object decoded = value.loadAndMerge(wireType, in, held);
    try {
      return wrap.apply(decoded);
    } catch (ProtoException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DecodeException("Failed to construct " + armType.getName() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void validate(Object slot) {
    if (!holds(slot)) {
      return;
    }
    final Object wrapped = unwrap.apply(slot);
    if (wrapped == null) {
      throw new ValidationException("oneof alternative '" + name + "' (" + number + ") holds no value");
    }
    value.validate(wrapped);
  }

  @Override
  public Object merge(Object current, Object other) {
    if (!holds(other)) {
      return current;
    }
    if (!holds(current)) {
      return other;
    }
    final Object merged = value.merge(unwrap.apply(current), unwrap.apply(other));
    try {
      return wrap.apply(merged);
    } catch (ProtoException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ValidationException("Failed to construct " + armType.getName() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public Object defaultValue() {
    return null;
  }
}
