// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/// Serializes the constants of one enum as int32 varints of their number.
public final class EnumSerializer<E extends Enum<E>> implements Serializer<E> {

  final Class<E> enumType;
  final Map<Integer, E> byNumber;
  final int[] numbers;
  final E defaultValue;

  EnumSerializer(Class<E> enumType) {
    this.enumType = Objects.requireNonNull(enumType);
    final E[] constants = enumType.getEnumConstants();
    if (constants == null || constants.length == 0) {
      throw new TypeMappingException("Enum has no constants: " + enumType.getName());
    }
    this.numbers = new int[constants.length];
    this.byNumber = new HashMap<>(constants.length * 2);
    for (E constant : constants) {
      final int number = numberOf(constant);
      numbers[constant.ordinal()] = number;
      final E clash = byNumber.putIfAbsent(number, constant);
      if (clash != null) {
        throw new TypeMappingException("Enum " + enumType.getName() + " has constants " + clash + " and " + constant
            + " with the same number " + number);
      }
    }
    // the constant numbered zero is the wire default, otherwise the first declared
    this.defaultValue = byNumber.getOrDefault(0, constants[0]);
  }

  /// Create the serializer for an enum type
  /// @throws TypeMappingException if the enum has no constants or two constants share a number
  public static <E extends Enum<E>> EnumSerializer<E> of(Class<E> enumType) {
    return new EnumSerializer<>(enumType);
  }

  static int numberOf(Enum<?> constant) {
    return constant instanceof ProtoEnum numbered ? numbered.number() : constant.ordinal();
  }

  @Override
  public WireType wireType() {
    return WireType.VARINT;
  }

  @Override
  public Class<E> javaType() {
    return enumType;
  }

  @Override
  public void validate(Object value) {
    if (value == null) {
      throw new ValidationException(enumType.getSimpleName() + " value must not be null");
    }
    if (!enumType.isInstance(value)) {
      throw new ValidationException(value + " is not a member of " + enumType.getName()
          + Arrays.stream(enumType.getEnumConstants()).map(Enum::name).collect(Collectors.joining(", ", " [", "]")));
    }
  }

  @Override
  public void dump(E value, WriteBuffer out) {
    out.putSignedVarInt(numbers[value.ordinal()]);
  }

  @Override
  public E load(ReadBuffer in) {
    final long number = in.getVarLong();
    final E constant = number == (int) number ? byNumber.get((int) number) : null;
    if (constant == null) {
      throw new DecodeException("Unknown " + enumType.getName() + " number: " + number);
    }
    return constant;
  }

  @Override
  public E defaultValue() {
    return defaultValue;
  }

  @Override
  public String toString() {
    return "enum " + enumType.getSimpleName();
  }
}
