// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.util.Optional;

/// Scalar wire kinds selectable with [ProtoField#type()], each bound to the Java type its serializer handles.
public enum ProtoType {
  /// Infer the kind from the Java type of the component
  DEFAULT(null),
  BOOL(Serializers.BOOL),
  INT32(Serializers.INT32),
  INT64(Serializers.INT64),
  UINT32(Serializers.UINT32),
  UINT64(Serializers.UINT64),
  SINT32(Serializers.SINT32),
  SINT64(Serializers.SINT64),
  FIXED32(Serializers.FIXED32),
  FIXED64(Serializers.FIXED64),
  SFIXED32(Serializers.SFIXED32),
  SFIXED64(Serializers.SFIXED64),
  FLOAT(Serializers.FLOAT),
  DOUBLE(Serializers.DOUBLE),
  STRING(Serializers.STRING),
  BYTES(Serializers.BYTES),
  /// Non-standard: a non-negative `long` as an unsigned varint
  UINT(Serializers.UNSIGNED_VARINT);

  final Serializer<?> serializer;

  ProtoType(Serializer<?> serializer) {
    this.serializer = serializer;
  }

  public Optional<Serializer<?>> serializer() {
    return Optional.ofNullable(serializer);
  }

  /// The kind a Java type maps to when no kind is named
  static Optional<ProtoType> inferred(Class<?> javaType) {
    final Class<?> boxed = boxed(javaType);
    if (boxed == Boolean.class) {
      return Optional.of(BOOL);
    }
    if (boxed == Integer.class) {
      return Optional.of(INT32);
    }
    if (boxed == Long.class) {
      return Optional.of(INT64);
    }
    if (boxed == Float.class) {
      return Optional.of(FLOAT);
    }
    if (boxed == Double.class) {
      return Optional.of(DOUBLE);
    }
    if (boxed == String.class) {
      return Optional.of(STRING);
    }
    if (boxed == byte[].class) {
      return Optional.of(BYTES);
    }
    return Optional.empty();
  }

  /// True if values of the Java type can be handed to this kind's serializer
  boolean accepts(Class<?> javaType) {
    return serializer != null && serializer.javaType() == boxed(javaType);
  }

  static Class<?> boxed(Class<?> javaType) {
    if (!javaType.isPrimitive()) {
      return javaType;
    }
    if (javaType == boolean.class) {
      return Boolean.class;
    }
    if (javaType == int.class) {
      return Integer.class;
    }
    if (javaType == long.class) {
      return Long.class;
    }
    if (javaType == float.class) {
      return Float.class;
    }
    if (javaType == double.class) {
      return Double.class;
    }
    if (javaType == short.class) {
      return Short.class;
    }
    if (javaType == byte.class) {
      return Byte.class;
    }
    if (javaType == char.class) {
      return Character.class;
    }
    return Void.class;
  }
}
