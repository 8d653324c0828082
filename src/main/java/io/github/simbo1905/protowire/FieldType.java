// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Type expression of a record component: the value kind, optionally wrapped once in `Optional` or `List`.
/// All node types are nested within this interface.
sealed interface FieldType permits
    FieldType.ScalarNode, FieldType.EnumNode, FieldType.MessageNode,
    FieldType.OptionalNode, FieldType.ListNode {

  /// Recursive descent over a component's generic type, building the tree bottom-up
  /// @param type the generic type of the record component
  /// @param requested the wire kind named on the annotation, applied to the innermost value type
  /// @throws TypeMappingException if any part of the type has no wire mapping
  static FieldType analyze(Type type, ProtoType requested) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(requested, "requested");
    return analyzeType(type, requested);
  }

  private static FieldType analyzeType(Type type, ProtoType requested) {
    if (type instanceof Class<?> clazz) {
      return analyzeClass(clazz, requested);
    }

    if (type instanceof ParameterizedType paramType && paramType.getRawType() instanceof Class<?> rawClass) {
      final Type[] typeArgs = paramType.getActualTypeArguments();

      if (rawClass == List.class) {
        final FieldType element = analyzeType(typeArgs[0], requested);
        if (element instanceof ListNode) {
          throw new TypeMappingException("Repeated of repeated is not supported: " + type.getTypeName());
        }
        if (element instanceof OptionalNode) {
          throw new TypeMappingException("Repeated of optional is not supported: " + type.getTypeName());
        }
        return new ListNode(element);
      }

      if (rawClass == Optional.class) {
        final FieldType wrapped = analyzeType(typeArgs[0], requested);
        if (wrapped instanceof ListNode || wrapped instanceof OptionalNode) {
          throw new TypeMappingException("Optional may only wrap a single value: " + type.getTypeName());
        }
        return new OptionalNode(wrapped);
      }

      if (Map.class.isAssignableFrom(rawClass)) {
        throw new TypeMappingException("Map fields are not supported: " + type.getTypeName());
      }
      throw new TypeMappingException("Type is not serializable: " + type.getTypeName()
          + " (repeated fields must be declared as List)");
    }

    if (type instanceof GenericArrayType) {
      throw new TypeMappingException("Generic arrays are not supported: " + type.getTypeName());
    }

    if (type instanceof TypeVariable<?>) {
      throw new TypeMappingException("Type variables are not supported: " + type.getTypeName());
    }

    if (type instanceof WildcardType) {
      throw new TypeMappingException("Wildcard types are not supported: " + type.getTypeName());
    }

    throw new TypeMappingException("Type is not serializable: " + type.getTypeName());
  }

  @SuppressWarnings("unchecked")
  private static FieldType analyzeClass(Class<?> clazz, ProtoType requested) {
    if (requested != ProtoType.DEFAULT) {
      if (!requested.accepts(clazz)) {
        throw new TypeMappingException(requested + " requires "
            + requested.serializer.javaType().getSimpleName() + " but the component is " + clazz.getTypeName());
      }
      return new ScalarNode(requested, clazz);
    }
    if (clazz.isEnum()) {
      return new EnumNode((Class<? extends Enum<?>>) clazz);
    }
    if (clazz.isRecord()) {
      return new MessageNode((Class<? extends Record>) clazz);
    }
    if (clazz.isArray() && clazz != byte[].class) {
      throw new TypeMappingException("Arrays other than byte[] are not supported, use List: " + clazz.getTypeName());
    }
    return ProtoType.inferred(clazz)
        .map(kind -> (FieldType) new ScalarNode(kind, clazz))
        .orElseThrow(() -> new TypeMappingException("Type is not serializable: " + clazz.getTypeName()));
  }

  /// A scalar value of a fixed wire kind
  record ScalarNode(ProtoType kind, Class<?> javaType) implements FieldType {
    public ScalarNode {
      Objects.requireNonNull(kind);
      Objects.requireNonNull(javaType);
    }
  }

  /// An enum written by number
  record EnumNode(Class<? extends Enum<?>> enumType) implements FieldType {
  }

  /// A nested record written as an embedded message
  record MessageNode(Class<? extends Record> recordType) implements FieldType {
  }

  /// A value that may be absent
  record OptionalNode(FieldType wrapped) implements FieldType {
  }

  /// A repeated value
  record ListNode(FieldType element) implements FieldType {
  }
}
