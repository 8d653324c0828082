// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.RecordComponent;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static io.github.simbo1905.protowire.ProtoCodec.LOGGER;

/// Derives the field map of a record type from its annotated components. Runs once per record class: the result
/// is an ordinary [MessageEngine] built with [MessageEngine.Builder], and per-message work never reflects.
final class RecordSchema {

  static final Map<Class<?>, MessageEngine<?>> ENGINES = new ConcurrentHashMap<>();

  private RecordSchema() {
  }

  /// Derive the engine of a record type together with every message type it reaches that is not yet cached. The
  /// engines of one registration are only published once the whole graph has been derived, so a failure anywhere
  /// leaves nothing behind.
  @SuppressWarnings("unchecked")
  static <T> MessageEngine<T> engineFor(Class<T> type) {
    final MessageEngine<?> cached = ENGINES.get(type);
    if (cached != null) {
      return (MessageEngine<T>) cached;
    }
    final Map<Class<?>, MessageEngine<?>> pending = new LinkedHashMap<>();
    engineFor(type, Map.of(), pending);
    pending.forEach(ENGINES::putIfAbsent);
    return (MessageEngine<T>) ENGINES.get(type);
  }

  /// @param requiredChains the record types being derived further up the stack, each mapped to whether every
  ///                       field leading from it down to `type` is a required singular message
  /// @param pending        the engines derived so far by this registration
  @SuppressWarnings("unchecked")
  static <T> MessageEngine<T> engineFor(Class<T> type, Map<Class<?>, Boolean> requiredChains,
                                        Map<Class<?>, MessageEngine<?>> pending) {
    final MessageEngine<?> cached = ENGINES.getOrDefault(type, pending.get(type));
    if (cached != null) {
      return (MessageEngine<T>) cached;
    }
    if (!type.isRecord()) {
      throw new TypeMappingException("Message types must be records: " + type.getName());
    }
    final Map<Class<?>, Boolean> chains = new HashMap<>(requiredChains);
    chains.put(type, Boolean.TRUE);
    final MessageEngine<T> engine = derive(type, chains, pending);
    pending.put(type, engine);
    return engine;
  }

  static <T> MessageEngine<T> derive(Class<T> type, Map<Class<?>, Boolean> chains,
                                     Map<Class<?>, MessageEngine<?>> pending) {
    LOGGER.fine(() -> "Deriving message schema for " + type.getName());
    final RecordComponent[] components = type.getRecordComponents();
    final MethodHandle constructor = canonicalConstructor(type, components);
    final MessageEngine.Builder<T> builder = new MessageEngine.Builder<>(type);
    @SuppressWarnings("unchecked") final Function<Object, Object>[] toComponent = new Function[components.length];

    for (int i = 0; i < components.length; i++) {
      final RecordComponent component = components[i];
      final ProtoField protoField = component.getAnnotation(ProtoField.class);
      final ProtoOneOf protoOneOf = component.getAnnotation(ProtoOneOf.class);
      final MethodHandle accessor = accessor(component);
      toComponent[i] = Function.identity();

      if (protoField != null && protoOneOf != null) {
        throw new TypeMappingException(where(type, component) + " cannot be both a field and a oneof");
      }
      if (protoOneOf != null) {
        builder.oneOf(component.getName(), getter(accessor), alternatives(type, component, chains, pending));
        continue;
      }
      if (protoField == null) {
        throw new TypeMappingException(where(type, component) + " has no @ProtoField or @ProtoOneOf annotation");
      }

      final FieldType fieldType;
      try {
        fieldType = FieldType.analyze(component.getGenericType(), protoField.type());
      } catch (TypeMappingException e) {
        throw new TypeMappingException(where(type, component) + ": " + e.getMessage(), e);
      }
      LOGGER.fine(() -> where(type, component) + " is field " + protoField.number() + " of type " + fieldType);

      if (fieldType instanceof FieldType.OptionalNode optional) {
        final Function<Object, Object> getter = getter(accessor);
        builder.optional(protoField.number(), component.getName(),
            serializer(optional.wrapped(), false, type, component, chains, pending),
            record -> {
              final Optional<?> value = (Optional<?>) getter.apply(record);
              return value == null ? null : value.orElse(null);
            });
        toComponent[i] = Optional::ofNullable;
      } else if (fieldType instanceof FieldType.ListNode list) {
        builder.repeated(protoField.number(), component.getName(),
            serializer(list.element(), false, type, component, chains, pending),
            listGetter(accessor), protoField.packed());
      } else {
        builder.required(protoField.number(), component.getName(),
            serializer(fieldType, true, type, component, chains, pending), getter(accessor));
      }
    }

    return builder.build(values -> {
      final Object[] arguments = new Object[values.length];
      for (int i = 0; i < values.length; i++) {
        arguments[i] = toComponent[i].apply(values[i]);
      }
      return invoke(constructor, type, arguments);
    });
  }

  /// The serializer of a single value
  /// @param required true when the value is a singular non-optional component, which must have a finite default
  @SuppressWarnings({"unchecked", "rawtypes"})
  static Serializer<Object> serializer(FieldType fieldType, boolean required, Class<?> owner, RecordComponent component,
                                       Map<Class<?>, Boolean> chains, Map<Class<?>, MessageEngine<?>> pending) {
    if (fieldType instanceof FieldType.ScalarNode scalar) {
      return (Serializer<Object>) scalar.kind().serializer;
    }
    if (fieldType instanceof FieldType.EnumNode enumNode) {
      return (Serializer<Object>) EnumSerializer.of((Class) enumNode.enumType());
    }
    if (fieldType instanceof FieldType.MessageNode message) {
      final Class<?> nested = message.recordType();
      final MessageEngine<?> cached = ENGINES.getOrDefault(nested, pending.get(nested));
      if (cached != null) {
        return (Serializer<Object>) cached.serializer();
      }
      final Boolean requiredChain = chains.get(nested);
      if (requiredChain != null) {
        if (required && requiredChain) {
          throw new TypeMappingException(where(owner, component) + " is a required field that recurses into "
              + nested.getName() + " without an Optional or List in between");
        }
        LOGGER.fine(() -> where(owner, component) + " refers back to " + nested.getSimpleName()
            + ", resolving it on first use");
        return new MessageSerializer(nested, () -> pending.get(nested));
      }
      final Map<Class<?>, Boolean> next = chains.entrySet().stream()
          .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue() && required));
      return (Serializer<Object>) engineFor(nested, next, pending).serializer();
    }
    throw new TypeMappingException(where(owner, component) + " has unsupported type " + fieldType);
  }

  /// Build one alternative per record reachable through the sealed interface of a oneof component
  static OneOfField[] alternatives(Class<?> owner, RecordComponent component, Map<Class<?>, Boolean> chains,
                                   Map<Class<?>, MessageEngine<?>> pending) {
    final Class<?> union = component.getType();
    if (!union.isInterface() || !union.isSealed()) {
      throw new TypeMappingException(where(owner, component) + " must be a sealed interface to be a oneof");
    }
    final List<Class<?>> arms = permittedRecords(union, new HashSet<>()).collect(Collectors.toList());
    final List<Class<?>> illegal = arms.stream().filter(c -> !c.isRecord()).collect(Collectors.toList());
    if (!illegal.isEmpty()) {
      throw new TypeMappingException(where(owner, component) + " permits types that are not records: "
          + illegal.stream().map(Class::getName).collect(Collectors.joining(", ")));
    }
    return arms.stream()
        .sorted(Comparator.comparing(Class::getName))
        .map(arm -> alternative(owner, component, arm, chains, pending))
        .toArray(OneOfField[]::new);
  }

  static <A> OneOfField alternative(Class<?> owner, RecordComponent union, Class<A> arm,
                                    Map<Class<?>, Boolean> chains, Map<Class<?>, MessageEngine<?>> pending) {
    final RecordComponent[] components = arm.getRecordComponents();
    if (components.length != 1 || components[0].getAnnotation(ProtoField.class) == null) {
      throw new TypeMappingException(where(owner, union) + " alternative " + arm.getName()
          + " must have exactly one component annotated with @ProtoField");
    }
    final RecordComponent component = components[0];
    final ProtoField protoField = component.getAnnotation(ProtoField.class);
    final FieldType fieldType = FieldType.analyze(component.getGenericType(), protoField.type());
    if (fieldType instanceof FieldType.ListNode || fieldType instanceof FieldType.OptionalNode) {
      throw new TypeMappingException(where(arm, component) + " must be a single value to be a oneof alternative");
    }
    final MethodHandle constructor = canonicalConstructor(arm, components);
    final Function<Object, Object> unwrap = getter(accessor(component));
    return OneOfField.of(protoField.number(), component.getName(),
        serializer(fieldType, false, arm, component, chains, pending), arm,
        value -> invoke(constructor, arm, value), unwrap);
  }

  /// Discover all records reachable from a sealed interface including nested sealed interfaces
  static Stream<Class<?>> permittedRecords(Class<?> current, Set<Class<?>> visited) {
    if (!visited.add(current)) {
      return Stream.empty();
    }
    if (current.isSealed()) {
      return Arrays.stream(current.getPermittedSubclasses())
          .flatMap(child -> permittedRecords(child, visited));
    }
    return Stream.of(current);
  }

  static MethodHandle canonicalConstructor(Class<?> type, RecordComponent[] components) {
    try {
      final Class<?>[] parameterTypes = Arrays.stream(components).map(RecordComponent::getType).toArray(Class<?>[]::new);
      final Constructor<?> constructor = type.getDeclaredConstructor(parameterTypes);
      return MethodHandles.lookup().unreflectConstructor(constructor);
    } catch (NoSuchMethodException | IllegalAccessException e) {
      throw new TypeMappingException("Records should be public such as a top level of static nested type: "
          + e.getMessage(), e);
    }
  }

  static MethodHandle accessor(RecordComponent component) {
    try {
      return MethodHandles.lookup().unreflect(component.getAccessor());
    } catch (IllegalAccessException e) {
      throw new TypeMappingException("Failed to un reflect accessor for " + component.getName(), e);
    }
  }

  static Function<Object, Object> getter(MethodHandle accessor) {
    return record -> {
      try {
        return accessor.invokeWithArguments(record);
      } catch (RuntimeException e) {
        throw e;
      } catch (Throwable e) {
        throw new IllegalStateException(e.getMessage(), e);
      }
    };
  }

  static Function<Object, List<?>> listGetter(MethodHandle accessor) {
    final Function<Object, Object> getter = getter(accessor);
    return record -> (List<?>) getter.apply(record);
  }

  static <T> T invoke(MethodHandle constructor, Class<T> type, Object... arguments) {
    try {
      return type.cast(constructor.invokeWithArguments(arguments));
    } catch (RuntimeException e) {
      throw e;
    } catch (Throwable e) {
      throw new IllegalStateException("Failed to construct " + type.getName() + ": " + e.getMessage(), e);
    }
  }

  static String where(Class<?> owner, RecordComponent component) {
    return owner.getSimpleName() + "." + component.getName();
  }
}
