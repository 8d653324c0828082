// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/// The codec of one message type. Holds the fields ordered by number together with the slot each one reads and
/// writes. A slot is one attribute of the record: a singular or repeated field owns a slot alone, the alternatives
/// of a union share one.
///
/// Encoding walks the fields in ascending number order. Decoding starts from the default slot values and folds each
/// tagged occurrence into its slot, skipping numbers it does not know, then builds the record once the input is
/// exhausted.
public final class MessageEngine<T> implements ProtoCodec<T> {

  static final String TYPE_URL_PREFIX = "type.googleapis.com/";

  /// One attribute of the record and how to read it. Union slots list their alternatives.
  record Slot(String name, Function<Object, Object> getter, List<OneOfField> alternatives) {
  }

  final Class<T> type;
  final String typeUrl;
  final Slot[] slots;
  final Field[] fields;          // ascending by number
  final int[] fieldSlots;        // fields[i] reads and writes slot fieldSlots[i]
  final Map<Integer, Integer> fieldIndexByNumber;
  final Function<Object[], T> constructor;
  final MessageSerializer<T> serializer;
  volatile Object[] defaults;

  MessageEngine(Class<T> type, String typeUrl, List<Slot> slots, List<Field> fields, List<Integer> fieldSlots,
                Function<Object[], T> constructor) {
    this.type = type;
    this.typeUrl = typeUrl;
    this.slots = slots.toArray(Slot[]::new);
    this.constructor = constructor;

    final Integer[] order = IntStream.range(0, fields.size()).boxed()
        .sorted(Comparator.comparingInt(i -> fields.get(i).number()))
        .toArray(Integer[]::new);
    this.fields = Arrays.stream(order).map(fields::get).toArray(Field[]::new);
    this.fieldSlots = Arrays.stream(order).mapToInt(fieldSlots::get).toArray();

    final Map<Integer, Integer> byNumber = new HashMap<>(this.fields.length * 2);
    for (int i = 0; i < this.fields.length; i++) {
      final Field field = this.fields[i];
      final Integer clash = byNumber.putIfAbsent(field.number(), i);
      if (clash != null) {
        throw new TypeMappingException(type.getName() + " declares field number " + field.number() + " for both '"
            + this.fields[clash].name() + "' and '" + field.name() + "'");
      }
    }
    this.fieldIndexByNumber = Map.copyOf(byNumber);
    this.serializer = new MessageSerializer<>(this);

    LOGGER.info(() -> "MessageEngine registered " + type.getName() + " with fields " + Arrays.stream(this.fields)
        .map(f -> f.number() + ":" + f.name()).collect(Collectors.joining(", ", "[", "]")));
  }

  @Override
  public Class<T> type() {
    return type;
  }

  @Override
  public String typeUrl() {
    return typeUrl;
  }

  @Override
  public Serializer<T> serializer() {
    return serializer;
  }

  /// @return the fields in ascending number order
  public List<Field> fields() {
    return List.of(fields);
  }

  /// @return the field declared with the number, if any
  public Optional<Field> field(int number) {
    return Optional.ofNullable(fieldIndexByNumber.get(number)).map(i -> fields[i]);
  }

  Object[] extract(T record) {
    final Object[] values = new Object[slots.length];
    for (int i = 0; i < slots.length; i++) {
      values[i] = slots[i].getter().apply(record);
    }
    return values;
  }

  @Override
  public void validate(T record) {
    validateValues(checkedExtract(record));
  }

  Object[] checkedExtract(Object record) {
    if (record == null) {
      throw new ValidationException(type.getSimpleName() + " must not be null");
    }
    if (!type.isInstance(record)) {
      throw new ValidationException("expected " + type.getName() + " but was " + record.getClass().getName());
    }
    return extract(type.cast(record));
  }

  void validateValues(Object[] values) {
    for (int s = 0; s < slots.length; s++) {
      final Object value = values[s];
      final List<OneOfField> alternatives = slots[s].alternatives();
      if (value != null && !alternatives.isEmpty() && alternatives.stream().noneMatch(a -> a.holds(value))) {
        throw new ValidationException("oneof '" + slots[s].name() + "' holds unregistered alternative "
            + value.getClass().getName());
      }
    }
    for (int i = 0; i < fields.length; i++) {
      fields[i].validate(values[fieldSlots[i]]);
    }
  }

  @Override
  public byte[] encode(@NotNull T record) {
    final Object[] values = checkedExtract(record);
    validateValues(values);
    final WriteBuffer out = WriteBuffer.allocate();
    dumpValues(values, out);
    LOGGER.finer(() -> "Encoded " + type.getSimpleName() + " to " + out.position() + " bytes");
    return out.toByteArray();
  }

  @Override
  public void encode(@NotNull T record, @NotNull OutputStream out) throws IOException {
    final Object[] values = checkedExtract(record);
    validateValues(values);
    final WriteBuffer buffer = WriteBuffer.allocate();
    dumpValues(values, buffer);
    buffer.writeTo(out);
  }

  /// Write the fields of a record that has already been validated
  void dump(T record, WriteBuffer out) {
    dumpValues(extract(record), out);
  }

  void dumpValues(Object[] values, WriteBuffer out) {
    for (int i = 0; i < fields.length; i++) {
      fields[i].dump(values[fieldSlots[i]], out);
    }
  }

  @Override
  public T decode(byte[] bytes) {
    return decode(ReadBuffer.wrap(bytes));
  }

  @Override
  public T decode(@NotNull ByteBuffer buffer) {
    final ReadBuffer in = ReadBuffer.wrap(buffer);
    final T record = decode(in);
    buffer.position(buffer.position() + in.position());
    return record;
  }

  @Override
  public T decode(@NotNull InputStream in) throws IOException {
    return decode(in.readAllBytes());
  }

  @Override
  public T decode(@NotNull ReadBuffer in) {
    final Object[] values = defaults().clone();
    while (in.hasRemaining()) {
      final Tag tag = Tag.decode(in.getVarLong());
      final Integer index = fieldIndexByNumber.get(tag.number());
      if (index == null) {
        LOGGER.fine(() -> "Skipping unknown field " + tag.number() + " of wire type " + tag.wireType() + " in "
            + type.getSimpleName());
        in.skip(tag.wireType());
        continue;
      }
      final int slot = fieldSlots[index];
      values[slot] = fields[index].loadAndMerge(tag.wireType(), in, values[slot]);
    }
    return construct(values, true);
  }

  @Override
  public T merge(@NotNull T record, @NotNull T other) {
    final Object[] values = checkedExtract(record);
    final Object[] others = checkedExtract(other);
    for (int i = 0; i < fields.length; i++) {
      final int slot = fieldSlots[i];
      values[slot] = fields[i].merge(values[slot], others[slot]);
    }
    return construct(values, false);
  }

  @Override
  public T defaultInstance() {
    return construct(defaults().clone(), false);
  }

  Object[] defaults() {
    Object[] result = defaults;
    if (result == null) {
      result = new Object[slots.length];
      for (int i = 0; i < fields.length; i++) {
        final Object value = fields[i].defaultValue();
        if (value != null) {
          result[fieldSlots[i]] = value;
        }
      }
      defaults = result;
    }
    return result;
  }

  /// @param decoding true when the values came off the wire, so that a constructor rejecting them is a decode
  ///                 failure rather than a validation failure
  T construct(Object[] values, boolean decoding) {
    for (int i = 0; i < fields.length; i++) {
      values[fieldSlots[i]] = fields[i].finish(values[fieldSlots[i]]);
    }
    try {
      return constructor.apply(values);
    } catch (ProtoException e) {
      throw e;
    } catch (RuntimeException e) {
      final String message = "Failed to construct " + type.getName() + ": " + e.getMessage();
      throw decoding ? new DecodeException(message, e) : new ValidationException(message, e);
    }
  }

  @Override
  public String toString() {
    return "MessageEngine[" + type.getName() + "]";
  }

  /// Declares the fields of a message type one by one. Slots are numbered in declaration order, which is the order
  /// of the values handed to the constructor function.
  public static final class Builder<T> {

    final Class<T> type;
    String typeUrl;
    final List<Slot> slots = new ArrayList<>();
    final List<Field> fields = new ArrayList<>();
    final List<Integer> fieldSlots = new ArrayList<>();

    Builder(Class<T> type) {
      this.type = type;
      final String name = type.getCanonicalName() != null ? type.getCanonicalName() : type.getName();
      this.typeUrl = TYPE_URL_PREFIX + name;
    }

    public Builder<T> typeUrl(@NotNull String typeUrl) {
      this.typeUrl = Objects.requireNonNull(typeUrl);
      return this;
    }

    /// A singular field that must always hold a value
    public <V> Builder<T> required(int number, String name, Serializer<V> serializer,
                                   Function<? super T, ? extends V> getter) {
      return slot(name, getter, new NonRepeatedField(number, name, serializer, false));
    }

    /// A singular field whose absence is a null value and writes nothing
    public <V> Builder<T> optional(int number, String name, Serializer<V> serializer,
                                   Function<? super T, ? extends V> getter) {
      return slot(name, getter, new NonRepeatedField(number, name, serializer, true));
    }

    /// A repeated field, packed when the element kind allows it
    public <E> Builder<T> repeated(int number, String name, Serializer<E> serializer,
                                   Function<? super T, ? extends List<? extends E>> getter) {
      return repeated(number, name, serializer, getter, true);
    }

    /// A repeated field. Length-delimited element kinds are never packed whatever the preference.
    public <E> Builder<T> repeated(int number, String name, Serializer<E> serializer,
                                   Function<? super T, ? extends List<? extends E>> getter, boolean packed) {
      final Field field = packed && serializer.packable()
          ? new PackedRepeatedField(number, name, serializer)
          : new UnpackedRepeatedField(number, name, serializer);
      return slot(name, getter, field);
    }

    /// A union whose alternatives share one slot, null when no alternative is set
    public Builder<T> oneOf(String name, Function<? super T, ?> getter, OneOfField... alternatives) {
      if (alternatives.length == 0) {
        throw new TypeMappingException("oneof '" + name + "' of " + type.getName() + " has no alternatives");
      }
      final int slot = addSlot(name, getter, List.of(alternatives));
      for (OneOfField alternative : alternatives) {
        fields.add(alternative);
        fieldSlots.add(slot);
      }
      return this;
    }

    Builder<T> slot(String name, Function<? super T, ?> getter, Field field) {
      final int slot = addSlot(name, getter, List.of());
      fields.add(field);
      fieldSlots.add(slot);
      return this;
    }

    @SuppressWarnings("unchecked")
    int addSlot(String name, Function<? super T, ?> getter, List<OneOfField> alternatives) {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(getter, "getter");
      if (slots.stream().anyMatch(s -> s.name().equals(name))) {
        throw new TypeMappingException(type.getName() + " declares '" + name + "' twice");
      }
      slots.add(new Slot(name, (Function<Object, Object>) getter, alternatives));
      return slots.size() - 1;
    }

    /// @param constructor builds an instance from the slot values in declaration order
    /// @throws TypeMappingException if two fields share a number
    public MessageEngine<T> build(@NotNull Function<Object[], T> constructor) {
      Objects.requireNonNull(constructor, "constructor");
      return new MessageEngine<>(type, typeUrl, slots, fields, fieldSlots, constructor);
    }
  }
}
