// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.logging.Logger;

/// Main interface of the protowire library: encodes records of one message type to the Protocol Buffers wire
/// format and decodes them back. Instances are immutable and may be shared between threads.
public sealed interface ProtoCodec<T> permits MessageEngine {

  Logger LOGGER = Logger.getLogger(ProtoCodec.class.getName());

  /// @return the message type this codec handles
  Class<T> type();

  /// Validate then serialize a record
  /// @param record The record to serialize
  /// @return The wire bytes, identical for equal records
  /// @throws ValidationException if any field cannot be written, in which case nothing is written
  byte[] encode(T record);

  /// Validate then serialize a record to a stream
  void encode(T record, OutputStream out) throws IOException;

  /// Deserialize a record from the whole of the given bytes
  /// @throws DecodeException if the bytes are malformed
  T decode(byte[] bytes);

  /// Deserialize a record from the remaining bytes of the buffer, consuming them
  T decode(ByteBuffer buffer);

  /// Deserialize a record from everything the stream yields until its end
  T decode(InputStream in) throws IOException;

  /// Deserialize a record from the remaining bytes of a cursor
  T decode(ReadBuffer in);

  /// Combine two records field by field: singular values of `other` win when present, embedded messages merge
  /// and repeated fields concatenate
  /// @return a new record, the arguments are not modified
  T merge(T record, T other);

  /// @throws ValidationException naming the first field whose value cannot be written
  void validate(T record);

  /// @return the record decoded from zero bytes
  T defaultInstance();

  /// @return `type.googleapis.com/` followed by the qualified name of the message type
  String typeUrl();

  /// @return the serializer that embeds this message type inside another as a length-delimited field
  Serializer<T> serializer();

  /// Factory method for the codec of a record type whose components are annotated with [ProtoField] or
  /// [ProtoOneOf]. The schema is derived once per class and cached.
  /// @param type The record class
  /// @return The codec for the record type
  /// @throws TypeMappingException if a component has no wire mapping
  static <T extends Record> ProtoCodec<T> forRecord(@NotNull Class<T> type) {
    Objects.requireNonNull(type, "Class must not be null");
    return RecordSchema.engineFor(type);
  }

  /// Start declaring the fields of a message type explicitly, without annotations
  /// @param type The class of the instances the codec reads and writes
  static <T> MessageEngine.Builder<T> builder(@NotNull Class<T> type) {
    Objects.requireNonNull(type, "Class must not be null");
    return new MessageEngine.Builder<>(type);
  }
}
