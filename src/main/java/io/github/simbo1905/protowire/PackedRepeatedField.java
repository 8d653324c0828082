// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.util.List;

import static io.github.simbo1905.protowire.ProtoCodec.LOGGER;

/// A repeated scalar written as a single length-delimited block of untagged elements. An empty list writes nothing.
public final class PackedRepeatedField extends RepeatedField {

  public PackedRepeatedField(int number, String name, Serializer<?> element) {
    super(number, name, element);
    if (!element.packable()) {
      throw new TypeMappingException("Field '" + name + "' cannot pack length-delimited " + element);
    }
  }

  @Override
  @SuppressWarnings("unchecked")
  public void dump(Object value, WriteBuffer out) {
    final List<Object> values = (List<Object>) value;
    if (values.isEmpty()) {
      return;
    }
    LOGGER.finer(() -> "Writing packed field " + number + " '" + name + "' of " + values.size()
        + " elements at position " + out.position());
    out.putTag(number, WireType.LENGTH_DELIMITED);
    packing.dump(values, out);
  }
}
