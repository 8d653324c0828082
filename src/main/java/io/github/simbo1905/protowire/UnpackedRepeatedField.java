// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.util.List;

import static io.github.simbo1905.protowire.ProtoCodec.LOGGER;

/// A repeated field written as one tagged occurrence per element, in list order.
public final class UnpackedRepeatedField extends RepeatedField {

  public UnpackedRepeatedField(int number, String name, Serializer<?> element) {
    super(number, name, element);
  }

  @Override
  public void dump(Object value, WriteBuffer out) {
    final List<?> values = (List<?>) value;
    LOGGER.finer(() -> "Writing unpacked field " + number + " '" + name + "' of " + values.size()
        + " elements at position " + out.position());
    for (Object element : values) {
      out.putTag(number, serializer.wireType());
      serializer.dump(element, out);
    }
  }
}
