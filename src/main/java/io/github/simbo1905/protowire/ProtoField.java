// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Assigns a field number to a record component.
///
/// The wire kind follows from the component type unless [#type()] names one: `int` is `int32`, `long` is `int64`,
/// `Optional<X>` is an optional `X` and `List<X>` a repeated `X`.
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface ProtoField {

  /// The field number, unique within the record, from 1 to 2^29-1 excluding 19000-19999
  int number();

  /// The wire kind of the value, or of each element for repeated fields
  ProtoType type() default ProtoType.DEFAULT;

  /// Whether a repeated scalar is written as one packed block. Ignored for other fields.
  boolean packed() default true;
}
