// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.protowire;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Marks a record component whose type is a sealed interface as a union of alternatives.
///
/// Every permitted subtype must be a record with exactly one component annotated with [ProtoField]; that
/// component's number identifies the alternative on the wire. The component holds null when no alternative is set.
///
/// ```java
/// sealed interface Contact permits Email, Phone {}
/// record Email(@ProtoField(number = 2) String address) implements Contact {}
/// record Phone(@ProtoField(number = 3) String digits) implements Contact {}
/// record Person(@ProtoField(number = 1) String name, @ProtoOneOf Contact contact) {}
/// ```
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface ProtoOneOf {
}
