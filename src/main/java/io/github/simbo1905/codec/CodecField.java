// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Per-component encoding options for a record
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.RECORD_COMPONENT, ElementType.METHOD})
public @interface CodecField {

  /// Key written for this component; empty means the component name
  String value() default "";

  /// Leave the component out of the output map when its value is empty
  boolean omitEmpty() default false;

  /// Never encode this component
  boolean skip() default false;

  /// Write the fields of this record-typed component into the enclosing map instead of as a nested map
  boolean inline() default false;
}
