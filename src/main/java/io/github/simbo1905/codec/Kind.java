// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/// The closed set of shapes the engine knows how to walk, classified from a runtime class.
enum Kind {
  /// null: the nil of every nilable shape
  INVALID,
  BOOL,
  STRING,
  /// Byte, Short, Integer and Long, widened to a signed long
  INT,
  /// Character, the only unsigned integral type, widened to an unsigned long
  UINT,
  FLOAT32,
  FLOAT64,
  /// byte[], written as one raw byte string
  BYTES,
  /// any other Java array
  ARRAY,
  /// any Collection
  SLICE,
  MAP,
  /// a record
  STRUCT,
  /// Optional, OptionalInt, OptionalLong and OptionalDouble: nil when empty, else the content
  POINTER,
  UNSUPPORTED;

  private static final ClassValue<Kind> KINDS = new ClassValue<>() {
    @Override
    protected Kind computeValue(Class<?> type) {
      return classify(type);
    }
  };

  static Kind of(Object value) {
    return value == null ? INVALID : KINDS.get(value.getClass());
  }

  static @NotNull Kind classify(@NotNull Class<?> type) {
    if (type == Boolean.class) {
      return BOOL;
    }
    if (type == String.class) {
      return STRING;
    }
    if (type == Integer.class || type == Long.class || type == Short.class || type == Byte.class) {
      return INT;
    }
    if (type == Character.class) {
      return UINT;
    }
    if (type == Double.class) {
      return FLOAT64;
    }
    if (type == Float.class) {
      return FLOAT32;
    }
    if (type == byte[].class) {
      return BYTES;
    }
    if (type.isArray()) {
      return ARRAY;
    }
    if (Collection.class.isAssignableFrom(type)) {
      return SLICE;
    }
    if (Map.class.isAssignableFrom(type)) {
      return MAP;
    }
    if (type.isRecord()) {
      return STRUCT;
    }
    if (type == Optional.class || type == OptionalInt.class || type == OptionalLong.class || type == OptionalDouble.class) {
      return POINTER;
    }
    return UNSUPPORTED;
  }

  /// The empty values that `omitEmpty` leaves out: false, numeric zero, the NUL char, null, an empty optional,
  /// and any zero-length string, array, collection or map. Records are never empty.
  static boolean isEmptyValue(Object value) {
    return switch (of(value)) {
      case INVALID -> true;
      case BOOL -> !((Boolean) value);
      case STRING -> ((String) value).isEmpty();
      case INT -> ((Number) value).longValue() == 0L;
      case UINT -> (Character) value == '\0';
      case FLOAT32 -> (Float) value == 0.0f;
      case FLOAT64 -> (Double) value == 0.0d;
      case BYTES, ARRAY -> Array.getLength(value) == 0;
      case SLICE -> ((Collection<?>) value).isEmpty();
      case MAP -> ((Map<?, ?>) value).isEmpty();
      case POINTER -> !isPresent(value);
      case STRUCT, UNSUPPORTED -> false;
    };
  }

  static boolean isPresent(Object optional) {
    if (optional instanceof Optional<?> o) {
      return o.isPresent();
    }
    if (optional instanceof OptionalInt o) {
      return o.isPresent();
    }
    if (optional instanceof OptionalLong o) {
      return o.isPresent();
    }
    return ((OptionalDouble) optional).isPresent();
  }

  /// The content of a present optional, boxed
  static Object content(Object optional) {
    if (optional instanceof Optional<?> o) {
      return o.get();
    }
    if (optional instanceof OptionalInt o) {
      return o.getAsInt();
    }
    if (optional instanceof OptionalLong o) {
      return o.getAsLong();
    }
    return ((OptionalDouble) optional).getAsDouble();
  }
}
