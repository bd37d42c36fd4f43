// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import java.lang.invoke.MethodHandle;
import java.util.Objects;

/// One encodable record field: the key to write, whether to omit it when empty, and how to reach it.
/// `index` is the component index of a direct field and -1 for a field reached through inlined records,
/// in which case `path` holds the accessor chain from the outer record.
/// Accessors are adapted to `(Object)Object` so they can be invoked exactly.
record FieldInfo(String name, boolean omitEmpty, int index, MethodHandle[] path) {
  FieldInfo {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(path, "path must not be null");
    assert path.length > 0 : "Field " + name + " has no accessor";
    assert index < 0 || path.length == 1 : "Direct field " + name + " must have a single accessor";
  }

  boolean direct() {
    return index >= 0;
  }

  /// Resolve this field's value on an instance of the owning record.
  /// A null inlined record along the path makes the field null.
  Object valueOf(Object record) throws Throwable {
    if (direct()) {
      return (Object) path[0].invokeExact(record);
    }
    Object current = record;
    for (MethodHandle accessor : path) {
      if (current == null) {
        return null;
      }
      current = (Object) accessor.invokeExact(current);
    }
    return current;
  }

  @Override
  public String toString() {
    return "FieldInfo[name=" + name + ", omitEmpty=" + omitEmpty + ", index=" + index + ", depth=" + path.length + "]";
  }
}
