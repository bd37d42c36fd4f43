// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import java.util.Objects;

/// A registered extension: values whose class is exactly `type` are written by `function` under `tag`
public record ExtensionEntry(Class<?> type, byte tag, ExtensionFunction<?> function) {
  public ExtensionEntry {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(function, "function must not be null");
  }

  /// Run the function against a value of the registered type
  byte[] apply(Object value) throws Exception {
    @SuppressWarnings("unchecked") final var fn = (ExtensionFunction<Object>) function;
    return fn.encode(value);
  }
}
