// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import java.util.Arrays;

/// How extension payloads are written. The default for new [Handle]s is read from the system property
/// `no.framework.codec.ExtensionMode` and is TAGGED when the property is absent.
public enum ExtensionMode {
  /// An extension preamble carrying the tag and length, followed by the payload bytes
  TAGGED,

  /// The payload as an untyped raw byte string; the tag is not written
  RAW;

  static final String PROPERTY = "no.framework.codec.ExtensionMode";

  static ExtensionMode current() {
    final String mode = System.getProperty(PROPERTY, TAGGED.name()).toUpperCase();
    try {
      return ExtensionMode.valueOf(mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid extension mode: " + mode + ". Must be one of: " + Arrays.toString(ExtensionMode.values()));
    }
  }
}
