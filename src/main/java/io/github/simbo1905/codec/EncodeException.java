// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import java.util.Objects;

/// Raised by [Encoder#encode(Object)] when a value cannot be written.
/// The output target is left partially written; nothing is rolled back.
public final class EncodeException extends Exception {

  /// Why the encode was aborted
  public enum Reason {
    /// The value has a shape with no defined encoding, or nests too deeply
    UNSUPPORTED_SHAPE,
    /// A registered [ExtensionFunction] failed; the cause is the original failure
    EXTENSION_FAILURE,
    /// The byte sink reported an I/O failure
    SINK_FAILURE,
    /// The wire format or a record accessor failed with an unchecked exception
    UNEXPECTED_FAILURE
  }

  private final Reason reason;

  EncodeException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason);
  }

  EncodeException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason);
  }

  public Reason reason() {
    return reason;
  }
}
