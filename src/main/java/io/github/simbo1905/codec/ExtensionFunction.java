// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

/// User-supplied encoding for an extension type.
/// @param <T> the registered type
@FunctionalInterface
public interface ExtensionFunction<T> {

  /// @param value the non-null value to encode
  /// @return the payload, or null to have the value written as nil
  /// @throws Exception any failure, which aborts the encode with [EncodeException.Reason#EXTENSION_FAILURE]
  byte[] encode(T value) throws Exception;
}
