// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

/// Character set hint passed to [PrimitiveEncoder] string writes. RAW means the bytes are opaque.
public enum CharEncoding {
  RAW,
  UTF8,
  UTF16LE,
  UTF16BE,
  UTF32LE,
  UTF32BE
}
