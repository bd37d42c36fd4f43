// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import java.util.Arrays;
import java.util.Objects;

/// Caller-owned output slot for [Encoder#forBytes(ByteSlot, Handle)].
/// After each successful encode it holds the encoder's backing array and the length of the encoded prefix.
/// Reusing a slot for the next encoder reuses its array when it is large enough, so steady-state
/// encoding into the same slot does not allocate.
public final class ByteSlot {
  private byte[] array;
  private int length;

  /// An empty slot; the first encoder allocates [ByteSink#DEFAULT_BUFFER_SIZE] bytes
  public ByteSlot() {
  }

  /// A slot that starts from the given array, all of which counts as content until the first encode
  /// overwrites it from the start.
  public ByteSlot(byte[] initial) {
    this.array = Objects.requireNonNull(initial, "initial must not be null");
    this.length = initial.length;
  }

  /// The backing array, or null if nothing was ever stored. Only the first [#length()] bytes are encoded output.
  public byte[] array() {
    return array;
  }

  public int length() {
    return length;
  }

  /// A copy of exactly the encoded prefix
  public byte[] toByteArray() {
    return array == null ? new byte[0] : Arrays.copyOf(array, length);
  }

  void store(byte[] array, int length) {
    assert length <= array.length : "length " + length + " exceeds capacity " + array.length;
    this.array = array;
    this.length = length;
  }
}
