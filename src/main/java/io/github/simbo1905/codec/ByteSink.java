// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import java.io.IOException;

/// Low-level byte writer that a [PrimitiveEncoder] writes through. All multi-byte integers are big-endian.
/// Any failure aborts the current encode; there is no partial-write recovery.
public sealed interface ByteSink permits StreamByteSink, BufferByteSink {

  /// Size of the buffer a slow stream is wrapped in, and of a fresh [ByteSlot] array
  int DEFAULT_BUFFER_SIZE = 1 << 6;

  /// Write the low 16 bits of `value`
  void writeUint16(int value) throws IOException;

  void writeUint32(int value) throws IOException;

  void writeUint64(long value) throws IOException;

  default void writeBytes(byte[] bytes) throws IOException {
    writeBytes(bytes, 0, bytes.length);
  }

  void writeBytes(byte[] bytes, int offset, int length) throws IOException;

  /// Write the UTF-8 bytes of `value` with no length prefix
  void writeString(String value) throws IOException;

  /// Write the low 8 bits of `b`
  void writeByte(int b) throws IOException;

  void write2(int b1, int b2) throws IOException;

  void write3(int b1, int b2, int b3) throws IOException;

  void write4(int b1, int b2, int b3, int b4) throws IOException;

  /// Push everything written so far to the output target
  void flush() throws IOException;
}
