// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// [ByteSink] over an externally owned [OutputStream].
/// Streams that are not cheap for single-byte writes are wrapped in a small buffer.
final class StreamByteSink implements ByteSink {
  private final OutputStream out;
  // scratch for big-endian integers, reused on every write
  private final ByteBuffer scratch = ByteBuffer.allocate(Long.BYTES);

  StreamByteSink(OutputStream out) {
    Objects.requireNonNull(out, "out must not be null");
    this.out = hasCheapSmallWrites(out) ? out : new BufferedOutputStream(out, DEFAULT_BUFFER_SIZE);
  }

  static boolean hasCheapSmallWrites(OutputStream out) {
    return out instanceof BufferedOutputStream || out instanceof ByteArrayOutputStream;
  }

  OutputStream stream() {
    return out;
  }

  @Override
  public void writeUint16(int value) throws IOException {
    scratch.clear();
    scratch.putShort((short) value);
    out.write(scratch.array(), 0, Short.BYTES);
  }

  @Override
  public void writeUint32(int value) throws IOException {
    scratch.clear();
    scratch.putInt(value);
    out.write(scratch.array(), 0, Integer.BYTES);
  }

  @Override
  public void writeUint64(long value) throws IOException {
    scratch.clear();
    scratch.putLong(value);
    out.write(scratch.array(), 0, Long.BYTES);
  }

  @Override
  public void writeBytes(byte[] bytes, int offset, int length) throws IOException {
    out.write(bytes, offset, length);
  }

  @Override
  public void writeString(String value) throws IOException {
    final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    out.write(bytes, 0, bytes.length);
  }

  @Override
  public void writeByte(int b) throws IOException {
    out.write(b);
  }

  @Override
  public void write2(int b1, int b2) throws IOException {
    out.write(b1);
    out.write(b2);
  }

  @Override
  public void write3(int b1, int b2, int b3) throws IOException {
    out.write(b1);
    out.write(b2);
    out.write(b3);
  }

  @Override
  public void write4(int b1, int b2, int b3, int b4) throws IOException {
    out.write(b1);
    out.write(b2);
    out.write(b3);
    out.write(b4);
  }

  @Override
  public void flush() throws IOException {
    out.flush();
  }
}
