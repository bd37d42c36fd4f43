// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// [ByteSink] that writes into an owned growable array and hands the prefix back to a [ByteSlot] on flush.
///
/// Three numbers describe the state: the write cursor, the visible length and the capacity (`buf.length`).
/// The visible length starts at the slot's previous output length and is widened to the capacity once a
/// write passes it.
/// `cursor <= length <= capacity` always holds and capacity never shrinks. When a write does not fit the
/// array is reallocated to `2 * capacity + n`.
final class BufferByteSink implements ByteSink {
  private final ByteSlot out;
  private byte[] buf;
  private int length;
  private int cursor;

  BufferByteSink(ByteSlot out) {
    this.out = Objects.requireNonNull(out, "out must not be null");
    final byte[] initial = out.array();
    if (initial == null) {
      this.buf = new byte[DEFAULT_BUFFER_SIZE];
      this.length = buf.length;
    } else {
      this.buf = initial;
      this.length = out.length();
    }
  }

  int cursor() {
    return cursor;
  }

  int length() {
    return length;
  }

  int capacity() {
    return buf.length;
  }

  /// Reserve `n` bytes and return the offset to write them at
  int grow(int n) {
    final int oldCursor = cursor;
    final int newCursor = oldCursor + n;
    if (newCursor > buf.length) {
      final byte[] bigger = new byte[2 * buf.length + n];
      System.arraycopy(buf, 0, bigger, 0, oldCursor);
      buf = bigger;
      length = bigger.length;
    } else if (newCursor > length) {
      length = buf.length;
    }
    cursor = newCursor;
    return oldCursor;
  }

  @Override
  public void writeUint16(int value) {
    final int c = grow(2);
    buf[c] = (byte) (value >>> 8);
    buf[c + 1] = (byte) value;
  }

  @Override
  public void writeUint32(int value) {
    final int c = grow(4);
    buf[c] = (byte) (value >>> 24);
    buf[c + 1] = (byte) (value >>> 16);
    buf[c + 2] = (byte) (value >>> 8);
    buf[c + 3] = (byte) value;
  }

  @Override
  public void writeUint64(long value) {
    final int c = grow(8);
    buf[c] = (byte) (value >>> 56);
    buf[c + 1] = (byte) (value >>> 48);
    buf[c + 2] = (byte) (value >>> 40);
    buf[c + 3] = (byte) (value >>> 32);
    buf[c + 4] = (byte) (value >>> 24);
    buf[c + 5] = (byte) (value >>> 16);
    buf[c + 6] = (byte) (value >>> 8);
    buf[c + 7] = (byte) value;
  }

  @Override
  public void writeBytes(byte[] bytes) {
    writeBytes(bytes, 0, bytes.length);
  }

  @Override
  public void writeBytes(byte[] bytes, int offset, int len) {
    Objects.checkFromIndexSize(offset, len, bytes.length);
    final int c = grow(len);
    System.arraycopy(bytes, offset, buf, c, len);
  }

  @Override
  public void writeString(String value) {
    writeBytes(value.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public void writeByte(int b) {
    final int c = grow(1);
    buf[c] = (byte) b;
  }

  @Override
  public void write2(int b1, int b2) {
    final int c = grow(2);
    buf[c] = (byte) b1;
    buf[c + 1] = (byte) b2;
  }

  @Override
  public void write3(int b1, int b2, int b3) {
    final int c = grow(3);
    buf[c] = (byte) b1;
    buf[c + 1] = (byte) b2;
    buf[c + 2] = (byte) b3;
  }

  @Override
  public void write4(int b1, int b2, int b3, int b4) {
    final int c = grow(4);
    buf[c] = (byte) b1;
    buf[c + 1] = (byte) b2;
    buf[c + 2] = (byte) b3;
    buf[c + 3] = (byte) b4;
  }

  @Override
  public void flush() {
    out.store(buf, cursor);
  }
}
