// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import java.io.IOException;

/// The capability set a wire format implements. The engine calls these for leaves and for
/// container preambles; the format writes bytes through the [ByteSink] it was created with.
/// Preambles only announce a count, they never reserve space.
public interface PrimitiveEncoder {

  /// Hook for a format to fully handle a type it has an optimised representation for.
  /// @param type the runtime class of the value
  /// @param value the non-null value
  /// @return true if the value was written and the engine must not encode it again
  default boolean encodeBuiltin(Class<?> type, Object value) throws IOException {
    return false;
  }

  void encodeNil() throws IOException;

  void encodeInt(long value) throws IOException;

  /// @param value the 64 bits to write, interpreted as unsigned
  void encodeUint(long value) throws IOException;

  void encodeBool(boolean value) throws IOException;

  void encodeFloat32(float value) throws IOException;

  void encodeFloat64(double value) throws IOException;

  /// Announce an extension payload of `length` raw bytes that the engine writes directly to the sink
  void encodeExtPreamble(byte tag, int length) throws IOException;

  void encodeArrayPreamble(int length) throws IOException;

  void encodeMapPreamble(int length) throws IOException;

  void encodeString(CharEncoding encoding, String value) throws IOException;

  /// Write a string the format may intern; formats without symbols write a plain string
  void encodeSymbol(String value) throws IOException;

  void encodeStringBytes(CharEncoding encoding, byte[] value) throws IOException;
}
