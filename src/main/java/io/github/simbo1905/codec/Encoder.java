// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import java.util.logging.Logger;

import static io.github.simbo1905.codec.EncodeException.Reason.SINK_FAILURE;
import static io.github.simbo1905.codec.EncodeException.Reason.UNEXPECTED_FAILURE;
import static io.github.simbo1905.codec.EncodeException.Reason.UNSUPPORTED_SHAPE;

/// Encodes values to an output stream or a [ByteSlot] using the wire format of a [Handle].
///
/// Records encode as maps from field name to value. Every component is written unless it is marked
/// `@CodecField(skip = true)`, or it is empty and marked omit-empty. The empty values are false, 0, null,
/// an empty optional, and any array, collection, map or string of length zero. Record field names and
/// the String keys of maps are written as symbols, which formats that support them may intern.
///
/// An encoder binds one sink to one wire format instance. It may be used for any number of sequential
/// [#encode(Object)] calls, each appending to the output, but never from two threads at once.
public final class Encoder {

  public static final Logger LOGGER = Logger.getLogger(Encoder.class.getName());

  private final ByteSink sink;
  private final ValueEncoder engine;

  private Encoder(ByteSink sink, Handle handle) {
    this.sink = sink;
    this.engine = new ValueEncoder(sink, handle);
  }

  /// Encode to a stream. Streams other than [java.io.BufferedOutputStream] and
  /// [java.io.ByteArrayOutputStream] are wrapped in a small buffer that is flushed after every encode.
  public static Encoder forStream(OutputStream out, Handle handle) {
    Objects.requireNonNull(out, "out must not be null");
    Objects.requireNonNull(handle, "handle must not be null");
    LOGGER.finer(() -> "Encoder for stream " + out.getClass().getName()
        + (StreamByteSink.hasCheapSmallWrites(out) ? "" : " (buffered)"));
    return new Encoder(new StreamByteSink(out), handle);
  }

  /// Encode into a byte array owned by `out`. After each encode the slot holds the output prefix.
  public static Encoder forBytes(ByteSlot out, Handle handle) {
    Objects.requireNonNull(out, "out must not be null");
    Objects.requireNonNull(handle, "handle must not be null");
    LOGGER.finer(() -> "Encoder for bytes, reusing " + (out.array() == null ? 0 : out.array().length) + " bytes");
    return new Encoder(new BufferByteSink(out), handle);
  }

  /// Encode one value and flush the output.
  /// @throws EncodeException on the first failure; the output is then left partially written
  public void encode(Object value) throws EncodeException {
    try {
      engine.encode(value);
      sink.flush();
    } catch (EncodeException e) {
      throw logged(e);
    } catch (IOException e) {
      throw logged(new EncodeException(SINK_FAILURE, "Write failed: " + e.getMessage(), e));
    } catch (RuntimeException e) {
      throw logged(new EncodeException(UNEXPECTED_FAILURE, "Encode failed: " + e, e));
    } catch (StackOverflowError e) {
      throw logged(new EncodeException(UNSUPPORTED_SHAPE, "Value nests too deeply for the thread stack", e));
    }
  }

  private static EncodeException logged(EncodeException e) {
    LOGGER.fine(() -> "Encode aborted with " + e.reason() + ": " + e.getMessage());
    return e;
  }
}
