// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Function;

import static io.github.simbo1905.codec.Encoder.LOGGER;

/// Shared encoding configuration: the extension registry, how extensions are written, and the wire format.
/// A handle is immutable once built and may be shared by any number of concurrently running encoders.
public final class Handle {

  static final int DEFAULT_MAX_DEPTH = 1024;

  private final ExtensionRegistry extensions;
  private final ExtensionMode extensionMode;
  private final Function<ByteSink, ? extends PrimitiveEncoder> primitiveEncoders;
  private final int maxDepth;

  private Handle(Builder builder) {
    this.extensions = builder.extensions.freeze();
    this.extensionMode = builder.extensionMode;
    this.primitiveEncoders = builder.primitiveEncoders;
    this.maxDepth = builder.maxDepth;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ExtensionRegistry extensions() {
    return extensions;
  }

  public ExtensionMode extensionMode() {
    return extensionMode;
  }

  public int maxDepth() {
    return maxDepth;
  }

  /// Create the wire format for one sink
  @NotNull PrimitiveEncoder newPrimitiveEncoder(@NotNull ByteSink sink) {
    return Objects.requireNonNull(primitiveEncoders.apply(sink), "primitive encoder factory returned null");
  }

  public static final class Builder {
    private ExtensionRegistry extensions = new ExtensionRegistry();
    private ExtensionMode extensionMode = ExtensionMode.current();
    private Function<ByteSink, ? extends PrimitiveEncoder> primitiveEncoders;
    private int maxDepth = DEFAULT_MAX_DEPTH;

    private Builder() {
    }

    /// The registry to consult; it is frozen by [#build()]
    public Builder extensions(ExtensionRegistry extensions) {
      this.extensions = Objects.requireNonNull(extensions, "extensions must not be null");
      return this;
    }

    public Builder extensionMode(ExtensionMode extensionMode) {
      this.extensionMode = Objects.requireNonNull(extensionMode, "extensionMode must not be null");
      return this;
    }

    /// Factory for the wire format, called once per encoder with that encoder's sink
    public Builder primitiveEncoder(Function<ByteSink, ? extends PrimitiveEncoder> factory) {
      this.primitiveEncoders = Objects.requireNonNull(factory, "factory must not be null");
      return this;
    }

    /// Deepest container nesting accepted before the value is rejected as unsupported
    public Builder maxDepth(int maxDepth) {
      if (maxDepth <= 0) {
        throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
      }
      this.maxDepth = maxDepth;
      return this;
    }

    public Handle build() {
      if (primitiveEncoders == null) {
        throw new IllegalStateException("A primitive encoder factory is required");
      }
      final var handle = new Handle(this);
      LOGGER.fine(() -> "Built handle with " + handle.extensions.size() + " extensions, mode " + handle.extensionMode
          + ", maxDepth " + handle.maxDepth);
      return handle;
    }
  }
}
