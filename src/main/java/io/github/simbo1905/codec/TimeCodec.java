// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Objects;

/// Compact variable-length binary form of an instant plus its zone offset, for use as an extension payload.
///
/// Layout, all big-endian, each part only present when needed:
/// - epoch seconds: 4 bytes when strictly inside the `int` range, otherwise 8 bytes (long form)
/// - nano-of-second: 4 bytes, omitted when zero
/// - zone offset in minutes: 2 bytes, sign in bit 15 and magnitude below it, omitted for UTC
/// - a single zero pad byte when the long form was used and the nanos were omitted
///
/// A decoder infers which parts are present from the total length, which is between 4 and 14 bytes.
public final class TimeCodec {

  static final int MAX_LENGTH = 14;
  static final int SIGN_BIT = 1 << 15;

  private TimeCodec() {
  }

  /// Encode an instant as UTC
  public static byte[] encode(Instant instant) {
    return encode(instant, ZoneOffset.UTC);
  }

  public static byte[] encode(ZonedDateTime dateTime) {
    Objects.requireNonNull(dateTime, "dateTime must not be null");
    return encode(dateTime.toInstant(), dateTime.getZone());
  }

  public static byte[] encode(OffsetDateTime dateTime) {
    Objects.requireNonNull(dateTime, "dateTime must not be null");
    return encode(dateTime.toInstant(), dateTime.getOffset());
  }

  /// Encode an instant together with the offset the zone had at that instant.
  /// Any zone whose normalized form is [ZoneOffset#UTC] (such as `Z`, `UTC` or `Etc/UTC`) writes no offset.
  public static byte[] encode(Instant instant, ZoneId zone) {
    Objects.requireNonNull(instant, "instant must not be null");
    Objects.requireNonNull(zone, "zone must not be null");
    final long seconds = instant.getEpochSecond();
    final int nanos = instant.getNano();
    final var buffer = ByteBuffer.allocate(MAX_LENGTH);

    boolean padZero = false;
    if (seconds > Integer.MIN_VALUE && seconds < Integer.MAX_VALUE) {
      buffer.putInt((int) seconds);
    } else {
      buffer.putLong(seconds);
      padZero = nanos == 0;
    }
    if (nanos != 0) {
      buffer.putInt(nanos);
    }
    if (!isUtc(zone)) {
      buffer.putShort(offsetField(zone.getRules().getOffset(instant)));
    }
    if (padZero) {
      buffer.put((byte) 0);
    }
    return Arrays.copyOf(buffer.array(), buffer.position());
  }

  static boolean isUtc(ZoneId zone) {
    return ZoneOffset.UTC.equals(zone.normalized());
  }

  /// Sign-magnitude minutes: the Java `short` carries the 16 bits unchanged
  static short offsetField(ZoneOffset offset) {
    int minutes = offset.getTotalSeconds() / 60;
    final boolean negative = minutes < 0;
    if (negative) {
      minutes = -minutes;
    }
    int field = minutes;
    if (negative) {
      field |= SIGN_BIT;
    }
    return (short) field;
  }

  /// Register this codec for [Instant], [ZonedDateTime] and [OffsetDateTime] under one tag
  public static ExtensionRegistry register(ExtensionRegistry registry, byte tag) {
    Objects.requireNonNull(registry, "registry must not be null");
    return registry
        .register(Instant.class, tag, TimeCodec::encode)
        .register(ZonedDateTime.class, tag, TimeCodec::encode)
        .register(OffsetDateTime.class, tag, TimeCodec::encode);
  }
}
