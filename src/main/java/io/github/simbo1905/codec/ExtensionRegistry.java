// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static io.github.simbo1905.codec.Encoder.LOGGER;

/// Type to (tag, function) table consulted before kind based encoding.
///
/// Two views are kept in step: a compact array scanned by identity for small tables and a hash map for
/// larger ones. Every mutation updates the array and then rebuilds the map from it.
///
/// The registry is configured and then frozen. [Handle.Builder#build()] freezes the registry it is given,
/// after which [#register] throws, so a registry shared by concurrent encoders cannot change underneath them.
public final class ExtensionRegistry {

  /// Below this many entries lookups scan the array, at or above it they use the map
  static final int MAP_ACCESS_THRESHOLD = 4;

  private static final int INITIAL_CAPACITY = 8;

  private ExtensionEntry[] entries = new ExtensionEntry[0];
  private int size;
  private Map<Class<?>, ExtensionEntry> byType = Map.of();
  private volatile boolean frozen;

  /// Register, replace or remove the extension for `type`.
  /// @param type the exact runtime class to match
  /// @param tag the extension tag written in the extension preamble
  /// @param function the encoder, or null to remove any existing entry for `type`
  /// @throws IllegalStateException if the registry is frozen
  public <T> ExtensionRegistry register(Class<T> type, byte tag, ExtensionFunction<? super T> function) {
    Objects.requireNonNull(type, "type must not be null");
    if (frozen) {
      throw new IllegalStateException("Extension registry is frozen; cannot register " + type.getName());
    }
    removeFromArray(type);
    if (function != null) {
      ensureCapacity(size + 1);
      entries[size++] = new ExtensionEntry(type, tag, function);
    }
    rebuildMap();
    LOGGER.fine(() -> (function == null ? "Removed extension for " : "Registered extension tag " + tag + " for ")
        + type.getName() + ", registry size " + size);
    return this;
  }

  /// Find the extension for an exact runtime class
  public Optional<ExtensionEntry> lookup(Class<?> type) {
    return Optional.ofNullable(find(type));
  }

  ExtensionEntry find(Class<?> type) {
    final int n = size;
    if (n == 0) {
      return null;
    }
    if (n < MAP_ACCESS_THRESHOLD) {
      for (int i = 0; i < n; i++) {
        if (entries[i].type() == type) {
          return entries[i];
        }
      }
      return null;
    }
    return byType.get(type);
  }

  public int size() {
    return size;
  }

  public boolean isFrozen() {
    return frozen;
  }

  /// Disallow further registration. Idempotent.
  public ExtensionRegistry freeze() {
    if (!frozen) {
      frozen = true;
      LOGGER.fine(() -> "Froze extension registry with " + size + " entries");
    }
    return this;
  }

  int capacity() {
    return entries.length;
  }

  Map<Class<?>, ExtensionEntry> hashedView() {
    return byType;
  }

  private void removeFromArray(Class<?> type) {
    for (int i = 0; i < size; i++) {
      if (entries[i].type() == type) {
        System.arraycopy(entries, i + 1, entries, i, size - i - 1);
        entries[--size] = null;
        return;
      }
    }
  }

  private void ensureCapacity(int needed) {
    if (needed <= entries.length) {
      return;
    }
    final int grown = entries.length == 0 ? INITIAL_CAPACITY : needed * 3 / 2;
    entries = Arrays.copyOf(entries, Math.max(grown, needed));
  }

  private void rebuildMap() {
    final var map = new HashMap<Class<?>, ExtensionEntry>(Math.max(INITIAL_CAPACITY, size * 3 / 2));
    for (int i = 0; i < size; i++) {
      map.put(entries[i].type(), entries[i]);
    }
    byType = map;
  }
}
