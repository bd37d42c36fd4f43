// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ExtensionRegistryTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static final List<Class<?>> TYPES = List.of(
      UUID.class, URI.class, BigDecimal.class, BigInteger.class, Duration.class, StringBuilder.class);

  static byte[] none(Object value) {
    return new byte[0];
  }

  static ExtensionRegistry registryOf(int count) {
    final var registry = new ExtensionRegistry();
    IntStream.range(0, count).forEach(i -> registry.register(TYPES.get(i), (byte) (i + 1), ExtensionRegistryTest::none));
    return registry;
  }

  @Test
  void emptyRegistryFindsNothing() {
    final var registry = new ExtensionRegistry();
    assertThat(registry.lookup(UUID.class)).isEmpty();
    assertThat(registry.size()).isZero();
  }

  @Test
  void removingOneKeepsTheOthersBelowThreshold() {
    assertRemovalKeepsOthers(ExtensionRegistry.MAP_ACCESS_THRESHOLD - 1);
  }

  @Test
  void removingOneKeepsTheOthersAboveThreshold() {
    assertRemovalKeepsOthers(TYPES.size());
  }

  private static void assertRemovalKeepsOthers(int count) {
    final var registry = registryOf(count);
    final Class<?> removed = TYPES.get(1);
    registry.register(removed, (byte) 99, null);

    assertThat(registry.size()).isEqualTo(count - 1);
    assertThat(registry.lookup(removed)).isEmpty();
    for (int i = 0; i < count; i++) {
      if (i == 1) {
        continue;
      }
      final var entry = registry.lookup(TYPES.get(i));
      assertThat(entry).isPresent();
      assertThat(entry.get().tag()).isEqualTo((byte) (i + 1));
      assertThat(entry.get().type()).isSameAs(TYPES.get(i));
    }
  }

  @Test
  void bothViewsAgreeAfterEveryMutation() {
    final var registry = new ExtensionRegistry();
    for (int i = 0; i < TYPES.size(); i++) {
      registry.register(TYPES.get(i), (byte) i, ExtensionRegistryTest::none);
      assertViewsAgree(registry);
    }
    registry.register(TYPES.get(0), (byte) 42, ExtensionRegistryTest::none);
    assertViewsAgree(registry);
    registry.register(TYPES.get(3), (byte) 0, null);
    assertViewsAgree(registry);
  }

  private static void assertViewsAgree(ExtensionRegistry registry) {
    assertThat(registry.hashedView()).hasSize(registry.size());
    registry.hashedView().forEach((type, entry) -> assertThat(registry.find(type)).isSameAs(entry));
  }

  @Test
  void reRegisteringReplacesTagAndFunction() {
    final ExtensionFunction<UUID> first = uuid -> new byte[]{1};
    final ExtensionFunction<UUID> second = uuid -> new byte[]{2};
    final var registry = new ExtensionRegistry()
        .register(UUID.class, (byte) 1, first)
        .register(UUID.class, (byte) 2, second);

    assertThat(registry.size()).isEqualTo(1);
    final var entry = registry.lookup(UUID.class).orElseThrow();
    assertThat(entry.tag()).isEqualTo((byte) 2);
    assertThat(entry.function()).isSameAs(second);
  }

  @Test
  void removingUnknownTypeIsHarmless() {
    final var registry = registryOf(2);
    registry.register(Duration.class, (byte) 0, null);
    assertThat(registry.size()).isEqualTo(2);
  }

  @Test
  void lookupIsByExactClass() {
    final var registry = new ExtensionRegistry().register(Number.class, (byte) 1, ExtensionRegistryTest::none);
    assertThat(registry.lookup(Integer.class)).isEmpty();
    assertThat(registry.lookup(Number.class)).isPresent();
  }

  @Test
  void linearViewGrowsByHalfAgainWhenFull() {
    final var many = new ExtensionRegistry();
    final List<Class<?>> types = List.of(
        UUID.class, URI.class, BigDecimal.class, BigInteger.class, Duration.class, StringBuilder.class,
        Instant.class, ZonedDateTime.class, OffsetDateTime.class);
    types.forEach(type -> many.register(type, (byte) 1, ExtensionRegistryTest::none));
    assertThat(many.size()).isEqualTo(9);
    assertThat(many.capacity()).isEqualTo(9 * 3 / 2);
  }

  @Test
  void frozenRegistryRejectsRegistration() {
    final var registry = registryOf(2).freeze();
    assertThat(registry.isFrozen()).isTrue();
    assertThatThrownBy(() -> registry.register(Duration.class, (byte) 3, ExtensionRegistryTest::none))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("frozen");
    assertThatThrownBy(() -> registry.register(UUID.class, (byte) 1, null))
        .isInstanceOf(IllegalStateException.class);
    assertThat(registry.lookup(UUID.class)).isPresent();
  }
}
