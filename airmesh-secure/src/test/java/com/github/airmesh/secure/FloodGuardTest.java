// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

import com.github.airmesh.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FloodGuardTest {
  final MutableClock clock = MutableClock.startingNow();
  final FloodGuard guard = new FloodGuard(2, Duration.ofSeconds(1), Duration.ZERO, clock);
  final FloodGuard banning = new FloodGuard(2, Duration.ofSeconds(1), Duration.ofMinutes(5), clock);

  void flood(FloodGuard floodGuard, String peerId) {
    for (int i = 0; i < 3; i++) {
      floodGuard.tryAcquire(peerId);
    }
  }

  @Test
  void limitsEachPeerSeparately() {
    assertTrue(guard.tryAcquire("bob"));
    assertTrue(guard.tryAcquire("bob"));
    assertFalse(guard.tryAcquire("bob"));
    assertTrue(guard.tryAcquire("carol"));
  }

  @Test
  void windowRollsOverWhenBanningIsDisabled() {
    guard.tryAcquire("bob");
    guard.tryAcquire("bob");
    clock.advance(Duration.ofMillis(999));
    assertFalse(guard.tryAcquire("bob"));

    clock.advance(Duration.ofMillis(1));
    assertTrue(guard.tryAcquire("bob"));
    assertFalse(guard.isBanned("bob"));
  }

  @Test
  void exceedingTheLimitBansThePeer() {
    flood(banning, "bob");

    assertTrue(banning.isBanned("bob"));
    clock.advance(Duration.ofMinutes(5).minusMillis(1));
    assertFalse(banning.tryAcquire("bob"));
    assertTrue(banning.tryAcquire("carol"));

    clock.advance(Duration.ofMillis(1));
    assertFalse(banning.isBanned("bob"));
    assertTrue(banning.tryAcquire("bob"));
  }

  @Test
  void repeatOffencesDoubleTheBan() {
    flood(banning, "bob");
    clock.advance(Duration.ofMinutes(5));
    flood(banning, "bob");

    clock.advance(Duration.ofMinutes(10).minusMillis(1));
    assertTrue(banning.isBanned("bob"));
    clock.advance(Duration.ofMillis(1));
    assertFalse(banning.isBanned("bob"));
  }

  @Test
  void escalationIsCapped() {
    for (int i = 0; i <= FloodGuard.MAX_ESCALATION + 2; i++) {
      flood(banning, "bob");
      clock.advance(Duration.ofMinutes(5L << FloodGuard.MAX_ESCALATION));
    }
    flood(banning, "bob");

    clock.advance(Duration.ofMinutes(5L << FloodGuard.MAX_ESCALATION));
    assertFalse(banning.isBanned("bob"));
  }

  @Test
  void disconnectKeepsTheBan() {
    flood(banning, "bob");
    banning.forget("bob");

    assertFalse(banning.tryAcquire("bob"));
  }

  @Test
  void forgottenPeerStartsANewWindow() {
    guard.tryAcquire("bob");
    guard.tryAcquire("bob");
    guard.forget("bob");

    assertTrue(guard.tryAcquire("bob"));
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class,
        () -> new FloodGuard(0, Duration.ofSeconds(1), Duration.ZERO, clock));
    assertThrows(IllegalArgumentException.class,
        () -> new FloodGuard(1, Duration.ofSeconds(1), Duration.ofSeconds(-1), clock));
  }
}
