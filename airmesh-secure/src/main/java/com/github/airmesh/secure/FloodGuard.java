// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.github.airmesh.MeshLogger.LOGGER;

/// Caps the number of inbound frames accepted from one peer within a fixed window. Frames over the limit are
/// dropped before they are decoded.
///
/// The first frame over the limit also bans the peer: nothing from it is accepted until the ban expires. Each
/// further offence doubles the ban, up to [#MAX_ESCALATION] doublings. The offence count outlives disconnects so a
/// reconnect does not reset it. A zero ban duration only drops the excess frames.
public class FloodGuard {
  static final int MAX_ESCALATION = 4;

  private static final class Window {
    long startMillis;
    int count;
    long bannedUntilMillis;
    int offences;
  }

  private final int limit;
  private final long windowMillis;
  private final long banMillis;
  private final Clock clock;
  private final Map<String, Window> windows = new ConcurrentHashMap<>();

  public FloodGuard(int limit, Duration window, Duration ban, Clock clock) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive");
    }
    if (ban.isNegative()) {
      throw new IllegalArgumentException("ban cannot be negative");
    }
    this.limit = limit;
    this.windowMillis = window.toMillis();
    this.banMillis = ban.toMillis();
    this.clock = clock;
  }

  /// @return true if a frame from `peerId` may be processed now
  public boolean tryAcquire(String peerId) {
    final long now = clock.millis();
    final var window = windows.computeIfAbsent(peerId, k -> new Window());
    final int count;
    final long banned;
    synchronized (window) {
      if (now < window.bannedUntilMillis) {
        return false;
      }
      if (window.count == 0 || now - window.startMillis >= windowMillis) {
        window.startMillis = now;
        window.count = 0;
      }
      count = ++window.count;
      if (count == limit + 1 && banMillis > 0) {
        window.offences++;
        banned = banMillis << Math.min(window.offences - 1, MAX_ESCALATION);
        window.bannedUntilMillis = now + banned;
        window.count = 0;
      } else {
        banned = 0;
      }
    }
    if (banned > 0) {
      LOGGER.warning(() -> "Flood limit of " + limit + " frames exceeded by " + peerId + ", banned for "
          + Duration.ofMillis(banned));
    } else if (count == limit + 1) {
      LOGGER.warning(() -> "Flood limit of " + limit + " frames reached for " + peerId + ", dropping");
    }
    return count <= limit;
  }

  public boolean isBanned(String peerId) {
    final var window = windows.get(peerId);
    if (window == null) {
      return false;
    }
    synchronized (window) {
      return clock.millis() < window.bannedUntilMillis;
    }
  }

  /// Forgets the rate window of a peer that went away. Bans and the offence count are kept.
  public void forget(String peerId) {
    final var window = windows.get(peerId);
    if (window != null) {
      synchronized (window) {
        window.count = 0;
      }
    }
  }
}
