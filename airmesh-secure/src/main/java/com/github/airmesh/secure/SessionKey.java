// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

import org.jetbrains.annotations.TestOnly;

import java.time.Instant;
import java.util.Arrays;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/// The symmetric state shared with one peer. Both directions share a single message counter; the chain key pair for
/// counter `n` is derived from the pair for `n - 1` by [Crypto#ratchet]. Keys for counters inside the backtrack
/// window that were skipped or used for sending are retained so that reordered frames still decrypt, and the
/// counters already accepted are remembered so that a replay is rejected.
///
/// Instances are mutated only by [SessionCipher] while holding the instance monitor.
public final class SessionKey {

  /// Which side of the handshake installed this session. The local role is bound into every sealed frame as
  /// associated data so that a frame reflected back to its sender does not authenticate.
  public enum Role {
    INITIATOR,
    RESPONDER;

    byte[] associatedData() {
      return new byte[]{(byte) ordinal()};
    }

    Role peer() {
      return this == INITIATOR ? RESPONDER : INITIATOR;
    }
  }

  record ChainKeys(byte[] encryptionKey, byte[] hmacKey) {
    ChainKeys {
      Objects.requireNonNull(encryptionKey);
      Objects.requireNonNull(hmacKey);
    }

    void destroy() {
      Arrays.fill(encryptionKey, (byte) 0);
      Arrays.fill(hmacKey, (byte) 0);
    }
  }

  private final String peerId;
  private final Optional<String> deviceId;
  private final Role localRole;
  private final Instant createdAt;

  ChainKeys current;
  long messageNumber;
  boolean destroyed;
  final NavigableMap<Long, ChainKeys> retained = new TreeMap<>();
  final NavigableSet<Long> accepted = new TreeSet<>();

  SessionKey(String peerId, Optional<String> deviceId, Role localRole, Instant createdAt, ChainKeys initial) {
    this.peerId = Objects.requireNonNull(peerId);
    this.deviceId = Objects.requireNonNull(deviceId);
    this.localRole = Objects.requireNonNull(localRole);
    this.createdAt = Objects.requireNonNull(createdAt);
    this.current = Objects.requireNonNull(initial);
  }

  public String peerId() {
    return peerId;
  }

  public Optional<String> deviceId() {
    return deviceId;
  }

  public Role localRole() {
    return localRole;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public synchronized long messageNumber() {
    return messageNumber;
  }

  public synchronized boolean isDestroyed() {
    return destroyed;
  }

  /// Drops retained keys and accepted counters that have fallen behind the backtrack window.
  void prune(int backtrackWindow) {
    final long floor = messageNumber - backtrackWindow;
    final var expired = retained.headMap(floor, false);
    expired.values().forEach(ChainKeys::destroy);
    expired.clear();
    accepted.headSet(floor, false).clear();
  }

  synchronized void destroy() {
    if (destroyed) {
      return;
    }
    destroyed = true;
    current.destroy();
    retained.values().forEach(ChainKeys::destroy);
    retained.clear();
    accepted.clear();
  }

  @TestOnly
  synchronized byte[] currentEncryptionKey() {
    return current.encryptionKey().clone();
  }

  @TestOnly
  synchronized byte[] currentHmacKey() {
    return current.hmacKey().clone();
  }

  @TestOnly
  synchronized int retainedKeyCount() {
    return retained.size();
  }

  @Override
  public String toString() {
    return "SessionKey[peerId=" + peerId + ", deviceId=" + deviceId.orElse("-") + ", role=" + localRole
        + ", createdAt=" + createdAt + ']';
  }
}
