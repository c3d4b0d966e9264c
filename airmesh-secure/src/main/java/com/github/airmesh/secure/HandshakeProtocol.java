// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

import com.github.airmesh.MeshConfig;
import com.github.airmesh.PeerIdentity;
import com.github.airmesh.TimeoutScheduler;
import com.github.airmesh.network.Backoff;
import com.github.airmesh.network.ConnectionManager;
import com.github.airmesh.network.MeshEvent;
import com.github.airmesh.network.MeshEvents;
import com.github.airmesh.network.SendResult;
import com.github.airmesh.network.SessionMaintenance;
import com.github.airmesh.wire.KeyExchangeStatus;
import com.github.airmesh.wire.WireCodec;
import com.github.airmesh.wire.WireMessage;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;

import static com.github.airmesh.MeshLogger.LOGGER;

/// ## Handshake Protocol
///
/// Establishes a [SessionKey] with a connected peer using X25519 and HKDF-SHA256.
///
/// Each node has a long lived identity key. The initiator generates an ephemeral key per attempt and sends its
/// public half in a key exchange request. A responder without a session computes
/// `DH(identity, initiator ephemeral)`, installs the session and answers [KeyExchangeStatus#SUCCESS] with its
/// identity public key. The initiator computes `DH(ephemeral, responder identity)` and installs the same keys. The
/// 64 bytes of HKDF output are split into the initial encryption key and the initial HMAC key; the HKDF info binds
/// both sender ids in sorted order.
///
/// A responder that already holds a session answers [KeyExchangeStatus#ALREADY_ESTABLISHED] and keeps it. A request
/// whose public key cannot be used is answered with [KeyExchangeStatus#ERROR].
///
/// When both sides initiate at once the side whose sender id sorts first keeps the initiator role and ignores the
/// peer's request; the other side answers it and its own pending attempt completes when the key is installed.
///
/// An attempt that gets no answer within `handshakeResponseTimeout` is retried after an exponential backoff with the
/// same ephemeral key. After `handshakeMaxAttempts` the peer is marked [HandshakeState.Failed] and a
/// [MeshEvent.HandshakeFailed] is published.
public class HandshakeProtocol implements SessionMaintenance {
  static final byte[] SALT = "airmesh-session-v1".getBytes(StandardCharsets.UTF_8);
  static final int DERIVED_LENGTH = 2 * Crypto.KEY_LENGTH;

  /// One in-flight initiation. Mutable fields are guarded by `lock`.
  private static final class Attempt {
    final String peerId;
    final X25519Key ephemeral;
    final CompletableFuture<HandshakeState> result = new CompletableFuture<>();
    int retryCount;
    TimeoutScheduler.Timeout timeout;

    Attempt(String peerId, X25519Key ephemeral) {
      this.peerId = peerId;
      this.ephemeral = ephemeral;
    }

    void cancelTimeout() {
      if (timeout != null) {
        timeout.cancel();
        timeout = null;
      }
    }
  }

  private final PeerIdentity self;
  private final X25519Key identity;
  private final SessionCipher cipher;
  private final ConnectionManager connections;
  private final MeshConfig config;
  private final TimeoutScheduler scheduler;
  private final MeshEvents events;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, Attempt> attempts = new HashMap<>();
  /// Ephemeral keys kept across attempts until a session is installed, so a late answer to an earlier attempt
  /// derives the same keys on both sides. Guarded by `lock`.
  private final Map<String, X25519Key> ephemerals = new HashMap<>();
  private final Map<String, HandshakeState> states = new ConcurrentHashMap<>();

  public HandshakeProtocol(PeerIdentity self, X25519Key identity, SessionCipher cipher,
                           ConnectionManager connections, MeshConfig config, TimeoutScheduler scheduler,
                           MeshEvents events, Clock clock) {
    this.self = Objects.requireNonNull(self, "self cannot be null");
    this.identity = Objects.requireNonNull(identity, "identity cannot be null");
    this.cipher = Objects.requireNonNull(cipher, "cipher cannot be null");
    this.connections = Objects.requireNonNull(connections, "connections cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    this.events = Objects.requireNonNull(events, "events cannot be null");
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
  }

  /// Starts a handshake with `peerId` unless a session exists or an attempt is already running, in which case the
  /// existing outcome is returned.
  ///
  /// @return completes with [HandshakeState.Established] or [HandshakeState.Failed]
  public CompletableFuture<HandshakeState> initiate(String peerId) {
    Objects.requireNonNull(peerId, "peerId cannot be null");
    if (cipher.hasSession(peerId)) {
      states.put(peerId, HandshakeState.ESTABLISHED);
      return CompletableFuture.completedFuture(HandshakeState.ESTABLISHED);
    }
    final Attempt attempt;
    lock.lock();
    try {
      final var existing = attempts.get(peerId);
      if (existing != null) {
        LOGGER.finest(() -> self.senderId() + " joining running handshake with " + peerId);
        return existing.result;
      }
      attempt = new Attempt(peerId, ephemerals.computeIfAbsent(peerId, k -> X25519Key.generate()));
      attempts.put(peerId, attempt);
    } finally {
      lock.unlock();
    }
    LOGGER.fine(() -> self.senderId() + " initiating handshake with " + peerId);
    cipher.whenInstalled(peerId).thenRun(() -> onInstalled(peerId));
    sendRequest(attempt, 0);
    return attempt.result;
  }

  /// Handles an inbound key exchange request.
  public void onKeyExchange(String peerId, WireMessage.KeyExchange request) {
    if (!isFresh(request.timestamp())) {
      LOGGER.warning(() -> self.senderId() + " ignoring stale key exchange from " + peerId
          + " timestamp=" + request.timestamp());
      return;
    }
    if (request.senderId().equals(self.senderId())) {
      LOGGER.warning(() -> self.senderId() + " ignoring key exchange carrying our own sender id from " + peerId);
      return;
    }
    if (cipher.hasSession(peerId)) {
      LOGGER.fine(() -> self.senderId() + " already has a session with " + peerId);
      reply(peerId, KeyExchangeStatus.ALREADY_ESTABLISHED, identity.publicKey(), Optional.empty());
      return;
    }
    final boolean initiating;
    lock.lock();
    try {
      initiating = attempts.containsKey(peerId);
    } finally {
      lock.unlock();
    }
    if (initiating && self.senderId().compareTo(request.senderId()) < 0) {
      LOGGER.fine(() -> self.senderId() + " keeps the initiator role over " + peerId);
      return;
    }
    final byte[] sharedSecret;
    try {
      sharedSecret = identity.agree(request.publicKey());
    } catch (GeneralSecurityException e) {
      LOGGER.log(Level.WARNING, self.senderId() + " rejecting key exchange from " + peerId, e);
      reply(peerId, KeyExchangeStatus.ERROR, new byte[0], Optional.of("invalid public key"));
      return;
    }
    // the answer goes out before installing so that it precedes any buffered frames flushed by the install
    reply(peerId, KeyExchangeStatus.SUCCESS, identity.publicKey(), Optional.empty());
    install(peerId, request.senderId(), SessionKey.Role.RESPONDER, sharedSecret);
  }

  /// Handles an inbound key exchange response.
  public void onKeyExchangeResponse(String peerId, WireMessage.KeyExchangeResponse response) {
    switch (response.status()) {
      case ALREADY_ESTABLISHED ->
          LOGGER.fine(() -> self.senderId() + " peer " + peerId + " reports an established session");
      case ERROR -> {
        final var error = response.error().orElse("unspecified");
        LOGGER.warning(() -> self.senderId() + " peer " + peerId + " rejected key exchange: " + error);
        events.publish(new MeshEvent.PeerReportedError(peerId, error));
      }
      case SUCCESS -> onSuccess(peerId, response);
    }
  }

  private void onSuccess(String peerId, WireMessage.KeyExchangeResponse response) {
    if (cipher.hasSession(peerId)) {
      LOGGER.finest(() -> self.senderId() + " ignoring success from " + peerId + " with a session in place");
      return;
    }
    final Attempt attempt;
    lock.lock();
    try {
      attempt = attempts.get(peerId);
    } finally {
      lock.unlock();
    }
    if (attempt == null) {
      LOGGER.warning(() -> self.senderId() + " ignoring unsolicited key exchange response from " + peerId);
      return;
    }
    final byte[] sharedSecret;
    try {
      sharedSecret = attempt.ephemeral.agree(response.publicKey());
    } catch (GeneralSecurityException e) {
      // the attempt stays open and is retried on timeout
      LOGGER.log(Level.WARNING, self.senderId() + " cannot use public key from " + peerId, e);
      return;
    }
    install(peerId, response.senderId(), SessionKey.Role.INITIATOR, sharedSecret);
  }

  /// Abandons any running attempt and forgets the state for `peerId`.
  public void reset(String peerId) {
    final Attempt attempt;
    lock.lock();
    try {
      attempt = attempts.remove(peerId);
      ephemerals.remove(peerId);
      if (attempt != null) {
        attempt.cancelTimeout();
      }
    } finally {
      lock.unlock();
    }
    states.remove(peerId);
    if (attempt != null) {
      LOGGER.fine(() -> self.senderId() + " abandoned handshake with " + peerId);
      attempt.result.complete(new HandshakeState.Failed("reset"));
    }
  }

  public HandshakeState stateOf(String peerId) {
    return states.getOrDefault(peerId, HandshakeState.NO_SESSION);
  }

  public boolean isInFlight(String peerId) {
    lock.lock();
    try {
      return attempts.containsKey(peerId);
    } finally {
      lock.unlock();
    }
  }

  /// Drops sessions with peers that are gone and starts handshakes with connected peers that lack one.
  @Override
  public void repair(Set<String> connectedPeers) {
    for (String peerId : cipher.sessionPeers()) {
      if (!connectedPeers.contains(peerId)) {
        LOGGER.fine(() -> self.senderId() + " repair drops session with absent peer " + peerId);
        cipher.removeSession(peerId);
        states.remove(peerId);
      }
    }
    for (String peerId : connectedPeers) {
      if (!cipher.hasSession(peerId) && !isInFlight(peerId)) {
        LOGGER.fine(() -> self.senderId() + " repair starts handshake with " + peerId);
        initiate(peerId);
      }
    }
  }

  private void sendRequest(Attempt attempt, int retryCount) {
    final var peerId = attempt.peerId;
    if (!connections.isConnected(peerId)) {
      fail(attempt, "peer not connected");
      return;
    }
    final Instant sentAt = clock.instant();
    lock.lock();
    try {
      if (attempts.get(peerId) != attempt) {
        return;
      }
      attempt.retryCount = retryCount;
      attempt.timeout = scheduler.schedule("handshake-" + peerId, config.handshakeResponseTimeout(),
          () -> onResponseTimeout(attempt));
    } finally {
      lock.unlock();
    }
    states.put(peerId, new HandshakeState.RequestSent(retryCount, sentAt));
    final var request = new WireMessage.KeyExchange(retryCount, epochSeconds32(), self.senderId(),
        attempt.ephemeral.publicKey());
    LOGGER.finer(() -> self.senderId() + " sending key exchange attempt " + (retryCount + 1) + " to " + peerId);
    connections.send(peerId, WireCodec.encode(request)).thenAccept(result -> {
      if (result != SendResult.SUCCESS) {
        LOGGER.fine(() -> self.senderId() + " key exchange to " + peerId + " not sent: " + result);
      }
    });
  }

  private void onResponseTimeout(Attempt attempt) {
    final var peerId = attempt.peerId;
    final int next;
    lock.lock();
    try {
      if (attempts.get(peerId) != attempt) {
        return;
      }
      next = attempt.retryCount + 1;
    } finally {
      lock.unlock();
    }
    if (cipher.hasSession(peerId)) {
      onInstalled(peerId);
      return;
    }
    if (next >= config.handshakeMaxAttempts()) {
      fail(attempt, "no response after " + next + " attempts");
      return;
    }
    final var delay = Backoff.exponential(config.handshakeBackoffBase(), next);
    LOGGER.fine(() -> self.senderId() + " no key exchange response from " + peerId + ", retrying in " + delay);
    lock.lock();
    try {
      if (attempts.get(peerId) != attempt) {
        return;
      }
      attempt.timeout = scheduler.schedule("handshake-retry-" + peerId, delay, () -> {
        lock.lock();
        final boolean current;
        try {
          current = attempts.get(peerId) == attempt;
        } finally {
          lock.unlock();
        }
        if (current) {
          sendRequest(attempt, next);
        }
      });
    } finally {
      lock.unlock();
    }
  }

  private void onInstalled(String peerId) {
    final Attempt attempt;
    lock.lock();
    try {
      attempt = attempts.remove(peerId);
      if (attempt != null) {
        attempt.cancelTimeout();
      }
    } finally {
      lock.unlock();
    }
    if (attempt != null) {
      states.put(peerId, HandshakeState.ESTABLISHED);
      attempt.result.complete(HandshakeState.ESTABLISHED);
    }
  }

  private void fail(Attempt attempt, String reason) {
    final boolean removed;
    lock.lock();
    try {
      removed = attempts.remove(attempt.peerId, attempt);
      attempt.cancelTimeout();
    } finally {
      lock.unlock();
    }
    if (!removed) {
      return;
    }
    LOGGER.warning(() -> self.senderId() + " handshake with " + attempt.peerId + " failed: " + reason);
    final var failed = new HandshakeState.Failed(reason);
    states.put(attempt.peerId, failed);
    attempt.result.complete(failed);
    events.publish(new MeshEvent.HandshakeFailed(attempt.peerId, reason));
  }

  private void install(String peerId, String peerSenderId, SessionKey.Role role, byte[] sharedSecret) {
    final byte[] okm;
    try {
      okm = SimpleHKDF.derive(SALT, sharedSecret, info(self.senderId(), peerSenderId), DERIVED_LENGTH);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HKDF-SHA256 failed", e);
    } finally {
      Arrays.fill(sharedSecret, (byte) 0);
    }
    final var encryptionKey = Arrays.copyOfRange(okm, 0, Crypto.KEY_LENGTH);
    final var hmacKey = Arrays.copyOfRange(okm, Crypto.KEY_LENGTH, DERIVED_LENGTH);
    Arrays.fill(okm, (byte) 0);
    final Optional<String> deviceId = peerSenderId.equals(peerId) ? Optional.empty() : Optional.of(peerSenderId);
    lock.lock();
    try {
      ephemerals.remove(peerId);
    } finally {
      lock.unlock();
    }
    cipher.installSession(peerId, deviceId, role, encryptionKey, hmacKey);
    Arrays.fill(encryptionKey, (byte) 0);
    Arrays.fill(hmacKey, (byte) 0);
    states.put(peerId, HandshakeState.ESTABLISHED);
    LOGGER.info(() -> self.senderId() + " established session with " + peerId + " as " + role);
    events.publish(new MeshEvent.HandshakeCompleted(peerId, deviceId));
  }

  private void reply(String peerId, KeyExchangeStatus status, byte[] publicKey, Optional<String> error) {
    final var response = new WireMessage.KeyExchangeResponse(status, epochSeconds32(), self.senderId(),
        publicKey, error);
    connections.send(peerId, WireCodec.encode(response)).thenAccept(result -> {
      if (result != SendResult.SUCCESS) {
        LOGGER.fine(() -> self.senderId() + " key exchange response to " + peerId + " not sent: " + result);
      }
    });
  }

  /// HKDF info binding both sender ids in an order both sides agree on.
  static byte[] info(String a, String b) {
    final String first = a.compareTo(b) <= 0 ? a : b;
    final String second = first.equals(a) ? b : a;
    return ("airmesh:" + first + "|" + second).getBytes(StandardCharsets.UTF_8);
  }

  private long epochSeconds32() {
    return clock.instant().getEpochSecond() & WireMessage.MAX_TIMESTAMP;
  }

  private boolean isFresh(long timestamp) {
    final long now = epochSeconds32();
    return Math.abs(now - timestamp) <= config.maxMessageAge().getSeconds();
  }
}
