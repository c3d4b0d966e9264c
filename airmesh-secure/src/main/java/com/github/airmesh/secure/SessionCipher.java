// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

import com.github.airmesh.MeshConfig;
import com.github.airmesh.wire.EncryptedFrame;

import javax.crypto.AEADBadTagException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;

import static com.github.airmesh.MeshLogger.LOGGER;
import static com.github.airmesh.MeshLogger.fingerprint;

/// ## Session Cipher
///
/// Holds one [SessionKey] per peer and seals or opens [EncryptedFrame]s with it. A frame carries the message
/// counter, a timestamp in epoch seconds, an HMAC-SHA256 over the sealed bytes and the AES-GCM output
/// `nonce || ciphertext || tag`. Decryption checks, in order:
///
/// 1. a session exists for the sender, looked up by transport id or by device id
/// 2. the counter is not behind the backtrack window
/// 3. the counter has not been accepted before
/// 4. the timestamp is within `maxMessageAge` of the local clock in either direction
/// 5. the counter is not more than `maxForwardSkip` ahead
/// 6. the HMAC matches, compared in constant time
/// 7. the AEAD tag verifies with the sender's role as associated data
///
/// Only a frame that passes every check changes the session. A session that has sealed or opened
/// `maxMessagesPerKey` messages, or is older than `keyRotationInterval`, is discarded and the next operation fails
/// with [CryptoError#NO_SESSION_KEY] so that the caller runs a fresh handshake.
///
/// A device id names a physical device across transport reconnects. When a device id shows up under a new
/// transport id the mapping moves and the session of the old transport id is dropped.
public class SessionCipher {
  static final byte[] ENCRYPTION_RATCHET_LABEL = "airmesh-enc-ratchet".getBytes(StandardCharsets.UTF_8);
  static final byte[] HMAC_RATCHET_LABEL = "airmesh-mac-ratchet".getBytes(StandardCharsets.UTF_8);

  private final MeshConfig config;
  private final Clock clock;

  private final Map<String, SessionKey> sessions = new ConcurrentHashMap<>();
  private final Map<String, String> deviceToPeer = new ConcurrentHashMap<>();
  private final Map<String, CompletableFuture<String>> installWaiters = new ConcurrentHashMap<>();

  /// Guards installation, removal and the device mapping. Never acquired while holding a session monitor.
  private final ReentrantLock tableLock = new ReentrantLock();

  public SessionCipher(MeshConfig config, Clock clock) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
  }

  /// Installs a fresh session with `peerId`, replacing and destroying any previous one.
  ///
  /// @param encryptionKey the 32 byte initial AES key
  /// @param hmacKey       the 32 byte initial HMAC key
  public SessionKey installSession(String peerId, Optional<String> deviceId, SessionKey.Role localRole,
                                   byte[] encryptionKey, byte[] hmacKey) {
    Objects.requireNonNull(peerId, "peerId cannot be null");
    if (encryptionKey.length != Crypto.KEY_LENGTH || hmacKey.length != Crypto.KEY_LENGTH) {
      throw new IllegalArgumentException("session keys must be " + Crypto.KEY_LENGTH + " bytes");
    }
    final var session = new SessionKey(peerId, deviceId, localRole, clock.instant(),
        new SessionKey.ChainKeys(encryptionKey.clone(), hmacKey.clone()));
    tableLock.lock();
    try {
      final var previous = sessions.put(peerId, session);
      if (previous != null) {
        previous.destroy();
      }
      deviceToPeer.entrySet().removeIf(e -> e.getValue().equals(peerId)
          && deviceId.map(d -> !d.equals(e.getKey())).orElse(true));
      deviceId.ifPresent(device -> {
        final var stalePeer = deviceToPeer.put(device, peerId);
        if (stalePeer != null && !stalePeer.equals(peerId)) {
          LOGGER.info(() -> "Device " + device + " moved from " + stalePeer + " to " + peerId);
          final var stale = sessions.remove(stalePeer);
          if (stale != null) {
            stale.destroy();
          }
        }
      });
    } finally {
      tableLock.unlock();
    }
    LOGGER.fine(() -> "Installed session with " + peerId + " as " + localRole
        + " keyFingerprint=" + fingerprint(encryptionKey));
    final var waiter = installWaiters.remove(peerId);
    if (waiter != null) {
      waiter.complete(peerId);
    }
    return session;
  }

  /// True if a session with `peerId` exists and is within its message and age limits. A session found past a limit
  /// is discarded here, so an idle peer answers the next key exchange with fresh keys.
  public boolean hasSession(String peerId) {
    final var session = resolve(peerId);
    if (session == null) {
      return false;
    }
    final boolean spent;
    synchronized (session) {
      spent = checkUsable(session);
    }
    if (spent) {
      discard(session, "limit reached while idle");
      return false;
    }
    return true;
  }

  public Optional<SessionKey> session(String peerId) {
    return Optional.ofNullable(resolve(peerId));
  }

  /// The next message counter of the session with `peerId`, if there is one.
  public OptionalLong messageNumber(String peerId) {
    final var session = resolve(peerId);
    return session == null ? OptionalLong.empty() : OptionalLong.of(session.messageNumber());
  }

  public Set<String> sessionPeers() {
    return Set.copyOf(sessions.keySet());
  }

  public Optional<String> peerForDevice(String deviceId) {
    return Optional.ofNullable(deviceToPeer.get(deviceId));
  }

  /// Removes and destroys the session with `peerId` along with its device mapping.
  ///
  /// @return true if there was a session
  public boolean removeSession(String peerId) {
    final SessionKey removed;
    tableLock.lock();
    try {
      removed = sessions.remove(peerId);
      deviceToPeer.values().removeIf(peerId::equals);
      if (removed != null) {
        removed.destroy();
      }
    } finally {
      tableLock.unlock();
    }
    if (removed != null) {
      LOGGER.fine(() -> "Removed session with " + peerId);
    }
    return removed != null;
  }

  /// A future that completes with `peerId` the next time a session with that peer is installed, or at once if one
  /// exists now.
  public CompletableFuture<String> whenInstalled(String peerId) {
    if (hasSession(peerId)) {
      return CompletableFuture.completedFuture(peerId);
    }
    final var waiter = installWaiters.computeIfAbsent(peerId, k -> new CompletableFuture<>());
    // an install may have raced the registration
    if (hasSession(peerId) && installWaiters.remove(peerId, waiter)) {
      waiter.complete(peerId);
    }
    return waiter;
  }

  public EncryptedFrame encrypt(String peerId, byte[] plaintext) throws CryptoException {
    Objects.requireNonNull(plaintext, "plaintext cannot be null");
    final var session = requireSession(peerId);
    final EncryptedFrame frame;
    final boolean exhausted;
    synchronized (session) {
      final boolean expired = checkUsable(session);
      if (!expired) {
        final long n = session.messageNumber;
        final var keys = session.current;
        final byte[] sealed = Crypto.seal(keys.encryptionKey(), session.localRole().associatedData(), plaintext);
        frame = new EncryptedFrame(n, clock.instant().getEpochSecond(), Crypto.hmac(keys.hmacKey(), sealed), sealed);
        // the peer may send with the same counter so the key stays available to open its frame
        session.retained.put(n, keys);
        session.current = ratchet(keys, n);
        session.messageNumber = n + 1;
        session.prune(config.backtrackWindow());
        exhausted = session.messageNumber >= config.maxMessagesPerKey();
      } else {
        frame = null;
        exhausted = true;
      }
    }
    if (frame == null) {
      discard(session, "expired");
      throw new CryptoException(CryptoError.NO_SESSION_KEY, "session with " + peerId + " expired");
    }
    if (exhausted) {
      discard(session, "message limit reached");
    }
    LOGGER.finest(() -> "Encrypted message " + frame.messageNumber() + " for " + peerId);
    return frame;
  }

  public byte[] decrypt(String peerId, EncryptedFrame frame) throws CryptoException {
    Objects.requireNonNull(frame, "frame cannot be null");
    final var session = requireSession(peerId);
    final byte[] plaintext;
    final boolean exhausted;
    synchronized (session) {
      if (checkUsable(session)) {
        plaintext = null;
        exhausted = true;
      } else {
        plaintext = open(session, frame);
        exhausted = session.messageNumber >= config.maxMessagesPerKey();
      }
    }
    if (plaintext == null) {
      discard(session, "expired");
      throw new CryptoException(CryptoError.NO_SESSION_KEY, "session with " + peerId + " expired");
    }
    if (exhausted) {
      discard(session, "message limit reached");
    }
    return plaintext;
  }

  /// Validates and opens `frame`, committing the counter only when every check passes. Caller holds the session
  /// monitor.
  private byte[] open(SessionKey session, EncryptedFrame frame) throws CryptoException {
    final long m = frame.messageNumber();
    final long current = session.messageNumber;
    final int window = config.backtrackWindow();
    if (m < current - window) {
      throw new CryptoException(CryptoError.STALE_MESSAGE,
          "message " + m + " is behind the window ending at " + current);
    }
    if (session.accepted.contains(m)) {
      throw new CryptoException(CryptoError.REPLAY, "message " + m + " was already accepted");
    }
    final long now = clock.instant().getEpochSecond();
    final long maxAge = config.maxMessageAge().getSeconds();
    if (frame.timestamp() < now - maxAge || frame.timestamp() > now + maxAge) {
      throw new CryptoException(CryptoError.MESSAGE_EXPIRED, "timestamp " + frame.timestamp()
          + " is more than " + Duration.ofSeconds(maxAge) + " from " + now);
    }
    if (m - current > config.maxForwardSkip()) {
      throw new CryptoException(CryptoError.INVALID_FRAME,
          "message " + m + " skips too far ahead of " + current);
    }

    final SessionKey.ChainKeys keys;
    final List<SessionKey.ChainKeys> skipped = new ArrayList<>();
    if (m < current) {
      keys = session.retained.get(m);
      if (keys == null) {
        throw new CryptoException(CryptoError.REPLAY, "key for message " + m + " was already consumed");
      }
    } else {
      var k = session.current;
      for (long i = current; i < m; i++) {
        skipped.add(k);
        k = ratchet(k, i);
      }
      keys = k;
    }

    if (!Crypto.constantTimeEquals(Crypto.hmac(keys.hmacKey(), frame.ciphertext()), frame.hmac())) {
      throw new CryptoException(CryptoError.AUTHENTICATION_FAILED, "HMAC mismatch on message " + m);
    }
    final byte[] plaintext;
    try {
      plaintext = Crypto.open(keys.encryptionKey(), session.localRole().peer().associatedData(), frame.ciphertext());
    } catch (AEADBadTagException e) {
      throw new CryptoException(CryptoError.AUTHENTICATION_FAILED, "AEAD tag mismatch on message " + m, e);
    } catch (GeneralSecurityException e) {
      throw new CryptoException(CryptoError.DECRYPTION_FAILED, "cannot open message " + m, e);
    }

    session.accepted.add(m);
    if (m < current) {
      session.retained.remove(m).destroy();
    } else {
      for (int i = 0; i < skipped.size(); i++) {
        session.retained.put(current + i, skipped.get(i));
      }
      session.current = ratchet(keys, m);
      session.messageNumber = m + 1;
      keys.destroy();
    }
    session.prune(window);
    LOGGER.finest(() -> "Decrypted message " + m + " from " + session.peerId());
    return plaintext;
  }

  private SessionKey requireSession(String peerId) throws CryptoException {
    Objects.requireNonNull(peerId, "peerId cannot be null");
    final var session = resolve(peerId);
    if (session == null) {
      throw new CryptoException(CryptoError.NO_SESSION_KEY, "no session with " + peerId);
    }
    return session;
  }

  /// @return true if the session is destroyed or past one of its limits. Caller holds the session monitor.
  private boolean checkUsable(SessionKey session) {
    if (session.destroyed) {
      return true;
    }
    final var age = Duration.between(session.createdAt(), clock.instant());
    return session.messageNumber >= config.maxMessagesPerKey() || age.compareTo(config.keyRotationInterval()) > 0;
  }

  private void discard(SessionKey session, String reason) {
    final boolean removed;
    tableLock.lock();
    try {
      removed = sessions.remove(session.peerId(), session);
      if (removed) {
        deviceToPeer.values().removeIf(session.peerId()::equals);
      }
      session.destroy();
    } finally {
      tableLock.unlock();
    }
    if (removed) {
      LOGGER.log(Level.INFO, () -> "Discarded session with " + session.peerId() + ": " + reason);
    }
  }

  private SessionKey resolve(String id) {
    final var direct = sessions.get(id);
    if (direct != null) {
      return direct;
    }
    final var mapped = deviceToPeer.get(id);
    return mapped == null ? null : sessions.get(mapped);
  }

  static SessionKey.ChainKeys ratchet(SessionKey.ChainKeys keys, long counter) {
    return new SessionKey.ChainKeys(
        Crypto.ratchet(keys.encryptionKey(), ENCRYPTION_RATCHET_LABEL, counter),
        Crypto.ratchet(keys.hmacKey(), HMAC_RATCHET_LABEL, counter));
  }
}
