// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

import com.github.airmesh.MeshConfig;
import com.github.airmesh.network.ConnectionManager;
import com.github.airmesh.network.SendResult;
import com.github.airmesh.wire.DecodeException;
import com.github.airmesh.wire.EncryptedFrame;
import com.github.airmesh.wire.MessageType;
import com.github.airmesh.wire.WireCodec;
import com.github.airmesh.wire.WireMessage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;

import static com.github.airmesh.MeshLogger.LOGGER;

/// ## Message Router
///
/// Decodes every inbound frame and dispatches it by type. Key exchange frames go to the [HandshakeProtocol].
/// Frames of a confidential type carry an [EncryptedFrame] envelope and are decrypted before dispatch; any decoding
/// or cryptographic failure drops the frame. Frames with an unknown tag are dropped with a warning.
///
/// Outbound confidential payloads are encrypted when a session exists. Without one they are buffered per peer up to
/// `maxPendingBytes` and a handshake is started; the buffer is flushed when the session is established and failed
/// with [SendResult#NO_SESSION] when the handshake fails.
public class MessageRouter {

  /// A feature subscription. The name appears in logs.
  public record Subscription(MessageType type, FeatureHandler handler, String name) {
    public Subscription {
      Objects.requireNonNull(type);
      Objects.requireNonNull(handler);
      Objects.requireNonNull(name);
    }
  }

  private record PendingMessage(MessageType type, byte[] payload, CompletableFuture<SendResult> result) {
  }

  private static final class PendingQueue {
    final List<PendingMessage> messages = new ArrayList<>();
    int bytes;
  }

  private final String selfId;
  private final MeshConfig config;
  private final ConnectionManager connections;
  private final SessionCipher cipher;
  private final HandshakeProtocol handshake;
  private final FloodGuard floodGuard;

  private final Map<MessageType, List<Subscription>> subscriptions = new ConcurrentHashMap<>();
  private final Map<String, PendingQueue> pending = new ConcurrentHashMap<>();

  public MessageRouter(String selfId, MeshConfig config, ConnectionManager connections, SessionCipher cipher,
                       HandshakeProtocol handshake, FloodGuard floodGuard) {
    this.selfId = Objects.requireNonNull(selfId, "selfId cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.connections = Objects.requireNonNull(connections, "connections cannot be null");
    this.cipher = Objects.requireNonNull(cipher, "cipher cannot be null");
    this.handshake = Objects.requireNonNull(handshake, "handshake cannot be null");
    this.floodGuard = Objects.requireNonNull(floodGuard, "floodGuard cannot be null");
  }

  /// Registers a handler for a feature type. Several handlers may share a type; each receives every payload.
  public Subscription subscribe(MessageType type, FeatureHandler handler, String name) {
    if (type.isKeyExchange()) {
      throw new IllegalArgumentException("key exchange frames are handled internally");
    }
    final var subscription = new Subscription(type, handler, name);
    subscriptions.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(subscription);
    LOGGER.fine(() -> selfId + " subscribed " + name + " to " + type);
    return subscription;
  }

  public void unsubscribe(Subscription subscription) {
    final var list = subscriptions.get(subscription.type());
    if (list != null) {
      list.remove(subscription);
    }
  }

  /// Entry point for every inbound frame from the transport.
  public void onBytesReceived(String peerId, byte[] bytes) {
    if (!floodGuard.tryAcquire(peerId)) {
      return;
    }
    final WireMessage message;
    try {
      message = WireCodec.decode(bytes);
    } catch (DecodeException e) {
      LOGGER.warning(() -> selfId + " dropping undecodable frame from " + peerId + ": " + e.getMessage());
      return;
    }
    if (message instanceof WireMessage.KeyExchange request) {
      handshake.onKeyExchange(peerId, request);
    } else if (message instanceof WireMessage.KeyExchangeResponse response) {
      handshake.onKeyExchangeResponse(peerId, response);
    } else if (message instanceof WireMessage.Payload payload) {
      deliver(peerId, payload);
    } else if (message instanceof WireMessage.Unrecognized unrecognized) {
      LOGGER.warning(() -> selfId + " dropping frame with unknown type tag " + unrecognized.type().tag()
          + " from " + peerId);
    }
  }

  private void deliver(String peerId, WireMessage.Payload payload) {
    final var type = payload.type();
    byte[] plaintext = payload.payload();
    if (config.isConfidential(type)) {
      try {
        plaintext = cipher.decrypt(peerId, WireCodec.decodeEnvelope(plaintext));
      } catch (DecodeException e) {
        LOGGER.warning(() -> selfId + " dropping " + type + " from " + peerId + " with bad envelope: "
            + e.getMessage());
        return;
      } catch (CryptoException e) {
        LOGGER.warning(() -> selfId + " dropping " + type + " from " + peerId + ": " + e.getMessage());
        return;
      }
    }
    if (type == MessageType.SYSTEM && StabilityProbe.isProbe(plaintext)) {
      LOGGER.finest(() -> selfId + " consumed stability probe from " + peerId);
      return;
    }
    final var handlers = subscriptions.getOrDefault(type, List.of());
    if (handlers.isEmpty()) {
      LOGGER.fine(() -> selfId + " no handler for " + type + " from " + peerId);
      return;
    }
    for (Subscription subscription : handlers) {
      try {
        subscription.handler().onMessage(plaintext.clone(), peerId);
      } catch (RuntimeException e) {
        LOGGER.log(Level.SEVERE, selfId + " handler " + subscription.name() + " failed on " + type
            + " from " + peerId, e);
      }
    }
  }

  /// Sends a feature payload to one peer, encrypting it when the type is confidential.
  public CompletableFuture<SendResult> send(String peerId, MessageType type, byte[] payload) {
    Objects.requireNonNull(peerId, "peerId cannot be null");
    Objects.requireNonNull(payload, "payload cannot be null");
    if (type.isKeyExchange()) {
      throw new IllegalArgumentException("key exchange frames are sent by the handshake protocol");
    }
    if (!config.isConfidential(type)) {
      return connections.send(peerId, WireCodec.encode(new WireMessage.Payload(type, payload)));
    }
    if (!connections.isConnected(peerId)) {
      return CompletableFuture.completedFuture(SendResult.NOT_CONNECTED);
    }
    if (cipher.hasSession(peerId)) {
      try {
        return sendEncrypted(peerId, type, payload);
      } catch (CryptoException e) {
        LOGGER.fine(() -> selfId + " session with " + peerId + " ended, buffering: " + e.getMessage());
      }
    }
    return buffer(peerId, type, payload);
  }

  /// Sends a feature payload to every connected peer.
  public Map<String, CompletableFuture<SendResult>> broadcast(MessageType type, byte[] payload) {
    final Map<String, CompletableFuture<SendResult>> results = new LinkedHashMap<>();
    for (String peerId : connections.connectedPeers()) {
      results.put(peerId, send(peerId, type, payload));
    }
    return results;
  }

  /// Fails anything buffered for a peer that has gone away.
  public void onPeerDisconnected(String peerId) {
    floodGuard.forget(peerId);
    drain(peerId).forEach(m -> m.result().complete(SendResult.NOT_CONNECTED));
  }

  public int pendingBytes(String peerId) {
    final var queue = pending.get(peerId);
    if (queue == null) {
      return 0;
    }
    synchronized (queue) {
      return queue.bytes;
    }
  }

  private CompletableFuture<SendResult> sendEncrypted(String peerId, MessageType type, byte[] payload)
      throws CryptoException {
    final EncryptedFrame frame = cipher.encrypt(peerId, payload);
    final var bytes = WireCodec.encode(new WireMessage.Payload(type, WireCodec.encodeEnvelope(frame)));
    return connections.send(peerId, bytes);
  }

  private CompletableFuture<SendResult> buffer(String peerId, MessageType type, byte[] payload) {
    final var message = new PendingMessage(type, payload.clone(), new CompletableFuture<>());
    final var queue = pending.computeIfAbsent(peerId, k -> new PendingQueue());
    final boolean first;
    synchronized (queue) {
      if (queue.bytes + payload.length > config.maxPendingBytes()) {
        LOGGER.warning(() -> selfId + " pending buffer for " + peerId + " is full, dropping " + type);
        return CompletableFuture.completedFuture(SendResult.FAILED);
      }
      first = queue.messages.isEmpty();
      queue.messages.add(message);
      queue.bytes += payload.length;
    }
    LOGGER.finer(() -> selfId + " buffered " + type + " for " + peerId + " until a session exists");
    if (first) {
      handshake.initiate(peerId).thenAccept(state -> settle(peerId, state));
    }
    return message.result();
  }

  private void settle(String peerId, HandshakeState state) {
    final var messages = drain(peerId);
    if (messages.isEmpty()) {
      return;
    }
    if (!(state instanceof HandshakeState.Established)) {
      LOGGER.warning(() -> selfId + " failing " + messages.size() + " buffered messages for " + peerId
          + ": " + state);
      messages.forEach(m -> m.result().complete(SendResult.NO_SESSION));
      return;
    }
    LOGGER.fine(() -> selfId + " flushing " + messages.size() + " buffered messages to " + peerId);
    for (PendingMessage m : messages) {
      try {
        sendEncrypted(peerId, m.type(), m.payload()).whenComplete((result, error) ->
            m.result().complete(error == null ? result : SendResult.FAILED));
      } catch (CryptoException e) {
        LOGGER.warning(() -> selfId + " cannot flush to " + peerId + ": " + e.getMessage());
        m.result().complete(SendResult.NO_SESSION);
      }
    }
  }

  private List<PendingMessage> drain(String peerId) {
    final var queue = pending.get(peerId);
    if (queue == null) {
      return List.of();
    }
    synchronized (queue) {
      final var drained = new ArrayList<>(queue.messages);
      queue.messages.clear();
      queue.bytes = 0;
      return drained;
    }
  }
}
