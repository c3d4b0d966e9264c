// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

import com.github.airmesh.ExecutorTimeoutScheduler;
import com.github.airmesh.MeshConfig;
import com.github.airmesh.PeerIdentity;
import com.github.airmesh.TimeoutScheduler;
import com.github.airmesh.network.ConnectionManager;
import com.github.airmesh.network.MeshEvent;
import com.github.airmesh.network.MeshEvents;
import com.github.airmesh.network.MeshTransport;
import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Level;

import static com.github.airmesh.MeshLogger.LOGGER;

/// Wires the connection manager, session cipher, handshake protocol and message router of one node together. Each
/// newly connected peer is probed for link stability and then handshaken with; a disconnect drops the session, the
/// running handshake and anything buffered for the peer.
public final class MeshNode implements AutoCloseable {
  private final PeerIdentity self;
  private final MeshTransport transport;
  private final TimeoutScheduler scheduler;
  private final boolean ownsScheduler;
  private final MeshEvents events = new MeshEvents();
  private final ConnectionManager connections;
  private final SessionCipher cipher;
  private final HandshakeProtocol handshake;
  private final StabilityProbe stabilityProbe;
  private final MessageRouter router;

  private MeshNode(PeerIdentity self, MeshTransport transport, MeshConfig config, Clock clock,
                   TimeoutScheduler scheduler, boolean ownsScheduler) {
    this.self = Objects.requireNonNull(self, "self cannot be null");
    this.transport = Objects.requireNonNull(transport, "transport cannot be null");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    this.ownsScheduler = ownsScheduler;
    Objects.requireNonNull(config, "config cannot be null");
    Objects.requireNonNull(clock, "clock cannot be null");
    this.connections = new ConnectionManager(self.transportId(), transport, config, scheduler, events, clock);
    this.cipher = new SessionCipher(config, clock);
    this.handshake = new HandshakeProtocol(self, X25519Key.generate(), cipher, connections, config, scheduler,
        events, clock);
    this.stabilityProbe = new StabilityProbe(connections, scheduler, config);
    this.router = new MessageRouter(self.transportId(), config, connections, cipher, handshake,
        new FloodGuard(config.floodLimit(), config.floodWindow(), config.floodBanDuration(), clock));

    connections.addSessionMaintenance(handshake);
    events.subscribe(MeshEvent.PeerConnected.class, e -> onPeerConnected(e.peerId()), "handshake-on-connect");
    events.subscribe(MeshEvent.PeerDisconnected.class, e -> onPeerDisconnected(e.peerId()), "session-cleanup");
  }

  /// A node with its own scheduling thread and the system clock.
  public static MeshNode create(@NotNull PeerIdentity self, @NotNull MeshTransport transport,
                                @NotNull MeshConfig config) {
    return new MeshNode(self, transport, config, Clock.systemUTC(),
        new ExecutorTimeoutScheduler(self.transportId()), true);
  }

  /// A node driven by the given clock and scheduler. The caller keeps ownership of the scheduler.
  public static MeshNode create(@NotNull PeerIdentity self, @NotNull MeshTransport transport,
                                @NotNull MeshConfig config, @NotNull Clock clock,
                                @NotNull TimeoutScheduler scheduler) {
    return new MeshNode(self, transport, config, clock, scheduler, false);
  }

  /// Starts peer discovery. Inbound bytes flow to the router from here on.
  public void start() {
    LOGGER.info(() -> "Starting mesh node " + self.transportId());
    connections.start(router::onBytesReceived);
  }

  private void onPeerConnected(String peerId) {
    stabilityProbe.probe(peerId).thenAccept(stable -> {
      if (stable) {
        handshake.initiate(peerId);
      } else {
        // the repair pass retries the handshake if the link survives
        LOGGER.warning(() -> self.transportId() + " link to " + peerId + " is unstable, deferring handshake");
      }
    });
  }

  private void onPeerDisconnected(String peerId) {
    cipher.removeSession(peerId);
    handshake.reset(peerId);
    router.onPeerDisconnected(peerId);
  }

  public PeerIdentity self() {
    return self;
  }

  public MeshEvents events() {
    return events;
  }

  public ConnectionManager connections() {
    return connections;
  }

  public SessionCipher cipher() {
    return cipher;
  }

  public HandshakeProtocol handshake() {
    return handshake;
  }

  public MessageRouter router() {
    return router;
  }

  @Override
  public void close() {
    LOGGER.info(() -> "Closing mesh node " + self.transportId());
    connections.close();
    if (ownsScheduler) {
      scheduler.close();
    }
    try {
      transport.close();
    } catch (RuntimeException e) {
      LOGGER.log(Level.WARNING, "Transport of " + self.transportId() + " failed to close", e);
    }
  }
}
