// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.network;

import com.github.airmesh.MeshConfig;
import com.github.airmesh.TimeoutScheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.stream.Collectors;

import static com.github.airmesh.MeshLogger.LOGGER;

/// ## Connection Lifecycle
///
/// Turns the raw discovery and connection callbacks of the [MeshTransport] into a managed peer set:
///
/// - A discovered peer is invited at most once at a time. Discovery of self, of a connected peer, of a peer that is
///   already being invited, or any discovery while connected plus in-flight peers reach `maxConnections` is ignored.
/// - Every invitation has a safety timeout that clears the in-flight flag even when the transport never calls back.
/// - An unexpected disconnect publishes [MeshEvent.PeerDisconnected] once and then retries with exponential backoff.
///   Each retry re-checks that the peer is still discovered, not connected and not being invited. When the budget is
///   used up [MeshEvent.PeerUnreachable] is published.
/// - A periodic repair pass hands the connected peer set to every registered [SessionMaintenance].
/// - [#send] re-validates the connection before each transport call. A transport `NOT_CONNECTED` result
///   re-synchronises the peer state; a `FAILED` result is retried with backoff.
///
/// All per-peer state lives in one table guarded by a lock. Transport calls and event publication happen outside
/// the lock.
public class ConnectionManager implements TransportListener, AutoCloseable {

  /// Mutable per-peer bookkeeping. Guarded by `lock`.
  private static final class PeerEntry {
    final String peerId;
    ConnectionState state = ConnectionState.DISCOVERED;
    boolean discovered;
    boolean inFlight;
    long attemptGeneration;
    int retryCount;
    Instant nextRetryAt;
    TimeoutScheduler.Timeout safetyTimeout;
    TimeoutScheduler.Timeout retryTimeout;

    PeerEntry(String peerId) {
      this.peerId = peerId;
    }

    void cancelTimeouts() {
      if (safetyTimeout != null) {
        safetyTimeout.cancel();
        safetyTimeout = null;
      }
      if (retryTimeout != null) {
        retryTimeout.cancel();
        retryTimeout = null;
      }
      nextRetryAt = null;
    }

    ConnectionAttempt snapshot() {
      return new ConnectionAttempt(inFlight, retryCount, Optional.ofNullable(nextRetryAt));
    }
  }

  private final String selfId;
  private final MeshTransport transport;
  private final MeshConfig config;
  private final TimeoutScheduler scheduler;
  private final MeshEvents events;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, PeerEntry> peers = new HashMap<>();
  private final List<SessionMaintenance> maintenance = new CopyOnWriteArrayList<>();

  private volatile BiConsumer<String, byte[]> inbound = (peer, bytes) ->
      LOGGER.warning(() -> "Dropping " + bytes.length + " bytes from " + peer + " before start");
  private volatile TimeoutScheduler.Timeout repairTimer;
  private volatile boolean running;

  public ConnectionManager(String selfId, MeshTransport transport, MeshConfig config,
                           TimeoutScheduler scheduler, MeshEvents events, Clock clock) {
    this.selfId = Objects.requireNonNull(selfId, "selfId cannot be null");
    this.transport = Objects.requireNonNull(transport, "transport cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    this.events = Objects.requireNonNull(events, "events cannot be null");
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
  }

  public void addSessionMaintenance(SessionMaintenance sessionMaintenance) {
    maintenance.add(sessionMaintenance);
  }

  /// Starts discovery, routing inbound bytes to `inboundHandler`, and schedules the periodic repair pass.
  public void start(BiConsumer<String, byte[]> inboundHandler) {
    this.inbound = Objects.requireNonNull(inboundHandler, "inboundHandler cannot be null");
    running = true;
    repairTimer = scheduler.scheduleRepeating("repair-" + selfId, config.repairInterval(), this::runRepair);
    LOGGER.fine(() -> selfId + " connection manager started");
    transport.discoverPeers(this);
  }

  @Override
  public void onPeerFound(String peerId) {
    if (selfId.equals(peerId)) {
      return;
    }
    final boolean invite;
    lock.lock();
    try {
      final var entry = peers.computeIfAbsent(peerId, PeerEntry::new);
      entry.discovered = true;
      invite = mayInvite(entry);
      if (invite) {
        beginAttempt(entry);
      }
    } finally {
      lock.unlock();
    }
    if (invite) {
      invite(peerId);
    }
  }

  @Override
  public void onPeerLost(String peerId) {
    lock.lock();
    try {
      final var entry = peers.get(peerId);
      if (entry == null) {
        return;
      }
      entry.discovered = false;
      if (entry.state != ConnectionState.CONNECTED) {
        entry.cancelTimeouts();
        peers.remove(peerId);
        LOGGER.fine(() -> selfId + " evicted lost peer " + peerId);
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void onStateChanged(String peerId, TransportState state) {
    if (selfId.equals(peerId)) {
      return;
    }
    LOGGER.finer(() -> selfId + " transport reports " + peerId + " " + state);
    switch (state) {
      case CONNECTING -> markConnecting(peerId);
      case CONNECTED -> markConnected(peerId);
      case NOT_CONNECTED -> markNotConnected(peerId);
    }
  }

  @Override
  public void onBytesReceived(String peerId, byte[] bytes) {
    try {
      inbound.accept(peerId, bytes);
    } catch (RuntimeException e) {
      LOGGER.log(Level.SEVERE, selfId + " failed to process bytes from " + peerId, e);
    }
  }

  /// Closes the connection to a peer on request of this node. No reconnect follows.
  public void disconnect(String peerId) {
    final boolean wasConnected;
    lock.lock();
    try {
      final var entry = peers.get(peerId);
      wasConnected = entry != null && entry.state == ConnectionState.CONNECTED;
      if (entry != null) {
        entry.cancelTimeouts();
        entry.inFlight = false;
        entry.state = ConnectionState.DISCONNECTED;
        if (!entry.discovered) {
          peers.remove(peerId);
        }
      }
    } finally {
      lock.unlock();
    }
    transport.disconnect(peerId);
    if (wasConnected) {
      LOGGER.info(() -> selfId + " disconnected from " + peerId);
      events.publish(new MeshEvent.PeerDisconnected(peerId));
    }
  }

  /// Sends bytes to one connected peer.
  ///
  /// @return completes with [SendResult#SUCCESS], [SendResult#NOT_CONNECTED] or, once retries are used up,
  /// [SendResult#FAILED]
  public CompletableFuture<SendResult> send(String peerId, byte[] bytes) {
    final var result = new CompletableFuture<SendResult>();
    attemptSend(peerId, bytes, 1, result);
    return result;
  }

  public boolean isConnected(String peerId) {
    lock.lock();
    try {
      final var entry = peers.get(peerId);
      return entry != null && entry.state == ConnectionState.CONNECTED;
    } finally {
      lock.unlock();
    }
  }

  public Set<String> connectedPeers() {
    lock.lock();
    try {
      return peers.values().stream()
          .filter(e -> e.state == ConnectionState.CONNECTED)
          .map(e -> e.peerId)
          .collect(Collectors.toUnmodifiableSet());
    } finally {
      lock.unlock();
    }
  }

  public Optional<ConnectionState> stateOf(String peerId) {
    lock.lock();
    try {
      return Optional.ofNullable(peers.get(peerId)).map(e -> e.state);
    } finally {
      lock.unlock();
    }
  }

  public Optional<ConnectionAttempt> attemptOf(String peerId) {
    lock.lock();
    try {
      return Optional.ofNullable(peers.get(peerId)).map(PeerEntry::snapshot);
    } finally {
      lock.unlock();
    }
  }

  /// One pass of session repair. Scheduled every `repairInterval` after [#start] and callable directly.
  public void runRepair() {
    final var connected = connectedPeers();
    LOGGER.finer(() -> selfId + " repair pass over " + connected.size() + " connected peers");
    for (SessionMaintenance sessionMaintenance : maintenance) {
      try {
        sessionMaintenance.repair(connected);
      } catch (RuntimeException e) {
        LOGGER.log(Level.SEVERE, selfId + " session repair failed", e);
      }
    }
  }

  @Override
  public void close() {
    running = false;
    final var timer = repairTimer;
    if (timer != null) {
      timer.cancel();
    }
    lock.lock();
    try {
      peers.values().forEach(PeerEntry::cancelTimeouts);
      peers.clear();
    } finally {
      lock.unlock();
    }
    LOGGER.fine(() -> selfId + " connection manager closed");
  }

  private boolean mayInvite(PeerEntry entry) {
    if (entry.state == ConnectionState.CONNECTED) {
      LOGGER.finest(() -> selfId + " ignoring discovery of connected peer " + entry.peerId);
      return false;
    }
    if (entry.inFlight) {
      LOGGER.finest(() -> selfId + " already inviting " + entry.peerId);
      return false;
    }
    final long busy = peers.values().stream()
        .filter(e -> e.state == ConnectionState.CONNECTED || e.inFlight)
        .count();
    if (busy >= config.maxConnections()) {
      LOGGER.fine(() -> selfId + " at connection limit " + config.maxConnections() + ", not inviting " + entry.peerId);
      return false;
    }
    return true;
  }

  private void beginAttempt(PeerEntry entry) {
    entry.inFlight = true;
    entry.state = ConnectionState.CONNECTING;
    final long generation = ++entry.attemptGeneration;
    entry.safetyTimeout = scheduler.schedule("attempt-safety-" + entry.peerId, config.attemptSafetyTimeout(),
        () -> onAttemptSafetyTimeout(entry.peerId, generation));
  }

  private void invite(String peerId) {
    LOGGER.fine(() -> selfId + " inviting " + peerId);
    try {
      transport.connect(peerId, config.connectTimeout());
    } catch (RuntimeException e) {
      LOGGER.log(Level.WARNING, selfId + " transport rejected invitation to " + peerId, e);
      markNotConnected(peerId);
    }
  }

  private void onAttemptSafetyTimeout(String peerId, long generation) {
    final List<MeshEvent> published = new ArrayList<>();
    lock.lock();
    try {
      final var entry = peers.get(peerId);
      if (entry == null || !entry.inFlight || entry.attemptGeneration != generation) {
        return;
      }
      LOGGER.fine(() -> selfId + " invitation to " + peerId + " timed out without a callback");
      entry.inFlight = false;
      entry.safetyTimeout = null;
      entry.state = ConnectionState.DISCONNECTED;
      scheduleRetry(entry, published);
    } finally {
      lock.unlock();
    }
    published.forEach(events::publish);
  }

  private void markConnecting(String peerId) {
    lock.lock();
    try {
      final var entry = peers.computeIfAbsent(peerId, PeerEntry::new);
      if (entry.state != ConnectionState.CONNECTED) {
        entry.state = ConnectionState.CONNECTING;
      }
    } finally {
      lock.unlock();
    }
  }

  private void markConnected(String peerId) {
    final boolean newlyConnected;
    lock.lock();
    try {
      final var entry = peers.computeIfAbsent(peerId, PeerEntry::new);
      newlyConnected = entry.state != ConnectionState.CONNECTED;
      entry.cancelTimeouts();
      entry.inFlight = false;
      entry.retryCount = 0;
      entry.discovered = true;
      entry.state = ConnectionState.CONNECTED;
    } finally {
      lock.unlock();
    }
    if (newlyConnected) {
      LOGGER.info(() -> selfId + " connected to " + peerId);
      events.publish(new MeshEvent.PeerConnected(peerId));
    }
  }

  private void markNotConnected(String peerId) {
    final List<MeshEvent> published = new ArrayList<>();
    lock.lock();
    try {
      final var entry = peers.get(peerId);
      if (entry == null) {
        return;
      }
      if (entry.state == ConnectionState.CONNECTED) {
        entry.state = ConnectionState.DISCONNECTED;
        published.add(new MeshEvent.PeerDisconnected(peerId));
        scheduleRetry(entry, published);
      } else if (entry.inFlight) {
        entry.inFlight = false;
        if (entry.safetyTimeout != null) {
          entry.safetyTimeout.cancel();
          entry.safetyTimeout = null;
        }
        entry.state = ConnectionState.DISCONNECTED;
        scheduleRetry(entry, published);
      } else {
        LOGGER.finest(() -> selfId + " ignoring repeated disconnect of " + peerId);
      }
    } finally {
      lock.unlock();
    }
    if (!published.isEmpty() && published.get(0) instanceof MeshEvent.PeerDisconnected) {
      LOGGER.info(() -> selfId + " lost connection to " + peerId);
    }
    published.forEach(events::publish);
  }

  /// Schedules the next retry from the reconnect budget, or gives up on the peer. Caller holds `lock`.
  private void scheduleRetry(PeerEntry entry, List<MeshEvent> published) {
    if (!running) {
      return;
    }
    if (!entry.discovered) {
      entry.cancelTimeouts();
      peers.remove(entry.peerId);
      LOGGER.fine(() -> selfId + " not retrying undiscovered peer " + entry.peerId);
      return;
    }
    if (entry.retryCount >= config.maxReconnectAttempts()) {
      final int attempts = entry.retryCount;
      LOGGER.warning(() -> selfId + " giving up on " + entry.peerId + " after " + attempts + " retries");
      entry.cancelTimeouts();
      entry.retryCount = 0;
      published.add(new MeshEvent.PeerUnreachable(entry.peerId, attempts));
      return;
    }
    entry.retryCount++;
    final var delay = Backoff.exponential(config.reconnectBaseDelay(), entry.retryCount);
    entry.nextRetryAt = clock.instant().plus(delay);
    final var peerId = entry.peerId;
    final int retry = entry.retryCount;
    LOGGER.fine(() -> selfId + " retry " + retry + " for " + peerId + " in " + delay.toMillis() + "ms");
    entry.retryTimeout = scheduler.schedule("reconnect-" + peerId, delay, () -> retry(peerId));
  }

  private void retry(String peerId) {
    final boolean invite;
    lock.lock();
    try {
      final var entry = peers.get(peerId);
      if (entry == null) {
        return;
      }
      entry.retryTimeout = null;
      entry.nextRetryAt = null;
      if (!entry.discovered) {
        peers.remove(peerId);
        LOGGER.fine(() -> selfId + " dropping retry, " + peerId + " is no longer discovered");
        return;
      }
      invite = mayInvite(entry);
      if (invite) {
        beginAttempt(entry);
      }
    } finally {
      lock.unlock();
    }
    if (invite) {
      invite(peerId);
    }
  }

  private void attemptSend(String peerId, byte[] bytes, int attempt, CompletableFuture<SendResult> result) {
    if (!isConnected(peerId)) {
      LOGGER.fine(() -> selfId + " not sending to " + peerId + ", not connected");
      result.complete(SendResult.NOT_CONNECTED);
      return;
    }
    SendResult outcome;
    try {
      outcome = transport.send(bytes, List.of(peerId));
    } catch (RuntimeException e) {
      LOGGER.log(Level.WARNING, selfId + " transport send to " + peerId + " threw", e);
      outcome = SendResult.FAILED;
    }
    switch (outcome) {
      case SUCCESS -> result.complete(SendResult.SUCCESS);
      case NOT_CONNECTED -> {
        LOGGER.fine(() -> selfId + " transport reports " + peerId + " not connected, re-synchronising");
        markNotConnected(peerId);
        result.complete(SendResult.NOT_CONNECTED);
      }
      default -> {
        if (attempt >= config.maxSendAttempts() || !running) {
          LOGGER.warning(() -> selfId + " send to " + peerId + " failed after " + attempt + " attempts");
          result.complete(SendResult.FAILED);
        } else {
          final var delay = Backoff.exponential(config.sendRetryBaseDelay(), attempt);
          scheduler.schedule("send-retry-" + peerId, delay, () -> attemptSend(peerId, bytes, attempt + 1, result));
        }
      }
    }
  }
}
