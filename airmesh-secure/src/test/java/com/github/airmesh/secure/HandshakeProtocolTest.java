// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

import com.github.airmesh.LoggerConfig;
import com.github.airmesh.ManualScheduler;
import com.github.airmesh.MeshConfig;
import com.github.airmesh.MutableClock;
import com.github.airmesh.PeerIdentity;
import com.github.airmesh.network.ConnectionManager;
import com.github.airmesh.network.MeshEvent;
import com.github.airmesh.network.MeshEvents;
import com.github.airmesh.network.RecordingTransport;
import com.github.airmesh.network.TransportState;
import com.github.airmesh.wire.DecodeException;
import com.github.airmesh.wire.KeyExchangeStatus;
import com.github.airmesh.wire.WireCodec;
import com.github.airmesh.wire.WireMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class HandshakeProtocolTest {
  final MeshConfig config = MeshConfig.defaults();
  MutableClock clock;
  ManualScheduler scheduler;
  Side alice;
  Side bob;

  /// One node's handshake stack over a transport whose frames the test relays by hand.
  class Side {
    final String id;
    final RecordingTransport transport = new RecordingTransport();
    final MeshEvents events = new MeshEvents();
    final List<MeshEvent> published = new ArrayList<>();
    final ConnectionManager connections;
    final SessionCipher cipher;
    final HandshakeProtocol handshake;
    int relayed;

    Side(String id) {
      this.id = id;
      events.subscribe(MeshEvent.class, published::add, "recorder");
      connections = new ConnectionManager(id, transport, config, scheduler, events, clock);
      connections.start((peer, bytes) -> {
      });
      cipher = new SessionCipher(config, clock);
      handshake = new HandshakeProtocol(new PeerIdentity(id), X25519Key.generate(), cipher, connections, config,
          scheduler, events, clock);
    }

    void connectedTo(String peer) {
      transport.listener().onStateChanged(peer, TransportState.CONNECTED);
    }

    List<WireMessage> sent() {
      final List<WireMessage> messages = new ArrayList<>();
      for (var sent : transport.sent) {
        try {
          messages.add(WireCodec.decode(sent.bytes()));
        } catch (DecodeException e) {
          throw new AssertionError(e);
        }
      }
      return messages;
    }

    WireMessage lastSent() {
      final var messages = sent();
      assertFalse(messages.isEmpty(), id + " sent nothing");
      return messages.get(messages.size() - 1);
    }

    /// Hands everything this side sent since the last relay to `to`.
    void relayTo(Side to) {
      final var messages = sent();
      for (int i = relayed; i < messages.size(); i++) {
        final var message = messages.get(i);
        if (message instanceof WireMessage.KeyExchange request) {
          to.handshake.onKeyExchange(id, request);
        } else if (message instanceof WireMessage.KeyExchangeResponse response) {
          to.handshake.onKeyExchangeResponse(id, response);
        }
      }
      relayed = messages.size();
    }
  }

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  @BeforeEach
  void setup() {
    clock = MutableClock.startingNow();
    scheduler = new ManualScheduler(clock);
    alice = new Side("alice");
    bob = new Side("bob");
    alice.connectedTo("bob");
    bob.connectedTo("alice");
  }

  @AfterEach
  void tearDown() {
    alice.connections.close();
    bob.connections.close();
    scheduler.close();
  }

  static void assertSameKeys(SessionCipher a, String peerOfA, SessionCipher b, String peerOfB) {
    final var sa = a.session(peerOfA).orElseThrow();
    final var sb = b.session(peerOfB).orElseThrow();
    assertArrayEquals(sa.currentEncryptionKey(), sb.currentEncryptionKey());
    assertArrayEquals(sa.currentHmacKey(), sb.currentHmacKey());
  }

  @Test
  void requestAndSuccessEstablishTheSameKeys() {
    final var outcome = alice.handshake.initiate("bob");

    final var request = (WireMessage.KeyExchange) alice.lastSent();
    assertEquals(0, request.retryCount());
    assertEquals("alice", request.senderId());
    assertEquals(X25519Key.PUBLIC_KEY_LENGTH, request.publicKey().length);
    assertThat(alice.handshake.stateOf("bob")).isInstanceOf(HandshakeState.RequestSent.class);

    alice.relayTo(bob);
    final var response = (WireMessage.KeyExchangeResponse) bob.lastSent();
    assertEquals(KeyExchangeStatus.SUCCESS, response.status());
    assertEquals("bob", response.senderId());
    assertTrue(response.error().isEmpty());
    assertTrue(bob.cipher.hasSession("alice"));

    bob.relayTo(alice);

    assertEquals(HandshakeState.ESTABLISHED, outcome.join());
    assertEquals(HandshakeState.ESTABLISHED, alice.handshake.stateOf("bob"));
    assertEquals(HandshakeState.ESTABLISHED, bob.handshake.stateOf("alice"));
    assertFalse(alice.handshake.isInFlight("bob"));
    assertSameKeys(alice.cipher, "bob", bob.cipher, "alice");
    assertEquals(SessionKey.Role.INITIATOR, alice.cipher.session("bob").orElseThrow().localRole());
    assertEquals(SessionKey.Role.RESPONDER, bob.cipher.session("alice").orElseThrow().localRole());
    assertThat(alice.published).contains(new MeshEvent.HandshakeCompleted("bob", Optional.empty()));
    assertThat(bob.published).contains(new MeshEvent.HandshakeCompleted("alice", Optional.empty()));
    assertTrue(scheduler.pendingTaskNames().stream().noneMatch(n -> n.startsWith("handshake")));
  }

  @Test
  void secondRequestIsAnsweredAlreadyEstablished() {
    alice.handshake.initiate("bob");
    final var request = (WireMessage.KeyExchange) alice.lastSent();
    alice.relayTo(bob);
    bob.relayTo(alice);
    final var session = bob.cipher.session("alice").orElseThrow();

    bob.handshake.onKeyExchange("alice", request);

    final var response = (WireMessage.KeyExchangeResponse) bob.lastSent();
    assertEquals(KeyExchangeStatus.ALREADY_ESTABLISHED, response.status());
    assertEquals(X25519Key.PUBLIC_KEY_LENGTH, response.publicKey().length);
    assertSame(session, bob.cipher.session("alice").orElseThrow());

    bob.relayTo(alice);
    assertSameKeys(alice.cipher, "bob", bob.cipher, "alice");
  }

  @Test
  void initiateWithSessionIsImmediate() {
    alice.handshake.initiate("bob");
    alice.relayTo(bob);
    bob.relayTo(alice);
    final int sent = alice.transport.sent.size();

    assertEquals(HandshakeState.ESTABLISHED, alice.handshake.initiate("bob").join());
    assertEquals(sent, alice.transport.sent.size());
  }

  @Test
  void concurrentInitiateJoinsTheRunningAttempt() {
    final var first = alice.handshake.initiate("bob");
    final var second = alice.handshake.initiate("bob");

    assertSame(first, second);
    assertEquals(1, alice.transport.sent.size());
  }

  @Test
  void unansweredRequestIsRetriedWithBackoffThenFails() {
    final var outcome = alice.handshake.initiate("bob");

    scheduler.advance(config.handshakeResponseTimeout());
    assertEquals(1, alice.transport.sent.size());
    scheduler.advance(Duration.ofSeconds(2));
    assertEquals(2, alice.transport.sent.size());
    scheduler.advance(config.handshakeResponseTimeout().plusSeconds(3));
    assertEquals(2, alice.transport.sent.size(), "second backoff is twice the first");
    scheduler.advance(Duration.ofSeconds(1));
    assertEquals(3, alice.transport.sent.size());
    assertFalse(outcome.isDone());

    scheduler.advance(config.handshakeResponseTimeout());

    final var state = assertInstanceOf(HandshakeState.Failed.class, outcome.join());
    assertThat(state.reason()).contains("3 attempts");
    assertEquals(state, alice.handshake.stateOf("bob"));
    assertFalse(alice.handshake.isInFlight("bob"));
    assertThat(alice.published).contains(new MeshEvent.HandshakeFailed("bob", state.reason()));

    final var requests = alice.sent().stream().map(WireMessage.KeyExchange.class::cast).toList();
    assertEquals(List.of(0, 1, 2), requests.stream().map(WireMessage.KeyExchange::retryCount).toList());
    assertArrayEquals(requests.get(0).publicKey(), requests.get(2).publicKey());

    scheduler.advance(Duration.ofMinutes(1));
    assertEquals(3, alice.transport.sent.size());
  }

  @Test
  void lateResponseToARetryStillCompletes() {
    final var outcome = alice.handshake.initiate("bob");
    scheduler.advance(config.handshakeResponseTimeout().plusSeconds(2));
    assertEquals(2, alice.transport.sent.size());

    alice.relayTo(bob);
    bob.relayTo(alice);

    assertEquals(HandshakeState.ESTABLISHED, outcome.join());
    assertSameKeys(alice.cipher, "bob", bob.cipher, "alice");
  }

  @Test
  void peerGoneBeforeRetryFailsWithoutLeakingTheAttempt() {
    final var outcome = alice.handshake.initiate("bob");
    alice.transport.listener().onStateChanged("bob", TransportState.NOT_CONNECTED);

    scheduler.advance(config.handshakeResponseTimeout().plusSeconds(2));

    final var state = assertInstanceOf(HandshakeState.Failed.class, outcome.join());
    assertEquals("peer not connected", state.reason());
    assertFalse(alice.handshake.isInFlight("bob"));
    assertEquals(1, alice.transport.sent.size());
  }

  @Test
  void resetAbandonsTheAttempt() {
    final var outcome = alice.handshake.initiate("bob");

    alice.handshake.reset("bob");

    assertInstanceOf(HandshakeState.Failed.class, outcome.join());
    assertEquals(HandshakeState.NO_SESSION, alice.handshake.stateOf("bob"));
    assertFalse(alice.handshake.isInFlight("bob"));
    scheduler.advance(Duration.ofMinutes(1));
    assertEquals(1, alice.transport.sent.size());
  }

  @Test
  void unusablePublicKeyIsAnsweredWithError() {
    bob.handshake.onKeyExchange("alice", new WireMessage.KeyExchange(0, clock.instant().getEpochSecond(), "alice",
        new byte[32]));

    final var response = (WireMessage.KeyExchangeResponse) bob.lastSent();
    assertEquals(KeyExchangeStatus.ERROR, response.status());
    assertEquals(0, response.publicKey().length);
    assertTrue(response.error().isPresent());
    assertFalse(bob.cipher.hasSession("alice"));

    bob.relayTo(alice);
    assertThat(alice.published).contains(new MeshEvent.PeerReportedError("bob", response.error().get()));
  }

  @Test
  void crossingRequestsSettleOnOneInitiator() {
    final var aliceOutcome = alice.handshake.initiate("bob");
    final var bobOutcome = bob.handshake.initiate("alice");

    bob.relayTo(alice);
    assertEquals(1, alice.transport.sent.size(), "alice keeps the initiator role and does not answer");
    alice.relayTo(bob);
    bob.relayTo(alice);

    assertEquals(HandshakeState.ESTABLISHED, aliceOutcome.join());
    assertEquals(HandshakeState.ESTABLISHED, bobOutcome.join());
    assertEquals(SessionKey.Role.INITIATOR, alice.cipher.session("bob").orElseThrow().localRole());
    assertSameKeys(alice.cipher, "bob", bob.cipher, "alice");
  }

  @Test
  void staleRequestIsIgnored() {
    final long old = clock.instant().minus(config.maxMessageAge()).getEpochSecond() - 1;

    bob.handshake.onKeyExchange("alice", new WireMessage.KeyExchange(0, old, "alice",
        X25519Key.generate().publicKey()));

    assertTrue(bob.transport.sent.isEmpty());
    assertFalse(bob.cipher.hasSession("alice"));
  }

  @Test
  void unsolicitedSuccessIsIgnored() {
    alice.handshake.onKeyExchangeResponse("bob", new WireMessage.KeyExchangeResponse(KeyExchangeStatus.SUCCESS,
        clock.instant().getEpochSecond(), "bob", X25519Key.generate().publicKey(), Optional.empty()));

    assertFalse(alice.cipher.hasSession("bob"));
  }

  @Test
  void lateAnswerToAnEarlierAttemptDerivesTheSameKeys() {
    final var first = alice.handshake.initiate("bob");
    scheduler.advance(Duration.ofSeconds(16));
    assertInstanceOf(HandshakeState.Failed.class, first.join());

    final var second = alice.handshake.initiate("bob");
    alice.relayTo(bob);
    bob.relayTo(alice);

    assertEquals(HandshakeState.ESTABLISHED, second.join());
    assertSameKeys(alice.cipher, "bob", bob.cipher, "alice");
  }

  @Test
  void everyHandshakeDerivesFreshKeys() {
    alice.handshake.initiate("bob");
    alice.relayTo(bob);
    bob.relayTo(alice);
    final var firstKey = alice.cipher.session("bob").orElseThrow().currentEncryptionKey();
    alice.cipher.removeSession("bob");
    bob.cipher.removeSession("alice");

    alice.handshake.initiate("bob");
    alice.relayTo(bob);
    bob.relayTo(alice);

    assertFalse(Arrays.equals(firstKey, alice.cipher.session("bob").orElseThrow().currentEncryptionKey()));
    assertSameKeys(alice.cipher, "bob", bob.cipher, "alice");
  }

  @Test
  void deviceIdIsMappedToTheTransportId() {
    final var carol = new Side("carol-radio");
    final var device = new HandshakeProtocol(new PeerIdentity("carol-radio", "carol-device"), X25519Key.generate(),
        carol.cipher, carol.connections, config, scheduler, carol.events, clock);
    carol.connectedTo("alice");
    alice.connectedTo("carol-radio");

    device.initiate("alice");
    carol.relayTo(alice);

    assertEquals(Optional.of("carol-radio"), alice.cipher.peerForDevice("carol-device"));
    assertTrue(alice.cipher.hasSession("carol-device"));
    assertThat(alice.published).contains(new MeshEvent.HandshakeCompleted("carol-radio", Optional.of("carol-device")));
    carol.connections.close();
  }

  @Test
  void repairDropsSessionsOfAbsentPeersAndStartsMissingHandshakes() {
    alice.handshake.initiate("bob");
    alice.relayTo(bob);
    bob.relayTo(alice);
    alice.connectedTo("carol");

    alice.handshake.repair(Set.of("carol"));

    assertFalse(alice.cipher.hasSession("bob"));
    assertTrue(alice.handshake.isInFlight("carol"));
    final var request = (WireMessage.KeyExchange) alice.lastSent();
    assertEquals("alice", request.senderId());
  }

  @Test
  void hkdfInfoIsOrderIndependent() {
    assertArrayEquals(HandshakeProtocol.info("alice", "bob"), HandshakeProtocol.info("bob", "alice"));
  }
}
