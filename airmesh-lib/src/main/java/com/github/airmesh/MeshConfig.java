// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh;

import com.github.airmesh.wire.MessageType;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/// Tunable policy for a mesh node. Every value has a default taken from field experience with small meshes of phones
/// so [#defaults()] is a sensible starting point; tests shrink the timeouts and limits through [#toBuilder()].
///
/// @param maxConnections         concurrent connection ceiling
/// @param connectTimeout         timeout handed to the transport when inviting a peer
/// @param attemptSafetyTimeout   an in-flight connection attempt is forgotten after this even without a callback
/// @param maxReconnectAttempts   reconnects tried after an unexpected disconnect
/// @param reconnectBaseDelay     first reconnect delay, doubled on each further attempt
/// @param repairInterval         period of the session repair pass
/// @param maxSendAttempts        attempts for a send that the transport reports as failed
/// @param sendRetryBaseDelay     first send retry delay, doubled on each further attempt
/// @param handshakeMaxAttempts   key exchange frames sent before a handshake is declared failed
/// @param handshakeResponseTimeout wait for a response to a single key exchange frame
/// @param handshakeBackoffBase   first delay between key exchange attempts, doubled on each further attempt
/// @param maxMessagesPerKey      message count after which a session is discarded
/// @param keyRotationInterval    age after which a session is discarded
/// @param backtrackWindow        how far behind the current message number a frame may arrive
/// @param maxForwardSkip         how far ahead of the current message number a frame may arrive
/// @param maxMessageAge          freshness window for encrypted frames and key exchange requests
/// @param stabilityProbeCount    probes sent before a connect triggered handshake, zero disables probing
/// @param stabilityProbeRequired probes that must be delivered for the link to count as stable
/// @param stabilityProbeInterval gap between probes
/// @param floodLimit             inbound frames accepted per peer inside one flood window
/// @param floodWindow            length of the flood window
/// @param floodBanDuration       how long a peer that exceeds the flood limit is ignored, doubled for each repeat
///                               offence; zero disables banning
/// @param maxPendingBytes        plaintext buffered per peer while waiting for a session
/// @param confidentialTypes      message types that are always encrypted
public record MeshConfig(
    int maxConnections,
    Duration connectTimeout,
    Duration attemptSafetyTimeout,
    int maxReconnectAttempts,
    Duration reconnectBaseDelay,
    Duration repairInterval,
    int maxSendAttempts,
    Duration sendRetryBaseDelay,
    int handshakeMaxAttempts,
    Duration handshakeResponseTimeout,
    Duration handshakeBackoffBase,
    long maxMessagesPerKey,
    Duration keyRotationInterval,
    int backtrackWindow,
    int maxForwardSkip,
    Duration maxMessageAge,
    int stabilityProbeCount,
    int stabilityProbeRequired,
    Duration stabilityProbeInterval,
    int floodLimit,
    Duration floodWindow,
    Duration floodBanDuration,
    int maxPendingBytes,
    Set<MessageType> confidentialTypes
) {

  public MeshConfig {
    positive("maxConnections", maxConnections);
    positive("connectTimeout", connectTimeout);
    positive("attemptSafetyTimeout", attemptSafetyTimeout);
    notNegative("maxReconnectAttempts", maxReconnectAttempts);
    positive("reconnectBaseDelay", reconnectBaseDelay);
    positive("repairInterval", repairInterval);
    positive("maxSendAttempts", maxSendAttempts);
    positive("sendRetryBaseDelay", sendRetryBaseDelay);
    positive("handshakeMaxAttempts", handshakeMaxAttempts);
    positive("handshakeResponseTimeout", handshakeResponseTimeout);
    positive("handshakeBackoffBase", handshakeBackoffBase);
    if (maxMessagesPerKey <= 0) {
      throw new IllegalArgumentException("maxMessagesPerKey must be positive: " + maxMessagesPerKey);
    }
    positive("keyRotationInterval", keyRotationInterval);
    notNegative("backtrackWindow", backtrackWindow);
    positive("maxForwardSkip", maxForwardSkip);
    positive("maxMessageAge", maxMessageAge);
    notNegative("stabilityProbeCount", stabilityProbeCount);
    notNegative("stabilityProbeRequired", stabilityProbeRequired);
    if (stabilityProbeRequired > stabilityProbeCount) {
      throw new IllegalArgumentException("stabilityProbeRequired " + stabilityProbeRequired
          + " exceeds stabilityProbeCount " + stabilityProbeCount);
    }
    positive("stabilityProbeInterval", stabilityProbeInterval);
    positive("floodLimit", floodLimit);
    positive("floodWindow", floodWindow);
    Objects.requireNonNull(floodBanDuration, "floodBanDuration cannot be null");
    if (floodBanDuration.isNegative()) {
      throw new IllegalArgumentException("floodBanDuration cannot be negative: " + floodBanDuration);
    }
    positive("maxPendingBytes", maxPendingBytes);
    Objects.requireNonNull(confidentialTypes, "confidentialTypes cannot be null");
    if (confidentialTypes.contains(MessageType.KEY_EXCHANGE)
        || confidentialTypes.contains(MessageType.KEY_EXCHANGE_RESPONSE)) {
      throw new IllegalArgumentException("key exchange frames establish the keys so cannot be encrypted");
    }
    confidentialTypes = Set.copyOf(confidentialTypes);
  }

  public static MeshConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public boolean isConfidential(MessageType type) {
    return confidentialTypes.contains(type);
  }

  private static void positive(String name, int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be positive: " + value);
    }
  }

  private static void notNegative(String name, int value) {
    if (value < 0) {
      throw new IllegalArgumentException(name + " cannot be negative: " + value);
    }
  }

  private static void positive(String name, Duration value) {
    Objects.requireNonNull(value, name + " cannot be null");
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive: " + value);
    }
  }

  public static final class Builder {
    private int maxConnections = 15;
    private Duration connectTimeout = Duration.ofSeconds(30);
    private Duration attemptSafetyTimeout = Duration.ofSeconds(35);
    private int maxReconnectAttempts = 3;
    private Duration reconnectBaseDelay = Duration.ofSeconds(2);
    private Duration repairInterval = Duration.ofSeconds(30);
    private int maxSendAttempts = 3;
    private Duration sendRetryBaseDelay = Duration.ofMillis(200);
    private int handshakeMaxAttempts = 3;
    private Duration handshakeResponseTimeout = Duration.ofSeconds(3);
    private Duration handshakeBackoffBase = Duration.ofSeconds(2);
    private long maxMessagesPerKey = 500;
    private Duration keyRotationInterval = Duration.ofMinutes(5);
    private int backtrackWindow = 10;
    private int maxForwardSkip = 64;
    private Duration maxMessageAge = Duration.ofMinutes(5);
    private int stabilityProbeCount = 3;
    private int stabilityProbeRequired = 2;
    private Duration stabilityProbeInterval = Duration.ofMillis(500);
    private int floodLimit = 100;
    private Duration floodWindow = Duration.ofSeconds(1);
    private Duration floodBanDuration = Duration.ofMinutes(5);
    private int maxPendingBytes = 64240;
    private Set<MessageType> confidentialTypes = EnumSet.of(
        MessageType.SIGNAL, MessageType.EMERGENCY, MessageType.CHAT, MessageType.GAME);

    private Builder() {
    }

    private Builder(MeshConfig config) {
      maxConnections = config.maxConnections;
      connectTimeout = config.connectTimeout;
      attemptSafetyTimeout = config.attemptSafetyTimeout;
      maxReconnectAttempts = config.maxReconnectAttempts;
      reconnectBaseDelay = config.reconnectBaseDelay;
      repairInterval = config.repairInterval;
      maxSendAttempts = config.maxSendAttempts;
      sendRetryBaseDelay = config.sendRetryBaseDelay;
      handshakeMaxAttempts = config.handshakeMaxAttempts;
      handshakeResponseTimeout = config.handshakeResponseTimeout;
      handshakeBackoffBase = config.handshakeBackoffBase;
      maxMessagesPerKey = config.maxMessagesPerKey;
      keyRotationInterval = config.keyRotationInterval;
      backtrackWindow = config.backtrackWindow;
      maxForwardSkip = config.maxForwardSkip;
      maxMessageAge = config.maxMessageAge;
      stabilityProbeCount = config.stabilityProbeCount;
      stabilityProbeRequired = config.stabilityProbeRequired;
      stabilityProbeInterval = config.stabilityProbeInterval;
      floodLimit = config.floodLimit;
      floodWindow = config.floodWindow;
      floodBanDuration = config.floodBanDuration;
      maxPendingBytes = config.maxPendingBytes;
      confidentialTypes = config.confidentialTypes;
    }

    public Builder maxConnections(int value) {
      maxConnections = value;
      return this;
    }

    public Builder connectTimeout(Duration value) {
      connectTimeout = value;
      return this;
    }

    public Builder attemptSafetyTimeout(Duration value) {
      attemptSafetyTimeout = value;
      return this;
    }

    public Builder maxReconnectAttempts(int value) {
      maxReconnectAttempts = value;
      return this;
    }

    public Builder reconnectBaseDelay(Duration value) {
      reconnectBaseDelay = value;
      return this;
    }

    public Builder repairInterval(Duration value) {
      repairInterval = value;
      return this;
    }

    public Builder maxSendAttempts(int value) {
      maxSendAttempts = value;
      return this;
    }

    public Builder sendRetryBaseDelay(Duration value) {
      sendRetryBaseDelay = value;
      return this;
    }

    public Builder handshakeMaxAttempts(int value) {
      handshakeMaxAttempts = value;
      return this;
    }

    public Builder handshakeResponseTimeout(Duration value) {
      handshakeResponseTimeout = value;
      return this;
    }

    public Builder handshakeBackoffBase(Duration value) {
      handshakeBackoffBase = value;
      return this;
    }

    public Builder maxMessagesPerKey(long value) {
      maxMessagesPerKey = value;
      return this;
    }

    public Builder keyRotationInterval(Duration value) {
      keyRotationInterval = value;
      return this;
    }

    public Builder backtrackWindow(int value) {
      backtrackWindow = value;
      return this;
    }

    public Builder maxForwardSkip(int value) {
      maxForwardSkip = value;
      return this;
    }

    public Builder maxMessageAge(Duration value) {
      maxMessageAge = value;
      return this;
    }

    /// Disables the stability probe when `count` is zero.
    public Builder stabilityProbe(int count, int required, Duration interval) {
      stabilityProbeCount = count;
      stabilityProbeRequired = required;
      stabilityProbeInterval = interval;
      return this;
    }

    public Builder floodLimit(int limit, Duration window) {
      floodLimit = limit;
      floodWindow = window;
      return this;
    }

    /// A zero duration disables banning.
    public Builder floodBanDuration(Duration value) {
      floodBanDuration = value;
      return this;
    }

    public Builder maxPendingBytes(int value) {
      maxPendingBytes = value;
      return this;
    }

    public Builder confidentialTypes(Set<MessageType> value) {
      confidentialTypes = value;
      return this;
    }

    public MeshConfig build() {
      return new MeshConfig(maxConnections, connectTimeout, attemptSafetyTimeout, maxReconnectAttempts,
          reconnectBaseDelay, repairInterval, maxSendAttempts, sendRetryBaseDelay, handshakeMaxAttempts,
          handshakeResponseTimeout, handshakeBackoffBase, maxMessagesPerKey, keyRotationInterval, backtrackWindow,
          maxForwardSkip, maxMessageAge, stabilityProbeCount, stabilityProbeRequired, stabilityProbeInterval,
          floodLimit, floodWindow, floodBanDuration, maxPendingBytes, confidentialTypes);
    }
  }
}
