// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

import com.github.airmesh.MeshConfig;
import com.github.airmesh.TimeoutScheduler;
import com.github.airmesh.network.ConnectionManager;
import com.github.airmesh.network.SendResult;
import com.github.airmesh.wire.MessageType;
import com.github.airmesh.wire.WireCodec;
import com.github.airmesh.wire.WireMessage;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.github.airmesh.MeshLogger.LOGGER;

/// Checks that a freshly connected link carries traffic before a handshake is attempted over it. A number of small
/// SYSTEM frames are sent at a fixed interval; the link counts as stable when enough of them are accepted by the
/// transport. Receivers drop the probe frames silently.
public class StabilityProbe {
  /// Leads every probe payload. Text payloads never start with a NUL byte so feature traffic cannot be mistaken
  /// for a probe.
  static final byte MARKER = 0;
  static final String PREFIX = "stability-test-";
  private static final byte[] PREFIX_BYTES = PREFIX.getBytes(StandardCharsets.UTF_8);

  private final ConnectionManager connections;
  private final TimeoutScheduler scheduler;
  private final MeshConfig config;

  public StabilityProbe(ConnectionManager connections, TimeoutScheduler scheduler, MeshConfig config) {
    this.connections = connections;
    this.scheduler = scheduler;
    this.config = config;
  }

  /// @return completes with true when at least `stabilityProbeRequired` of `stabilityProbeCount` frames were sent
  public CompletableFuture<Boolean> probe(String peerId) {
    final var done = new CompletableFuture<Boolean>();
    if (config.stabilityProbeCount() == 0) {
      done.complete(true);
      return done;
    }
    sendProbe(peerId, 0, Collections.synchronizedList(new ArrayList<>()), done);
    return done;
  }

  private void sendProbe(String peerId, int index, List<CompletableFuture<SendResult>> results,
                         CompletableFuture<Boolean> done) {
    final var payload = payload(index);
    results.add(connections.send(peerId, WireCodec.encode(new WireMessage.Payload(MessageType.SYSTEM, payload))));
    if (index + 1 < config.stabilityProbeCount()) {
      scheduler.schedule("stability-probe-" + peerId, config.stabilityProbeInterval(),
          () -> sendProbe(peerId, index + 1, results, done));
      return;
    }
    CompletableFuture.allOf(results.toArray(new CompletableFuture<?>[0])).thenRun(() -> {
      final long delivered = results.stream().filter(r -> r.join() == SendResult.SUCCESS).count();
      LOGGER.fine(() -> "Stability probe to " + peerId + " delivered " + delivered + "/"
          + config.stabilityProbeCount());
      done.complete(delivered >= config.stabilityProbeRequired());
    });
  }

  static byte[] payload(int index) {
    final var text = (PREFIX + index).getBytes(StandardCharsets.UTF_8);
    final var payload = new byte[1 + text.length];
    payload[0] = MARKER;
    System.arraycopy(text, 0, payload, 1, text.length);
    return payload;
  }

  static boolean isProbe(byte[] payload) {
    if (payload.length < 1 + PREFIX_BYTES.length || payload[0] != MARKER) {
      return false;
    }
    for (int i = 0; i < PREFIX_BYTES.length; i++) {
      if (payload[1 + i] != PREFIX_BYTES[i]) {
        return false;
      }
    }
    return true;
  }
}
