// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.network;

import java.util.Objects;
import java.util.Optional;

/// Typed events published on [MeshEvents]. Consumers subscribe to the event classes they care about.
public sealed interface MeshEvent {
  String peerId();

  record PeerConnected(String peerId) implements MeshEvent {
    public PeerConnected {
      Objects.requireNonNull(peerId);
    }
  }

  record PeerDisconnected(String peerId) implements MeshEvent {
    public PeerDisconnected {
      Objects.requireNonNull(peerId);
    }
  }

  /// The reconnect budget for a peer is exhausted.
  record PeerUnreachable(String peerId, int attempts) implements MeshEvent {
    public PeerUnreachable {
      Objects.requireNonNull(peerId);
    }
  }

  record HandshakeCompleted(String peerId, Optional<String> deviceId) implements MeshEvent {
    public HandshakeCompleted {
      Objects.requireNonNull(peerId);
      Objects.requireNonNull(deviceId);
    }
  }

  record HandshakeFailed(String peerId, String reason) implements MeshEvent {
    public HandshakeFailed {
      Objects.requireNonNull(peerId);
      Objects.requireNonNull(reason);
    }
  }

  /// The peer answered a key exchange with an error status.
  record PeerReportedError(String peerId, String error) implements MeshEvent {
    public PeerReportedError {
      Objects.requireNonNull(peerId);
      Objects.requireNonNull(error);
    }
  }
}
