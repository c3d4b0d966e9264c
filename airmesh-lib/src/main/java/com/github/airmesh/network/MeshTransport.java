// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.network;

import java.time.Duration;
import java.util.Collection;

/// The narrow view of the peer-to-peer radio layer. It is treated as an unreliable byte pipe between discovered peers:
/// delivery is at-least-once and may be reordered, and nothing sent through it is encrypted or authenticated.
public interface MeshTransport extends AutoCloseable {

  /// Starts advertising and browsing. Discovery, state changes and inbound bytes are reported to the listener.
  void discoverPeers(TransportListener listener);

  /// Invites a discovered peer. The outcome arrives later through [TransportListener#onStateChanged].
  void connect(String peerId, Duration timeout);

  void disconnect(String peerId);

  /// Sends the same bytes to every listed peer. Returns [SendResult#SUCCESS], [SendResult#NOT_CONNECTED] or
  /// [SendResult#FAILED].
  SendResult send(byte[] bytes, Collection<String> peerIds);

  @Override
  void close();
}
