// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.network;

/// Callbacks from the radio transport. They may arrive concurrently from different threads.
public interface TransportListener {
  void onPeerFound(String peerId);

  void onPeerLost(String peerId);

  void onStateChanged(String peerId, TransportState state);

  void onBytesReceived(String peerId, byte[] bytes);
}
