// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.network;

/// Connection states reported by the radio transport for a single peer.
public enum TransportState {
  CONNECTING,
  CONNECTED,
  NOT_CONNECTED
}
