// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.network;

import java.util.Set;

/// Invoked by the periodic repair pass of the [ConnectionManager] with a snapshot of the connected peers.
@FunctionalInterface
public interface SessionMaintenance {
  void repair(Set<String> connectedPeers);
}
