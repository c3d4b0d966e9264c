// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.network;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/// Snapshot of the connection attempt bookkeeping held for a peer.
///
/// @param inFlight    an invitation has been sent and neither a callback nor the safety timeout has cleared it
/// @param retryCount  retries used from the reconnect budget
/// @param nextRetryAt when the next retry is scheduled, if one is
public record ConnectionAttempt(boolean inFlight, int retryCount, Optional<Instant> nextRetryAt) {
  public ConnectionAttempt {
    Objects.requireNonNull(nextRetryAt, "nextRetryAt cannot be null");
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount cannot be negative: " + retryCount);
    }
  }
}
