// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.network;

import java.time.Duration;

public final class Backoff {
  private static final int MAX_SHIFT = 16;

  private Backoff() {
  }

  /// The delay before retry number `attempt` (starting at 1): `base * 2^(attempt - 1)`.
  public static Duration exponential(Duration base, int attempt) {
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt starts at 1: " + attempt);
    }
    return base.multipliedBy(1L << Math.min(attempt - 1, MAX_SHIFT));
  }
}
