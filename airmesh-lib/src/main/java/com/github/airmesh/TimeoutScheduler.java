// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh;

import java.time.Duration;

/// Handles scheduling of timeouts, retries and periodic repair for a mesh node. Tasks must be short: they run on the
/// node's scheduling thread and must never block it.
public interface TimeoutScheduler extends AutoCloseable {

  /// A scheduled task that can be cancelled before it runs.
  interface Timeout {
    void cancel();

    boolean isDone();
  }

  Timeout schedule(String name, Duration delay, Runnable task);

  Timeout scheduleRepeating(String name, Duration interval, Runnable task);

  @Override
  void close();
}
