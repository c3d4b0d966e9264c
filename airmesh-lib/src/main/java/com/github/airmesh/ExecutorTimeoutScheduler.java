// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;

import static com.github.airmesh.MeshLogger.LOGGER;

/// [TimeoutScheduler] backed by a single daemon thread named `airmesh-scheduler-<node>`.
public class ExecutorTimeoutScheduler implements TimeoutScheduler {
  private final String nodeName;
  private final ScheduledExecutorService executor;
  private final AtomicBoolean running = new AtomicBoolean(true);

  public ExecutorTimeoutScheduler(String nodeName) {
    this.nodeName = nodeName;
    final var threadPool = new ScheduledThreadPoolExecutor(1, runnable -> {
      final var thread = new Thread(runnable, "airmesh-scheduler-" + nodeName);
      thread.setDaemon(true);
      return thread;
    });
    threadPool.setRemoveOnCancelPolicy(true);
    this.executor = threadPool;
  }

  @Override
  public Timeout schedule(String name, Duration delay, Runnable task) {
    LOGGER.finest(() -> nodeName + " scheduling " + name + " in " + delay.toMillis() + "ms");
    return wrap(executor.schedule(guarded(name, task), delay.toMillis(), TimeUnit.MILLISECONDS));
  }

  @Override
  public Timeout scheduleRepeating(String name, Duration interval, Runnable task) {
    LOGGER.fine(() -> nodeName + " scheduling " + name + " every " + interval.toMillis() + "ms");
    final long millis = interval.toMillis();
    return wrap(executor.scheduleAtFixedRate(guarded(name, task), millis, millis, TimeUnit.MILLISECONDS));
  }

  @Override
  public void close() {
    if (running.compareAndSet(true, false)) {
      LOGGER.fine(() -> nodeName + " scheduler stopping");
      executor.shutdownNow();
    }
  }

  /// Exceptions are logged and absorbed so that repeating tasks keep running.
  private Runnable guarded(String name, Runnable task) {
    return () -> {
      if (!running.get()) {
        return;
      }
      try {
        task.run();
      } catch (RuntimeException e) {
        LOGGER.log(Level.SEVERE, nodeName + " scheduled task " + name + " failed", e);
      }
    };
  }

  private static Timeout wrap(ScheduledFuture<?> future) {
    return new Timeout() {
      @Override
      public void cancel() {
        future.cancel(false);
      }

      @Override
      public boolean isDone() {
        return future.isDone();
      }
    };
  }
}
