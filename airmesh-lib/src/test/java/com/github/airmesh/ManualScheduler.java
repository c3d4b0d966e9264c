// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

import static com.github.airmesh.MeshLogger.LOGGER;

/// Deterministic [TimeoutScheduler] for tests. Nothing runs until the test calls [#advance], which moves the shared
/// [MutableClock] forward and runs every task that falls due, in due order, on the calling thread.
public class ManualScheduler implements TimeoutScheduler {

  private static final class Task implements Timeout {
    final String name;
    final Runnable runnable;
    final Duration repeat;
    final long sequence;
    Instant due;
    boolean cancelled;
    boolean done;

    Task(String name, Runnable runnable, Duration repeat, long sequence, Instant due) {
      this.name = name;
      this.runnable = runnable;
      this.repeat = repeat;
      this.sequence = sequence;
      this.due = due;
    }

    @Override
    public void cancel() {
      cancelled = true;
    }

    @Override
    public boolean isDone() {
      return done || cancelled;
    }
  }

  private final MutableClock clock;
  private final PriorityQueue<Task> queue = new PriorityQueue<>(
      Comparator.comparing((Task t) -> t.due).thenComparingLong(t -> t.sequence));
  private long sequence;

  public ManualScheduler(MutableClock clock) {
    this.clock = clock;
  }

  @Override
  public Timeout schedule(String name, Duration delay, Runnable task) {
    final var scheduled = new Task(name, task, null, sequence++, clock.instant().plus(delay));
    queue.add(scheduled);
    return scheduled;
  }

  @Override
  public Timeout scheduleRepeating(String name, Duration interval, Runnable task) {
    final var scheduled = new Task(name, task, interval, sequence++, clock.instant().plus(interval));
    queue.add(scheduled);
    return scheduled;
  }

  /// Moves time forward by `duration`, running everything that falls due on the way.
  public void advance(Duration duration) {
    final var target = clock.instant().plus(duration);
    while (true) {
      final var next = queue.peek();
      if (next == null || next.due.isAfter(target)) {
        break;
      }
      queue.poll();
      if (next.cancelled) {
        continue;
      }
      if (next.due.isAfter(clock.instant())) {
        clock.set(next.due);
      }
      LOGGER.finest(() -> "ManualScheduler running " + next.name + " at " + next.due);
      next.runnable.run();
      if (next.repeat != null && !next.cancelled) {
        next.due = next.due.plus(next.repeat);
        queue.add(next);
      } else {
        next.done = true;
      }
    }
    clock.set(target);
  }

  /// Runs the tasks that are already due without moving time.
  public void runDue() {
    advance(Duration.ZERO);
  }

  public List<String> pendingTaskNames() {
    final List<String> names = new ArrayList<>();
    queue.stream().filter(t -> !t.cancelled).sorted(queue.comparator()).forEach(t -> names.add(t.name));
    return names;
  }

  @Override
  public void close() {
    queue.forEach(Task::cancel);
    queue.clear();
  }
}
