// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.network;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;

import static com.github.airmesh.MeshLogger.LOGGER;

/// Synchronous event bus shared by the components of one node. Subscribers run on the publishing thread in
/// subscription order; an exception in one subscriber is logged and does not stop delivery to the others.
public class MeshEvents {
  private final List<NamedSubscriber<?>> subscribers = new CopyOnWriteArrayList<>();

  public <E extends MeshEvent> NamedSubscriber<E> subscribe(Class<E> type, Consumer<? super E> handler, String name) {
    final var subscriber = new NamedSubscriber<E>(type, handler, name);
    subscribers.add(subscriber);
    LOGGER.finer(() -> "Subscribed " + name + " to " + type.getSimpleName());
    return subscriber;
  }

  public void unsubscribe(NamedSubscriber<?> subscriber) {
    subscribers.remove(subscriber);
  }

  public void publish(MeshEvent event) {
    LOGGER.finer(() -> "Publishing " + event);
    for (NamedSubscriber<?> subscriber : subscribers) {
      try {
        subscriber.accept(event);
      } catch (RuntimeException e) {
        LOGGER.log(Level.SEVERE, "Subscriber " + subscriber.name() + " failed on " + event, e);
      }
    }
  }
}
