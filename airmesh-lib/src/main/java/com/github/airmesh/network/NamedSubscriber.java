// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.network;

import java.util.function.Consumer;

/// A named subscription to one class of [MeshEvent]. The name shows up in logs when a subscriber misbehaves.
public record NamedSubscriber<E extends MeshEvent>(Class<E> type, Consumer<? super E> handler, String name) {
  void accept(MeshEvent event) {
    if (type.isInstance(event)) {
      handler.accept(type.cast(event));
    }
  }
}
