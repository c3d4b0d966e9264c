// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.wire;

/// The type tag in byte 1 of every frame. Known tags are a [MessageType]. Tags this version does not understand are
/// kept as an [UnknownType] carrying the raw value so that newer peers can be logged rather than rejected.
public sealed interface FrameType permits MessageType, UnknownType {
  int tag();

  static FrameType of(int tag) {
    final FrameType known = MessageType.fromTag(tag).orElse(null);
    return known != null ? known : new UnknownType(tag);
  }
}
