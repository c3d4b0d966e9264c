// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.wire;

public record UnknownType(int tag) implements FrameType {
  public UnknownType {
    if (tag < 0 || tag > 255) {
      throw new IllegalArgumentException("Type tag must fit in one byte: " + tag);
    }
    if (MessageType.fromTag(tag).isPresent()) {
      throw new IllegalArgumentException("Type tag " + tag + " is a known message type");
    }
  }
}
