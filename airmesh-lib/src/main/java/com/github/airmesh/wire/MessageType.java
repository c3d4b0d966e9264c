// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.wire;

import java.util.Optional;

public enum MessageType implements FrameType {
  SIGNAL(1),
  EMERGENCY(2),
  CHAT(3),
  SYSTEM(4),
  KEY_EXCHANGE(5),
  GAME(6),
  TOPOLOGY(7),
  KEY_EXCHANGE_RESPONSE(8);

  private static final MessageType[] BY_TAG = new MessageType[256];

  static {
    for (MessageType type : values()) {
      BY_TAG[type.tag] = type;
    }
  }

  private final int tag;

  MessageType(int tag) {
    this.tag = tag;
  }

  @Override
  public int tag() {
    return tag;
  }

  /// Key exchange frames are handled by the handshake and are never encrypted.
  public boolean isKeyExchange() {
    return this == KEY_EXCHANGE || this == KEY_EXCHANGE_RESPONSE;
  }

  public static Optional<MessageType> fromTag(int tag) {
    if (tag < 0 || tag >= BY_TAG.length) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_TAG[tag]);
  }
}
