// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.wire;

import java.util.Optional;

/// Outcome reported by the responder of a key exchange.
public enum KeyExchangeStatus {
  SUCCESS(0),
  ALREADY_ESTABLISHED(1),
  ERROR(2);

  private final int code;

  KeyExchangeStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static Optional<KeyExchangeStatus> fromCode(int code) {
    for (KeyExchangeStatus status : values()) {
      if (status.code == code) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }
}
