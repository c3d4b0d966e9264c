// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

public enum CryptoError {
  NO_SESSION_KEY,
  KEY_EXCHANGE_FAILED,
  AUTHENTICATION_FAILED,
  /// The message number was already accepted, or its key has been consumed.
  REPLAY,
  /// The message number is further behind than the backtrack window allows.
  STALE_MESSAGE,
  /// The timestamp is outside the freshness window.
  MESSAGE_EXPIRED,
  DECRYPTION_FAILED,
  INVALID_FRAME
}
