// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

/// A per-message cryptographic failure. The message is dropped; the connection and session are unaffected.
public class CryptoException extends Exception {
  private final CryptoError error;

  public CryptoException(CryptoError error, String message) {
    super(error + ": " + message);
    this.error = error;
  }

  public CryptoException(CryptoError error, String message, Throwable cause) {
    super(error + ": " + message, cause);
    this.error = error;
  }

  public CryptoError error() {
    return error;
  }
}
