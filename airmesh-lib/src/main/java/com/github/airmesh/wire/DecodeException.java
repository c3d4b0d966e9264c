// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.wire;

/// Raised for any malformed frame. Decoding never lets a runtime exception escape for bad input.
public class DecodeException extends Exception {
  private final DecodeError error;

  public DecodeException(DecodeError error, String message) {
    super(error + ": " + message);
    this.error = error;
  }

  public DecodeException(DecodeError error, String message, Throwable cause) {
    super(error + ": " + message, cause);
    this.error = error;
  }

  public DecodeError error() {
    return error;
  }
}
