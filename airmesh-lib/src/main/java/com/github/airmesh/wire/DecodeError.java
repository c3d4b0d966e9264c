// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.wire;

public enum DecodeError {
  /// A declared length or fixed field reads past the end of the buffer.
  TRUNCATED,
  /// Byte 0 is not a protocol version this codec understands.
  UNSUPPORTED_VERSION,
  /// A field is present but its value is not valid, such as malformed UTF-8 or an unknown status code.
  INVALID_FIELD
}
