// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.wire;

import java.util.Arrays;
import java.util.Objects;

/// The envelope produced by the session cipher and carried as the payload of a confidential frame.
///
/// @param messageNumber position in the session's key ratchet
/// @param timestamp     seconds since the epoch when the frame was sealed
/// @param hmac          HMAC-SHA256 over `ciphertext`
/// @param ciphertext    the AEAD nonce followed by the sealed plaintext and tag
public record EncryptedFrame(long messageNumber, long timestamp, byte[] hmac, byte[] ciphertext) {
  public EncryptedFrame {
    if (messageNumber < 0) {
      throw new IllegalArgumentException("messageNumber cannot be negative: " + messageNumber);
    }
    Objects.requireNonNull(hmac, "hmac cannot be null");
    Objects.requireNonNull(ciphertext, "ciphertext cannot be null");
    if (hmac.length > 0xFFFF) {
      throw new IllegalArgumentException("hmac is too long: " + hmac.length);
    }
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof EncryptedFrame that
        && messageNumber == that.messageNumber
        && timestamp == that.timestamp
        && Arrays.equals(hmac, that.hmac)
        && Arrays.equals(ciphertext, that.ciphertext);
  }

  @Override
  public int hashCode() {
    return (Long.hashCode(messageNumber) * 31 + Long.hashCode(timestamp)) * 31
        + Arrays.hashCode(hmac) * 17 + Arrays.hashCode(ciphertext);
  }

  @Override
  public String toString() {
    return String.format("EncryptedFrame[messageNumber=%d, timestamp=%d, hmac=byte[%d], ciphertext=byte[%d]]",
        messageNumber, timestamp, hmac.length, ciphertext.length);
  }
}
