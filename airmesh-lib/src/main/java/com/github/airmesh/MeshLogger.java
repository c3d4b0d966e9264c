// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.logging.Logger;

/// Shared logger for all AirMesh components. Configure the `com.github.airmesh` logger to control the output.
public final class MeshLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.airmesh");
  static final int FINGERPRINT_BYTES = 4;

  private MeshLogger() {
  }

  /// The first [#FINGERPRINT_BYTES] bytes of the SHA-256 of key material, in hex. Lets logs correlate keys
  /// without revealing any of their bits.
  public static String fingerprint(byte[] keyMaterial) {
    try {
      final byte[] digest = MessageDigest.getInstance("SHA-256").digest(keyMaterial);
      return HexFormat.of().formatHex(Arrays.copyOf(digest, FINGERPRINT_BYTES));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available on this JVM", e);
    }
  }
}
