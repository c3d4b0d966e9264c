// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;

/// HKDF with HMAC-SHA256 as described in RFC 5869. JEP 478 brings a key derivation API to later JDKs; until the
/// project can require one of those this small implementation is used.
public final class SimpleHKDF {
  static final String HMAC_SHA256 = "HmacSHA256";
  static final int HASH_LENGTH = 32;

  private SimpleHKDF() {
  }

  public static byte[] extract(byte[] salt, byte[] ikm) throws GeneralSecurityException {
    if (salt == null || salt.length == 0) {
      salt = new byte[HASH_LENGTH];
    }
    final Mac mac = Mac.getInstance(HMAC_SHA256);
    mac.init(new SecretKeySpec(salt, HMAC_SHA256));
    return mac.doFinal(ikm);
  }

  public static byte[] expand(byte[] prk, byte[] info, int length) throws GeneralSecurityException {
    if (length <= 0 || length > 255 * HASH_LENGTH) {
      throw new IllegalArgumentException("HKDF output length out of range: " + length);
    }
    final Mac mac = Mac.getInstance(HMAC_SHA256);
    mac.init(new SecretKeySpec(prk, HMAC_SHA256));

    final byte[] result = new byte[length];
    byte[] t = new byte[0];
    int offset = 0;
    for (int i = 1; offset < length; i++) {
      mac.update(t);
      if (info != null) {
        mac.update(info);
      }
      mac.update((byte) i);
      t = mac.doFinal();
      final int chunkLength = Math.min(t.length, length - offset);
      System.arraycopy(t, 0, result, offset, chunkLength);
      offset += chunkLength;
    }
    return result;
  }

  public static byte[] derive(byte[] salt, byte[] ikm, byte[] info, int length) throws GeneralSecurityException {
    return expand(extract(salt, ikm), info, length);
  }
}
