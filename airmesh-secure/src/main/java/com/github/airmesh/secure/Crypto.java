// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.SecureRandom;

/// Symmetric primitives used by the session cipher: AES-256-GCM sealing with a random nonce, HMAC-SHA256 and the
/// one way ratchet step. Cipher, MAC and random instances are cached per thread.
public final class Crypto {
  public static final int KEY_LENGTH = 32;
  public static final int GCM_NONCE_LENGTH = 12;
  public static final int GCM_TAG_LENGTH = 16;
  static final int GCM_TAG_LENGTH_BITS = GCM_TAG_LENGTH * 8;

  private static final ThreadLocal<SecureRandom> RANDOM = ThreadLocal.withInitial(SecureRandom::new);
  private static final ThreadLocal<Cipher> CIPHER = ThreadLocal.withInitial(() -> {
    try {
      return Cipher.getInstance("AES/GCM/NoPadding");
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Required crypto algorithm unavailable", e);
    }
  });
  private static final ThreadLocal<Mac> HMAC = ThreadLocal.withInitial(() -> {
    try {
      return Mac.getInstance(SimpleHKDF.HMAC_SHA256);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Required crypto algorithm unavailable", e);
    }
  });

  private Crypto() {
  }

  /// Encrypts `plaintext` under a fresh random nonce.
  ///
  /// @return `nonce || ciphertext || tag`
  /// @throws SecurityException if the platform cipher fails
  public static byte[] seal(byte[] key, byte[] aad, byte[] plaintext) {
    try {
      final byte[] nonce = randomBytes(GCM_NONCE_LENGTH);
      final Cipher cipher = CIPHER.get();
      cipher.init(Cipher.ENCRYPT_MODE,
          new SecretKeySpec(key, "AES"),
          new GCMParameterSpec(GCM_TAG_LENGTH_BITS, nonce));
      cipher.updateAAD(aad);
      final byte[] sealed = cipher.doFinal(plaintext);
      return ByteBuffer.allocate(nonce.length + sealed.length).put(nonce).put(sealed).array();
    } catch (GeneralSecurityException e) {
      throw new SecurityException("Encryption failed", e);
    }
  }

  /// Reverses [#seal]. A wrong key, wrong AAD or any modified byte surfaces as
  /// [javax.crypto.AEADBadTagException].
  public static byte[] open(byte[] key, byte[] aad, byte[] sealed) throws GeneralSecurityException {
    if (sealed.length < GCM_NONCE_LENGTH + GCM_TAG_LENGTH) {
      throw new GeneralSecurityException("Sealed data of " + sealed.length + " bytes is too short");
    }
    final Cipher cipher = CIPHER.get();
    cipher.init(Cipher.DECRYPT_MODE,
        new SecretKeySpec(key, "AES"),
        new GCMParameterSpec(GCM_TAG_LENGTH_BITS, sealed, 0, GCM_NONCE_LENGTH));
    cipher.updateAAD(aad);
    return cipher.doFinal(sealed, GCM_NONCE_LENGTH, sealed.length - GCM_NONCE_LENGTH);
  }

  public static byte[] hmac(byte[] key, byte[] data) {
    final Mac mac = HMAC.get();
    try {
      mac.init(new SecretKeySpec(key, SimpleHKDF.HMAC_SHA256));
    } catch (InvalidKeyException e) {
      throw new IllegalArgumentException("Invalid HMAC key", e);
    }
    return mac.doFinal(data);
  }

  /// One ratchet step: `HMAC(key, label || counter)` with the counter as eight big-endian bytes. The previous key
  /// cannot be recovered from the result.
  public static byte[] ratchet(byte[] key, byte[] label, long counter) {
    return hmac(key, ByteBuffer.allocate(label.length + Long.BYTES).put(label).putLong(counter).array());
  }

  public static boolean constantTimeEquals(byte[] a, byte[] b) {
    return MessageDigest.isEqual(a, b);
  }

  public static byte[] randomBytes(int length) {
    final var bytes = new byte[length];
    RANDOM.get().nextBytes(bytes);
    return bytes;
  }
}
