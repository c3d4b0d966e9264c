// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

import javax.crypto.KeyAgreement;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;

/// An X25519 key pair. Public keys travel as the raw 32 byte u-coordinate; the JDK wants them wrapped in an X.509
/// SubjectPublicKeyInfo so the fixed DER prefix is added and stripped here.
public final class X25519Key {
  public static final int PUBLIC_KEY_LENGTH = 32;

  /// DER header of an X25519 SubjectPublicKeyInfo (OID 1.3.101.110) holding a 32 byte key.
  private static final byte[] X509_PREFIX = {
      0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x6e, 0x03, 0x21, 0x00};

  private final KeyPair keyPair;
  private final byte[] publicKey;

  private X25519Key(KeyPair keyPair) {
    this.keyPair = keyPair;
    final byte[] encoded = keyPair.getPublic().getEncoded();
    this.publicKey = Arrays.copyOfRange(encoded, encoded.length - PUBLIC_KEY_LENGTH, encoded.length);
  }

  public static X25519Key generate() {
    try {
      return new X25519Key(KeyPairGenerator.getInstance("X25519").generateKeyPair());
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("X25519 is not available on this JVM", e);
    }
  }

  /// The raw 32 byte public key.
  public byte[] publicKey() {
    return publicKey.clone();
  }

  /// Computes the shared secret with a peer's raw public key.
  ///
  /// @throws InvalidKeyException if the key has the wrong length or is a low order point
  public byte[] agree(byte[] peerPublicKey) throws GeneralSecurityException {
    final KeyAgreement agreement = KeyAgreement.getInstance("X25519");
    agreement.init(keyPair.getPrivate());
    agreement.doPhase(decodePublicKey(peerPublicKey), true);
    return agreement.generateSecret();
  }

  static PublicKey decodePublicKey(byte[] raw) throws GeneralSecurityException {
    if (raw == null || raw.length != PUBLIC_KEY_LENGTH) {
      throw new InvalidKeyException("X25519 public key must be " + PUBLIC_KEY_LENGTH + " bytes but was "
          + (raw == null ? "null" : raw.length));
    }
    final var encoded = new byte[X509_PREFIX.length + PUBLIC_KEY_LENGTH];
    System.arraycopy(X509_PREFIX, 0, encoded, 0, X509_PREFIX.length);
    System.arraycopy(raw, 0, encoded, X509_PREFIX.length, PUBLIC_KEY_LENGTH);
    return KeyFactory.getInstance("X25519").generatePublic(new X509EncodedKeySpec(encoded));
  }
}
