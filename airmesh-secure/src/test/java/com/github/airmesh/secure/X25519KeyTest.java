// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

import org.junit.jupiter.api.Test;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;

import static org.junit.jupiter.api.Assertions.*;

class X25519KeyTest {

  @Test
  void bothSidesComputeTheSameSecret() throws GeneralSecurityException {
    final var alice = X25519Key.generate();
    final var bob = X25519Key.generate();

    final var aliceSecret = alice.agree(bob.publicKey());
    final var bobSecret = bob.agree(alice.publicKey());

    assertEquals(32, aliceSecret.length);
    assertArrayEquals(aliceSecret, bobSecret);
  }

  @Test
  void publicKeyIsRaw() {
    final var key = X25519Key.generate();

    assertEquals(X25519Key.PUBLIC_KEY_LENGTH, key.publicKey().length);
    assertNotSame(key.publicKey(), key.publicKey());
  }

  @Test
  void wrongLengthIsRejected() {
    final var key = X25519Key.generate();

    assertThrows(InvalidKeyException.class, () -> key.agree(new byte[31]));
    assertThrows(InvalidKeyException.class, () -> key.agree(new byte[0]));
  }

  @Test
  void lowOrderPointIsRejected() {
    final var key = X25519Key.generate();

    assertThrows(InvalidKeyException.class, () -> key.agree(new byte[32]));
  }
}
