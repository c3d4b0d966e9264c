// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

import org.junit.jupiter.api.Test;

import java.security.GeneralSecurityException;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

/// Test vectors from RFC 5869 appendix A.
class SimpleHKDFTest {
  static final HexFormat HEX = HexFormat.of();

  @Test
  void basicCase() throws GeneralSecurityException {
    final byte[] ikm = HEX.parseHex("0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b");
    final byte[] salt = HEX.parseHex("000102030405060708090a0b0c");
    final byte[] info = HEX.parseHex("f0f1f2f3f4f5f6f7f8f9");

    final byte[] prk = SimpleHKDF.extract(salt, ikm);
    assertEquals("077709362c2e32df0ddc3f0dc47bba6390b6c73bb50f9c3122ec844ad7c2b3e5", HEX.formatHex(prk));

    final byte[] okm = SimpleHKDF.expand(prk, info, 42);
    assertEquals("3cb25f25faacd57a90434f64d0362f2a2d2d0a90cf1a5a4c5db02d56ecc4c5bf34007208d5b887185865",
        HEX.formatHex(okm));
  }

  @Test
  void emptySaltAndInfo() throws GeneralSecurityException {
    final byte[] ikm = HEX.parseHex("0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b");

    final byte[] okm = SimpleHKDF.derive(new byte[0], ikm, new byte[0], 42);

    assertEquals("8da4e775a563c18f715f802a063c5a31b8a11f5c5ee1879ec3454e5f3c738d2d9d201395faa4b61a96c8",
        HEX.formatHex(okm));
  }

  @Test
  void outputLengthIsBounded() {
    final byte[] prk = new byte[32];
    assertThrows(IllegalArgumentException.class, () -> SimpleHKDF.expand(prk, null, 0));
    assertThrows(IllegalArgumentException.class, () -> SimpleHKDF.expand(prk, null, 255 * 32 + 1));
  }
}
