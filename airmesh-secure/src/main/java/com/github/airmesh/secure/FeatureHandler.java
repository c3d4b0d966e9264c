// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

/// Receives decoded, and where the type is confidential decrypted, payloads for one message type.
///
/// SYSTEM payloads that start with a NUL byte followed by `stability-test-` are link probes. The router consumes
/// them and never hands them to a handler.
@FunctionalInterface
public interface FeatureHandler {
  void onMessage(byte[] payload, String senderPeerId);
}
