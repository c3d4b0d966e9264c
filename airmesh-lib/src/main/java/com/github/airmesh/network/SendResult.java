// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.network;

/// Outcome of handing bytes to the mesh. The transport itself only reports the first three values.
public enum SendResult {
  SUCCESS,
  /// The destination is not connected. Informational, the connection state is re-synchronised.
  NOT_CONNECTED,
  /// The transport failed to deliver after the configured retries.
  FAILED,
  /// No secure session could be established for a confidential message.
  NO_SESSION
}
