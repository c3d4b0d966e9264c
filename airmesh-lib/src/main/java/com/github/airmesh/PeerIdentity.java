// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh;

import java.util.Objects;
import java.util.Optional;

/// A peer as seen by the mesh. The transport id is the ephemeral display name the radio layer reports. The device id
/// is the stable application level identifier a peer announces during the handshake.
public record PeerIdentity(String transportId, Optional<String> deviceId) {
  public PeerIdentity {
    Objects.requireNonNull(transportId, "transportId cannot be null");
    Objects.requireNonNull(deviceId, "deviceId cannot be null");
    if (transportId.isBlank()) {
      throw new IllegalArgumentException("transportId cannot be blank");
    }
    deviceId.ifPresent(d -> {
      if (d.isBlank()) {
        throw new IllegalArgumentException("deviceId cannot be blank");
      }
    });
  }

  public PeerIdentity(String transportId) {
    this(transportId, Optional.empty());
  }

  public PeerIdentity(String transportId, String deviceId) {
    this(transportId, Optional.of(deviceId));
  }

  /// The identifier written into key exchange frames.
  public String senderId() {
    return deviceId.orElse(transportId);
  }
}
