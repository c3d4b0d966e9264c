// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.secure;

import java.time.Instant;
import java.util.Objects;

/// Per-peer handshake progress as seen by the local node.
public sealed interface HandshakeState {

  record NoSession() implements HandshakeState {
  }

  /// A request is outstanding. `retryCount` is zero for the first attempt.
  record RequestSent(int retryCount, Instant sentAt) implements HandshakeState {
    public RequestSent {
      Objects.requireNonNull(sentAt);
    }
  }

  record Established() implements HandshakeState {
  }

  /// Terminal until a fresh connect, a repair pass or an explicit initiate starts a new attempt.
  record Failed(String reason) implements HandshakeState {
    public Failed {
      Objects.requireNonNull(reason);
    }
  }

  HandshakeState NO_SESSION = new NoSession();
  HandshakeState ESTABLISHED = new Established();
}
