// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Secure sessions over the mesh: X25519 handshakes, the ratcheting session cipher and the message router that
/// decrypts confidential frames before handing them to feature handlers. [com.github.airmesh.secure.MeshNode] wires
/// the parts of one node together.
package com.github.airmesh.secure;
