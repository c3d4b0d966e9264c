// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.wire;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.CRC32;

/// The decoded form of a frame. Feature frames carry an opaque payload that the feature handler decodes itself. The
/// key exchange frames carry the fields the handshake needs. Frames with a tag this version does not know decode to
/// [Unrecognized] so that they can be logged and dropped.
public sealed interface WireMessage {

  int MAX_PUBLIC_KEY_LENGTH = 0xFFFF;
  long MAX_TIMESTAMP = 0xFFFFFFFFL;

  FrameType type();

  default int version() {
    return WireCodec.VERSION;
  }

  /// A feature frame. For confidential types the payload is an encrypted envelope.
  record Payload(MessageType type, byte[] payload) implements WireMessage {
    public Payload {
      Objects.requireNonNull(type, "type cannot be null");
      Objects.requireNonNull(payload, "payload cannot be null");
      if (type.isKeyExchange()) {
        throw new IllegalArgumentException("Key exchange frames have their own record types: " + type);
      }
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Payload that && type == that.type && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
      return 31 * type.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
      return String.format("Payload[type=%s, payload=byte[%d]:CRC32=%d]", type, payload.length, crc(payload));
    }
  }

  /// A key exchange request. The timestamp is in seconds since the epoch and is carried as an unsigned 32-bit value.
  record KeyExchange(int retryCount, long timestamp, String senderId, byte[] publicKey) implements WireMessage {
    public KeyExchange {
      if (retryCount < 0 || retryCount > 255) {
        throw new IllegalArgumentException("retryCount must fit in one byte: " + retryCount);
      }
      checkTimestamp(timestamp);
      Objects.requireNonNull(senderId, "senderId cannot be null");
      checkPublicKey(publicKey);
    }

    @Override
    public MessageType type() {
      return MessageType.KEY_EXCHANGE;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof KeyExchange that
          && retryCount == that.retryCount
          && timestamp == that.timestamp
          && senderId.equals(that.senderId)
          && Arrays.equals(publicKey, that.publicKey);
    }

    @Override
    public int hashCode() {
      return Objects.hash(retryCount, timestamp, senderId) * 31 + Arrays.hashCode(publicKey);
    }

    @Override
    public String toString() {
      return String.format("KeyExchange[retryCount=%d, timestamp=%d, senderId=%s, publicKey=byte[%d]]",
          retryCount, timestamp, senderId, publicKey.length);
    }
  }

  /// The reply to a [KeyExchange]. An empty error text is normalised to [Optional#empty()].
  record KeyExchangeResponse(KeyExchangeStatus status, long timestamp, String senderId, byte[] publicKey,
                             Optional<String> error) implements WireMessage {
    public KeyExchangeResponse {
      Objects.requireNonNull(status, "status cannot be null");
      checkTimestamp(timestamp);
      Objects.requireNonNull(senderId, "senderId cannot be null");
      checkPublicKey(publicKey);
      Objects.requireNonNull(error, "error cannot be null");
      error = error.filter(e -> !e.isEmpty());
    }

    @Override
    public MessageType type() {
      return MessageType.KEY_EXCHANGE_RESPONSE;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof KeyExchangeResponse that
          && status == that.status
          && timestamp == that.timestamp
          && senderId.equals(that.senderId)
          && Arrays.equals(publicKey, that.publicKey)
          && error.equals(that.error);
    }

    @Override
    public int hashCode() {
      return Objects.hash(status, timestamp, senderId, error) * 31 + Arrays.hashCode(publicKey);
    }

    @Override
    public String toString() {
      return String.format("KeyExchangeResponse[status=%s, timestamp=%d, senderId=%s, publicKey=byte[%d], error=%s]",
          status, timestamp, senderId, publicKey.length, error.orElse(""));
    }
  }

  /// A frame whose tag this version does not know.
  record Unrecognized(UnknownType type, byte[] payload) implements WireMessage {
    public Unrecognized {
      Objects.requireNonNull(type, "type cannot be null");
      Objects.requireNonNull(payload, "payload cannot be null");
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Unrecognized that && type.equals(that.type) && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
      return 31 * type.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
      return String.format("Unrecognized[tag=%d, payload=byte[%d]]", type.tag(), payload.length);
    }
  }

  private static void checkTimestamp(long timestamp) {
    if (timestamp < 0 || timestamp > MAX_TIMESTAMP) {
      throw new IllegalArgumentException("timestamp must fit in an unsigned 32-bit field: " + timestamp);
    }
  }

  private static void checkPublicKey(byte[] publicKey) {
    Objects.requireNonNull(publicKey, "publicKey cannot be null");
    if (publicKey.length > MAX_PUBLIC_KEY_LENGTH) {
      throw new IllegalArgumentException("publicKey is too long: " + publicKey.length);
    }
  }

  private static long crc(byte[] bytes) {
    final var crc32 = new CRC32();
    crc32.update(bytes);
    return crc32.getValue();
  }
}
