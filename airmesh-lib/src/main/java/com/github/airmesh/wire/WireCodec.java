// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.wire;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

import static com.github.airmesh.MeshLogger.LOGGER;

/// ## AirMesh Wire Format
///
/// Every frame starts with a two byte header followed by a type specific payload:
///
/// ```
/// byte 0     : protocol version (=1)
/// byte 1     : message type (1=signal, 2=emergency, 3=chat, 4=system, 5=keyExchange, 6=game, 7=topology,
///              8=keyExchangeResponse)
/// bytes 2..N : type specific payload
/// ```
///
/// Key exchange sub-payloads are little-endian:
///
/// ```
/// keyExchange         : retryCount:u8, timestamp:u32, senderIdLen:u8, senderId, pubKeyLen:u16, pubKey
/// keyExchangeResponse : status:u8, timestamp:u32, senderIdLen:u8, senderId, pubKeyLen:u16, pubKey, errLen:u8, err
/// ```
///
/// The encrypted envelope carried inside confidential frames is an independently versioned big-endian format:
///
/// ```
/// version:u8 (=1), messageNumber:u64, timestamp:u64, hmacLen:u16, hmac, ciphertext
/// ```
///
/// Strings are UTF-8 and are cut to 255 bytes on a character boundary when encoded.
public final class WireCodec {
  public static final int VERSION = 1;
  public static final int HEADER_SIZE = 2;
  public static final int ENVELOPE_VERSION = 1;
  /// version + messageNumber + timestamp + hmacLen
  public static final int ENVELOPE_MIN_SIZE = 1 + 8 + 8 + 2;
  static final int MAX_SHORT_STRING = 255;

  private WireCodec() {
  }

  public static byte[] encode(WireMessage message) {
    Objects.requireNonNull(message, "message cannot be null");
    if (message instanceof WireMessage.Payload payload) {
      return frame(payload.type(), payload.payload());
    } else if (message instanceof WireMessage.KeyExchange keyExchange) {
      return encodeKeyExchange(keyExchange);
    } else if (message instanceof WireMessage.KeyExchangeResponse response) {
      return encodeKeyExchangeResponse(response);
    } else if (message instanceof WireMessage.Unrecognized unrecognized) {
      return frame(unrecognized.type(), unrecognized.payload());
    }
    throw new IllegalArgumentException("Unsupported message: " + message.getClass());
  }

  public static WireMessage decode(byte[] bytes) throws DecodeException {
    Objects.requireNonNull(bytes, "bytes cannot be null");
    if (bytes.length < HEADER_SIZE) {
      throw new DecodeException(DecodeError.TRUNCATED,
          "frame of " + bytes.length + " bytes is shorter than the header");
    }
    final int version = bytes[0] & 0xFF;
    if (version != VERSION) {
      throw new DecodeException(DecodeError.UNSUPPORTED_VERSION, "protocol version " + version);
    }
    final int tag = bytes[1] & 0xFF;
    final var type = FrameType.of(tag);
    if (type instanceof UnknownType unknown) {
      LOGGER.finest(() -> "Decoded frame with unknown type tag " + tag);
      return new WireMessage.Unrecognized(unknown, body(bytes));
    }
    final var messageType = (MessageType) type;
    switch (messageType) {
      case KEY_EXCHANGE:
        return decodeKeyExchange(bytes);
      case KEY_EXCHANGE_RESPONSE:
        return decodeKeyExchangeResponse(bytes);
      default:
        return new WireMessage.Payload(messageType, body(bytes));
    }
  }

  public static byte[] encodeEnvelope(EncryptedFrame frame) {
    Objects.requireNonNull(frame, "frame cannot be null");
    final var buffer = ByteBuffer.allocate(ENVELOPE_MIN_SIZE + frame.hmac().length + frame.ciphertext().length)
        .order(ByteOrder.BIG_ENDIAN);
    buffer.put((byte) ENVELOPE_VERSION);
    buffer.putLong(frame.messageNumber());
    buffer.putLong(frame.timestamp());
    buffer.putShort((short) frame.hmac().length);
    buffer.put(frame.hmac());
    buffer.put(frame.ciphertext());
    return buffer.array();
  }

  public static EncryptedFrame decodeEnvelope(byte[] bytes) throws DecodeException {
    Objects.requireNonNull(bytes, "bytes cannot be null");
    if (bytes.length < ENVELOPE_MIN_SIZE) {
      throw new DecodeException(DecodeError.TRUNCATED,
          "envelope of " + bytes.length + " bytes is shorter than " + ENVELOPE_MIN_SIZE);
    }
    final var reader = new ByteReader(bytes, 0, ByteOrder.BIG_ENDIAN);
    final int version = reader.u8("envelope version");
    if (version != ENVELOPE_VERSION) {
      throw new DecodeException(DecodeError.UNSUPPORTED_VERSION, "envelope version " + version);
    }
    final long messageNumber = reader.i64("messageNumber");
    if (messageNumber < 0) {
      throw new DecodeException(DecodeError.INVALID_FIELD, "messageNumber out of range");
    }
    final long timestamp = reader.i64("timestamp");
    final int hmacLength = reader.u16("hmacLen");
    final byte[] hmac = reader.bytes(hmacLength, "hmac");
    return new EncryptedFrame(messageNumber, timestamp, hmac, reader.rest());
  }

  private static byte[] frame(FrameType type, byte[] body) {
    final var bytes = new byte[HEADER_SIZE + body.length];
    bytes[0] = (byte) VERSION;
    bytes[1] = (byte) type.tag();
    System.arraycopy(body, 0, bytes, HEADER_SIZE, body.length);
    return bytes;
  }

  private static byte[] body(byte[] bytes) {
    final var body = new byte[bytes.length - HEADER_SIZE];
    System.arraycopy(bytes, HEADER_SIZE, body, 0, body.length);
    return body;
  }

  private static byte[] encodeKeyExchange(WireMessage.KeyExchange message) {
    final byte[] senderId = shortString(message.senderId());
    final var buffer = header(MessageType.KEY_EXCHANGE,
        1 + 4 + 1 + senderId.length + 2 + message.publicKey().length);
    buffer.put((byte) message.retryCount());
    buffer.putInt((int) message.timestamp());
    buffer.put((byte) senderId.length);
    buffer.put(senderId);
    buffer.putShort((short) message.publicKey().length);
    buffer.put(message.publicKey());
    return buffer.array();
  }

  private static byte[] encodeKeyExchangeResponse(WireMessage.KeyExchangeResponse message) {
    final byte[] senderId = shortString(message.senderId());
    final byte[] error = shortString(message.error().orElse(""));
    final var buffer = header(MessageType.KEY_EXCHANGE_RESPONSE,
        1 + 4 + 1 + senderId.length + 2 + message.publicKey().length + 1 + error.length);
    buffer.put((byte) message.status().code());
    buffer.putInt((int) message.timestamp());
    buffer.put((byte) senderId.length);
    buffer.put(senderId);
    buffer.putShort((short) message.publicKey().length);
    buffer.put(message.publicKey());
    buffer.put((byte) error.length);
    buffer.put(error);
    return buffer.array();
  }

  private static ByteBuffer header(MessageType type, int bodyLength) {
    final var buffer = ByteBuffer.allocate(HEADER_SIZE + bodyLength).order(ByteOrder.LITTLE_ENDIAN);
    buffer.put((byte) VERSION);
    buffer.put((byte) type.tag());
    return buffer;
  }

  private static WireMessage.KeyExchange decodeKeyExchange(byte[] bytes) throws DecodeException {
    final var reader = new ByteReader(bytes, HEADER_SIZE, ByteOrder.LITTLE_ENDIAN);
    final int retryCount = reader.u8("retryCount");
    final long timestamp = reader.u32("timestamp");
    final String senderId = reader.utf8(reader.u8("senderIdLen"), "senderId");
    final byte[] publicKey = reader.bytes(reader.u16("pubKeyLen"), "pubKey");
    return new WireMessage.KeyExchange(retryCount, timestamp, senderId, publicKey);
  }

  private static WireMessage.KeyExchangeResponse decodeKeyExchangeResponse(byte[] bytes) throws DecodeException {
    final var reader = new ByteReader(bytes, HEADER_SIZE, ByteOrder.LITTLE_ENDIAN);
    final int code = reader.u8("status");
    final var status = KeyExchangeStatus.fromCode(code).orElseThrow(() ->
        new DecodeException(DecodeError.INVALID_FIELD, "unknown key exchange status " + code));
    final long timestamp = reader.u32("timestamp");
    final String senderId = reader.utf8(reader.u8("senderIdLen"), "senderId");
    final byte[] publicKey = reader.bytes(reader.u16("pubKeyLen"), "pubKey");
    // the error text is optional on the wire
    final Optional<String> error = reader.remaining() == 0
        ? Optional.empty()
        : Optional.of(reader.utf8(reader.u8("errLen"), "err"));
    return new WireMessage.KeyExchangeResponse(status, timestamp, senderId, publicKey, error);
  }

  /// UTF-8 bytes of `value` cut to at most 255 bytes without splitting a multibyte character.
  static byte[] shortString(String value) {
    final byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
    if (utf8.length <= MAX_SHORT_STRING) {
      return utf8;
    }
    int cut = MAX_SHORT_STRING;
    while (cut > 0 && (utf8[cut] & 0xC0) == 0x80) {
      cut--;
    }
    final var truncated = new byte[cut];
    System.arraycopy(utf8, 0, truncated, 0, cut);
    return truncated;
  }
}
