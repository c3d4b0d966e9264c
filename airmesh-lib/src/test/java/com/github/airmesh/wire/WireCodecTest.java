// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.wire;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class WireCodecTest {

  static DecodeError decodeError(byte[] bytes) {
    final var e = assertThrows(DecodeException.class, () -> WireCodec.decode(bytes));
    return e.error();
  }

  @Test
  void oneByteFrameIsTruncated() {
    assertEquals(DecodeError.TRUNCATED, decodeError(new byte[]{1}));
    assertEquals(DecodeError.TRUNCATED, decodeError(new byte[0]));
  }

  @Test
  void wrongVersionIsUnsupported() {
    assertEquals(DecodeError.UNSUPPORTED_VERSION, decodeError(new byte[]{2, 3, 0}));
  }

  @Test
  void chatFrameLayout() throws DecodeException {
    final var payload = "hi".getBytes(StandardCharsets.UTF_8);
    final var bytes = WireCodec.encode(new WireMessage.Payload(MessageType.CHAT, payload));

    assertArrayEquals(new byte[]{1, 3, 'h', 'i'}, bytes);
    final var decoded = WireCodec.decode(bytes);
    assertEquals(new WireMessage.Payload(MessageType.CHAT, payload), decoded);
    assertEquals(1, decoded.version());
  }

  @Test
  void keyExchangeLayoutIsLittleEndian() throws DecodeException {
    final var message = new WireMessage.KeyExchange(2, 0x01020304L, "ab", new byte[]{9, 8, 7});

    final var bytes = WireCodec.encode(message);

    assertArrayEquals(new byte[]{
        1, 5,
        2,
        4, 3, 2, 1,
        2, 'a', 'b',
        3, 0, 9, 8, 7}, bytes);
    assertEquals(message, WireCodec.decode(bytes));
  }

  @Test
  void keyExchangeResponseLayout() throws DecodeException {
    final var message = new WireMessage.KeyExchangeResponse(KeyExchangeStatus.ERROR, 0xFFFFFFFFL, "b",
        new byte[0], Optional.of("bad"));

    final var bytes = WireCodec.encode(message);

    assertArrayEquals(new byte[]{
        1, 8,
        2,
        -1, -1, -1, -1,
        1, 'b',
        0, 0,
        3, 'b', 'a', 'd'}, bytes);
    assertEquals(message, WireCodec.decode(bytes));
  }

  @Test
  void responseWithoutErrorTextDecodes() throws DecodeException {
    final var bytes = new byte[]{1, 8, 0, 0, 0, 0, 0, 1, 'b', 1, 0, 42};

    final var decoded = (WireMessage.KeyExchangeResponse) WireCodec.decode(bytes);

    assertEquals(KeyExchangeStatus.SUCCESS, decoded.status());
    assertArrayEquals(new byte[]{42}, decoded.publicKey());
    assertTrue(decoded.error().isEmpty());
  }

  @Test
  void publicKeyLengthPastEndIsTruncated() {
    final var bytes = new byte[]{1, 5, 0, 0, 0, 0, 0, 1, 'a', 32, 0, 1, 2, 3};

    assertEquals(DecodeError.TRUNCATED, decodeError(bytes));
  }

  @Test
  void senderLengthPastEndIsTruncated() {
    assertEquals(DecodeError.TRUNCATED, decodeError(new byte[]{1, 5, 0, 0, 0, 0, 0, 9, 'a'}));
  }

  @Test
  void unknownStatusIsInvalid() {
    assertEquals(DecodeError.INVALID_FIELD, decodeError(new byte[]{1, 8, 7, 0, 0, 0, 0, 0, 0, 0}));
  }

  @Test
  void malformedUtf8IsInvalid() {
    assertEquals(DecodeError.INVALID_FIELD, decodeError(new byte[]{1, 5, 0, 0, 0, 0, 0, 1, (byte) 0xC3, 0, 0}));
  }

  @Test
  void unknownTagDecodesToUnrecognized() throws DecodeException {
    final var decoded = WireCodec.decode(new byte[]{1, 42, 5, 6});

    final var unrecognized = assertInstanceOf(WireMessage.Unrecognized.class, decoded);
    assertEquals(42, unrecognized.type().tag());
    assertArrayEquals(new byte[]{5, 6}, unrecognized.payload());
  }

  @Test
  void longSenderIsCutOnCharacterBoundary() throws DecodeException {
    // 200 two-byte characters is 400 bytes of UTF-8
    final var sender = "é".repeat(200);
    final var bytes = WireCodec.encode(new WireMessage.KeyExchange(0, 0, sender, new byte[0]));

    final var decoded = (WireMessage.KeyExchange) WireCodec.decode(bytes);

    assertEquals("é".repeat(127), decoded.senderId());
  }

  @Test
  void envelopeLayoutIsBigEndian() throws DecodeException {
    final var frame = new EncryptedFrame(258, 3, new byte[]{7, 7}, new byte[]{1, 2, 3});

    final var bytes = WireCodec.encodeEnvelope(frame);

    assertArrayEquals(new byte[]{
        1,
        0, 0, 0, 0, 0, 0, 1, 2,
        0, 0, 0, 0, 0, 0, 0, 3,
        0, 2, 7, 7,
        1, 2, 3}, bytes);
    assertEquals(frame, WireCodec.decodeEnvelope(bytes));
  }

  @Test
  void shortEnvelopeIsTruncated() {
    final var e = assertThrows(DecodeException.class, () -> WireCodec.decodeEnvelope(new byte[18]));
    assertEquals(DecodeError.TRUNCATED, e.error());
  }

  @Test
  void envelopeHmacOverrunIsTruncated() {
    final var bytes = new byte[WireCodec.ENVELOPE_MIN_SIZE];
    bytes[0] = 1;
    bytes[17] = 0;
    bytes[18] = 32;

    final var e = assertThrows(DecodeException.class, () -> WireCodec.decodeEnvelope(bytes));
    assertEquals(DecodeError.TRUNCATED, e.error());
  }

  @Test
  void envelopeWithWrongVersionIsUnsupported() {
    final var bytes = new byte[WireCodec.ENVELOPE_MIN_SIZE];
    bytes[0] = 9;

    final var e = assertThrows(DecodeException.class, () -> WireCodec.decodeEnvelope(bytes));
    assertEquals(DecodeError.UNSUPPORTED_VERSION, e.error());
  }

  @Test
  void keyExchangeTypesCannotBeSentAsPlainPayload() {
    assertThrows(IllegalArgumentException.class,
        () -> new WireMessage.Payload(MessageType.KEY_EXCHANGE, new byte[0]));
  }

  @Test
  void frameTypeLookup() {
    assertThat(FrameType.of(7)).isEqualTo(MessageType.TOPOLOGY);
    assertThat(FrameType.of(8)).isEqualTo(MessageType.KEY_EXCHANGE_RESPONSE);
    assertThat(FrameType.of(0)).isEqualTo(new UnknownType(0));
    assertThat(FrameType.of(255)).isEqualTo(new UnknownType(255));
  }
}
