// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.airmesh.wire;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/// Bounds checked reads over a frame. Every read checks the remaining length first so that a short or lying frame
/// surfaces as [DecodeError#TRUNCATED] rather than a [java.nio.BufferUnderflowException].
final class ByteReader {
  private final ByteBuffer buffer;

  ByteReader(byte[] bytes, int offset, ByteOrder order) {
    this.buffer = ByteBuffer.wrap(bytes);
    this.buffer.position(offset);
    this.buffer.order(order);
  }

  int remaining() {
    return buffer.remaining();
  }

  int u8(String field) throws DecodeException {
    require(1, field);
    return buffer.get() & 0xFF;
  }

  int u16(String field) throws DecodeException {
    require(2, field);
    return buffer.getShort() & 0xFFFF;
  }

  long u32(String field) throws DecodeException {
    require(4, field);
    return buffer.getInt() & 0xFFFFFFFFL;
  }

  long i64(String field) throws DecodeException {
    require(8, field);
    return buffer.getLong();
  }

  byte[] bytes(int length, String field) throws DecodeException {
    require(length, field);
    final var result = new byte[length];
    buffer.get(result);
    return result;
  }

  byte[] rest() {
    final var result = new byte[buffer.remaining()];
    buffer.get(result);
    return result;
  }

  String utf8(int length, String field) throws DecodeException {
    final var raw = bytes(length, field);
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(raw))
          .toString();
    } catch (CharacterCodingException e) {
      throw new DecodeException(DecodeError.INVALID_FIELD, field + " is not valid UTF-8", e);
    }
  }

  private void require(int length, String field) throws DecodeException {
    if (buffer.remaining() < length) {
      throw new DecodeException(DecodeError.TRUNCATED,
          String.format("%s needs %d bytes at offset %d but only %d remain",
              field, length, buffer.position(), buffer.remaining()));
    }
  }
}
