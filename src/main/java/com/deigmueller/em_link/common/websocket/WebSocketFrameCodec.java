package com.deigmueller.em_link.common.websocket;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.security.SecureRandom;

/**
 * Encodes and decodes RFC 6455 frames. Client frames are always masked, server frames are
 * accepted masked or unmasked.
 */
public class WebSocketFrameCodec {
  // Class members
  private static final SecureRandom RANDOM = new SecureRandom();

  public static final int DEFAULT_MAX_PAYLOAD = 4 * 1024 * 1024;

  // Instance members
  private final int maxPayload;

  public WebSocketFrameCodec() {
    this(DEFAULT_MAX_PAYLOAD);
  }

  public WebSocketFrameCodec(int maxPayload) {
    this.maxPayload = maxPayload;
  }

  /**
   * Encode a frame
   * @param frame Frame to encode
   * @param mask Masking key (4 bytes) or null to send the payload unmasked
   * @return Encoded bytes
   */
  public byte @NotNull [] encode(@NotNull WebSocketFrame frame,
                                 byte @Nullable [] mask) {
    byte[] payload = frame.payload();
    int length = payload.length;

    int headerLength = 2 + (length <= 125 ? 0 : length <= 0xFFFF ? 2 : 8) + (mask != null ? 4 : 0);
    byte[] result = new byte[headerLength + length];

    result[0] = (byte) ((frame.fin() ? 0x80 : 0x00) | (frame.opcode() & 0x0F));
    int maskBit = mask != null ? 0x80 : 0x00;

    int offset;
    if (length <= 125) {
      result[1] = (byte) (maskBit | length);
      offset = 2;
    } else if (length <= 0xFFFF) {
      result[1] = (byte) (maskBit | 126);
      result[2] = (byte) (length >> 8);
      result[3] = (byte) length;
      offset = 4;
    } else {
      result[1] = (byte) (maskBit | 127);
      long longLength = length;
      for (int i = 0; i < 8; i++) {
        result[2 + i] = (byte) (longLength >> (56 - 8 * i));
      }
      offset = 10;
    }

    if (mask != null) {
      System.arraycopy(mask, 0, result, offset, 4);
      offset += 4;
      for (int i = 0; i < length; i++) {
        result[offset + i] = (byte) (payload[i] ^ mask[i % 4]);
      }
    } else {
      System.arraycopy(payload, 0, result, offset, length);
    }

    return result;
  }

  public byte @NotNull [] encodeMasked(@NotNull WebSocketFrame frame) {
    return encode(frame, randomMask());
  }

  /**
   * Read the next frame from the stream
   * @param input Stream positioned at a frame boundary
   * @return Decoded frame with the payload unmasked
   * @throws EOFException if the stream ends before a complete frame was read
   * @throws ProtocolException if the frame is malformed
   */
  public @NotNull WebSocketFrame decode(@NotNull InputStream input) throws IOException {
    int first = readByte(input);
    int second = readByte(input);

    if ((first & 0x70) != 0) {
      throw new ProtocolException(ProtocolException.Kind.FRAME_ERROR, "reserved bits set in frame header");
    }

    boolean fin = (first & 0x80) != 0;
    int opcode = first & 0x0F;
    boolean masked = (second & 0x80) != 0;

    long length = second & 0x7F;
    if (length == 126) {
      length = ((long) readByte(input) << 8) | readByte(input);
    } else if (length == 127) {
      length = 0;
      for (int i = 0; i < 8; i++) {
        length = (length << 8) | readByte(input);
      }
      if (length < 0) {
        throw new ProtocolException(ProtocolException.Kind.FRAME_ERROR, "negative frame length");
      }
    }

    if (length > maxPayload) {
      throw new ProtocolException(ProtocolException.Kind.FRAME_ERROR, "frame of " + length + " bytes exceeds the limit of " + maxPayload);
    }

    boolean control = (opcode & 0x8) != 0;
    if (control && (length > 125 || !fin)) {
      throw new ProtocolException(ProtocolException.Kind.FRAME_ERROR, "invalid control frame");
    }

    byte[] mask = masked ? readFully(input, 4) : null;
    byte[] payload = readFully(input, (int) length);
    if (mask != null) {
      for (int i = 0; i < payload.length; i++) {
        payload[i] = (byte) (payload[i] ^ mask[i % 4]);
      }
    }

    return new WebSocketFrame(fin, opcode, payload);
  }

  public static byte @NotNull [] randomMask() {
    byte[] mask = new byte[4];
    RANDOM.nextBytes(mask);
    return mask;
  }

  private static int readByte(@NotNull InputStream input) throws IOException {
    int value = input.read();
    if (value < 0) {
      throw new EOFException("stream ended inside a frame");
    }
    return value;
  }

  private static byte @NotNull [] readFully(@NotNull InputStream input, int length) throws IOException {
    byte[] buffer = new byte[length];
    int read = 0;
    while (read < length) {
      int count = input.read(buffer, read, length - read);
      if (count < 0) {
        throw new EOFException("stream ended inside a frame");
      }
      read += count;
    }
    return buffer;
  }
}
