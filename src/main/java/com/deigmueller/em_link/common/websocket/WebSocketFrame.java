package com.deigmueller.em_link.common.websocket;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;

/**
 * A single RFC 6455 frame with its payload already unmasked
 */
public record WebSocketFrame(
      boolean fin,
      int opcode,
      byte @NotNull [] payload
) {
  public static final int OPCODE_CONTINUATION = 0x0;
  public static final int OPCODE_TEXT = 0x1;
  public static final int OPCODE_BINARY = 0x2;
  public static final int OPCODE_CLOSE = 0x8;
  public static final int OPCODE_PING = 0x9;
  public static final int OPCODE_PONG = 0xA;

  public static final int CLOSE_NORMAL = 1000;

  public static @NotNull WebSocketFrame text(@NotNull String text) {
    return new WebSocketFrame(true, OPCODE_TEXT, text.getBytes(StandardCharsets.UTF_8));
  }

  public static @NotNull WebSocketFrame close(int statusCode) {
    return new WebSocketFrame(true, OPCODE_CLOSE, new byte[] { (byte) (statusCode >> 8), (byte) statusCode });
  }

  public static @NotNull WebSocketFrame pong(byte @NotNull [] payload) {
    return new WebSocketFrame(true, OPCODE_PONG, payload);
  }

  public boolean isControl() {
    return (opcode & 0x8) != 0;
  }

  public @NotNull String text() {
    return new String(payload, StandardCharsets.UTF_8);
  }
}
