/*
 * Copyright (C) 2018-2023 layline.io GmbH <http://www.layline.io>
 */

package com.deigmueller.em_link.common.websocket;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

@Getter
public class ProtocolException extends RuntimeException {
  private final Kind kind;

  public ProtocolException(@NotNull Kind kind,
                           @NotNull String message) {
    this(kind, message, null);
  }

  public ProtocolException(@NotNull Kind kind,
                           @NotNull String message,
                           @Nullable Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public enum Kind {
    HANDSHAKE_FAILED,
    FRAME_ERROR,
    TIMEOUT,
    CLOSED_BY_PEER
  }
}
