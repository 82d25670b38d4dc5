/*
 * Copyright (C) 2018-2023 layline.io GmbH <http://www.layline.io>
 */

package com.deigmueller.em_link.common.http;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

@Getter
public class TransportException extends RuntimeException {
  private final Kind kind;
  private final int statusCode;

  public TransportException(@NotNull Kind kind,
                            @NotNull String message) {
    this(kind, 0, message, null);
  }

  public TransportException(@NotNull Kind kind,
                            int statusCode,
                            @NotNull String message,
                            @Nullable Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.statusCode = statusCode;
  }

  public static TransportException httpStatus(int statusCode, @NotNull String uri) {
    return new TransportException(Kind.HTTP_STATUS, statusCode, "HTTP " + statusCode + " from device calling " + uri, null);
  }

  public enum Kind {
    TIMEOUT,
    HTTP_STATUS,
    INVALID_JSON
  }
}
