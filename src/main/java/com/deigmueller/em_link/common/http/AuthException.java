/*
 * Copyright (C) 2018-2023 layline.io GmbH <http://www.layline.io>
 */

package com.deigmueller.em_link.common.http;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;

@Getter
public class AuthException extends RuntimeException {
  private final Kind kind;

  public AuthException(@NotNull Kind kind,
                       @NotNull String message) {
    super(message);
    this.kind = kind;
  }

  public enum Kind {
    MISSING_CREDENTIALS,
    BAD_CREDENTIALS
  }
}
