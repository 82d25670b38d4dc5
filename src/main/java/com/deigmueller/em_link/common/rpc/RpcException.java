package com.deigmueller.em_link.common.rpc;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;

/**
 * Error reported by the device itself, either through the legacy {@code {code, message}} body
 * or through a JSON-RPC {@code error} member.
 */
@Getter
public class RpcException extends RuntimeException {
  private final int code;

  public RpcException(int code,
                      @NotNull String message) {
    super("device error " + code + ": " + message);
    this.code = code;
  }
}
