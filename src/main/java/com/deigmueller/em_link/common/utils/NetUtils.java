package com.deigmueller.em_link.common.utils;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.net.DatagramSocket;
import java.net.InetAddress;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public class NetUtils {
  public static @NotNull String detectPrimaryIpAddress() {
    try(final DatagramSocket socket = new DatagramSocket()){
      socket.connect(InetAddress.getByName("8.8.8.8"), 10002);
      return socket.getLocalAddress().getHostAddress();
    } catch (Exception e) {
      return "127.0.0.1";
    }
  }

  /**
   * Normalize a device identity (usually the MAC address) to upper case without separators
   * @param identity Raw identity as configured or as found in a request path
   * @return Normalized identity
   */
  public static @NotNull String normalizeIdentity(@NotNull String identity) {
    return identity.trim().replace(":", "").replace("-", "").toUpperCase(Locale.ROOT);
  }

  /**
   * Strip the wrappers added by CompletableFuture composition
   * @param throwable Failure as delivered to a completion callback
   * @return The underlying failure
   */
  public static @NotNull Throwable unwrap(@NotNull Throwable throwable) {
    Throwable current = throwable;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
          && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  public static @NotNull String describe(@Nullable Throwable throwable) {
    if (throwable == null) {
      return "unknown failure";
    }
    Throwable cause = unwrap(throwable);
    return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
  }
}
