package com.deigmueller.em_link.common.http;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Computes RFC 2617 digest authorization headers. The nonce count is shared by all requests
 * of one client and only ever increases.
 */
public class DigestAuthenticator {
  // Class members
  private static final SecureRandom RANDOM = new SecureRandom();
  private static final HexFormat HEX = HexFormat.of();

  // Instance members
  private final String username;
  private final String password;
  private final Supplier<String> clientNonceSupplier;
  private final AtomicLong nonceCount = new AtomicLong();

  public DigestAuthenticator(@NotNull String username,
                             @NotNull String password) {
    this(username, password, DigestAuthenticator::randomClientNonce);
  }

  public DigestAuthenticator(@NotNull String username,
                             @NotNull String password,
                             @NotNull Supplier<String> clientNonceSupplier) {
    this.username = username;
    this.password = password;
    this.clientNonceSupplier = clientNonceSupplier;
  }

  /**
   * Create the value of the Authorization header answering the given challenge
   * @param method HTTP method of the request to retry
   * @param uri Request URI (path and query) exactly as sent
   * @param challenge Parsed challenge
   * @return Authorization header value
   */
  public @NotNull String authorize(@NotNull String method,
                                   @NotNull String uri,
                                   @NotNull DigestChallenge challenge) {
    String nc = String.format("%08x", nonceCount.incrementAndGet());
    String cnonce = clientNonceSupplier.get();

    String ha1 = md5(username + ":" + challenge.realm() + ":" + password);
    if (challenge.isSessionAlgorithm()) {
      ha1 = md5(ha1 + ":" + challenge.nonce() + ":" + cnonce);
    }
    String ha2 = md5(method + ":" + uri);
    String response = computeResponse(ha1, challenge.nonce(), nc, cnonce, challenge.qop(), ha2);

    StringBuilder header = new StringBuilder("Digest username=\"").append(username)
          .append("\", realm=\"").append(challenge.realm())
          .append("\", nonce=\"").append(challenge.nonce())
          .append("\", uri=\"").append(uri)
          .append("\", response=\"").append(response).append('"');
    if (challenge.algorithm() != null) {
      header.append(", algorithm=").append(challenge.algorithm());
    }
    if (challenge.qop() != null) {
      header.append(", qop=").append(challenge.qop())
            .append(", nc=").append(nc)
            .append(", cnonce=\"").append(cnonce).append('"');
    }
    if (challenge.opaque() != null) {
      header.append(", opaque=\"").append(challenge.opaque()).append('"');
    }

    return header.toString();
  }

  public long getNonceCount() {
    return nonceCount.get();
  }

  public static @NotNull String computeResponse(@NotNull String ha1,
                                                @NotNull String nonce,
                                                @NotNull String nc,
                                                @NotNull String cnonce,
                                                @Nullable String qop,
                                                @NotNull String ha2) {
    return qop != null
          ? md5(ha1 + ":" + nonce + ":" + nc + ":" + cnonce + ":" + qop + ":" + ha2)
          : md5(ha1 + ":" + nonce + ":" + ha2);
  }

  public static @NotNull String md5(@NotNull String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("MD5");
      return HEX.formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 is not available", e);
    }
  }

  private static String randomClientNonce() {
    byte[] bytes = new byte[8];
    RANDOM.nextBytes(bytes);
    return HEX.formatHex(bytes);
  }
}
