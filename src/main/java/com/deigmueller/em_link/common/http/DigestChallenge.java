package com.deigmueller.em_link.common.http;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parameters of a {@code WWW-Authenticate: Digest ...} challenge (RFC 2617)
 */
public record DigestChallenge(
      @NotNull String realm,
      @NotNull String nonce,
      @Nullable String qop,
      @Nullable String opaque,
      @Nullable String algorithm
) {
  // Values may be quoted or bare tokens, depending on who rendered the header
  private static final Pattern PARAMETER = Pattern.compile("([\\w-]+)\\s*=\\s*(?:\"([^\"]*)\"|([^\\s,]+))");

  public static @NotNull DigestChallenge parse(@Nullable String header) {
    if (header == null || !header.trim().regionMatches(true, 0, "Digest", 0, 6)) {
      throw new AuthException(AuthException.Kind.BAD_CREDENTIALS, "device did not send a digest challenge: " + header);
    }

    Map<String,String> parameters = new HashMap<>();
    Matcher matcher = PARAMETER.matcher(header.trim().substring(6));
    while (matcher.find()) {
      String value = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
      parameters.put(matcher.group(1).toLowerCase(Locale.ROOT), value);
    }

    String nonce = parameters.get("nonce");
    if (nonce == null) {
      throw new AuthException(AuthException.Kind.BAD_CREDENTIALS, "digest challenge without nonce: " + header);
    }

    return new DigestChallenge(
          parameters.getOrDefault("realm", ""),
          nonce,
          selectQop(parameters.get("qop")),
          parameters.get("opaque"),
          parameters.get("algorithm"));
  }

  public boolean isSessionAlgorithm() {
    return algorithm != null && algorithm.equalsIgnoreCase("MD5-sess");
  }

  private static @Nullable String selectQop(@Nullable String offered) {
    if (offered == null || offered.isBlank()) {
      return null;
    }
    for (String option : offered.split(",")) {
      if (option.trim().equalsIgnoreCase("auth")) {
        return "auth";
      }
    }
    return offered.split(",")[0].trim();
  }
}
