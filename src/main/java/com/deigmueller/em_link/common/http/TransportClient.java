package com.deigmueller.em_link.common.http;

import com.deigmueller.em_link.common.rpc.Rpc;
import com.deigmueller.em_link.common.rpc.RpcCaller;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.apache.pekko.actor.ClassicActorSystemProvider;
import org.apache.pekko.http.javadsl.Http;
import org.apache.pekko.http.javadsl.model.ContentTypes;
import org.apache.pekko.http.javadsl.model.HttpEntities;
import org.apache.pekko.http.javadsl.model.HttpHeader;
import org.apache.pekko.http.javadsl.model.HttpRequest;
import org.apache.pekko.http.javadsl.model.headers.RawHeader;
import org.apache.pekko.stream.Materializer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP access to the device's {@code /rpc} endpoint with transparent digest authentication.
 * The first request of every exchange is sent without credentials; a 401 answer is retried
 * exactly once with an Authorization header computed from the challenge.
 */
public class TransportClient implements RpcCaller {
  // Class members
  private static final Logger LOGGER = LoggerFactory.getLogger("em-link.transport");

  // Instance members
  private final Http http;
  private final Materializer materializer;
  private final String host;
  private final Duration timeout;
  private final @Nullable DigestAuthenticator authenticator;

  public TransportClient(@NotNull ClassicActorSystemProvider system,
                         @NotNull String host,
                         @Nullable String username,
                         @Nullable String password,
                         @NotNull Duration timeout) {
    this.http = Http.get(system);
    this.materializer = Materializer.createMaterializer(system);
    this.host = host;
    this.timeout = timeout;
    this.authenticator = StringUtils.isNotEmpty(password)
          ? new DigestAuthenticator(StringUtils.defaultIfEmpty(username, "admin"), password)
          : null;
  }

  /**
   * Execute a GET request
   * @param pathAndQuery Path including the query string, e.g. {@code /rpc/Em.Status.Get?id=65535}
   * @return Parsed response body
   */
  public CompletionStage<JsonNode> get(@NotNull String pathAndQuery) {
    LOGGER.trace("TransportClient.get({})", pathAndQuery);

    return execute("GET", pathAndQuery, null);
  }

  /**
   * Execute a POST request with a JSON body
   * @param path Request path
   * @param body JSON body
   * @return Parsed response body
   */
  public CompletionStage<JsonNode> post(@NotNull String path,
                                        @NotNull JsonNode body) {
    LOGGER.trace("TransportClient.post({})", path);

    return execute("POST", path, Rpc.toString(body));
  }

  @Override
  public CompletionStage<JsonNode> call(@NotNull String method,
                                        @NotNull ObjectNode params) {
    LOGGER.trace("TransportClient.call({})", method);

    return get("/rpc/" + method + toQuery(params)).thenApply(Rpc::result);
  }

  public @NotNull String getHost() {
    return host;
  }

  /**
   * Encode scalar parameters as a query string
   * @param params RPC parameters
   * @return Query string including the leading {@code ?}, or an empty string
   * @throws IllegalArgumentException if a parameter is an array or an object
   */
  static @NotNull String toQuery(@NotNull ObjectNode params) {
    StringBuilder query = new StringBuilder();

    Iterator<Map.Entry<String,JsonNode>> fields = params.fields();
    while (fields.hasNext()) {
      Map.Entry<String,JsonNode> field = fields.next();
      JsonNode value = field.getValue();
      if (value.isContainerNode()) {
        throw new IllegalArgumentException("parameter " + field.getKey() + " cannot be sent in a query string");
      }

      query.append(query.length() == 0 ? '?' : '&')
            .append(URLEncoder.encode(field.getKey(), StandardCharsets.UTF_8))
            .append('=')
            .append(URLEncoder.encode(value.asText(), StandardCharsets.UTF_8));
    }

    return query.toString();
  }

  private CompletionStage<JsonNode> execute(@NotNull String method,
                                            @NotNull String pathAndQuery,
                                            @Nullable String body) {
    return send(method, pathAndQuery, body, null)
          .thenCompose(first -> {
            if (first.status() != 401) {
              return CompletableFuture.completedFuture(first);
            }

            if (authenticator == null) {
              throw new AuthException(AuthException.Kind.MISSING_CREDENTIALS,
                    "device " + host + " requires authentication but no password is configured");
            }

            LOGGER.debug("digest challenge from {}: {}", host, first.wwwAuthenticate());

            DigestChallenge challenge = DigestChallenge.parse(first.wwwAuthenticate());
            String authorization = authenticator.authorize(method, pathAndQuery, challenge);

            return send(method, pathAndQuery, body, authorization)
                  .thenApply(second -> {
                    if (second.status() == 401) {
                      throw new AuthException(AuthException.Kind.BAD_CREDENTIALS,
                            "device " + host + " rejected the configured credentials");
                    }
                    return second;
                  });
          })
          .thenApply(response -> interpret(pathAndQuery, response));
  }

  private CompletionStage<StrictResponse> send(@NotNull String method,
                                               @NotNull String pathAndQuery,
                                               @Nullable String body,
                                               @Nullable String authorization) {
    String uri = "http://" + host + pathAndQuery;

    HttpRequest request = method.equals("POST")
          ? HttpRequest.POST(uri).withEntity(HttpEntities.create(ContentTypes.APPLICATION_JSON, body != null ? body : "{}"))
          : HttpRequest.GET(uri);
    if (authorization != null) {
      request = request.addHeader(RawHeader.create("Authorization", authorization));
    }

    CompletionStage<StrictResponse> exchange = http.singleRequest(request)
          .thenCompose(response -> response.entity()
                .toStrict(timeout.toMillis(), materializer)
                .thenApply(strictEntity -> new StrictResponse(
                      response.status().intValue(),
                      response.getHeader("WWW-Authenticate").map(HttpHeader::value).orElse(null),
                      strictEntity.getData().utf8String())));

    return exchange.toCompletableFuture()
          .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
          .exceptionally(throwable -> {
            Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                  ? throwable.getCause()
                  : throwable;
            if (cause instanceof TimeoutException) {
              throw new TransportException(TransportException.Kind.TIMEOUT, 0,
                    "no answer from " + host + " within " + timeout.toMillis() + " ms", cause);
            }
            if (cause instanceof RuntimeException runtimeException) {
              throw runtimeException;
            }
            throw new CompletionException(cause);
          });
  }

  private JsonNode interpret(@NotNull String pathAndQuery,
                             @NotNull StrictResponse response) {
    if (response.status() != 200) {
      throw TransportException.httpStatus(response.status(), pathAndQuery);
    }

    JsonNode json;
    try {
      json = Rpc.getObjectMapper().readTree(response.body());
    } catch (IOException e) {
      throw new TransportException(TransportException.Kind.INVALID_JSON, 200,
            "invalid JSON from " + host + " calling " + pathAndQuery, e);
    }
    if (json == null || json.isMissingNode()) {
      throw new TransportException(TransportException.Kind.INVALID_JSON, 200,
            "empty body from " + host + " calling " + pathAndQuery, null);
    }

    Rpc.checkEnvelope(json);

    return json;
  }

  private record StrictResponse(
        int status,
        @Nullable String wwwAuthenticate,
        @NotNull String body
  ) {}
}
