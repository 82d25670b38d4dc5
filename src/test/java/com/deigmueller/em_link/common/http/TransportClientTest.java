package com.deigmueller.em_link.common.http;

import com.deigmueller.em_link.common.rpc.Rpc;
import com.deigmueller.em_link.common.rpc.RpcException;
import com.deigmueller.em_link.common.utils.NetUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.pekko.actor.testkit.typed.javadsl.ActorTestKit;
import org.apache.pekko.http.javadsl.Http;
import org.apache.pekko.http.javadsl.ServerBinding;
import org.apache.pekko.http.javadsl.model.ContentTypes;
import org.apache.pekko.http.javadsl.model.HttpHeader;
import org.apache.pekko.http.javadsl.model.HttpRequest;
import org.apache.pekko.http.javadsl.model.HttpResponse;
import org.apache.pekko.http.javadsl.model.StatusCodes;
import org.apache.pekko.http.javadsl.model.headers.RawHeader;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TransportClientTest {
  private static final String REALM = "em06p-aabbcc";
  private static final String NONCE = "5f2a6b7c";
  private static final String PASSWORD = "secret";
  private static final Pattern PARAMETER = Pattern.compile("([\\w-]+)\\s*=\\s*(?:\"([^\"]*)\"|([^\\s,]+))");
  private static final Duration TIMEOUT = Duration.ofSeconds(3);

  private static ActorTestKit testKit;
  private static ServerBinding binding;
  private static String host;

  @BeforeAll
  static void startServer() throws Exception {
    testKit = ActorTestKit.create();

    binding = Http.get(testKit.system())
          .newServerAt("127.0.0.1", 0)
          .bindSync(TransportClientTest::handle)
          .toCompletableFuture()
          .get(5, TimeUnit.SECONDS);

    host = "127.0.0.1:" + binding.localAddress().getPort();
  }

  @AfterAll
  static void stopServer() throws Exception {
    binding.unbind().toCompletableFuture().get(5, TimeUnit.SECONDS);
    testKit.shutdownTestKit();
  }

  @Test
  @DisplayName("call without credentials unwraps the result")
  void callWithoutCredentials() throws Exception {
    TransportClient client = new TransportClient(testKit.system(), host, null, null, TIMEOUT);

    JsonNode result = client.call("Refoss.GetDeviceInfo", Rpc.params()).toCompletableFuture().get(5, TimeUnit.SECONDS);

    assertThat(result.path("mac").asText(), is("AABBCCDDEEFF"));
  }

  @Test
  @DisplayName("a digest challenge is answered once with valid credentials")
  void digestChallengeIsAnswered() throws Exception {
    TransportClient client = new TransportClient(testKit.system(), host, "admin", PASSWORD, TIMEOUT);

    JsonNode first = client.call("Em.Status.Get", Rpc.params().put("id", 65535)).toCompletableFuture().get(5, TimeUnit.SECONDS);
    JsonNode second = client.call("Em.Status.Get", Rpc.params().put("id", 65535)).toCompletableFuture().get(5, TimeUnit.SECONDS);

    assertThat(first.path("em:1").path("power").asDouble(), is(120.5));
    assertThat(second.path("nc").asText(), is("00000002"));
  }

  @Test
  @DisplayName("a challenge without configured password fails with missing credentials")
  void challengeWithoutPassword() {
    TransportClient client = new TransportClient(testKit.system(), host, null, null, TIMEOUT);

    Throwable cause = failureOf(client.get("/rpc/Em.Status.Get?id=65535").toCompletableFuture());

    assertThat(cause, is(instanceOf(AuthException.class)));
    assertThat(((AuthException) cause).getKind(), is(AuthException.Kind.MISSING_CREDENTIALS));
  }

  @Test
  @DisplayName("a rejected retry fails with bad credentials")
  void rejectedRetry() {
    TransportClient client = new TransportClient(testKit.system(), host, "admin", "wrong", TIMEOUT);

    Throwable cause = failureOf(client.get("/rpc/Em.Status.Get?id=65535").toCompletableFuture());

    assertThat(cause, is(instanceOf(AuthException.class)));
    assertThat(((AuthException) cause).getKind(), is(AuthException.Kind.BAD_CREDENTIALS));
  }

  @Test
  @DisplayName("a non 200 status is reported with its code")
  void httpStatusIsReported() {
    TransportClient client = new TransportClient(testKit.system(), host, null, null, TIMEOUT);

    Throwable cause = failureOf(client.get("/rpc/Broken").toCompletableFuture());

    assertThat(cause, is(instanceOf(TransportException.class)));
    assertThat(((TransportException) cause).getKind(), is(TransportException.Kind.HTTP_STATUS));
    assertThat(((TransportException) cause).getStatusCode(), is(500));
  }

  @Test
  @DisplayName("a body that is no JSON is reported as invalid")
  void invalidJson() {
    TransportClient client = new TransportClient(testKit.system(), host, null, null, TIMEOUT);

    Throwable cause = failureOf(client.get("/rpc/Garbage").toCompletableFuture());

    assertThat(cause, is(instanceOf(TransportException.class)));
    assertThat(((TransportException) cause).getKind(), is(TransportException.Kind.INVALID_JSON));
  }

  @Test
  @DisplayName("both error envelopes become device errors")
  void errorEnvelopes() {
    TransportClient client = new TransportClient(testKit.system(), host, null, null, TIMEOUT);

    Throwable legacy = failureOf(client.call("Legacy.Fail", Rpc.params()).toCompletableFuture());
    Throwable jsonRpc = failureOf(client.call("JsonRpc.Fail", Rpc.params()).toCompletableFuture());

    assertThat(legacy, is(instanceOf(RpcException.class)));
    assertThat(((RpcException) legacy).getCode(), is(-103));
    assertThat(jsonRpc, is(instanceOf(RpcException.class)));
    assertThat(((RpcException) jsonRpc).getCode(), is(-105));
  }

  @Test
  @DisplayName("a slow device results in a timeout")
  void slowDeviceTimesOut() {
    TransportClient client = new TransportClient(testKit.system(), host, null, null, Duration.ofMillis(300));

    Throwable cause = failureOf(client.get("/rpc/Slow").toCompletableFuture());

    assertThat(cause, is(instanceOf(TransportException.class)));
    assertThat(((TransportException) cause).getKind(), is(TransportException.Kind.TIMEOUT));
  }

  @Test
  @DisplayName("toQuery encodes scalars and rejects containers")
  void toQuery() {
    assertThat(TransportClient.toQuery(Rpc.params()), is(""));
    assertThat(TransportClient.toQuery(Rpc.params().put("id", 3).put("name", "a b")), is("?id=3&name=a+b"));

    assertThrows(IllegalArgumentException.class,
          () -> TransportClient.toQuery((ObjectNode) Rpc.params().set("urls", Rpc.getObjectMapper().createArrayNode())));
  }

  private static Throwable failureOf(CompletableFuture<?> future) {
    ExecutionException exception = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
    return NetUtils.unwrap(exception.getCause());
  }

  private static HttpResponse handle(HttpRequest request) throws Exception {
    String path = request.getUri().path();
    String pathAndQuery = path + request.getUri().rawQueryString().map(query -> "?" + query).orElse("");

    switch (path) {
      case "/rpc/Refoss.GetDeviceInfo":
        return json("{\"id\":1,\"result\":{\"mac\":\"AABBCCDDEEFF\",\"model\":\"EM06P\"}}");
      case "/rpc/Broken":
        return HttpResponse.create().withStatus(StatusCodes.INTERNAL_SERVER_ERROR);
      case "/rpc/Garbage":
        return HttpResponse.create().withEntity(ContentTypes.TEXT_PLAIN_UTF8, "<html>not json</html>");
      case "/rpc/Legacy.Fail":
        return json("{\"code\":-103,\"message\":\"invalid argument\"}");
      case "/rpc/JsonRpc.Fail":
        return json("{\"id\":1,\"error\":{\"code\":-105,\"message\":\"not found\"}}");
      case "/rpc/Slow":
        Thread.sleep(1500);
        return json("{}");
      case "/rpc/Em.Status.Get":
        return handleProtected(request, pathAndQuery);
      default:
        return HttpResponse.create().withStatus(StatusCodes.NOT_FOUND);
    }
  }

  private static HttpResponse handleProtected(HttpRequest request, String pathAndQuery) {
    String authorization = request.getHeader("Authorization").map(HttpHeader::value).orElse(null);
    if (authorization == null) {
      return challenge();
    }

    Map<String,String> parameters = new HashMap<>();
    Matcher matcher = PARAMETER.matcher(authorization.substring(authorization.indexOf(' ') + 1));
    while (matcher.find()) {
      parameters.put(matcher.group(1), matcher.group(2) != null ? matcher.group(2) : matcher.group(3));
    }

    String ha1 = DigestAuthenticator.md5(parameters.get("username") + ":" + REALM + ":" + PASSWORD);
    String ha2 = DigestAuthenticator.md5("GET:" + parameters.get("uri"));
    String expected = DigestAuthenticator.computeResponse(
          ha1, NONCE, parameters.get("nc"), parameters.get("cnonce"), parameters.get("qop"), ha2);

    if (!expected.equals(parameters.get("response")) || !pathAndQuery.equals(parameters.get("uri"))) {
      return challenge();
    }

    return json("{\"id\":1,\"result\":{\"nc\":\"" + parameters.get("nc") + "\",\"em:1\":{\"id\":1,\"power\":120.5}}}");
  }

  private static HttpResponse challenge() {
    return HttpResponse.create()
          .withStatus(StatusCodes.UNAUTHORIZED)
          .addHeader(RawHeader.create("WWW-Authenticate",
                "Digest qop=\"auth\", realm=\"" + REALM + "\", nonce=\"" + NONCE + "\", algorithm=MD5"));
  }

  private static HttpResponse json(String body) {
    return HttpResponse.create().withEntity(ContentTypes.APPLICATION_JSON, body);
  }
}
