package com.deigmueller.em_link.common.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class Rpc {
  private static final Logger LOGGER = LoggerFactory.getLogger("em-link.rpc");
  @Getter private static final ObjectMapper objectMapper = createObjectMapper();

  public static ObjectMapper createObjectMapper() {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    return objectMapper.findAndRegisterModules();
  }

  public static String toString(@Nullable Object object) {
    LOGGER.debug("Rpc.toString({})", object != null ? object.getClass().getSimpleName() : "null");
    try {
      return objectMapper.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new RuntimeException(e);
    }
  }

  public static @NotNull ObjectNode params() {
    return objectMapper.createObjectNode();
  }

  /**
   * Unwrap the {@code result} member of a response, falling back to the response itself for
   * firmware that answers without an envelope.
   */
  public static @NotNull JsonNode result(@NotNull JsonNode response) {
    JsonNode result = response.get("result");
    return result != null && !result.isNull() ? result : response;
  }

  /**
   * Convert one of the two error envelopes into an exception
   * @param response Parsed response body
   * @throws RpcException if the body is the legacy {code&lt;0, message} or the JSON-RPC
   *                      {error:{code,message}} shape
   */
  public static void checkEnvelope(@NotNull JsonNode response) {
    JsonNode error = response.get("error");
    if (error != null && error.isObject()) {
      throw new RpcException(error.path("code").asInt(-1), error.path("message").asText("unknown error"));
    }

    JsonNode code = response.get("code");
    if (code != null && code.isNumber() && code.asInt() < 0) {
      throw new RpcException(code.asInt(), response.path("message").asText("unknown error"));
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPropertyOrder({"id", "src", "method", "params"})
  public record RequestFrame(
        @JsonProperty("id") long id,
        @JsonProperty("src") String src,
        @JsonProperty("method") String method,
        @JsonProperty("params") JsonNode params
  ) {
    @Override public String toString() { return Rpc.toString(this); }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPropertyOrder({"name", "event", "cid", "enable", "urls", "repeat_period"})
  public record WebhookCreateParams(
        @JsonProperty("name") String name,
        @JsonProperty("event") String event,
        @JsonProperty("cid") int cid,
        @JsonProperty("enable") boolean enable,
        @JsonProperty("urls") List<String> urls,
        @JsonProperty("repeat_period") int repeatPeriod
  ) {
    @Override public String toString() { return Rpc.toString(this); }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Hook(
        @JsonProperty("id") Integer id,
        @JsonProperty("name") String name,
        @JsonProperty("event") String event,
        @JsonProperty("cid") Integer cid,
        @JsonProperty("enable") Boolean enable,
        @JsonProperty("urls") List<String> urls
  ) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record HookList(
        @JsonProperty("hooks") List<Hook> hooks,
        @JsonProperty("rev") Integer rev
  ) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Acknowledge(
        @JsonProperty("ok") boolean ok
  ) {}
}
