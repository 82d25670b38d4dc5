package com.deigmueller.em_link.webhook;

import com.deigmueller.em_link.common.rpc.Rpc;
import com.deigmueller.em_link.common.rpc.RpcCaller;
import com.deigmueller.em_link.common.rpc.RpcException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * In-memory webhook table answering the RPC methods the registrar uses
 */
class SimulatedHookDevice {
  final Map<Integer,Rpc.Hook> hooks = new LinkedHashMap<>();
  final List<String> readerCalls = Collections.synchronizedList(new ArrayList<>());
  final List<String> mutatorCalls = Collections.synchronizedList(new ArrayList<>());
  final List<String> supportedEvents = new ArrayList<>(List.of("emmerge.power_change", "em.power_change"));

  boolean rejectAggregate;
  boolean failList;
  private int nextId = 1;

  synchronized int addHook(String name, String event, int cid) {
    int id = nextId++;
    hooks.put(id, new Rpc.Hook(id, name, event, cid, true, List.of("http://127.0.0.1:8741/webhook/X")));
    return id;
  }

  synchronized long countNamed(String name) {
    return hooks.values().stream().filter(hook -> name.equals(hook.name())).count();
  }

  RpcCaller reader() {
    return (method, params) -> {
      readerCalls.add(method);
      return answer(method, params);
    };
  }

  RpcCaller mutator() {
    return (method, params) -> {
      mutatorCalls.add(method);
      return answer(method, params);
    };
  }

  private synchronized CompletionStage<JsonNode> answer(@NotNull String method, @NotNull ObjectNode params) {
    switch (method) {
      case "Webhook.List" -> {
        if (failList) {
          return CompletableFuture.failedFuture(new RpcException(-1, "list failed"));
        }
        ObjectNode result = Rpc.params();
        ArrayNode array = result.putArray("hooks");
        for (Rpc.Hook hook : hooks.values()) {
          array.add(Rpc.getObjectMapper().valueToTree(hook));
        }
        result.put("rev", hooks.size());
        return CompletableFuture.completedFuture(result);
      }
      case "Webhook.Supported.List" -> {
        ObjectNode result = Rpc.params();
        ObjectNode types = result.putObject("types");
        for (String event : supportedEvents) {
          types.putObject(event);
        }
        return CompletableFuture.completedFuture(result);
      }
      case "Webhook.Create" -> {
        String event = params.path("event").asText();
        if (rejectAggregate && event.startsWith("emmerge.")) {
          return CompletableFuture.failedFuture(new RpcException(-103, "invalid argument 'event'"));
        }
        int id = addHook(params.path("name").asText(), event, params.path("cid").asInt());
        return CompletableFuture.completedFuture(Rpc.params().put("id", id).put("rev", hooks.size()));
      }
      case "Webhook.Delete" -> {
        hooks.remove(params.path("id").asInt());
        return CompletableFuture.completedFuture(Rpc.params().put("rev", hooks.size()));
      }
      default -> {
        return CompletableFuture.failedFuture(new RpcException(-114, "method not found"));
      }
    }
  }
}
