package com.deigmueller.em_link.common.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletionStage;

/**
 * Something that can execute a device RPC method and deliver the unwrapped {@code result}.
 */
public interface RpcCaller {
  CompletionStage<JsonNode> call(@NotNull String method,
                                 @NotNull ObjectNode params);
}
