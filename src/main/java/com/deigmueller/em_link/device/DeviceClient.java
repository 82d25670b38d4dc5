package com.deigmueller.em_link.device;

import com.deigmueller.em_link.common.rpc.Rpc;
import com.deigmueller.em_link.common.rpc.RpcCaller;
import com.deigmueller.em_link.webhook.WebhookRegistrar;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletionStage;

/**
 * The RPC calls a coordinator needs, bound to one device connection
 */
public class DeviceClient {
  public static final int ALL_CHANNELS = 65535;

  private final RpcCaller reader;
  private final WebhookRegistrar registrar;

  /**
   * @param reader Plain HTTP access
   * @param mutator WebSocket access for the calls the device rejects over HTTP
   */
  public DeviceClient(@NotNull RpcCaller reader,
                      @NotNull RpcCaller mutator) {
    this.reader = reader;
    this.registrar = new WebhookRegistrar(reader, mutator);
  }

  public CompletionStage<JsonNode> getStatus() {
    return reader.call("Em.Status.Get", Rpc.params().put("id", ALL_CHANNELS));
  }

  public CompletionStage<JsonNode> getDeviceInfo() {
    return reader.call("Refoss.GetDeviceInfo", Rpc.params());
  }

  public @NotNull WebhookRegistrar getRegistrar() {
    return registrar;
  }
}
