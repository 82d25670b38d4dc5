package com.deigmueller.em_link.device;

import com.deigmueller.em_link.common.http.TransportClient;
import com.deigmueller.em_link.common.websocket.RpcSocketClient;
import com.typesafe.config.Config;
import org.apache.pekko.actor.typed.ActorSystem;
import org.apache.pekko.actor.typed.DispatcherSelector;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.concurrent.Executor;

@FunctionalInterface
public interface DeviceClientFactory {
  @NotNull DeviceClient create(@NotNull ConnectionSettings settings);

  /**
   * Factory building real HTTP and WebSocket connections
   * @param system Actor system providing the HTTP client and the blocking dispatcher
   * @param config The {@code em-link} configuration block
   */
  static @NotNull DeviceClientFactory network(@NotNull ActorSystem<?> system,
                                              @NotNull Config config) {
    final Duration transportTimeout = config.getDuration("transport.timeout");
    final Duration socketTimeout = config.getDuration("websocket.timeout");
    final Duration closeGrace = config.getDuration("websocket.close-grace");
    final Executor executor = system.dispatchers().lookup(DispatcherSelector.blocking());

    return settings -> new DeviceClient(
          new TransportClient(system, settings.host(), settings.username(), settings.password(), transportTimeout),
          new RpcSocketClient(settings.host(), socketTimeout, closeGrace, executor));
  }
}
