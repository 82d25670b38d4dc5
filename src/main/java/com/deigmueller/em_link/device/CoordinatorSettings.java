package com.deigmueller.em_link.device;

import com.deigmueller.em_link.common.utils.NetUtils;
import com.typesafe.config.Config;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;

/**
 * Tuning shared by all coordinators
 */
public record CoordinatorSettings(
      int failureThreshold,
      @NotNull Duration safetyNetInterval,
      double jitter,
      @NotNull Duration retryDelay,
      @NotNull Duration minimumInterval,
      @NotNull Duration defaultPollInterval,
      @NotNull String advertisedAddress,
      int pushPort
) {
  /**
   * Read the settings from the {@code em-link} configuration block
   */
  public static @NotNull CoordinatorSettings fromConfig(@NotNull Config config) {
    Config coordinator = config.getConfig("coordinator");

    String advertisedAddress = config.getString("push-server.advertised-address");
    if (StringUtils.isBlank(advertisedAddress)) {
      advertisedAddress = NetUtils.detectPrimaryIpAddress();
    }

    return new CoordinatorSettings(
          coordinator.getInt("failure-threshold"),
          coordinator.getDuration("safety-net-interval"),
          coordinator.getDouble("jitter"),
          coordinator.getDuration("retry-delay"),
          coordinator.getDuration("minimum-interval"),
          coordinator.getDuration("default-poll-interval"),
          advertisedAddress,
          config.getInt("push-server.port"));
  }
}
