package com.deigmueller.em_link.device;

import com.typesafe.config.Config;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * User settings of one logical device
 * @param identity Device identity (MAC address without separators) or empty to probe it
 * @param host Host name or address, optionally with a port
 * @param username Digest user name
 * @param password Digest password, empty if the device is not protected
 * @param pollInterval Poll interval, bounded to 5 - 300 seconds
 * @param model Device model
 * @param channelIds Channels of the device, used for the per-channel webhook fallback
 * @param channelId Channel represented by this logical device or null for the whole device
 * @param manageWebhook false if another logical device registers the webhook
 * @param electricityPrice Price per kWh, disabled if not positive
 * @param currency Currency of the price
 * @param eventHint Webhook event to subscribe to, null to discover it
 */
public record ConnectionSettings(
      @NotNull String identity,
      @NotNull String host,
      @Nullable String username,
      @Nullable String password,
      @NotNull Duration pollInterval,
      @NotNull DeviceModel model,
      @NotNull List<Integer> channelIds,
      @Nullable Integer channelId,
      boolean manageWebhook,
      double electricityPrice,
      @NotNull String currency,
      @Nullable String eventHint
) {
  public static final Duration MIN_POLL_INTERVAL = Duration.ofSeconds(5);
  public static final Duration MAX_POLL_INTERVAL = Duration.ofSeconds(300);

  public ConnectionSettings {
    pollInterval = clampPollInterval(pollInterval);
    channelIds = List.copyOf(channelIds);
  }

  public static @NotNull ConnectionSettings fromConfig(@NotNull Config config,
                                                       @NotNull Duration defaultPollInterval) {
    DeviceModel model = config.hasPath("model") ? DeviceModel.fromString(config.getString("model")) : DeviceModel.GENERIC;

    List<Integer> channelIds = config.hasPath("channels") ? config.getIntList("channels") : model.channelIds();

    return new ConnectionSettings(
          config.hasPath("identity") ? config.getString("identity") : "",
          config.getString("host"),
          config.hasPath("username") ? config.getString("username") : null,
          config.hasPath("password") ? config.getString("password") : null,
          config.hasPath("poll-interval") ? config.getDuration("poll-interval") : defaultPollInterval,
          model,
          channelIds,
          config.hasPath("channel-id") ? config.getInt("channel-id") : null,
          !config.hasPath("manage-webhook") || config.getBoolean("manage-webhook"),
          config.hasPath("electricity-price") ? config.getDouble("electricity-price") : 0.0,
          config.hasPath("currency") ? config.getString("currency") : "EUR",
          config.hasPath("event") ? config.getString("event") : null);
  }

  public static @NotNull Duration clampPollInterval(@NotNull Duration pollInterval) {
    if (pollInterval.compareTo(MIN_POLL_INTERVAL) < 0) {
      return MIN_POLL_INTERVAL;
    }
    if (pollInterval.compareTo(MAX_POLL_INTERVAL) > 0) {
      return MAX_POLL_INTERVAL;
    }
    return pollInterval;
  }

  public boolean isChannelMode() {
    return channelId != null;
  }

  public boolean hasIdentity() {
    return StringUtils.isNotBlank(identity);
  }

  /**
   * Check whether the device connection (and with it the webhook) has to be rebuilt
   */
  public boolean connectionDiffers(@NotNull ConnectionSettings other) {
    return !host.equals(other.host)
          || !Objects.equals(StringUtils.defaultString(username), StringUtils.defaultString(other.username))
          || !Objects.equals(StringUtils.defaultString(password), StringUtils.defaultString(other.password));
  }

  public @NotNull ConnectionSettings withIdentity(@NotNull String newIdentity) {
    return new ConnectionSettings(newIdentity, host, username, password, pollInterval, model, channelIds,
          channelId, manageWebhook, electricityPrice, currency, eventHint);
  }

  @Override
  public String toString() {
    return "ConnectionSettings[identity=" + identity + ", host=" + host + ", username=" + username
          + ", pollInterval=" + pollInterval + ", model=" + model + ", channelId=" + channelId + "]";
  }
}
