package com.deigmueller.em_link.status;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Normalized device status
 * @param temperature Device temperature in °C or null if unknown or implausible
 * @param channels Distinct channel readings in device order
 * @param index Lookup by declared channel id and by 1-based position
 * @param totals Aggregates built from the reporting channels
 */
public record DeviceTelemetry(
      @Nullable Double temperature,
      @NotNull List<ChannelReading> channels,
      @NotNull Map<Integer,ChannelReading> index,
      @NotNull Totals totals
) {
  public static @NotNull DeviceTelemetry empty(@Nullable Double temperature) {
    return new DeviceTelemetry(temperature, Collections.emptyList(), Collections.emptyMap(), Totals.EMPTY);
  }

  public @Nullable ChannelReading channel(int channelId) {
    return index.get(channelId);
  }

  public boolean isEmpty() {
    return channels.isEmpty();
  }
}
