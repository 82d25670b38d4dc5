package com.deigmueller.em_link.status;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.function.Function;

/**
 * Aggregate values over all channels. A total is null when no channel reported the field.
 */
public record Totals(
      @Nullable Double power,
      @Nullable Double current,
      @Nullable Double apparentPower,
      @Nullable Double voltage,
      @Nullable Double powerFactor,
      @Nullable Double monthEnergy,
      @Nullable Double weekEnergy,
      @Nullable Double dayEnergy,
      @Nullable Double monthReturnedEnergy,
      @Nullable Double weekReturnedEnergy,
      @Nullable Double dayReturnedEnergy
) {
  public static final Totals EMPTY = new Totals(null, null, null, null, null, null, null, null, null, null, null);

  public static @NotNull Totals of(@NotNull Collection<ChannelReading> channels) {
    Double power = sum(channels, ChannelReading::power);
    Double apparentPower = sum(channels, ChannelReading::apparentPower);

    Double powerFactor = null;
    if (power != null && apparentPower != null && apparentPower > 0.0) {
      powerFactor = Math.max(-1.0, Math.min(1.0, power / apparentPower));
    }

    return new Totals(
          power,
          sum(channels, ChannelReading::current),
          apparentPower,
          average(channels, ChannelReading::voltage),
          powerFactor,
          sum(channels, ChannelReading::monthEnergy),
          sum(channels, ChannelReading::weekEnergy),
          sum(channels, ChannelReading::dayEnergy),
          sum(channels, ChannelReading::monthReturnedEnergy),
          sum(channels, ChannelReading::weekReturnedEnergy),
          sum(channels, ChannelReading::dayReturnedEnergy));
  }

  private static @Nullable Double sum(@NotNull Collection<ChannelReading> channels,
                                      @NotNull Function<ChannelReading,Double> field) {
    Double result = null;
    for (ChannelReading channel : channels) {
      Double value = field.apply(channel);
      if (value != null) {
        result = result != null ? result + value : value;
      }
    }
    return result;
  }

  private static @Nullable Double average(@NotNull Collection<ChannelReading> channels,
                                          @NotNull Function<ChannelReading,Double> field) {
    double sum = 0.0;
    int count = 0;
    for (ChannelReading channel : channels) {
      Double value = field.apply(channel);
      if (value != null) {
        sum += value;
        count++;
      }
    }
    return count > 0 ? sum / count : null;
  }
}
