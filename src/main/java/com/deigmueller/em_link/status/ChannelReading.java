package com.deigmueller.em_link.status;

import com.deigmueller.em_link.common.utils.Json;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;

/**
 * Canonical measurement of a single CT channel. Every value is optional; a null value means
 * the device did not report the field, which is not the same as zero.
 */
public record ChannelReading(
      int channelId,
      @Nullable Double power,
      @Nullable Double voltage,
      @Nullable Double current,
      @Nullable Double powerFactor,
      @Nullable Double apparentPower,
      @Nullable Double monthEnergy,
      @Nullable Double weekEnergy,
      @Nullable Double dayEnergy,
      @Nullable Double monthReturnedEnergy,
      @Nullable Double weekReturnedEnergy,
      @Nullable Double dayReturnedEnergy
) {
  private static final String[] POWER = {"power", "act_power", "active_power"};
  private static final String[] VOLTAGE = {"voltage"};
  private static final String[] CURRENT = {"current"};
  private static final String[] POWER_FACTOR = {"pf", "power_factor"};
  private static final String[] APPARENT_POWER = {"apower", "aprt_power", "apparent_power"};
  private static final String[] MONTH_ENERGY = {"month_energy"};
  private static final String[] WEEK_ENERGY = {"week_energy"};
  private static final String[] DAY_ENERGY = {"day_energy"};
  private static final String[] MONTH_RETURNED_ENERGY = {"month_ret_energy"};
  private static final String[] WEEK_RETURNED_ENERGY = {"week_ret_energy"};
  private static final String[] DAY_RETURNED_ENERGY = {"day_ret_energy"};

  /**
   * Map a firmware channel record onto the canonical reading
   * @param channelId Already resolved 1-based channel id
   * @param record JSON record as sent by the device
   * @return Canonical reading
   */
  public static @NotNull ChannelReading fromJson(int channelId,
                                                 @NotNull JsonNode record) {
    Double power = Json.readDoubleValue(record, POWER);
    Double powerFactor = Json.readDoubleValue(record, POWER_FACTOR);

    Double apparentPower = Json.readDoubleValue(record, APPARENT_POWER);
    if (apparentPower == null && power != null && powerFactor != null && powerFactor != 0.0) {
      apparentPower = power / powerFactor;
    }

    return new ChannelReading(
          channelId,
          power,
          Json.readDoubleValue(record, VOLTAGE),
          Json.readDoubleValue(record, CURRENT),
          powerFactor,
          apparentPower,
          Json.readDoubleValue(record, MONTH_ENERGY),
          Json.readDoubleValue(record, WEEK_ENERGY),
          Json.readDoubleValue(record, DAY_ENERGY),
          Json.readDoubleValue(record, MONTH_RETURNED_ENERGY),
          Json.readDoubleValue(record, WEEK_RETURNED_ENERGY),
          Json.readDoubleValue(record, DAY_RETURNED_ENERGY));
  }

  /**
   * Check whether a JSON node plausibly describes a channel
   * @param node Candidate node
   * @return true if it is an object carrying an id, a power, current or voltage value or any
   *         energy counter
   */
  public static boolean looksLikeChannel(@Nullable JsonNode node) {
    if (node == null || !node.isObject()) {
      return false;
    }

    if (node.has("id") || node.has("voltage") || node.has("current")) {
      return true;
    }
    for (String name : POWER) {
      if (node.has(name)) {
        return true;
      }
    }

    Iterator<String> fieldNames = node.fieldNames();
    while (fieldNames.hasNext()) {
      if (fieldNames.next().contains("energy")) {
        return true;
      }
    }

    return false;
  }

  /**
   * An idle channel reports {@code power = 0} and often omits the derived values. Zero those
   * so stale non-zero values do not survive.
   * @return Reading with apparent power, current and power factor defaulted to zero when the
   *         power is exactly zero
   */
  public @NotNull ChannelReading withIdleDefaults() {
    if (power == null || power != 0.0) {
      return this;
    }

    return new ChannelReading(
          channelId,
          power,
          voltage,
          current != null ? current : 0.0,
          powerFactor != null ? powerFactor : 0.0,
          apparentPower != null ? apparentPower : 0.0,
          monthEnergy,
          weekEnergy,
          dayEnergy,
          monthReturnedEnergy,
          weekReturnedEnergy,
          dayReturnedEnergy);
  }

  public @NotNull ChannelReading withChannelId(int newChannelId) {
    return new ChannelReading(
          newChannelId,
          power,
          voltage,
          current,
          powerFactor,
          apparentPower,
          monthEnergy,
          weekEnergy,
          dayEnergy,
          monthReturnedEnergy,
          weekReturnedEnergy,
          dayReturnedEnergy);
  }
}
