package com.deigmueller.em_link.device;

import com.deigmueller.em_link.status.ChannelReading;
import com.deigmueller.em_link.status.Totals;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps readings onto host capabilities. Values are only passed on when they changed, trigger
 * events are emitted on change and every host call is isolated so that a failing host never
 * disturbs the coordinator.
 */
public class CapabilityPublisher {
  // Class members
  private static final Logger LOGGER = LoggerFactory.getLogger("em-link.coordinator");

  public static final String MEASURE_POWER = "measure_power";
  public static final String MEASURE_VOLTAGE = "measure_voltage";
  public static final String MEASURE_CURRENT = "measure_current";
  public static final String MEASURE_POWER_FACTOR = "measure_power_factor";
  public static final String MEASURE_APPARENT_POWER = "measure_apparent_power";
  public static final String MEASURE_TEMPERATURE = "measure_temperature";
  public static final String METER_POWER = "meter_power";
  public static final String METER_POWER_WEEK = "meter_power_week";
  public static final String METER_POWER_DAY = "meter_power_day";
  public static final String METER_POWER_EXPORTED = "meter_power.exported";
  public static final String METER_POWER_WEEK_EXPORTED = "meter_power_week.exported";
  public static final String METER_POWER_DAY_EXPORTED = "meter_power_day.exported";
  public static final String METER_COST_DAY = "meter_cost_day";

  private static final Map<String,String> TRIGGERS = Map.of(
        MEASURE_POWER, "measure_power_changed",
        METER_POWER, "meter_power_changed",
        METER_POWER_WEEK, "meter_power_week_changed",
        METER_POWER_DAY, "meter_power_day_changed");

  // Instance members
  private final DeviceHost host;
  private final double electricityPrice;
  private final Map<String,Double> published = new HashMap<>();
  private Boolean availability;

  public CapabilityPublisher(@NotNull DeviceHost host,
                             double electricityPrice) {
    this.host = host;
    this.electricityPrice = electricityPrice;
  }

  /**
   * Publish the values of a single channel
   */
  public void publishReading(@NotNull ChannelReading reading) {
    publish(MEASURE_POWER, reading.power());
    publish(MEASURE_VOLTAGE, reading.voltage());
    publish(MEASURE_CURRENT, reading.current());
    publish(MEASURE_POWER_FACTOR, reading.powerFactor());
    publish(MEASURE_APPARENT_POWER, reading.apparentPower());
    publish(METER_POWER, reading.monthEnergy());
    publish(METER_POWER_WEEK, reading.weekEnergy());
    publish(METER_POWER_DAY, reading.dayEnergy());
    publish(METER_POWER_EXPORTED, reading.monthReturnedEnergy());
    publish(METER_POWER_WEEK_EXPORTED, reading.weekReturnedEnergy());
    publish(METER_POWER_DAY_EXPORTED, reading.dayReturnedEnergy());
    publishCost(reading.dayEnergy());
  }

  /**
   * Publish the device totals
   */
  public void publishTotals(@NotNull Totals totals,
                            @Nullable Double temperature) {
    publish(MEASURE_POWER, totals.power());
    publish(MEASURE_VOLTAGE, totals.voltage());
    publish(MEASURE_CURRENT, totals.current());
    publish(MEASURE_POWER_FACTOR, totals.powerFactor());
    publish(MEASURE_APPARENT_POWER, totals.apparentPower());
    publish(METER_POWER, totals.monthEnergy());
    publish(METER_POWER_WEEK, totals.weekEnergy());
    publish(METER_POWER_DAY, totals.dayEnergy());
    publish(METER_POWER_EXPORTED, totals.monthReturnedEnergy());
    publish(METER_POWER_WEEK_EXPORTED, totals.weekReturnedEnergy());
    publish(METER_POWER_DAY_EXPORTED, totals.dayReturnedEnergy());
    publish(MEASURE_TEMPERATURE, temperature);
    publishCost(totals.dayEnergy());
  }

  /**
   * Pass a single value to the host if it differs from the last one
   * @param capability Capability name
   * @param value New value, null values are ignored
   * @return true if the value was passed on
   */
  public boolean publish(@NotNull String capability,
                         @Nullable Double value) {
    if (value == null || value.equals(published.get(capability))) {
      return false;
    }

    try {
      host.setCapability(capability, value);
    } catch (Exception e) {
      LOGGER.error("host failed to accept {} = {}: {}", capability, value, e.getMessage());
      return false;
    }
    published.put(capability, value);

    String trigger = TRIGGERS.get(capability);
    if (trigger != null) {
      try {
        host.emitTrigger(trigger, Map.of(capability.equals(MEASURE_POWER) ? "power" : "energy", value));
      } catch (Exception e) {
        LOGGER.error("host failed to emit trigger {}: {}", trigger, e.getMessage());
      }
    }

    return true;
  }

  public void setAvailable(boolean available) {
    if (availability != null && availability == available) {
      return;
    }

    try {
      host.setAvailable(available);
      availability = available;
    } catch (Exception e) {
      LOGGER.error("host failed to change availability to {}: {}", available, e.getMessage());
    }
  }

  public @Nullable Double getPublished(@NotNull String capability) {
    return published.get(capability);
  }

  private void publishCost(@Nullable Double dayEnergy) {
    if (dayEnergy != null && electricityPrice > 0.0) {
      publish(METER_COST_DAY, dayEnergy * electricityPrice);
    }
  }
}
