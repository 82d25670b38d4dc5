package com.deigmueller.em_link.status;

import com.deigmueller.em_link.common.rpc.Rpc;
import com.deigmueller.em_link.common.utils.Json;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciles the different firmware answers to {@code Em.Status.Get} into one
 * {@link DeviceTelemetry}.
 */
public class StatusNormalizer {
  // Class members
  private static final Logger LOGGER = LoggerFactory.getLogger("em-link.normalizer");

  private static final double MIN_TEMPERATURE = -40.0;
  private static final double MAX_TEMPERATURE = 125.0;
  private static final double[] TEMPERATURE_DIVISORS = {1.0, 10.0, 100.0, 1000.0};
  private static final String[][] TEMPERATURE_PATHS = {
        {"temperature"},
        {"sys", "temperature"},
        {"sys", "temp"},
        {"device_temperature"},
        {"temp"}
  };

  /**
   * Normalize a status payload
   * @param raw Response body, with or without the {@code result} envelope
   * @return Normalized telemetry; the channel list is empty if no shape matched
   */
  public @NotNull DeviceTelemetry normalize(@NotNull JsonNode raw) {
    LOGGER.trace("StatusNormalizer.normalize()");

    JsonNode result = Rpc.result(raw);
    Double temperature = readTemperature(raw, result);

    for (ChannelShape shape : ChannelShape.values()) {
      List<ChannelShape.Candidate> candidates = shape.extract(raw, result);
      if (!candidates.isEmpty()) {
        LOGGER.debug("status payload matched shape {} with {} channel(s)", shape, candidates.size());
        return build(temperature, candidates);
      }
    }

    LOGGER.warn("no channel data found in status payload: {}", StringUtils.abbreviate(raw.toString(), 200));

    return DeviceTelemetry.empty(temperature);
  }

  private @NotNull DeviceTelemetry build(@Nullable Double temperature,
                                         @NotNull List<ChannelShape.Candidate> candidates) {
    List<ChannelReading> channels = new ArrayList<>(candidates.size());
    int position = 0;
    for (ChannelShape.Candidate candidate : candidates) {
      position++;
      int channelId = candidate.declaredId() != null ? candidate.declaredId() : position;
      channels.add(ChannelReading.fromJson(channelId, candidate.record()));
    }

    Map<Integer,ChannelReading> index = new LinkedHashMap<>();
    for (ChannelReading channel : channels) {
      index.putIfAbsent(channel.channelId(), channel);
    }
    for (int i = 0; i < channels.size(); i++) {
      index.putIfAbsent(i + 1, channels.get(i));
    }

    return new DeviceTelemetry(
          temperature,
          Collections.unmodifiableList(channels),
          Collections.unmodifiableMap(index),
          Totals.of(channels));
  }

  /**
   * Find the device temperature and bring it to °C
   */
  static @Nullable Double readTemperature(@NotNull JsonNode raw,
                                          @NotNull JsonNode result) {
    for (JsonNode root : new JsonNode[] { result, raw }) {
      for (String[] path : TEMPERATURE_PATHS) {
        JsonNode node = root;
        for (String element : path) {
          node = node.path(element);
        }

        Double value = temperatureValue(node);
        if (value != null) {
          Double scaled = scaleTemperature(value);
          if (scaled != null) {
            return scaled;
          }
          LOGGER.debug("ignoring implausible temperature {} at {}", value, String.join(".", path));
        }
      }
    }

    return null;
  }

  /**
   * Scale a raw temperature reading by the first divisor yielding a plausible value
   * @param value Raw value as reported
   * @return Temperature in °C or null if no divisor yields a value in the plausible range
   */
  static @Nullable Double scaleTemperature(double value) {
    for (double divisor : TEMPERATURE_DIVISORS) {
      double scaled = value / divisor;
      if (scaled >= MIN_TEMPERATURE && scaled <= MAX_TEMPERATURE) {
        return scaled;
      }
    }
    return null;
  }

  private static @Nullable Double temperatureValue(@NotNull JsonNode node) {
    if (node.isObject()) {
      return Json.readDoubleValue(node, "tC", "value", "celsius");
    }
    return Json.toDouble(node);
  }
}
