package com.deigmueller.em_link.device;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public enum DeviceModel {
  EM01P(1),
  EM06P(6),
  EM16P(18),
  GENERIC(0);

  private final List<Integer> channelIds;

  DeviceModel(int channelCount) {
    this.channelIds = Collections.unmodifiableList(
          IntStream.rangeClosed(1, channelCount).boxed().collect(Collectors.toList()));
  }

  /**
   * @return The 1-based channel ids of the model, empty for {@link #GENERIC}
   */
  public @NotNull List<Integer> channelIds() {
    return channelIds;
  }

  public static @NotNull DeviceModel fromString(@NotNull String value) {
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace("-", "");
    for (DeviceModel model : values()) {
      if (model.name().equals(normalized)) {
        return model;
      }
    }
    throw new IllegalArgumentException("unknown device model: " + value);
  }
}
