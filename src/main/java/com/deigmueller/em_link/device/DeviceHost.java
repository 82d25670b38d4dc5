package com.deigmueller.em_link.device;

import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * The platform hosting a logical device. It stores capability values, shows the availability
 * and wires trigger events into its automation engine.
 */
public interface DeviceHost {
  void setCapability(@NotNull String capability, double value);

  void setAvailable(boolean available);

  void emitTrigger(@NotNull String trigger, @NotNull Map<String,Object> payload);
}
