package com.deigmueller.em_link.device;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Host which only writes the published values to the log
 */
public class LoggingDeviceHost implements DeviceHost {
  private final Logger logger;

  public LoggingDeviceHost(@NotNull String identity) {
    this.logger = LoggerFactory.getLogger("em-link.host." + identity);
  }

  @Override
  public void setCapability(@NotNull String capability, double value) {
    logger.info("{} = {}", capability, value);
  }

  @Override
  public void setAvailable(boolean available) {
    if (available) {
      logger.info("device is available");
    } else {
      logger.warn("device is unavailable");
    }
  }

  @Override
  public void emitTrigger(@NotNull String trigger, @NotNull Map<String,Object> payload) {
    logger.debug("trigger {} {}", trigger, payload);
  }
}
