package com.deigmueller.em_link.push;

import com.deigmueller.em_link.status.ChannelReading;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A change notification posted by a device
 * @param identity Normalized device identity taken from the request path
 * @param method Method tag of the envelope, usually {@code NotifyStatus}
 * @param timestamp Device timestamp if present
 * @param reading Pushed channel values
 * @param aggregate true if the values describe the device as a whole ({@code emmerge})
 */
public record PushNotification(
      @NotNull String identity,
      @Nullable String method,
      @Nullable Double timestamp,
      @NotNull ChannelReading reading,
      boolean aggregate
) {
  public int channelId() {
    return reading.channelId();
  }
}
