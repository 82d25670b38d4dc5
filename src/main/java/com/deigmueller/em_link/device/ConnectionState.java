package com.deigmueller.em_link.device;

import lombok.Getter;
import lombok.Setter;
import org.jetbrains.annotations.NotNull;

/**
 * Mutable connection bookkeeping of a coordinator
 */
@Getter
@Setter
public class ConnectionState {
  private @NotNull ConnectionSettings settings;
  private @NotNull Phase phase = Phase.INITIALIZING;
  private Integer webhookId;
  private boolean webhookActive;
  private final AvailabilityTracker availability;

  public ConnectionState(@NotNull ConnectionSettings settings,
                         int failureThreshold) {
    this.settings = settings;
    this.availability = new AvailabilityTracker(failureThreshold);
  }

  public void clearWebhook() {
    webhookId = null;
    webhookActive = false;
  }

  public @NotNull Snapshot snapshot() {
    return new Snapshot(
          phase,
          availability.isAvailable(),
          availability.getConsecutiveFailures(),
          webhookId,
          webhookActive);
  }

  public enum Phase {
    INITIALIZING,
    WEBHOOK_ACTIVE,
    POLLING_ONLY,
    UNREACHABLE
  }

  public record Snapshot(
        @NotNull Phase phase,
        boolean available,
        int consecutiveFailures,
        Integer webhookId,
        boolean webhookActive
  ) {}
}
