package com.deigmueller.em_link.device;

import lombok.Getter;

/**
 * Failure hysteresis: a device is only reported unavailable after a number of consecutive
 * failed polls, and a single success makes it available again.
 */
@Getter
public class AvailabilityTracker {
  private final int threshold;
  private int consecutiveFailures;
  private boolean available = true;

  public AvailabilityTracker(int threshold) {
    if (threshold < 1) {
      throw new IllegalArgumentException("failure threshold must be positive");
    }
    this.threshold = threshold;
  }

  public Transition recordSuccess() {
    consecutiveFailures = 0;
    if (!available) {
      available = true;
      return Transition.RESTORED;
    }
    return Transition.UNCHANGED;
  }

  public Transition recordFailure() {
    consecutiveFailures++;
    if (available && consecutiveFailures >= threshold) {
      available = false;
      return Transition.LOST;
    }
    return Transition.UNCHANGED;
  }

  public enum Transition {
    UNCHANGED,
    RESTORED,
    LOST
  }
}
