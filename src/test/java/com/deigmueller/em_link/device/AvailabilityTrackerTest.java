package com.deigmueller.em_link.device;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AvailabilityTrackerTest {

  @Test
  @DisplayName("availability is lost only at the threshold")
  void lostAtThreshold() {
    AvailabilityTracker tracker = new AvailabilityTracker(3);

    assertThat(tracker.recordFailure(), is(AvailabilityTracker.Transition.UNCHANGED));
    assertThat(tracker.recordFailure(), is(AvailabilityTracker.Transition.UNCHANGED));
    assertThat(tracker.isAvailable(), is(true));

    assertThat(tracker.recordFailure(), is(AvailabilityTracker.Transition.LOST));
    assertThat(tracker.isAvailable(), is(false));

    assertThat(tracker.recordFailure(), is(AvailabilityTracker.Transition.UNCHANGED));
    assertThat(tracker.getConsecutiveFailures(), is(4));
  }

  @Test
  @DisplayName("a single success restores availability and resets the count")
  void successRestores() {
    AvailabilityTracker tracker = new AvailabilityTracker(2);
    tracker.recordFailure();
    tracker.recordFailure();

    assertThat(tracker.recordSuccess(), is(AvailabilityTracker.Transition.RESTORED));
    assertThat(tracker.isAvailable(), is(true));
    assertThat(tracker.getConsecutiveFailures(), is(0));
    assertThat(tracker.recordSuccess(), is(AvailabilityTracker.Transition.UNCHANGED));
  }

  @Test
  @DisplayName("a success in between starts counting anew")
  void successInBetween() {
    AvailabilityTracker tracker = new AvailabilityTracker(3);
    tracker.recordFailure();
    tracker.recordFailure();
    tracker.recordSuccess();
    tracker.recordFailure();
    tracker.recordFailure();

    assertThat(tracker.isAvailable(), is(true));
  }

  @Test
  @DisplayName("the threshold has to be positive")
  void positiveThreshold() {
    assertThrows(IllegalArgumentException.class, () -> new AvailabilityTracker(0));
  }
}
