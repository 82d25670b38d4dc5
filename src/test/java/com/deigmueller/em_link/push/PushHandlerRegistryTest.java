package com.deigmueller.em_link.push;

import com.deigmueller.em_link.status.ChannelReading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

class PushHandlerRegistryTest {
  private final PushHandlerRegistry registry = new PushHandlerRegistry();

  @Test
  @DisplayName("keys are built from normalized identities")
  void keys() {
    assertThat(PushHandlerRegistry.identityKey("aa:bb:cc:dd:ee:ff"), is("AABBCCDDEEFF"));
    assertThat(PushHandlerRegistry.channelKey("aa:bb:cc:dd:ee:ff", 2), is("AABBCCDDEEFF:2"));
  }

  @Test
  @DisplayName("a channel notification reaches the device and the channel consumer")
  void channelNotificationReachesBoth() {
    List<String> received = new ArrayList<>();
    registry.registerHandler(PushHandlerRegistry.identityKey("AABBCCDDEEFF"), notification -> received.add("device"));
    registry.registerHandler(PushHandlerRegistry.channelKey("AABBCCDDEEFF", 2), notification -> received.add("channel"));

    int delivered = registry.dispatch(notification(2, false));

    assertThat(delivered, is(2));
    assertThat(received, is(List.of("device", "channel")));
  }

  @Test
  @DisplayName("a merged notification also reaches the consumer of the channel it names")
  void mergedNotificationReachesChannel() throws Exception {
    List<String> received = new ArrayList<>();
    registry.registerHandler(PushHandlerRegistry.identityKey("AABBCCDDEEFF"), notification -> received.add("device"));
    registry.registerHandler(PushHandlerRegistry.channelKey("AABBCCDDEEFF", 2), notification -> received.add("channel " + notification.reading().power()));

    PushNotification notification = new PushNotificationParser().parse("AABBCCDDEEFF",
          "{\"method\":\"NotifyStatus\",\"params\":{\"emmerge\":{\"id\":2,\"power\":150.2}}}");

    assertThat(notification.aggregate(), is(true));
    assertThat(registry.dispatch(notification), is(2));
    assertThat(received, is(List.of("device", "channel 150.2")));
  }

  @Test
  @DisplayName("a failing consumer does not block the other one")
  void failingConsumerIsIsolated() {
    List<String> received = new ArrayList<>();
    registry.registerHandler("AABBCCDDEEFF", notification -> {
      throw new IllegalStateException("boom");
    });
    registry.registerHandler("AABBCCDDEEFF:3", notification -> received.add("channel"));

    assertThat(registry.dispatch(notification(3, false)), is(2));
    assertThat(received, is(List.of("channel")));
  }

  @Test
  @DisplayName("conditional unregistering keeps a replaced handler")
  void conditionalUnregister() {
    PushHandler first = notification -> { };
    PushHandler second = notification -> { };

    registry.registerHandler("AABBCCDDEEFF", first);
    registry.registerHandler("AABBCCDDEEFF", second);
    registry.unregisterHandler("AABBCCDDEEFF", first);

    assertThat(registry.hasHandler("AABBCCDDEEFF"), is(true));

    registry.unregisterHandler("AABBCCDDEEFF");

    assertThat(registry.hasHandler("AABBCCDDEEFF"), is(false));
    assertThat(registry.dispatch(notification(1, false)), is(0));
  }

  private static PushNotification notification(int channelId, boolean aggregate) {
    ChannelReading reading = new ChannelReading(channelId, 10.0, 230.0, null, null, null, null, null, null, null, null, null);
    return new PushNotification("AABBCCDDEEFF", "NotifyStatus", null, reading, aggregate);
  }
}
