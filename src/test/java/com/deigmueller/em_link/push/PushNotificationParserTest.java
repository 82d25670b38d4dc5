package com.deigmueller.em_link.push;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PushNotificationParserTest {
  private static final String IDENTITY = "AABBCCDDEEFF";

  private final PushNotificationParser parser = new PushNotificationParser();

  @Test
  @DisplayName("a channel notification carries its channel id")
  void channelNotification() throws Exception {
    PushNotification notification = parser.parse(IDENTITY,
          "{\"src\":\"em06p-aabbcc\",\"method\":\"NotifyStatus\",\"params\":{\"ts\":1704695819000,"
                + "\"em\":{\"id\":3,\"power\":123.4,\"voltage\":229.8,\"current\":0.61,\"pf\":0.88}}}");

    assertThat(notification.identity(), is(IDENTITY));
    assertThat(notification.method(), is("NotifyStatus"));
    assertThat(notification.timestamp(), is(1704695819000.0));
    assertThat(notification.aggregate(), is(false));
    assertThat(notification.channelId(), is(3));
    assertThat(notification.reading().power(), is(123.4));
    assertThat(notification.reading().powerFactor(), is(0.88));
  }

  @Test
  @DisplayName("an emmerge record is an aggregate notification")
  void aggregateNotification() throws Exception {
    PushNotification notification = parser.parse(IDENTITY,
          "{\"method\":\"NotifyStatus\",\"params\":{\"emmerge\":{\"id\":1,\"power\":500}}}");

    assertThat(notification.aggregate(), is(true));
    assertThat(notification.reading().power(), is(500.0));
  }

  @Test
  @DisplayName("the channel id falls back to the numbered key")
  void channelIdFromKey() throws Exception {
    PushNotification channel = parser.parse(IDENTITY, "{\"params\":{\"em:4\":{\"power\":5}}}");
    PushNotification merged = parser.parse(IDENTITY, "{\"params\":{\"emmerge:1\":{\"power\":7}}}");
    PushNotification unnumbered = parser.parse(IDENTITY, "{\"params\":{\"meter\":{\"power\":9}}}");

    assertThat(channel.channelId(), is(4));
    assertThat(channel.aggregate(), is(false));
    assertThat(merged.aggregate(), is(true));
    assertThat(unnumbered.channelId(), is(1));
  }

  @Test
  @DisplayName("the apparent power is derived from power and power factor")
  void derivedApparentPower() throws Exception {
    PushNotification notification = parser.parse(IDENTITY,
          "{\"method\":\"NotifyStatus\",\"params\":{\"em\":{\"id\":2,\"power\":150.2,\"pf\":0.92}}}");

    assertThat(notification.channelId(), is(2));
    assertThat(notification.reading().power(), is(150.2));
    assertThat(notification.reading().apparentPower(), closeTo(163.26, 0.01));
  }

  @Test
  @DisplayName("an oversized numbered key falls back to the first channel")
  void oversizedKey() throws Exception {
    PushNotification notification = parser.parse(IDENTITY, "{\"params\":{\"em:99999999999\":{\"power\":5}}}");

    assertThat(notification.channelId(), is(1));
    assertThat(notification.reading().power(), is(5.0));
  }

  @Test
  @DisplayName("an idle channel gets zero derived values")
  void idleChannel() throws Exception {
    PushNotification notification = parser.parse(IDENTITY, "{\"params\":{\"em\":{\"id\":2,\"power\":0,\"voltage\":231}}}");

    assertThat(notification.reading().current(), is(0.0));
    assertThat(notification.reading().powerFactor(), is(0.0));
    assertThat(notification.reading().apparentPower(), is(0.0));
    assertThat(notification.reading().voltage(), is(231.0));
  }

  @Test
  @DisplayName("a body without channel data yields no notification")
  void noChannelData() throws Exception {
    assertThat(parser.parse(IDENTITY, "{\"method\":\"NotifyEvent\",\"params\":{\"events\":[]}}"), is(nullValue()));
    assertThat(parser.parse(IDENTITY, "[1,2,3]"), is(nullValue()));
  }

  @Test
  @DisplayName("malformed JSON is reported")
  void malformedJson() {
    assertThrows(JsonProcessingException.class, () -> parser.parse(IDENTITY, "{\"params\":"));
  }
}
