package com.deigmueller.em_link.status;

import com.deigmueller.em_link.common.rpc.Rpc;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;

class StatusNormalizerTest {
  private final StatusNormalizer normalizer = new StatusNormalizer();

  @Test
  @DisplayName("status array with declared ids and totals")
  void statusArray() throws Exception {
    DeviceTelemetry telemetry = normalizer.normalize(json(
          "{\"id\":1,\"result\":{\"status\":["
                + "{\"id\":1,\"power\":100,\"voltage\":230,\"current\":0.5,\"pf\":0.5,\"month_energy\":10},"
                + "{\"id\":2,\"power\":-50,\"voltage\":232,\"current\":0.3,\"month_energy\":2.5}]}}"));

    assertThat(telemetry.channels().size(), is(2));
    assertThat(telemetry.channel(1).apparentPower(), closeTo(200.0, 1e-9));
    assertThat(telemetry.channel(2).power(), is(-50.0));

    Totals totals = telemetry.totals();
    assertThat(totals.power(), closeTo(50.0, 1e-9));
    assertThat(totals.current(), closeTo(0.8, 1e-9));
    assertThat(totals.voltage(), closeTo(231.0, 1e-9));
    assertThat(totals.apparentPower(), closeTo(200.0, 1e-9));
    assertThat(totals.powerFactor(), closeTo(0.25, 1e-9));
    assertThat(totals.monthEnergy(), closeTo(12.5, 1e-9));
    assertThat(totals.dayEnergy(), is(nullValue()));
  }

  @Test
  @DisplayName("zero based prefixed keys are shifted to one based ids")
  void prefixKeyedZeroBased() throws Exception {
    DeviceTelemetry telemetry = normalizer.normalize(json(
          "{\"em:0\":{\"power\":1},\"em:1\":{\"power\":2},\"sys\":{\"temperature\":{\"tC\":41.5}}}"));

    assertThat(telemetry.channels().size(), is(2));
    assertThat(telemetry.channel(1).power(), is(1.0));
    assertThat(telemetry.channel(2).power(), is(2.0));
    assertThat(telemetry.temperature(), is(41.5));
  }

  @Test
  @DisplayName("keyed channels can also be found by position")
  void keyedChannels() throws Exception {
    DeviceTelemetry telemetry = normalizer.normalize(json(
          "{\"result\":{\"channels\":{\"1\":{\"power\":5},\"3\":{\"power\":7}}}}"));

    assertThat(telemetry.channels().size(), is(2));
    assertThat(telemetry.channel(1).power(), is(5.0));
    assertThat(telemetry.channel(3).power(), is(7.0));
    assertThat(telemetry.channel(2).channelId(), is(3));
  }

  @Test
  @DisplayName("a single channel record with numeric strings")
  void singleRecord() throws Exception {
    DeviceTelemetry telemetry = normalizer.normalize(json(
          "{\"result\":{\"id\":2,\"act_power\":\"12.5\",\"voltage\":230}}"));

    assertThat(telemetry.channels().size(), is(1));
    assertThat(telemetry.channel(2).power(), is(12.5));
    assertThat(telemetry.channel(1).channelId(), is(2));
  }

  @Test
  @DisplayName("arrays nested below containers are found")
  void nestedArray() throws Exception {
    DeviceTelemetry telemetry = normalizer.normalize(json(
          "{\"result\":{\"data\":{\"meters\":[{\"power\":3},{\"power\":4}]}}}"));

    assertThat(telemetry.channels().size(), is(2));
    assertThat(telemetry.channel(1).power(), is(3.0));
    assertThat(telemetry.channel(2).power(), is(4.0));
  }

  @Test
  @DisplayName("duplicate ids keep the first record under the id")
  void duplicateIds() throws Exception {
    DeviceTelemetry telemetry = normalizer.normalize(json(
          "{\"status\":[{\"id\":1,\"power\":1},{\"id\":1,\"power\":2}]}"));

    assertThat(telemetry.channels().size(), is(2));
    assertThat(telemetry.channel(1).power(), is(1.0));
    assertThat(telemetry.channel(2).power(), is(2.0));
  }

  @Test
  @DisplayName("the aggregate power factor is clamped")
  void powerFactorIsClamped() throws Exception {
    DeviceTelemetry telemetry = normalizer.normalize(json(
          "{\"status\":[{\"id\":1,\"power\":100,\"apower\":50}]}"));

    assertThat(telemetry.totals().powerFactor(), is(1.0));
  }

  @Test
  @DisplayName("an unknown payload yields empty telemetry")
  void unknownPayload() throws Exception {
    DeviceTelemetry telemetry = normalizer.normalize(json("{\"result\":{\"foo\":\"bar\"}}"));

    assertThat(telemetry.isEmpty(), is(true));
    assertThat(telemetry.totals(), is(Totals.EMPTY));
    assertThat(telemetry.temperature(), is(nullValue()));
  }

  @Test
  @DisplayName("the same reading in every firmware shape normalizes identically")
  void shapesAreEquivalent() throws Exception {
    String first = "\"power\":100,\"voltage\":230,\"pf\":0.5,\"day_energy\":1.25";
    String second = "\"power\":50,\"voltage\":232,\"current\":0.2";

    DeviceTelemetry statusArray = normalizer.normalize(json(
          "{\"result\":{\"status\":[{\"id\":1," + first + "},{\"id\":2," + second + "}]}}"));
    DeviceTelemetry prefixKeyed = normalizer.normalize(json(
          "{\"result\":{\"em:1\":{" + first + "},\"em:2\":{" + second + "}}}"));
    DeviceTelemetry keyedObject = normalizer.normalize(json(
          "{\"result\":{\"1\":{" + first + "},\"2\":{" + second + "}}}"));

    assertThat(statusArray.channels().size(), is(2));
    assertThat(prefixKeyed.channels(), is(statusArray.channels()));
    assertThat(keyedObject.channels(), is(statusArray.channels()));
    assertThat(prefixKeyed.totals(), is(statusArray.totals()));
    assertThat(keyedObject.totals(), is(statusArray.totals()));
    assertThat(statusArray.totals().power(), closeTo(150.0, 1e-9));
  }

  @Test
  @DisplayName("channels without a value are left out of the total")
  void missingValuesAreNotZero() throws Exception {
    DeviceTelemetry telemetry = normalizer.normalize(json(
          "{\"status\":[{\"id\":1,\"power\":10},{\"id\":2,\"power\":null,\"voltage\":230}]}"));

    assertThat(telemetry.channels().size(), is(2));
    assertThat(telemetry.channel(2).power(), is(nullValue()));
    assertThat(telemetry.totals().power(), is(10.0));
    assertThat(telemetry.totals().voltage(), is(230.0));
  }

  @Test
  @DisplayName("keys with oversized channel numbers are skipped")
  void oversizedChannelKeys() throws Exception {
    DeviceTelemetry prefixKeyed = normalizer.normalize(json(
          "{\"em:99999999999\":{\"power\":3},\"em:1\":{\"power\":2}}"));
    DeviceTelemetry keyedObject = normalizer.normalize(json(
          "{\"channels\":{\"99999999999\":{\"power\":3},\"2\":{\"power\":4}}}"));

    assertThat(prefixKeyed.channels().size(), is(1));
    assertThat(prefixKeyed.channel(1).power(), is(2.0));
    assertThat(keyedObject.channels().size(), is(1));
    assertThat(keyedObject.channel(2).power(), is(4.0));
  }

  @Test
  @DisplayName("an implausible temperature does not hide a plausible one")
  void implausibleTemperatureFallsThrough() throws Exception {
    DeviceTelemetry telemetry = normalizer.normalize(json(
          "{\"result\":{\"temperature\":9999999,\"sys\":{\"temperature\":41},\"status\":[{\"id\":1,\"power\":1}]}}"));

    assertThat(telemetry.temperature(), is(41.0));
  }

  @Test
  @DisplayName("temperatures are scaled into the plausible range")
  void temperatureScaling() throws Exception {
    assertThat(StatusNormalizer.scaleTemperature(30), is(30.0));
    assertThat(StatusNormalizer.scaleTemperature(-35), is(-35.0));
    assertThat(StatusNormalizer.scaleTemperature(415), closeTo(41.5, 1e-9));
    assertThat(StatusNormalizer.scaleTemperature(4150), closeTo(41.5, 1e-9));
    assertThat(StatusNormalizer.scaleTemperature(1.0e7), is(nullValue()));

    JsonNode raw = json("{\"temperature\":452,\"result\":{\"status\":[{\"id\":1,\"power\":0}]}}");
    assertThat(normalizer.normalize(raw).temperature(), closeTo(45.2, 1e-9));
  }

  private static JsonNode json(String text) throws Exception {
    return Rpc.getObjectMapper().readTree(text);
  }
}
