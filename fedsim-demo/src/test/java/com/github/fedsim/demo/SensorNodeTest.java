// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.demo;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.fedsim.Event;
import com.github.fedsim.node.DeterminismHarness;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SensorNodeTest {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  static ObjectNode config(long seed) {
    ObjectNode config = JsonNodeFactory.instance.objectNode();
    config.put("seed", seed);
    return config;
  }

  static List<Double> temperatures(List<Event> events) {
    return events.stream().map(e -> e.payload().get("temperature").doubleValue()).toList();
  }

  @Test
  public void samplesOncePerPeriod() {
    SensorNode sensor = new SensorNode();
    sensor.init("sensor1", config(42));

    List<Event> events = sensor.advance(3_500_000, List.of());

    assertThat(events).extracting(Event::timeUs).containsExactly(1_000_000L, 2_000_000L, 3_000_000L);
    assertThat(events).extracting(Event::eventType).containsOnly(SensorNode.TRANSMIT);
    assertThat(events).extracting(Event::destination).containsOnly("gateway");
    assertThat(events).extracting(e -> e.payload().get("sample_id").longValue()).containsExactly(1L, 2L, 3L);
    assertThat(events).extracting(e -> e.payload().get("unit").asText()).containsOnly("C");
    assertThat(sensor.samplesTaken()).isEqualTo(3);
  }

  @Test
  public void temperaturesArePlausible() {
    SensorNode sensor = new SensorNode();
    sensor.init("sensor1", config(42));
    List<Double> readings = temperatures(sensor.advance(101_000_000, List.of()));

    assertThat(readings).hasSize(100);
    assertThat(readings).allSatisfy(t -> assertThat(t).isBetween(5.0, 35.0));
    double mean = readings.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
    assertThat(mean).isBetween(19.0, 21.0);
  }

  @Test
  public void honoursTheConfig() {
    ObjectNode config = config(1);
    config.put("start_us", 500);
    config.put("period_us", 250);
    config.put("destination", "edge");
    SensorNode sensor = new SensorNode();
    sensor.init("s", config);

    List<Event> events = sensor.advance(1_001, List.of());

    assertThat(events).extracting(Event::timeUs).containsExactly(500L, 750L, 1_000L);
    assertThat(events).extracting(Event::destination).containsOnly("edge");
  }

  @Test
  public void rejectsANonPositivePeriod() {
    ObjectNode config = config(1);
    config.put("period_us", 0);
    assertThatThrownBy(() -> new SensorNode().init("s", config)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void sameSeedSameTranscript() {
    assertThat(DeterminismHarness.reproducible(SensorNode::new, "sensor1", 42, config(42), 10_000_000, 1_000_000))
        .isTrue();
  }

  @Test
  public void seedAndNodeIdBothChangeTheReadings() {
    List<Double> base = temperatures(run("sensor1", 42));
    assertThat(temperatures(run("sensor1", 43))).isNotEqualTo(base);
    assertThat(temperatures(run("sensor2", 42))).isNotEqualTo(base);
    assertThat(temperatures(run("sensor1", 42))).isEqualTo(base);
  }

  static List<Event> run(String nodeId, long seed) {
    var harness = new DeterminismHarness(new SensorNode(), nodeId, seed);
    harness.run(10_000_000, 1_000_000);
    return harness.emitted();
  }
}
