// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.demo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.fedsim.Event;
import com.github.fedsim.node.AbstractSimNode;

import java.util.logging.Logger;

/// An edge gateway. Each `TRANSMIT` that arrives is processed `process_delay_us` later. Every
/// `aggregate_period_us` the gateway emits an undirected `AGGREGATE` metric event with the count, mean, minimum and
/// maximum of all temperatures processed so far.
public class GatewayNode extends AbstractSimNode {
  private static final Logger LOGGER = Logger.getLogger(GatewayNode.class.getName());

  public static final String PROCESS = "PROCESS";
  public static final String AGGREGATE = "AGGREGATE";

  private long processDelayUs;
  private long aggregatePeriodUs;
  private long received;
  private long processed;
  private double sum;
  private double min;
  private double max;

  @Override
  protected void configure(ObjectNode config) {
    processDelayUs = longSetting(config, "process_delay_us", 100L);
    aggregatePeriodUs = longSetting(config, "aggregate_period_us", 5_000_000L);
    if (processDelayUs < 0 || aggregatePeriodUs <= 0) {
      throw new IllegalArgumentException("process_delay_us must be non-negative and aggregate_period_us positive");
    }
    received = 0;
    processed = 0;
    sum = 0.0;
    min = Double.POSITIVE_INFINITY;
    max = Double.NEGATIVE_INFINITY;
    on(SensorNode.TRANSMIT, this::receive);
    on(PROCESS, this::process);
    on(AGGREGATE, this::aggregate);
    schedule(AGGREGATE, aggregatePeriodUs, null);
  }

  private void receive(Event event) {
    received++;
    final ObjectNode payload = event.payload();
    payload.put("sensor", event.source());
    schedule(PROCESS, now() + processDelayUs, payload);
  }

  private void process(Event event) {
    final JsonNode temperature = event.payload().get("temperature");
    if (temperature == null || !temperature.isNumber()) {
      LOGGER.warning(() -> "node=" + nodeId() + " ignoring reading without a temperature " + event);
      return;
    }
    final double value = temperature.doubleValue();
    processed++;
    sum += value;
    min = Math.min(min, value);
    max = Math.max(max, value);
  }

  private void aggregate(Event event) {
    if (processed > 0) {
      final ObjectNode payload = payload();
      payload.put("count", processed);
      payload.put("avg", sum / processed);
      payload.put("min", min);
      payload.put("max", max);
      emit(AGGREGATE, null, payload);
      LOGGER.fine(() -> String.format("node=%s aggregate at %d: count=%d avg=%.2f", nodeId(), now(), processed,
          sum / processed));
    }
    schedule(AGGREGATE, now() + aggregatePeriodUs, null);
  }

  public long received() {
    return received;
  }

  public long processed() {
    return processed;
  }

  @Override
  public void shutdown() {
    LOGGER.info(() -> "node=" + nodeId() + " received=" + received + " processed=" + processed);
  }
}
