// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.demo;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.fedsim.Event;
import com.github.fedsim.node.AbstractSimNode;

import java.util.logging.Logger;

/// A temperature sensor. Starting at `start_us` it takes a sample every `period_us`, drawing the temperature from
/// N(20, 2) with the node's seeded generator, and sends it to `destination` as a `TRANSMIT` event stamped with the
/// sample time.
public class SensorNode extends AbstractSimNode {
  private static final Logger LOGGER = Logger.getLogger(SensorNode.class.getName());

  public static final String SAMPLE = "SAMPLE";
  public static final String TRANSMIT = "TRANSMIT";

  static final double MEAN_C = 20.0;
  static final double STDDEV_C = 2.0;

  private long periodUs;
  private String destination;
  private long samplesTaken;

  @Override
  protected void configure(ObjectNode config) {
    final long startUs = longSetting(config, "start_us", 1_000_000L);
    periodUs = longSetting(config, "period_us", 1_000_000L);
    if (periodUs <= 0) {
      throw new IllegalArgumentException("period_us must be positive: " + periodUs);
    }
    destination = textSetting(config, "destination", "gateway");
    samplesTaken = 0;
    on(SAMPLE, this::sample);
    schedule(SAMPLE, startUs, null);
  }

  private void sample(Event event) {
    final double temperature = random().nextGaussian(MEAN_C, STDDEV_C);
    samplesTaken++;
    final ObjectNode payload = payload();
    payload.put("temperature", temperature);
    payload.put("unit", "C");
    payload.put("sample_id", samplesTaken);
    emit(TRANSMIT, destination, payload);
    schedule(SAMPLE, now() + periodUs, null);
  }

  public long samplesTaken() {
    return samplesTaken;
  }

  @Override
  public void shutdown() {
    LOGGER.info(() -> "node=" + nodeId() + " samples taken: " + samplesTaken);
  }
}
