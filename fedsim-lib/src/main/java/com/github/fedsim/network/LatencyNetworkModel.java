// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.network;

import com.github.fedsim.DeterministicSeed;
import com.github.fedsim.Event;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.random.RandomGenerator;

import static com.github.fedsim.FedSimLogger.LOGGER;

/// Delays each event by the latency of its link and drops it with the link's loss probability. Every configured link
/// draws from its own generator seeded from `"<source>_<destination>"` and the scenario seed, and all unconfigured
/// pairs share one generator seeded from `"default"`, so the drop pattern of a link does not depend on traffic on
/// other links. In-flight events are ordered by `(deliveryTimeUs, sequence)` so that events arriving at the same
/// time keep the order in which they were sent.
public final class LatencyNetworkModel implements NetworkModel {

  static final String DEFAULT_LINK = "default";

  private record InFlight(Event event, long deliveryTimeUs, long latencyUs, long sequence) {
  }

  private static final Comparator<InFlight> ORDER = Comparator
      .comparingLong(InFlight::deliveryTimeUs)
      .thenComparingLong(InFlight::sequence);

  private final NetworkConfig config;
  private final long seed;
  private final Map<NetworkConfig.LinkKey, NetworkConfig.Link> links;
  private final Map<NetworkConfig.LinkKey, RandomGenerator> linkRandoms = new HashMap<>();
  private RandomGenerator defaultRandom;
  private final PriorityQueue<InFlight> inFlight = new PriorityQueue<>(ORDER);
  private final NetworkMetrics metrics = new NetworkMetrics();
  private long nextSequence = 0;

  public LatencyNetworkModel(NetworkConfig config, long seed) {
    this.config = config;
    this.seed = seed;
    this.links = config.linksByKey();
    seedRandoms();
  }

  private void seedRandoms() {
    linkRandoms.clear();
    links.keySet().forEach(key -> linkRandoms.put(key, DeterministicSeed.random(key.seedLabel(), seed)));
    defaultRandom = DeterministicSeed.random(DEFAULT_LINK, seed);
  }

  @Override
  public List<Event> route(Event event) {
    metrics.recordSent();
    final var key = new NetworkConfig.LinkKey(event.source(), event.destination());
    final NetworkConfig.Link link = links.get(key);
    final long latencyUs = link != null ? link.latencyUs() : config.defaultLatencyUs();
    final double lossRate = link != null ? link.lossRate() : config.defaultLossRate();
    final RandomGenerator random = link != null ? linkRandoms.get(key) : defaultRandom;
    if (random.nextDouble() < lossRate) {
      metrics.recordDropped();
      LOGGER.finer(() -> "dropped " + event);
      return List.of();
    }
    final long deliveryTimeUs = saturatedAdd(event.timeUs(), latencyUs);
    inFlight.add(new InFlight(event.withTimeUs(deliveryTimeUs), deliveryTimeUs, latencyUs, nextSequence++));
    return List.of();
  }

  /// Both arguments are non-negative. An event so late that its delivery time overflows is never delivered.
  static long saturatedAdd(long timeUs, long latencyUs) {
    return latencyUs > Long.MAX_VALUE - timeUs ? Long.MAX_VALUE : timeUs + latencyUs;
  }

  @Override
  public List<Event> advanceTo(long limitUs) {
    final List<Event> due = new ArrayList<>();
    while (!inFlight.isEmpty() && inFlight.peek().deliveryTimeUs() < limitUs) {
      final InFlight next = inFlight.poll();
      metrics.recordDelivered(next.latencyUs());
      due.add(next.event());
    }
    return due;
  }

  public int inFlight() {
    return inFlight.size();
  }

  @Override
  public void reset() {
    inFlight.clear();
    nextSequence = 0;
    metrics.reset();
    seedRandoms();
  }

  @Override
  public NetworkMetrics.Snapshot metrics() {
    return metrics.snapshot();
  }
}
