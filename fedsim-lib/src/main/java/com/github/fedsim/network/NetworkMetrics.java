// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.network;

import java.util.OptionalLong;

/// Packet counters of a network model. Not thread safe: network models are only driven by the coordinator's routing
/// step which runs on one thread.
public final class NetworkMetrics {

  /// An immutable copy of the counters for reporting.
  public record Snapshot(long packetsSent, long packetsDelivered, long packetsDropped, long totalLatencyUs,
                         OptionalLong minLatencyUs, OptionalLong maxLatencyUs) {
    public static final Snapshot EMPTY = new Snapshot(0, 0, 0, 0, OptionalLong.empty(), OptionalLong.empty());

    public double averageLatencyUs() {
      return packetsDelivered == 0 ? 0.0 : (double) totalLatencyUs / packetsDelivered;
    }

    public long packetsInFlight() {
      return packetsSent - packetsDelivered - packetsDropped;
    }

    @Override
    public String toString() {
      return String.format("sent=%d delivered=%d dropped=%d inFlight=%d avgLatencyUs=%.1f minLatencyUs=%s maxLatencyUs=%s",
          packetsSent, packetsDelivered, packetsDropped, packetsInFlight(), averageLatencyUs(),
          minLatencyUs.isPresent() ? minLatencyUs.getAsLong() : "-",
          maxLatencyUs.isPresent() ? maxLatencyUs.getAsLong() : "-");
    }
  }

  private long sent;
  private long delivered;
  private long dropped;
  private long totalLatencyUs;
  private long minLatencyUs = Long.MAX_VALUE;
  private long maxLatencyUs = Long.MIN_VALUE;

  public void recordSent() {
    sent++;
  }

  public void recordDelivered(long latencyUs) {
    delivered++;
    totalLatencyUs += latencyUs;
    minLatencyUs = Math.min(minLatencyUs, latencyUs);
    maxLatencyUs = Math.max(maxLatencyUs, latencyUs);
  }

  public void recordDropped() {
    dropped++;
  }

  public void reset() {
    sent = 0;
    delivered = 0;
    dropped = 0;
    totalLatencyUs = 0;
    minLatencyUs = Long.MAX_VALUE;
    maxLatencyUs = Long.MIN_VALUE;
  }

  public Snapshot snapshot() {
    return new Snapshot(sent, delivered, dropped, totalLatencyUs,
        delivered == 0 ? OptionalLong.empty() : OptionalLong.of(minLatencyUs),
        delivered == 0 ? OptionalLong.empty() : OptionalLong.of(maxLatencyUs));
  }
}
