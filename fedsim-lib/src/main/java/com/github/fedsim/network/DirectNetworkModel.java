// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.network;

import com.github.fedsim.Event;

import java.util.List;

/// Zero latency and no loss. Every event arrives at the next cycle boundary exactly as it was sent.
public final class DirectNetworkModel implements NetworkModel {

  private final NetworkMetrics metrics = new NetworkMetrics();

  @Override
  public List<Event> route(Event event) {
    metrics.recordSent();
    metrics.recordDelivered(0);
    return List.of(event);
  }

  @Override
  public List<Event> advanceTo(long limitUs) {
    return List.of();
  }

  @Override
  public void reset() {
    metrics.reset();
  }

  @Override
  public NetworkMetrics.Snapshot metrics() {
    return metrics.snapshot();
  }
}
