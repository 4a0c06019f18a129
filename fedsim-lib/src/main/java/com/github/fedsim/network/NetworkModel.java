// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.network;

import com.github.fedsim.Event;

import java.util.List;

/// Decides when, and whether, an event sent from one node arrives at another. The coordinator hands every directed
/// event to [#route(Event)] once all nodes have finished a cycle, then calls [#advanceTo(long)] with the next cycle's
/// target to collect delayed events that are due in time to be delivered by that cycle.
///
/// Implementations must be deterministic given their configuration and seed and are only called from the
/// coordinator's routing step, so they need not be thread safe.
public interface NetworkModel {

  /// @return the events to deliver immediately. An empty list means dropped or delayed.
  List<Event> route(Event event);

  /// @return delayed events whose delivery time is strictly before `limitUs`, in delivery order. Each event is
  /// restamped with its delivery time.
  List<Event> advanceTo(long limitUs);

  /// Forgets in-flight events and counters and restores the initial random state.
  void reset();

  NetworkMetrics.Snapshot metrics();
}
