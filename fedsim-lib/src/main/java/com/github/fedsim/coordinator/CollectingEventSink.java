// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.coordinator;

import com.github.fedsim.Event;

import java.util.ArrayList;
import java.util.List;

/// Keeps sink events in memory in the order the coordinator routed them.
public final class CollectingEventSink implements EventSink {
  private final List<Event> events = new ArrayList<>();

  @Override
  public synchronized void accept(Event event) {
    events.add(event);
  }

  public synchronized List<Event> events() {
    return List.copyOf(events);
  }
}
