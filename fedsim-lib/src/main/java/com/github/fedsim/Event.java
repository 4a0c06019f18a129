// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/// Something that happened at a point in virtual time. Events flow from nodes to the coordinator and from the
/// coordinator to the node named as the destination. The coordinator only looks at the routing fields and passes the
/// payload through unmodified.
///
/// @param eventType   domain specific tag that each node dispatches on
/// @param timeUs      virtual timestamp in microseconds, never below the time at which the event was produced
/// @param source      the node that produced the event
/// @param destination the node the event should be delivered to, or null for an informational or metric event
/// @param payload     opaque JSON object, copied in and out so that the record stays immutable
public record Event(
    String eventType,
    long timeUs,
    String source,
    @Nullable String destination,
    ObjectNode payload
) {
  public Event {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(source, "source");
    if (eventType.isEmpty()) {
      throw new IllegalArgumentException("eventType must not be empty");
    }
    if (source.isEmpty()) {
      throw new IllegalArgumentException("source must not be empty");
    }
    if (timeUs < 0) {
      throw new IllegalArgumentException("timeUs must be non-negative: " + timeUs);
    }
    // an empty destination is how some backends spell "no destination"
    if (destination != null && destination.isEmpty()) {
      destination = null;
    }
    payload = payload == null ? JsonNodeFactory.instance.objectNode() : payload.deepCopy();
  }

  public static Event of(String eventType, long timeUs, String source, @Nullable String destination) {
    return new Event(eventType, timeUs, source, destination, null);
  }

  @Override
  public ObjectNode payload() {
    return payload.deepCopy();
  }

  /// @return true if the event should be delivered to another node rather than to the metrics sink.
  public boolean isDirected() {
    return destination != null;
  }

  /// Network models that delay delivery restamp the event with its arrival time.
  public Event withTimeUs(long newTimeUs) {
    return new Event(eventType, newTimeUs, source, destination, payload);
  }

  @Override
  public String toString() {
    return "Event[" + eventType + "@" + timeUs + " " + source + "->" + (destination == null ? "*" : destination)
        + " " + payload + "]";
  }
}
