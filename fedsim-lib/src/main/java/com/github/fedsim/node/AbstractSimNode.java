// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.fedsim.DeterministicSeed;
import com.github.fedsim.Event;
import com.github.fedsim.EventQueue;
import com.github.fedsim.SchedulingException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.random.RandomGenerator;

import static com.github.fedsim.FedSimLogger.LOGGER;

/// Base class for deterministic nodes. It owns the node's [EventQueue] and clock, the generator derived from the node
/// id and the scenario seed, and a dispatch table from `event_type` to handler. Subclasses register handlers and
/// schedule their first events in [#configure(ObjectNode)].
///
/// Inbound events are scheduled at the later of their own timestamp and the node's current time. An event sent
/// during the previous quantum therefore lands at the start of this one. This is the batching approximation of the
/// lockstep coordinator made explicit at the receiving end.
public abstract class AbstractSimNode implements SimNode {

  public static final String SEED = "seed";

  private String nodeId;
  private long seed;
  private RandomGenerator random;
  private EventQueue queue;
  private final Map<String, Consumer<Event>> handlers = new HashMap<>();
  private final List<Event> outbox = new ArrayList<>();

  @Override
  public final void init(String nodeId, ObjectNode config) {
    this.nodeId = nodeId;
    final JsonNode seedNode = config.get(SEED);
    if (seedNode != null && !seedNode.isIntegralNumber()) {
      throw new IllegalArgumentException("config field " + SEED + " must be an integer: " + seedNode);
    }
    this.seed = seedNode == null ? 0L : seedNode.longValue();
    this.random = DeterministicSeed.random(nodeId, seed);
    this.queue = new EventQueue();
    handlers.clear();
    outbox.clear();
    LOGGER.fine(() -> "node=" + nodeId + " initialised with seed=" + seed + " derived="
        + DeterministicSeed.derive(nodeId, seed));
    configure(config);
  }

  /// Reads node specific settings, registers handlers with [#on] and schedules the first events.
  protected abstract void configure(ObjectNode config);

  @Override
  public final List<Event> advance(long targetTimeUs, List<Event> inbound) {
    if (queue == null) {
      throw new IllegalStateException("advance before init");
    }
    inbound.forEach(this::onInbound);
    queue.advance(targetTimeUs, this::dispatch);
    final List<Event> emitted = List.copyOf(outbox);
    outbox.clear();
    return emitted;
  }

  protected void onInbound(Event event) {
    queue.schedule(event.timeUs() < queue.now() ? event.withTimeUs(queue.now()) : event);
  }

  private void dispatch(Event event) {
    final Consumer<Event> handler = handlers.get(event.eventType());
    if (handler == null) {
      onUnhandled(event);
    } else {
      handler.accept(event);
    }
  }

  /// Called for events with no registered handler. Ignores them by default.
  protected void onUnhandled(Event event) {
    LOGGER.finer(() -> "node=" + nodeId + " has no handler for " + event);
  }

  protected final void on(String eventType, Consumer<Event> handler) {
    if (handlers.putIfAbsent(eventType, handler) != null) {
      throw new IllegalArgumentException("handler already registered for " + eventType);
    }
  }

  /// Schedules an event for this node itself.
  protected final void schedule(String eventType, long timeUs, @Nullable ObjectNode payload) {
    queue.schedule(new Event(eventType, timeUs, nodeId, nodeId, payload));
  }

  /// Emits an event stamped with the current time.
  protected final void emit(String eventType, @Nullable String destination, @Nullable ObjectNode payload) {
    emitAt(eventType, queue.now(), destination, payload);
  }

  /// @throws SchedulingException if `timeUs` is in this node's past.
  protected final void emitAt(String eventType, long timeUs, @Nullable String destination,
                              @Nullable ObjectNode payload) {
    if (timeUs < queue.now()) {
      throw new SchedulingException("node " + nodeId + " cannot emit " + eventType + " at " + timeUs
          + " before now=" + queue.now());
    }
    outbox.add(new Event(eventType, timeUs, nodeId, destination, payload));
  }

  protected final long now() {
    return queue.now();
  }

  protected final String nodeId() {
    return nodeId;
  }

  protected final long seed() {
    return seed;
  }

  protected final RandomGenerator random() {
    return random;
  }

  protected static ObjectNode payload() {
    return JsonNodeFactory.instance.objectNode();
  }

  protected static long longSetting(ObjectNode config, String field, long defaultValue) {
    final JsonNode value = config.get(field);
    if (value == null || value.isNull()) {
      return defaultValue;
    }
    if (!value.isIntegralNumber()) {
      throw new IllegalArgumentException("config field " + field + " must be an integer: " + value);
    }
    return value.longValue();
  }

  protected static String textSetting(ObjectNode config, String field, String defaultValue) {
    final JsonNode value = config.get(field);
    if (value == null || value.isNull()) {
      return defaultValue;
    }
    if (!value.isTextual()) {
      throw new IllegalArgumentException("config field " + field + " must be a string: " + value);
    }
    return value.textValue();
  }
}
