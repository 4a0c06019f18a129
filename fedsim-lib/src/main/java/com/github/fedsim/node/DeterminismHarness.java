// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.node;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.fedsim.Event;
import com.github.fedsim.SchedulingException;
import com.github.fedsim.protocol.LineSource;
import com.github.fedsim.protocol.ProtocolCodec;
import com.github.fedsim.protocol.ProtocolMessage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/// Drives a single [SimNode] through the protocol in memory. Every message is encoded to its wire lines and decoded
/// again before it reaches the node or the caller, so the node sees exactly what it would see over a socket and the
/// transcript is the byte stream a coordinator would exchange with it. Lines sent to the node are prefixed with
/// `> ` and lines received from it with `< `.
///
/// The harness applies the same checks as the coordinator: targets never move backwards and no emitted event may be
/// earlier than the node's time at the start of the cycle. [#run(long, long)] uses the coordinator's cycle
/// arithmetic, and events the node addresses to itself come back as inbound events of the next cycle.
public final class DeterminismHarness {

  private final SimNode node;
  private final String nodeId;
  private final ObjectNode config;
  private final List<String> transcript = new ArrayList<>();
  private final List<Event> emitted = new ArrayList<>();
  private final List<Long> observedTimesUs = new ArrayList<>();
  private long currentTimeUs = 0L;
  private boolean initialised = false;
  private boolean shutDown = false;

  public DeterminismHarness(SimNode node, String nodeId, long seed, ObjectNode config) {
    this.node = node;
    this.nodeId = nodeId;
    this.config = config == null ? JsonNodeFactory.instance.objectNode() : config.deepCopy();
    this.config.put("seed", seed);
  }

  public DeterminismHarness(SimNode node, String nodeId, long seed) {
    this(node, nodeId, seed, null);
  }

  public void init() {
    if (initialised) {
      throw new IllegalStateException("already initialised");
    }
    final var init = (ProtocolMessage.Init) toNode(new ProtocolMessage.Init(nodeId, config));
    node.init(init.nodeId(), init.config());
    fromNode(new ProtocolMessage.Ready());
    initialised = true;
  }

  /// One cycle.
  ///
  /// @return the events the node emitted, as decoded from the wire.
  /// @throws SchedulingException if the target moves backwards or the node emits a retroactive event.
  public List<Event> advance(long targetTimeUs, List<Event> inbound) {
    if (!initialised || shutDown) {
      throw new IllegalStateException("advance needs an initialised node that is not shut down");
    }
    if (targetTimeUs < currentTimeUs) {
      throw new SchedulingException("target " + targetTimeUs + " is before node time " + currentTimeUs);
    }
    final var advance = (ProtocolMessage.Advance) toNode(new ProtocolMessage.Advance(targetTimeUs, inbound));
    final List<Event> out = node.advance(advance.targetTimeUs(), advance.events());
    final var done = (ProtocolMessage.Done) fromNode(new ProtocolMessage.Done(out));
    for (Event event : done.events()) {
      if (event.timeUs() < currentTimeUs) {
        throw new SchedulingException("retroactive event " + event + " before node time " + currentTimeUs);
      }
    }
    currentTimeUs = targetTimeUs;
    observedTimesUs.add(targetTimeUs);
    emitted.addAll(done.events());
    return done.events();
  }

  public void shutdown() {
    if (shutDown) {
      return;
    }
    toNode(new ProtocolMessage.Shutdown());
    node.shutdown();
    shutDown = true;
  }

  /// Runs INIT, every cycle up to `durationUs` and SHUTDOWN.
  ///
  /// @return the full transcript.
  public List<String> run(long durationUs, long quantumUs) {
    if (quantumUs <= 0) {
      throw new IllegalArgumentException("quantumUs must be positive: " + quantumUs);
    }
    init();
    List<Event> inbound = List.of();
    long globalTimeUs = 0L;
    while (globalTimeUs < durationUs) {
      final long target = durationUs - globalTimeUs < quantumUs ? durationUs : globalTimeUs + quantumUs;
      inbound = advance(target, inbound).stream()
          .filter(e -> nodeId.equals(e.destination()))
          .toList();
      globalTimeUs = target;
    }
    shutdown();
    return transcript();
  }

  public List<String> transcript() {
    return List.copyOf(transcript);
  }

  public List<Event> emitted() {
    return List.copyOf(emitted);
  }

  public List<Long> observedTimesUs() {
    return List.copyOf(observedTimesUs);
  }

  public long currentTimeUs() {
    return currentTimeUs;
  }

  /// Runs two fresh nodes from the factory with the same id, seed and config.
  ///
  /// @return true if both transcripts are identical.
  public static boolean reproducible(Supplier<? extends SimNode> factory, String nodeId, long seed,
                                     ObjectNode config, long durationUs, long quantumUs) {
    final var first = new DeterminismHarness(factory.get(), nodeId, seed, config).run(durationUs, quantumUs);
    final var second = new DeterminismHarness(factory.get(), nodeId, seed, config).run(durationUs, quantumUs);
    return first.equals(second);
  }

  private ProtocolMessage toNode(ProtocolMessage message) {
    return roundTrip(message, "> ");
  }

  private ProtocolMessage fromNode(ProtocolMessage message) {
    return roundTrip(message, "< ");
  }

  private ProtocolMessage roundTrip(ProtocolMessage message, String direction) {
    final List<String> lines = ProtocolCodec.encode(message);
    lines.forEach(line -> transcript.add(direction + line));
    final LineSource source = LineSource.of(lines);
    try {
      if (message instanceof ProtocolMessage.Command) {
        return ProtocolCodec.readCommand(source).orElseThrow();
      }
      return ProtocolCodec.readResponse(source);
    } catch (IOException e) {
      // only reachable if the codec cannot read what it wrote
      throw new UncheckedIOException(e);
    }
  }
}
