// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.coordinator;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.fedsim.Event;
import com.github.fedsim.SchedulingException;
import com.github.fedsim.network.NodeTransport;
import com.github.fedsim.protocol.LineFramer;
import com.github.fedsim.protocol.LineSource;
import com.github.fedsim.protocol.ProtocolCodec;
import com.github.fedsim.protocol.ProtocolException;
import com.github.fedsim.protocol.ProtocolMessage;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.TestOnly;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;

import static com.github.fedsim.FedSimLogger.LOGGER;

/// The coordinator side of one node. A handle exclusively owns the node's transport and drives the strict
/// request/response protocol: it never writes a second `ADVANCE` before it has read the `DONE` of the first.
///
/// Every per-node error is caught here and turned into a transition to [NodeState#FAILED] plus one structured log
/// record, so nothing a node does can abort the coordinator loop. Each blocking exchange runs on a coordinator worker
/// thread while the coordinator thread may concurrently call [#fail] on timeout. State transitions are therefore
/// synchronized and an exchange that completes after its node was failed is discarded.
public final class NodeHandle {

  private final String nodeId;
  private final @Nullable NodeTransport transport;
  private final ObjectNode config;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  // guarded by this
  private NodeState state;
  private @Nullable NodeFailure failure;

  private volatile long currentTimeUs = 0L;

  // only touched by the coordinator thread between cycles
  private final List<Event> pendingInbound = new ArrayList<>();

  private @Nullable LineSource lines;

  public NodeHandle(String nodeId, NodeTransport transport, ObjectNode config) {
    this(nodeId, transport, config, NodeState.CONNECTING, null);
  }

  private NodeHandle(String nodeId, @Nullable NodeTransport transport, @Nullable ObjectNode config, NodeState state,
                     @Nullable NodeFailure failure) {
    this.nodeId = nodeId;
    this.transport = transport;
    this.config = config == null ? JsonNodeFactory.instance.objectNode() : config.deepCopy();
    this.state = state;
    this.failure = failure;
  }

  /// A node that could not be reached at all. It appears in the summary as failed during initialisation.
  static NodeHandle unreachable(String nodeId, String message) {
    final var failure = new NodeFailure(NodeFailure.ErrorKind.TRANSPORT, 0, message);
    LOGGER.warning(() -> String.format("node=%s cycle=%d kind=%s state=%s message=%s",
        nodeId, 0, failure.kind(), NodeState.CONNECTING, message));
    return new NodeHandle(nodeId, null, null, NodeState.FAILED, failure);
  }

  public String nodeId() {
    return nodeId;
  }

  public synchronized NodeState state() {
    return state;
  }

  public synchronized Optional<NodeFailure> failure() {
    return Optional.ofNullable(failure);
  }

  public long currentTimeUs() {
    return currentTimeUs;
  }

  public synchronized boolean isLive() {
    return !state.isTerminal();
  }

  public boolean transportClosed() {
    return closed.get();
  }

  /// Sends `INIT` and waits for `READY`.
  ///
  /// @return true if the node is now idle.
  public boolean initialize() {
    if (!moveTo(NodeState.CONNECTING, NodeState.AWAITING_READY)) {
      return false;
    }
    try {
      send(new ProtocolMessage.Init(nodeId, config));
      ProtocolCodec.expectReady(lines());
      return moveTo(NodeState.AWAITING_READY, NodeState.IDLE);
    } catch (ProtocolException e) {
      fail(NodeFailure.ErrorKind.PROTOCOL, 0, e.getMessage());
    } catch (IOException e) {
      fail(NodeFailure.ErrorKind.TRANSPORT, 0, String.valueOf(e));
    }
    return false;
  }

  /// One protocol cycle: write `ADVANCE` and the inbound events, read `DONE` and the outbound events, and check
  /// that the node did not emit anything before the time it had reached at the start of the cycle.
  ///
  /// @return the node's events, or empty if the node failed in this cycle.
  public Optional<List<Event>> advance(long targetTimeUs, long cycle, List<Event> inbound) {
    final long startUs = currentTimeUs;
    if (targetTimeUs < startUs) {
      throw new IllegalArgumentException("node " + nodeId + " cannot be advanced backwards from " + startUs
          + " to " + targetTimeUs);
    }
    if (!moveTo(NodeState.IDLE, NodeState.ADVANCING)) {
      return Optional.empty();
    }
    try {
      send(new ProtocolMessage.Advance(targetTimeUs, inbound));
      if (!moveTo(NodeState.ADVANCING, NodeState.AWAITING_DONE)) {
        return Optional.empty();
      }
      final List<Event> events = ProtocolCodec.expectDone(lines());
      for (Event event : events) {
        if (event.timeUs() < startUs) {
          throw new SchedulingException("retroactive event " + event + " before node time " + startUs);
        }
      }
      if (!completeAdvance(targetTimeUs)) {
        return Optional.empty();
      }
      LOGGER.finer(() -> "node=" + nodeId + " cycle=" + cycle + " reached " + targetTimeUs + " with "
          + inbound.size() + " in " + events.size() + " out");
      return Optional.of(events);
    } catch (SchedulingException e) {
      fail(NodeFailure.ErrorKind.SCHEDULING, cycle, e.getMessage());
    } catch (ProtocolException e) {
      fail(NodeFailure.ErrorKind.PROTOCOL, cycle, e.getMessage());
    } catch (IOException e) {
      fail(NodeFailure.ErrorKind.TRANSPORT, cycle, String.valueOf(e));
    }
    return Optional.empty();
  }

  /// Sends `SHUTDOWN` and waits for the node to acknowledge by closing its stream. The coordinator bounds this wait
  /// and calls [#forceShutdown()] when the grace period runs out.
  public void shutdown() {
    synchronized (this) {
      if (state != NodeState.IDLE) {
        return;
      }
    }
    try {
      send(new ProtocolMessage.Shutdown());
      final LineSource source = lines();
      String line;
      while ((line = source.readLine()) != null) {
        final String unsolicited = line;
        LOGGER.warning(() -> "node=" + nodeId + " sent a line after SHUTDOWN: " + unsolicited);
      }
      LOGGER.fine(() -> "node=" + nodeId + " acknowledged SHUTDOWN");
    } catch (IOException e) {
      LOGGER.log(Level.FINE, "node=" + nodeId + " stream ended abruptly during shutdown", e);
    } finally {
      forceShutdown();
    }
  }

  /// Marks an idle node shut down and closes its transport without waiting.
  public void forceShutdown() {
    synchronized (this) {
      if (state == NodeState.IDLE) {
        state = NodeState.SHUT_DOWN;
      }
    }
    closeTransport();
  }

  /// Takes the node out of the run. Idempotent: only the first failure is recorded and logged.
  public void fail(NodeFailure.ErrorKind kind, long cycle, String message) {
    final NodeState from;
    synchronized (this) {
      if (state.isTerminal()) {
        return;
      }
      from = state;
      state = NodeState.FAILED;
      failure = new NodeFailure(kind, cycle, message);
    }
    LOGGER.warning(() -> String.format("node=%s cycle=%d kind=%s state=%s message=%s",
        nodeId, cycle, kind, from, message));
    closeTransport();
  }

  void enqueue(Event event) {
    pendingInbound.add(event);
  }

  List<Event> drainInbound() {
    final List<Event> drained = List.copyOf(pendingInbound);
    pendingInbound.clear();
    return drained;
  }

  @TestOnly
  List<Event> pendingInbound() {
    return List.copyOf(pendingInbound);
  }

  NodeSummary summary() {
    synchronized (this) {
      return new NodeSummary(nodeId, state, currentTimeUs, failure);
    }
  }

  private synchronized boolean moveTo(NodeState expected, NodeState next) {
    if (state == NodeState.FAILED) {
      return false;
    }
    if (state != expected || !state.canMoveTo(next)) {
      throw new IllegalStateException("node " + nodeId + " cannot move from " + state + " to " + next
          + " (expected " + expected + ")");
    }
    state = next;
    return true;
  }

  private synchronized boolean completeAdvance(long targetTimeUs) {
    if (state != NodeState.AWAITING_DONE) {
      return false;
    }
    currentTimeUs = targetTimeUs;
    state = NodeState.IDLE;
    return true;
  }

  private void send(ProtocolMessage message) throws IOException {
    if (transport == null) {
      throw new IOException("node " + nodeId + " has no transport");
    }
    ProtocolCodec.write(transport.output(), message);
  }

  private LineSource lines() throws IOException {
    if (lines == null) {
      if (transport == null) {
        throw new IOException("node " + nodeId + " has no transport");
      }
      lines = new LineFramer(transport.input());
    }
    return lines;
  }

  private void closeTransport() {
    if (transport != null && closed.compareAndSet(false, true)) {
      LOGGER.fine(() -> "closing " + transport.describe() + " of node=" + nodeId);
      transport.close();
    }
  }

  @Override
  public String toString() {
    return "NodeHandle[" + nodeId + " " + state() + " time_us=" + currentTimeUs + "]";
  }
}
