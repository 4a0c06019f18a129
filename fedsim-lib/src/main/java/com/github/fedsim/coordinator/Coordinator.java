// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.coordinator;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.fedsim.Event;
import com.github.fedsim.network.DirectNetworkModel;
import com.github.fedsim.network.NetworkAddress;
import com.github.fedsim.network.NetworkModel;
import com.github.fedsim.network.NodeTransport;
import com.github.fedsim.network.SocketTransport;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;

import static com.github.fedsim.FedSimLogger.LOGGER;

/// Drives a set of nodes through a conservative lockstep simulation. Each cycle moves the global clock forward by one
/// quantum:
///
/// 1. every live node is sent `ADVANCE <target>` with the events addressed to it, all nodes concurrently;
/// 2. the coordinator waits for every `DONE` up to one per-cycle deadline;
/// 3. only after that barrier are the emitted events routed, in node registration order and emission order, through
///    the [NetworkModel] into the inbound queues of live nodes or to the [EventSink];
/// 4. the global time becomes the target.
///
/// No node is ever asked to move past the global time of the next barrier, so every node's time is bounded by the
/// global time observed at the start of a cycle.
///
/// Known approximation: nodes are causally independent within a quantum. An event that one node emits at time `t`
/// reaches another node only at the next cycle boundary, at which point the receiver schedules it at the later of
/// `t` and its own time. True sub-quantum causality between two nodes is not modelled. A smaller quantum reduces the
/// error at the cost of more round trips.
///
/// Nodes that time out, send malformed responses, emit retroactive events or drop their connection are marked
/// failed and excluded from later cycles while the remaining nodes carry on. The run stops early only when no node is
/// left.
public final class Coordinator implements AutoCloseable {

  private final CoordinatorConfig config;
  private final NetworkModel networkModel;
  private final EventSink sink;
  private final Map<String, NodeHandle> handles = new LinkedHashMap<>();
  private final ExecutorService executor;
  private long sinkEvents = 0L;
  private boolean started = false;

  public Coordinator(CoordinatorConfig config) {
    this(config, new DirectNetworkModel(), new LoggingEventSink());
  }

  public Coordinator(CoordinatorConfig config, NetworkModel networkModel, EventSink sink) {
    this.config = config;
    this.networkModel = networkModel;
    this.sink = sink;
    this.executor = Executors.newCachedThreadPool(new NodeThreadFactory());
  }

  public CoordinatorConfig config() {
    return config;
  }

  /// Registers a node reachable over an already open transport. The handle takes ownership of the transport.
  public synchronized NodeHandle addNode(String nodeId, NodeTransport transport, ObjectNode nodeConfig) {
    requireNotStarted();
    if (handles.containsKey(nodeId)) {
      transport.close();
      throw new IllegalArgumentException("duplicate node id: " + nodeId);
    }
    final NodeHandle handle = new NodeHandle(nodeId, transport, initConfig(nodeConfig));
    handles.put(nodeId, handle);
    LOGGER.fine(() -> "registered node=" + nodeId + " on " + transport.describe());
    return handle;
  }

  public NodeHandle addNode(String nodeId, NodeTransport transport) {
    return addNode(nodeId, transport, null);
  }

  /// Opens a TCP connection to a node that is listening on `address`, with the configured retries.
  public NodeHandle connect(String nodeId, NetworkAddress address, ObjectNode nodeConfig) throws IOException {
    final var transport = SocketTransport.connect(address, config.connectAttempts(), config.connectRetryDelay());
    return addNode(nodeId, transport, nodeConfig);
  }

  /// Connects every node of the scenario. A node that cannot be reached is registered as failed so that the run
  /// goes ahead with the others and the summary reports it.
  public synchronized void connectAll(Scenario scenario) {
    for (Scenario.NodeSpec node : scenario.nodes()) {
      try {
        connect(node.nodeId(), node.address(), node.config());
      } catch (IOException e) {
        requireNotStarted();
        handles.put(node.nodeId(), NodeHandle.unreachable(node.nodeId(), "cannot connect to " + node.address()
            + ": " + e.getMessage()));
      }
    }
  }

  /// The `INIT` config of a node is its own config with the scenario seed, which always wins.
  private ObjectNode initConfig(ObjectNode nodeConfig) {
    final ObjectNode init = nodeConfig == null ? JsonNodeFactory.instance.objectNode() : nodeConfig.deepCopy();
    init.put("seed", config.seed());
    return init;
  }

  public synchronized List<NodeHandle> handles() {
    return List.copyOf(handles.values());
  }

  /// Sends `INIT` to every node still connecting, concurrently, and waits for `READY` up to the init timeout.
  public synchronized void initializeAll() {
    final Map<NodeHandle, Future<Boolean>> futures = new LinkedHashMap<>();
    for (NodeHandle handle : handles.values()) {
      if (handle.state() == NodeState.CONNECTING) {
        futures.put(handle, executor.submit(() -> handle.initialize()));
      }
    }
    awaitAll(futures, config.initTimeout(), 0L,
        handle -> handle.fail(NodeFailure.ErrorKind.TIMEOUT, 0L, "no READY within " + config.initTimeout()),
        (handle, ready) -> {
        });
    final long ready = handles.values().stream().filter(h -> h.state() == NodeState.IDLE).count();
    LOGGER.info(() -> "initialised " + ready + " of " + handles.size() + " nodes");
  }

  /// Runs the simulation from time zero to `durationUs` in steps of `quantumUs`, then shuts every live node down.
  /// A coordinator runs at most once.
  public synchronized SimulationSummary run(long durationUs, long quantumUs) {
    if (durationUs < 0) {
      throw new IllegalArgumentException("durationUs must be non-negative: " + durationUs);
    }
    requireNotStarted();
    initializeAll();
    started = true;

    final ScenarioClock clock = new ScenarioClock(quantumUs);
    LOGGER.info(() -> "starting run duration_us=" + durationUs + " quantum_us=" + quantumUs + " seed="
        + config.seed() + " nodes=" + handles.keySet());
    long cycle = 0L;
    while (clock.globalTimeUs() < durationUs && anyLive()) {
      cycle++;
      final long target = clock.nextTarget(durationUs);
      final Map<NodeHandle, List<Event>> emitted = advanceAll(target, cycle);
      final long nextLimit = durationUs - target < quantumUs ? durationUs : target + quantumUs;
      route(emitted, nextLimit);
      clock.advanceTo(target);
      final long c = cycle;
      LOGGER.fine(() -> "cycle=" + c + " global_time_us=" + target);
    }
    if (!anyLive()) {
      LOGGER.severe(() -> "every node has failed, stopping at global_time_us=" + clock.globalTimeUs());
    }
    shutdownAll();
    final var summary = new SimulationSummary(clock.globalTimeUs(), cycle,
        handles.values().stream().map(NodeHandle::summary).toList(), sinkEvents, networkModel.metrics());
    LOGGER.info(summary::render);
    return summary;
  }

  public SimulationSummary run(Scenario scenario) {
    return run(scenario.durationUs(), scenario.quantumUs());
  }

  private Map<NodeHandle, List<Event>> advanceAll(long target, long cycle) {
    final Map<NodeHandle, Future<Optional<List<Event>>>> futures = new LinkedHashMap<>();
    for (NodeHandle handle : handles.values()) {
      if (handle.isLive()) {
        final List<Event> inbound = handle.drainInbound();
        futures.put(handle, executor.submit(() -> handle.advance(target, cycle, inbound)));
      }
    }
    final Map<NodeHandle, List<Event>> emitted = new LinkedHashMap<>();
    awaitAll(futures, config.advanceTimeout(), cycle,
        handle -> handle.fail(NodeFailure.ErrorKind.TIMEOUT, cycle, "no DONE for target " + target + " within "
            + config.advanceTimeout()),
        (handle, events) -> events.ifPresent(e -> emitted.put(handle, e)));
    return emitted;
  }

  /// Waits for every future against one shared deadline. Futures still pending at the deadline are cancelled and
  /// handed to `onTimeout`, which must close the node's transport so that the blocked worker returns.
  private <T> void awaitAll(Map<NodeHandle, Future<T>> futures, Duration timeout, long cycle,
                            Consumer<NodeHandle> onTimeout, ResultConsumer<T> onResult) {
    final long deadline = System.nanoTime() + timeout.toNanos();
    for (var entry : futures.entrySet()) {
      final NodeHandle handle = entry.getKey();
      final Future<T> future = entry.getValue();
      try {
        final long remaining = Math.max(0L, deadline - System.nanoTime());
        onResult.accept(handle, future.get(remaining, TimeUnit.NANOSECONDS));
      } catch (TimeoutException e) {
        future.cancel(true);
        onTimeout.accept(handle);
      } catch (ExecutionException e) {
        LOGGER.log(Level.SEVERE, "unexpected error from node=" + handle.nodeId() + " cycle=" + cycle, e.getCause());
        handle.fail(NodeFailure.ErrorKind.PROTOCOL, cycle, "unexpected error: " + e.getCause());
      } catch (CancellationException e) {
        handle.fail(NodeFailure.ErrorKind.TIMEOUT, cycle, "cancelled");
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        future.cancel(true);
        handle.fail(NodeFailure.ErrorKind.TIMEOUT, cycle, "coordinator interrupted");
      }
    }
  }

  @FunctionalInterface
  private interface ResultConsumer<T> {
    void accept(NodeHandle handle, T result);
  }

  /// Runs strictly after the barrier on the coordinator thread, so inbound queues are never written concurrently.
  /// Iteration is in registration order and emission order which makes the inbound stream of every node a function
  /// of the emitted streams alone.
  private void route(Map<NodeHandle, List<Event>> emitted, long nextLimitUs) {
    for (var entry : emitted.entrySet()) {
      for (Event event : entry.getValue()) {
        if (!event.isDirected()) {
          toSink(event);
          continue;
        }
        final NodeHandle destination = handles.get(event.destination());
        if (destination == null || !destination.isLive()) {
          LOGGER.fine(() -> "undeliverable " + event + " from node=" + entry.getKey().nodeId());
          toSink(event);
          continue;
        }
        final List<Event> released;
        try {
          released = networkModel.route(event);
        } catch (RuntimeException e) {
          LOGGER.log(Level.WARNING, "network model rejected " + event + " from node=" + entry.getKey().nodeId()
              + ", passing it to the sink", e);
          toSink(event);
          continue;
        }
        released.forEach(this::deliver);
      }
    }
    networkModel.advanceTo(nextLimitUs).forEach(this::deliver);
  }

  private void deliver(Event event) {
    final NodeHandle destination = event.destination() == null ? null : handles.get(event.destination());
    if (destination != null && destination.isLive()) {
      destination.enqueue(event);
    } else {
      toSink(event);
    }
  }

  private void toSink(Event event) {
    sinkEvents++;
    sink.accept(event);
  }

  private void shutdownAll() {
    final Map<NodeHandle, Future<Boolean>> futures = new LinkedHashMap<>();
    for (NodeHandle handle : handles.values()) {
      if (handle.state() == NodeState.IDLE) {
        futures.put(handle, executor.submit(() -> {
          handle.shutdown();
          return Boolean.TRUE;
        }));
      }
    }
    awaitAll(futures, config.shutdownGrace(), 0L, handle -> {
      LOGGER.warning(() -> "node=" + handle.nodeId() + " did not close within " + config.shutdownGrace()
          + ", forcing it");
      handle.forceShutdown();
    }, (handle, done) -> {
    });
  }

  private boolean anyLive() {
    return handles.values().stream().anyMatch(NodeHandle::isLive);
  }

  private void requireNotStarted() {
    if (started) {
      throw new IllegalStateException("a coordinator runs only once");
    }
  }

  /// Fails any node that is still live, closes every transport and the sink, and stops the worker threads.
  @Override
  public synchronized void close() {
    for (NodeHandle handle : handles.values()) {
      if (handle.state() == NodeState.IDLE) {
        handle.forceShutdown();
      } else if (handle.isLive()) {
        handle.fail(NodeFailure.ErrorKind.TRANSPORT, 0L, "coordinator closed");
      }
    }
    executor.shutdownNow();
    sink.close();
  }

  private static final class NodeThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      final Thread thread = new Thread(r, "fedsim-node-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
