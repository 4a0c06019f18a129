// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.coordinator;

import com.github.fedsim.network.NetworkMetrics;

import java.util.List;

/// The result of a run. A run where every node failed is a hard failure. A run where only some nodes failed
/// succeeds and lists the degraded nodes with the cycle from which they were missing.
///
/// @param finalTimeUs the global time reached
/// @param cycles      number of `ADVANCE` cycles executed
/// @param nodes       every registered node in registration order
/// @param sinkEvents  number of events handed to the event sink
/// @param network     counters of the network model
public record SimulationSummary(long finalTimeUs, long cycles, List<NodeSummary> nodes, long sinkEvents,
                                NetworkMetrics.Snapshot network) {
  public SimulationSummary {
    nodes = List.copyOf(nodes);
  }

  public boolean allFailed() {
    return nodes.stream().allMatch(NodeSummary::failed);
  }

  public List<NodeSummary> degradedNodes() {
    return nodes.stream().filter(NodeSummary::failed).toList();
  }

  public NodeSummary node(String nodeId) {
    return nodes.stream()
        .filter(n -> n.nodeId().equals(nodeId))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown node " + nodeId));
  }

  /// @return 0 when at least one node ran to the end, otherwise 1.
  public int exitCode() {
    return allFailed() ? 1 : 0;
  }

  public String render() {
    final var sb = new StringBuilder();
    sb.append(allFailed() ? "SIMULATION FAILED" : degradedNodes().isEmpty() ? "SIMULATION COMPLETE" : "SIMULATION DEGRADED")
        .append(" final_time_us=").append(finalTimeUs)
        .append(" cycles=").append(cycles)
        .append(" sink_events=").append(sinkEvents)
        .append('\n');
    nodes.forEach(n -> sb.append("  ").append(n.render()).append('\n'));
    sb.append("  network ").append(network);
    return sb.toString();
  }
}
