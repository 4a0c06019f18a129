// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.coordinator;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.fedsim.network.NetworkAddress;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// What to run: how long, in which steps, with which seed, and against which nodes. Loading a scenario from a file
/// is left to the launcher.
public record Scenario(long durationUs, long quantumUs, long seed, List<NodeSpec> nodes) {

  /// One node of the scenario.
  ///
  /// @param config sent to the node in `INIT` together with the scenario seed
  public record NodeSpec(String nodeId, NetworkAddress address, ObjectNode config) {
    public NodeSpec {
      Objects.requireNonNull(nodeId, "nodeId");
      Objects.requireNonNull(address, "address");
      if (nodeId.isEmpty() || nodeId.chars().anyMatch(Character::isWhitespace)) {
        throw new IllegalArgumentException("nodeId must be non-empty without whitespace: '" + nodeId + "'");
      }
      config = config == null ? JsonNodeFactory.instance.objectNode() : config.deepCopy();
    }

    public NodeSpec(String nodeId, NetworkAddress address) {
      this(nodeId, address, null);
    }

    @Override
    public ObjectNode config() {
      return config.deepCopy();
    }
  }

  public Scenario {
    if (durationUs <= 0) {
      throw new IllegalArgumentException("durationUs must be positive: " + durationUs);
    }
    if (quantumUs <= 0) {
      throw new IllegalArgumentException("quantumUs must be positive: " + quantumUs);
    }
    nodes = List.copyOf(nodes);
    if (nodes.isEmpty()) {
      throw new IllegalArgumentException("a scenario needs at least one node");
    }
    final Set<String> ids = new HashSet<>();
    for (NodeSpec node : nodes) {
      if (!ids.add(node.nodeId())) {
        throw new IllegalArgumentException("duplicate node id: " + node.nodeId());
      }
    }
  }
}
