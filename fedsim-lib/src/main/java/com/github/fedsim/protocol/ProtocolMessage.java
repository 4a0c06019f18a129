// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.protocol;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.fedsim.Event;

import java.util.List;
import java.util.Objects;

/// The messages of the node protocol. Commands flow from the coordinator to a node and responses flow back:
///
/// ```
/// ProtocolMessage
/// ├── Command
/// │   ├── Init      INIT <node_id> <config-json>
/// │   ├── Advance   ADVANCE <target_time_us> + one JSON array line of inbound events
/// │   └── Shutdown  SHUTDOWN
/// └── Response
///     ├── Ready     READY
///     └── Done      DONE + one JSON array line of outbound events
/// ```
public sealed interface ProtocolMessage {

  sealed interface Command extends ProtocolMessage {
  }

  sealed interface Response extends ProtocolMessage {
  }

  record Init(String nodeId, ObjectNode config) implements Command {
    public Init {
      Objects.requireNonNull(nodeId, "nodeId");
      if (nodeId.isEmpty() || nodeId.chars().anyMatch(Character::isWhitespace)) {
        throw new IllegalArgumentException("nodeId must be non-empty without whitespace: '" + nodeId + "'");
      }
      config = config == null ? JsonNodeFactory.instance.objectNode() : config.deepCopy();
    }

    @Override
    public ObjectNode config() {
      return config.deepCopy();
    }
  }

  record Advance(long targetTimeUs, List<Event> events) implements Command {
    public Advance {
      if (targetTimeUs < 0) {
        throw new IllegalArgumentException("targetTimeUs must be non-negative: " + targetTimeUs);
      }
      events = List.copyOf(events);
    }
  }

  record Shutdown() implements Command {
  }

  record Ready() implements Response {
  }

  record Done(List<Event> events) implements Response {
    public Done {
      events = List.copyOf(events);
    }
  }
}
