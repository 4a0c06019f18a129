// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.node;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.fedsim.Event;

import java.util.List;

/// A simulation node as seen through the protocol. The [NodeProtocolLoop] calls these methods in protocol order:
/// [#init] once, [#advance] once per cycle with non-decreasing targets, [#shutdown] at most once.
///
/// A deterministic node must produce its events as a pure function of its id, its config (which carries the
/// scenario seed) and the inbound events it is given. Its only randomness must come from a generator seeded by
/// [com.github.fedsim.DeterministicSeed]. Nodes that wrap a real external process cannot promise this and must return
/// false from [#deterministic()]: their runs are only statistically reproducible.
public interface SimNode {

  void init(String nodeId, ObjectNode config);

  /// Processes everything before `targetTimeUs` and returns the events emitted on the way.
  List<Event> advance(long targetTimeUs, List<Event> inbound);

  default void shutdown() {
  }

  default boolean deterministic() {
    return true;
  }
}
