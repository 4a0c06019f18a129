// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.coordinator;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/// The final state of one node.
public record NodeSummary(String nodeId, NodeState state, long currentTimeUs, @Nullable NodeFailure failure) {

  public Optional<NodeFailure> failureOpt() {
    return Optional.ofNullable(failure);
  }

  public boolean failed() {
    return state == NodeState.FAILED;
  }

  String render() {
    if (failure == null) {
      return String.format("%-16s %-10s time_us=%d", nodeId, state, currentTimeUs);
    }
    return String.format("%-16s %-10s time_us=%d since cycle %d: %s %s", nodeId, state, currentTimeUs,
        failure.cycle(), failure.kind(), failure.message());
  }
}
