// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.coordinator;

import java.util.Objects;

/// Why and when a node was taken out of the run.
///
/// @param kind    the error class
/// @param cycle   the cycle in which the node failed where cycle 0 is initialisation and the first `ADVANCE` is cycle 1
/// @param message detail for the log and the summary
public record NodeFailure(ErrorKind kind, long cycle, String message) {

  public enum ErrorKind {
    /// A malformed line or a message that is not valid in the current state.
    PROTOCOL,
    /// No response before the deadline.
    TIMEOUT,
    /// The node emitted an event timestamped before its own current time.
    SCHEDULING,
    /// Connection refused, reset or closed.
    TRANSPORT
  }

  public NodeFailure {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
    if (cycle < 0) {
      throw new IllegalArgumentException("cycle must be non-negative: " + cycle);
    }
  }
}
