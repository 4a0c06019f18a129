// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim;

/// Thrown when something tries to move virtual time backwards: an event scheduled or emitted before the current
/// virtual time of the node, or a clock asked to advance to a target in its past. This is always a bug in the node
/// implementation and is never clamped away.
public class SchedulingException extends IllegalStateException {
  public SchedulingException(String message) {
    super(message);
  }
}
