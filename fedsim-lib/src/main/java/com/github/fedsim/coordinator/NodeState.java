// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.coordinator;

/// The protocol state of one node as seen by the coordinator:
///
/// ```
/// CONNECTING -> AWAITING_READY -> IDLE -> ADVANCING -> AWAITING_DONE -> IDLE ...
///                                 IDLE -> SHUT_DOWN
/// any live state -> FAILED
/// ```
///
/// `FAILED` and `SHUT_DOWN` are terminal.
public enum NodeState {
  CONNECTING,
  AWAITING_READY,
  IDLE,
  ADVANCING,
  AWAITING_DONE,
  FAILED,
  SHUT_DOWN;

  public boolean isTerminal() {
    return this == FAILED || this == SHUT_DOWN;
  }

  public boolean canMoveTo(NodeState next) {
    if (next == FAILED) {
      return !isTerminal();
    }
    return switch (this) {
      case CONNECTING -> next == AWAITING_READY;
      case AWAITING_READY -> next == IDLE;
      case IDLE -> next == ADVANCING || next == SHUT_DOWN;
      case ADVANCING -> next == AWAITING_DONE;
      case AWAITING_DONE -> next == IDLE;
      case FAILED, SHUT_DOWN -> false;
    };
  }
}
