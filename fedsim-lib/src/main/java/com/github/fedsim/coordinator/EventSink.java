// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.coordinator;

import com.github.fedsim.Event;

/// Receives the events that are not delivered to a node: events without a destination, which nodes emit as metrics,
/// and events addressed to a node that is unknown or no longer live. Called only from the coordinator's routing step.
public interface EventSink extends AutoCloseable {

  void accept(Event event);

  /// Flushes anything buffered. The coordinator closes its sink when it is closed.
  @Override
  default void close() {
  }
}
