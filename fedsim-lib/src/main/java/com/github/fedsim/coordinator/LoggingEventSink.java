// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.coordinator;

import com.github.fedsim.Event;
import com.github.fedsim.protocol.ProtocolCodec;

import java.util.logging.Level;
import java.util.logging.Logger;

/// Writes each sink event to the `com.github.fedsim.events` logger in its wire form.
public final class LoggingEventSink implements EventSink {
  private static final Logger EVENTS = Logger.getLogger("com.github.fedsim.events");

  private final Level level;

  public LoggingEventSink() {
    this(Level.INFO);
  }

  public LoggingEventSink(Level level) {
    this.level = level;
  }

  @Override
  public void accept(Event event) {
    EVENTS.log(level, () -> ProtocolCodec.toJsonNode(event).toString());
  }
}
