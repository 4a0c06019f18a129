// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.demo;

import java.util.Optional;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/// Sends all JUL logging to stderr at the level given by the `LOG_LEVEL` environment variable. Node processes may use
/// stdout for the protocol so nothing may be logged there.
public class LoggerConfig {

  static {
    try {
      Logger rootLogger = Logger.getLogger("");

      for (Handler handler : rootLogger.getHandlers()) {
        rootLogger.removeHandler(handler);
      }

      // ConsoleHandler writes to System.err
      ConsoleHandler consoleHandler = new ConsoleHandler();

      final var levelString = Optional.ofNullable(System.getenv("LOG_LEVEL"))
          .orElse("INFO");
      Level level = Level.parse(levelString);

      consoleHandler.setLevel(level);
      rootLogger.setLevel(level);
      rootLogger.addHandler(consoleHandler);

      consoleHandler.setFormatter(new SimpleFormatter() {
        @Override
        public String format(LogRecord record) {
          return String.format("[%s] %s %s%n",
              record.getLevel().getName(),
              record.getLoggerName(),
              formatMessage(record));
        }
      });

    } catch (Exception e) {
      System.err.println("Failed to configure logger: " + e.getMessage());
      e.printStackTrace();
    }
  }

  public static void initialize() {
    // Method to trigger static initialization
  }
}
