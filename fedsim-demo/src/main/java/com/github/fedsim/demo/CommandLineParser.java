// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.demo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Minimal `--option=value`, `--option value` and `--flag` parsing for the demo entry points.
class CommandLineParser {
  private final Map<String, String> options = new HashMap<>();
  private final List<String> remainingArgs = new ArrayList<>();

  void parse(String[] args) {
    for (int i = 0; i < args.length; i++) {
      final String arg = args[i];
      if (arg.startsWith("--")) {
        final String option = arg.substring(2);
        final int equals = option.indexOf('=');
        if (equals >= 0) {
          options.put(option.substring(0, equals), option.substring(equals + 1));
        } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
          // a single dash is allowed so that negative numbers can be passed as values
          options.put(option, args[++i]);
        } else {
          options.put(option, "true");
        }
      } else if (arg.equals("-h")) {
        options.put("help", "true");
      } else {
        remainingArgs.add(arg);
      }
    }
  }

  String getOption(String name) {
    return options.get(name);
  }

  boolean hasOption(String name) {
    return options.containsKey(name);
  }

  /// @throws IllegalArgumentException if the option is missing.
  String requireOption(String name) {
    final String value = options.get(name);
    if (value == null) {
      throw new IllegalArgumentException("Missing required option: --" + name);
    }
    return value;
  }

  long getLong(String name, long defaultValue) {
    final String value = options.get(name);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Option --" + name + " must be an integer: " + value, e);
    }
  }

  double getDouble(String name, double defaultValue) {
    final String value = options.get(name);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Option --" + name + " must be a number: " + value, e);
    }
  }

  /// @throws IllegalArgumentException on a positional argument or an option outside `known`.
  void requireOnly(Set<String> known) {
    if (!remainingArgs.isEmpty()) {
      throw new IllegalArgumentException("Unexpected arguments: " + remainingArgs);
    }
    final List<String> unknown = options.keySet().stream()
        .filter(name -> !known.contains(name))
        .sorted()
        .map(name -> "--" + name)
        .toList();
    if (!unknown.isEmpty()) {
      throw new IllegalArgumentException("Unknown options: " + unknown);
    }
  }
}
