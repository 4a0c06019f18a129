// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.network;

/// Where a node listens for its coordinator connection.
public record NetworkAddress(String host, int port) {
  public NetworkAddress {
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("Invalid host: '" + host + "'");
    }
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Invalid port: " + port);
    }
  }

  public NetworkAddress(int port) {
    this("localhost", port);
  }

  /// Parses `host:port` or a bare port which means localhost.
  public static NetworkAddress parse(String text) {
    final int colon = text.lastIndexOf(':');
    try {
      if (colon < 0) {
        return new NetworkAddress(Integer.parseInt(text.trim()));
      }
      return new NetworkAddress(text.substring(0, colon).trim(), Integer.parseInt(text.substring(colon + 1).trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid address: '" + text + "'", e);
    }
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}
