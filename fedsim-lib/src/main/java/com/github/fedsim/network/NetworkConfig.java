// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.network;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/// Latency and loss parameters for a [LatencyNetworkModel].
///
/// @param defaultLatencyUs latency of any pair of nodes without an explicit link
/// @param defaultLossRate  loss probability of any pair of nodes without an explicit link
/// @param links            directed links that override the defaults
public record NetworkConfig(long defaultLatencyUs, double defaultLossRate, List<Link> links) {

  /// A directed link from `source` to `destination`.
  public record Link(String source, String destination, long latencyUs, double lossRate) {
    public Link {
      if (source == null || source.isEmpty() || destination == null || destination.isEmpty()) {
        throw new IllegalArgumentException("link endpoints must be non-empty: " + source + "->" + destination);
      }
      validate(latencyUs, lossRate);
    }

    LinkKey key() {
      return new LinkKey(source, destination);
    }
  }

  /// Identifies a directed link by its endpoints, which may themselves contain underscores.
  record LinkKey(String source, String destination) {
    String seedLabel() {
      return source + "_" + destination;
    }
  }

  public NetworkConfig {
    validate(defaultLatencyUs, defaultLossRate);
    links = List.copyOf(links);
    final var duplicates = links.stream()
        .collect(Collectors.groupingBy(Link::key, Collectors.counting()))
        .entrySet().stream().filter(e -> e.getValue() > 1).map(Map.Entry::getKey).toList();
    if (!duplicates.isEmpty()) {
      throw new IllegalArgumentException("duplicate links: " + duplicates);
    }
  }

  public NetworkConfig(long defaultLatencyUs, double defaultLossRate) {
    this(defaultLatencyUs, defaultLossRate, List.of());
  }

  public Optional<Link> link(String source, String destination) {
    return links.stream()
        .filter(l -> l.source().equals(source) && l.destination().equals(destination))
        .findFirst();
  }

  Map<LinkKey, Link> linksByKey() {
    return links.stream().collect(Collectors.toMap(Link::key, Function.identity()));
  }

  private static void validate(long latencyUs, double lossRate) {
    if (latencyUs < 0) {
      throw new IllegalArgumentException("latencyUs must be non-negative: " + latencyUs);
    }
    if (!(lossRate >= 0.0 && lossRate <= 1.0)) {
      throw new IllegalArgumentException("lossRate must be between 0 and 1: " + lossRate);
    }
  }
}
