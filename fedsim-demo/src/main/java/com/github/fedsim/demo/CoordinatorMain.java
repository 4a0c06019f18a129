// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.demo;

import com.github.fedsim.coordinator.Coordinator;
import com.github.fedsim.coordinator.CoordinatorConfig;
import com.github.fedsim.coordinator.EventSink;
import com.github.fedsim.coordinator.LoggingEventSink;
import com.github.fedsim.coordinator.Scenario;
import com.github.fedsim.coordinator.SimulationSummary;
import com.github.fedsim.network.DirectNetworkModel;
import com.github.fedsim.network.LatencyNetworkModel;
import com.github.fedsim.network.NetworkAddress;
import com.github.fedsim.network.NetworkConfig;
import com.github.fedsim.network.NetworkModel;
import org.h2.mvstore.MVStore;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/// Command line entry point for a run against nodes that are already listening. Exits with 0 when at least one node
/// completed the run, 1 when every node failed, and 2 on a usage error.
public class CoordinatorMain {
  private static final Logger LOGGER = Logger.getLogger(CoordinatorMain.class.getName());

  static final int EXIT_OK = 0;
  static final int EXIT_ALL_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private static final String HELP = "help";
  private static final String DURATION = "duration-us";
  private static final String QUANTUM = "quantum-us";
  private static final String SEED = "seed";
  private static final String NODES = "nodes";
  private static final String INIT_TIMEOUT = "init-timeout-ms";
  private static final String ADVANCE_TIMEOUT = "advance-timeout-ms";
  private static final String LATENCY = "latency-us";
  private static final String LOSS_RATE = "loss-rate";
  private static final String METRICS_STORE = "metrics-store";

  private static final Set<String> OPTIONS = Set.of(HELP, DURATION, QUANTUM, SEED, NODES, INIT_TIMEOUT,
      ADVANCE_TIMEOUT, LATENCY, LOSS_RATE, METRICS_STORE);

  static final long DEFAULT_QUANTUM_US = 1_000L;

  public static void main(String[] args) {
    LoggerConfig.initialize();
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    final CommandLineParser parser = new CommandLineParser();
    parser.parse(args);
    if (parser.hasOption(HELP)) {
      printHelp(out);
      return EXIT_OK;
    }

    final Scenario scenario;
    final CoordinatorConfig config;
    final NetworkModel networkModel;
    try {
      parser.requireOnly(OPTIONS);
      scenario = parseScenario(parser);
      config = parseConfig(parser, scenario.seed());
      networkModel = parseNetworkModel(parser, scenario.seed());
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      printHelp(err);
      return EXIT_USAGE;
    }

    final EventSink sink = parser.hasOption(METRICS_STORE)
        ? new MVStoreEventSink(MVStore.open(parser.getOption(METRICS_STORE)))
        : new LoggingEventSink();
    try (Coordinator coordinator = new Coordinator(config, networkModel, sink)) {
      coordinator.connectAll(scenario);
      final SimulationSummary summary = coordinator.run(scenario);
      out.println(summary.render());
      return summary.exitCode() == 0 ? EXIT_OK : EXIT_ALL_FAILED;
    }
  }

  static Scenario parseScenario(CommandLineParser parser) {
    final long durationUs = parser.getLong(DURATION, -1L);
    if (!parser.hasOption(DURATION)) {
      throw new IllegalArgumentException("Missing required option: --" + DURATION);
    }
    final long quantumUs = parser.getLong(QUANTUM, DEFAULT_QUANTUM_US);
    final long seed = parser.getLong(SEED, CoordinatorConfig.DEFAULT_SEED);
    final List<Scenario.NodeSpec> nodes = new ArrayList<>();
    for (String entry : parser.requireOption(NODES).split(",")) {
      final String trimmed = entry.trim();
      final int equals = trimmed.indexOf('=');
      if (equals <= 0) {
        throw new IllegalArgumentException("Node must be given as id=host:port but was: " + trimmed);
      }
      nodes.add(new Scenario.NodeSpec(trimmed.substring(0, equals),
          NetworkAddress.parse(trimmed.substring(equals + 1))));
    }
    LOGGER.fine(() -> "scenario duration_us=" + durationUs + " quantum_us=" + quantumUs + " nodes=" + nodes.size());
    return new Scenario(durationUs, quantumUs, seed, nodes);
  }

  static CoordinatorConfig parseConfig(CommandLineParser parser, long seed) {
    CoordinatorConfig config = CoordinatorConfig.defaults().withSeed(seed);
    if (parser.hasOption(INIT_TIMEOUT)) {
      config = config.withInitTimeout(Duration.ofMillis(parser.getLong(INIT_TIMEOUT, 0L)));
    }
    if (parser.hasOption(ADVANCE_TIMEOUT)) {
      config = config.withAdvanceTimeout(Duration.ofMillis(parser.getLong(ADVANCE_TIMEOUT, 0L)));
    }
    return config;
  }

  static NetworkModel parseNetworkModel(CommandLineParser parser, long seed) {
    if (!parser.hasOption(LATENCY) && !parser.hasOption(LOSS_RATE)) {
      return new DirectNetworkModel();
    }
    return new LatencyNetworkModel(new NetworkConfig(parser.getLong(LATENCY, 0L), parser.getDouble(LOSS_RATE, 0.0)),
        seed);
  }

  private static void printHelp(PrintStream out) {
    out.println("Usage: java " + CoordinatorMain.class.getName() + " [options]");
    out.println("  --" + DURATION + "=10000000           Virtual time to simulate in microseconds (required)");
    out.println("  --" + QUANTUM + "=1000                Lockstep step in microseconds");
    out.println("  --" + SEED + "=42                     Scenario seed");
    out.println("  --" + NODES + "=id=host:port[,...]    Nodes to connect to in registration order (required)");
    out.println("  --" + INIT_TIMEOUT + "=10000          Deadline for READY responses");
    out.println("  --" + ADVANCE_TIMEOUT + "=10000       Per cycle deadline for DONE responses");
    out.println("  --" + LATENCY + "=0                   Default link latency, enables the latency network model");
    out.println("  --" + LOSS_RATE + "=0.0               Default link loss rate, enables the latency network model");
    out.println("  --" + METRICS_STORE + "=events.db     Store undirected events in an H2 MVStore file");
    out.println("  -h, --help                       Show this help message");
  }
}
