// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.demo;

import com.github.fedsim.node.NodeProtocolLoop;
import com.github.fedsim.node.SimNode;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Hosts one reference node. It listens on a TCP port, accepts a single coordinator connection and serves the
/// protocol on it, or serves the protocol on stdin and stdout with `--stdio`.
public class NodeServer implements AutoCloseable {
  private static final String HELP = "help";
  private static final String PORT = "port";
  private static final String TYPE = "type";
  private static final String STDIO = "stdio";
  private static final int BUFFER_SIZE = 8192;
  private static final Logger LOGGER = Logger.getLogger(NodeServer.class.getName());

  private final ServerSocket serverSocket;
  private final Supplier<? extends SimNode> nodeFactory;

  public NodeServer(int port, Supplier<? extends SimNode> nodeFactory) throws IOException {
    this.serverSocket = new ServerSocket(port);
    this.nodeFactory = nodeFactory;
  }

  /// Accepts one coordinator and serves it until `SHUTDOWN`, the end of the stream, or a protocol error. The
  /// connection is closed afterwards, which the coordinator reads as the acknowledgement of `SHUTDOWN`.
  public NodeProtocolLoop.Outcome serveOne() throws IOException {
    LOGGER.info(() -> "listening on port " + getPort());
    try (Socket clientSocket = serverSocket.accept()) {
      clientSocket.setTcpNoDelay(true);
      LOGGER.info(() -> "coordinator connected from " + clientSocket.getRemoteSocketAddress());
      final var in = new BufferedInputStream(clientSocket.getInputStream(), BUFFER_SIZE);
      final var out = new BufferedOutputStream(clientSocket.getOutputStream(), BUFFER_SIZE);
      return new NodeProtocolLoop(nodeFactory.get()).run(in, out);
    }
  }

  public int getPort() {
    return serverSocket.getLocalPort();
  }

  @Override
  public void close() throws IOException {
    serverSocket.close();
  }

  static SimNode nodeOfType(String type) {
    return switch (type) {
      case "sensor" -> new SensorNode();
      case "gateway" -> new GatewayNode();
      default -> throw new IllegalArgumentException("Unknown node type: " + type + " (expected sensor or gateway)");
    };
  }

  public static void main(String[] args) {
    LoggerConfig.initialize();
    CommandLineParser parser = new CommandLineParser();
    parser.parse(args);

    if (parser.hasOption(HELP)) {
      printHelp();
      return;
    }
    try {
      parser.requireOnly(Set.of(HELP, PORT, TYPE, STDIO));
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      printHelp();
      System.exit(2);
    }
    final String type = parser.getOption(TYPE);
    if (type == null || (!parser.hasOption(PORT) && !parser.hasOption(STDIO))) {
      System.err.println("Missing required option: --" + TYPE + " and one of --" + PORT + " or --" + STDIO);
      printHelp();
      System.exit(2);
    }
    try {
      nodeOfType(type);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.exit(2);
    }

    NodeProtocolLoop.Outcome outcome;
    try {
      if (parser.hasOption(STDIO)) {
        outcome = new NodeProtocolLoop(nodeOfType(type)).run(System.in, System.out);
      } else {
        try (NodeServer server = new NodeServer(Integer.parseInt(parser.getOption(PORT)), () -> nodeOfType(type))) {
          outcome = server.serveOne();
        }
      }
    } catch (IOException e) {
      LOGGER.log(Level.SEVERE, "node server failed", e);
      outcome = NodeProtocolLoop.Outcome.ERROR;
    }
    System.exit(outcome == NodeProtocolLoop.Outcome.ERROR ? 1 : 0);
  }

  private static void printHelp() {
    System.err.println("Usage: java " + NodeServer.class.getName() + " [options]");
    System.err.println("  --" + TYPE + "=sensor|gateway  Which reference node to run");
    System.err.println("  --" + PORT + "=5001            TCP port to accept the coordinator on");
    System.err.println("  --" + STDIO + "                Speak the protocol on stdin and stdout instead");
    System.err.println("  -h, --help               Show this help message");
  }
}
