// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.demo;

import com.github.fedsim.node.NodeProtocolLoop;
import com.github.fedsim.protocol.LineFramer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.OutputStream;
import java.net.InetAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(30)
public class NodeServerTest {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  final ExecutorService executor = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  public void servesOneCoordinator() throws Exception {
    try (var server = new NodeServer(0, SensorNode::new)) {
      Future<NodeProtocolLoop.Outcome> outcome = executor.submit(server::serveOne);

      try (var socket = new Socket(InetAddress.getLoopbackAddress(), server.getPort())) {
        OutputStream out = socket.getOutputStream();
        LineFramer in = new LineFramer(socket.getInputStream());
        out.write("INIT sensor1 {\"seed\":42}\nADVANCE 2500000\n[]\n".getBytes(StandardCharsets.UTF_8));
        out.flush();

        assertThat(in.readLine()).isEqualTo("READY");
        assertThat(in.readLine()).isEqualTo("DONE");
        assertThat(in.readLine()).contains("\"event_type\":\"TRANSMIT\"").contains("\"time_us\":2000000");

        out.write("SHUTDOWN\n".getBytes(StandardCharsets.UTF_8));
        out.flush();
        assertThat(in.readLine()).isNull();
      }
      assertThat(outcome.get(10, TimeUnit.SECONDS)).isEqualTo(NodeProtocolLoop.Outcome.SHUTDOWN);
    }
  }

  @Test
  public void malformedInputEndsTheSessionWithAnError() throws Exception {
    try (var server = new NodeServer(0, GatewayNode::new)) {
      Future<NodeProtocolLoop.Outcome> outcome = executor.submit(server::serveOne);

      try (var socket = new Socket(InetAddress.getLoopbackAddress(), server.getPort())) {
        socket.getOutputStream().write("INIT gateway not-json\n".getBytes(StandardCharsets.UTF_8));
        socket.getOutputStream().flush();
        assertThat(new LineFramer(socket.getInputStream()).readLine()).isNull();
      }
      assertThat(outcome.get(10, TimeUnit.SECONDS)).isEqualTo(NodeProtocolLoop.Outcome.ERROR);
    }
  }

  @Test
  public void knowsTheReferenceNodes() {
    assertThat(NodeServer.nodeOfType("sensor")).isInstanceOf(SensorNode.class);
    assertThat(NodeServer.nodeOfType("gateway")).isInstanceOf(GatewayNode.class);
    assertThatThrownBy(() -> NodeServer.nodeOfType("toaster")).isInstanceOf(IllegalArgumentException.class);
  }
}
