// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.coordinator;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.fedsim.Event;
import com.github.fedsim.LoggerConfig;
import com.github.fedsim.network.DirectNetworkModel;
import com.github.fedsim.network.LatencyNetworkModel;
import com.github.fedsim.network.NetworkAddress;
import com.github.fedsim.network.NetworkConfig;
import com.github.fedsim.network.NetworkMetrics;
import com.github.fedsim.network.NetworkModel;
import com.github.fedsim.node.PeriodicNode;
import com.github.fedsim.node.RecordingNode;
import com.github.fedsim.protocol.ProtocolCodec;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;

import static com.github.fedsim.coordinator.ScriptedNode.Misbehaviour.MALFORMED;
import static com.github.fedsim.coordinator.ScriptedNode.Misbehaviour.RETROACTIVE;
import static com.github.fedsim.coordinator.ScriptedNode.Misbehaviour.SILENT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(60)
public class CoordinatorTest {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  static final long SECOND = 1_000_000L;

  final CoordinatorConfig config = CoordinatorConfig.defaults()
      .withAdvanceTimeout(Duration.ofSeconds(5))
      .withShutdownGrace(Duration.ofSeconds(2))
      .withConnectRetries(3, Duration.ofMillis(20));

  final CollectingEventSink sink = new CollectingEventSink();

  static ObjectNode sendTo(String destination) {
    ObjectNode config = JsonNodeFactory.instance.objectNode();
    config.put("destination", destination);
    return config;
  }

  static List<Long> times(List<Event> events) {
    return events.stream().map(Event::timeUs).toList();
  }

  @Test
  public void periodicNodeRunsToTheEnd() throws IOException {
    try (var ticker = ScriptedNode.serving(new PeriodicNode());
         var coordinator = new Coordinator(config, new DirectNetworkModel(), sink)) {
      coordinator.connect("ticker", ticker.address(), null);

      SimulationSummary summary = coordinator.run(10 * SECOND, SECOND);

      assertThat(times(sink.events())).containsExactly(
          SECOND, 2 * SECOND, 3 * SECOND, 4 * SECOND, 5 * SECOND, 6 * SECOND, 7 * SECOND, 8 * SECOND, 9 * SECOND);
      assertThat(sink.events()).extracting(Event::eventType).containsOnly(PeriodicNode.TICK);
      assertThat(summary.cycles()).isEqualTo(10);
      assertThat(summary.finalTimeUs()).isEqualTo(10 * SECOND);
      assertThat(summary.sinkEvents()).isEqualTo(9);
      assertThat(summary.node("ticker").state()).isEqualTo(NodeState.SHUT_DOWN);
      assertThat(summary.node("ticker").currentTimeUs()).isEqualTo(10 * SECOND);
      assertThat(summary.exitCode()).isZero();
    }
  }

  @Test
  public void directedEventsArriveInTheNextCycle() throws IOException {
    RecordingNode b = new RecordingNode();
    try (var nodeA = ScriptedNode.serving(new PeriodicNode());
         var nodeB = ScriptedNode.serving(b);
         var coordinator = new Coordinator(config, new DirectNetworkModel(), sink)) {
      coordinator.connect("a", nodeA.address(), sendTo("b"));
      coordinator.connect("b", nodeB.address(), null);

      coordinator.run(4 * SECOND, SECOND);

      List<RecordingNode.Delivery> deliveries = b.deliveries();
      assertThat(b.targets()).containsExactly(SECOND, 2 * SECOND, 3 * SECOND, 4 * SECOND);
      assertThat(deliveries).extracting(d -> d.inbound().size()).containsExactly(0, 0, 1, 1);
      assertThat(deliveries.get(2).inbound().get(0).timeUs()).isEqualTo(SECOND);
      assertThat(deliveries.get(3).inbound().get(0).timeUs()).isEqualTo(2 * SECOND);
      assertThat(b.inbound()).extracting(Event::source).containsOnly("a");

      // b answers each delivery with an undirected SEEN at the start of the cycle it received it in
      assertThat(sink.events()).extracting(Event::eventType).containsOnly(RecordingNode.SEEN);
      assertThat(times(sink.events())).containsExactly(2 * SECOND, 3 * SECOND);
    }
  }

  @Test
  public void initConfigCarriesTheScenarioSeed() throws IOException {
    RecordingNode node = new RecordingNode();
    ObjectNode nodeConfig = JsonNodeFactory.instance.objectNode();
    nodeConfig.put("seed", 1);
    nodeConfig.put("colour", "blue");
    try (var server = ScriptedNode.serving(node);
         var coordinator = new Coordinator(config.withSeed(99), new DirectNetworkModel(), sink)) {
      coordinator.connect("n", server.address(), nodeConfig);

      coordinator.run(SECOND, SECOND);

      assertThat(node.config().get("seed").longValue()).isEqualTo(99);
      assertThat(node.config().get("colour").asText()).isEqualTo("blue");
      assertThat(node.isShutdown()).isTrue();
    }
  }

  @Test
  public void lastCycleIsClampedToTheDuration() throws IOException {
    RecordingNode node = new RecordingNode();
    try (var server = ScriptedNode.serving(node);
         var coordinator = new Coordinator(config, new DirectNetworkModel(), sink)) {
      coordinator.connect("n", server.address(), null);

      SimulationSummary summary = coordinator.run(2_500_000, SECOND);

      assertThat(node.targets()).containsExactly(SECOND, 2 * SECOND, 2_500_000L);
      assertThat(summary.cycles()).isEqualTo(3);
      assertThat(summary.finalTimeUs()).isEqualTo(2_500_000);
    }
  }

  @Test
  public void malformedNodeIsDroppedAndTheRunContinues() throws IOException {
    RecordingNode c = new RecordingNode();
    try (var nodeA = ScriptedNode.serving(new PeriodicNode());
         var nodeB = ScriptedNode.misbehavingAt(3, MALFORMED);
         var nodeC = ScriptedNode.serving(c);
         var coordinator = new Coordinator(config, new DirectNetworkModel(), sink)) {
      coordinator.connect("a", nodeA.address(), sendTo("b"));
      coordinator.connect("b", nodeB.address(), null);
      coordinator.connect("c", nodeC.address(), null);

      SimulationSummary summary = coordinator.run(6 * SECOND, SECOND);

      NodeSummary b = summary.node("b");
      assertThat(b.state()).isEqualTo(NodeState.FAILED);
      assertThat(b.failure()).isNotNull();
      assertThat(b.failure().kind()).isEqualTo(NodeFailure.ErrorKind.PROTOCOL);
      assertThat(b.failure().cycle()).isEqualTo(3);
      assertThat(b.currentTimeUs()).isEqualTo(2 * SECOND);

      assertThat(summary.node("a").state()).isEqualTo(NodeState.SHUT_DOWN);
      assertThat(summary.node("a").currentTimeUs()).isEqualTo(6 * SECOND);
      assertThat(summary.node("c").state()).isEqualTo(NodeState.SHUT_DOWN);
      assertThat(c.targets()).hasSize(6);
      assertThat(summary.degradedNodes()).extracting(NodeSummary::nodeId).containsExactly("b");
      assertThat(summary.exitCode()).isZero();

      // ticks addressed to b once it had failed are undeliverable
      assertThat(times(sink.events())).containsExactly(2 * SECOND, 3 * SECOND, 4 * SECOND, 5 * SECOND);
    }
  }

  @Test
  public void everyNodeFailingStopsTheRun() throws IOException {
    try (var bad = ScriptedNode.misbehavingAt(1, MALFORMED);
         var coordinator = new Coordinator(config, new DirectNetworkModel(), sink)) {
      coordinator.connect("bad", bad.address(), null);

      SimulationSummary summary = coordinator.run(10 * SECOND, SECOND);

      assertThat(summary.allFailed()).isTrue();
      assertThat(summary.exitCode()).isEqualTo(1);
      assertThat(summary.cycles()).isEqualTo(1);
      assertThat(summary.node("bad").failure().cycle()).isEqualTo(1);
    }
  }

  @Test
  public void silentNodeTimesOut() throws IOException {
    RecordingNode a = new RecordingNode();
    try (var nodeA = ScriptedNode.serving(a);
         var slow = ScriptedNode.misbehavingAt(2, SILENT);
         var coordinator = new Coordinator(config.withAdvanceTimeout(Duration.ofMillis(300)),
             new DirectNetworkModel(), sink)) {
      coordinator.connect("a", nodeA.address(), null);
      coordinator.connect("slow", slow.address(), null);

      SimulationSummary summary = coordinator.run(4 * SECOND, SECOND);

      assertThat(summary.node("slow").failure().kind()).isEqualTo(NodeFailure.ErrorKind.TIMEOUT);
      assertThat(summary.node("slow").failure().cycle()).isEqualTo(2);
      assertThat(summary.node("a").state()).isEqualTo(NodeState.SHUT_DOWN);
      assertThat(a.targets()).containsExactly(SECOND, 2 * SECOND, 3 * SECOND, 4 * SECOND);
    }
  }

  @Test
  public void retroactiveEventsFailTheNode() throws IOException {
    try (var liar = ScriptedNode.misbehavingAt(2, RETROACTIVE);
         var honest = ScriptedNode.serving(new RecordingNode());
         var coordinator = new Coordinator(config, new DirectNetworkModel(), sink)) {
      coordinator.connect("liar", liar.address(), null);
      coordinator.connect("honest", honest.address(), null);

      SimulationSummary summary = coordinator.run(3 * SECOND, SECOND);

      assertThat(summary.node("liar").failure().kind()).isEqualTo(NodeFailure.ErrorKind.SCHEDULING);
      assertThat(summary.node("liar").failure().cycle()).isEqualTo(2);
      assertThat(sink.events()).isEmpty();
      assertThat(summary.node("honest").state()).isEqualTo(NodeState.SHUT_DOWN);
    }
  }

  @Test
  public void initFailureIsReportedAtCycleZero() throws IOException {
    RecordingNode a = new RecordingNode();
    try (var bad = ScriptedNode.rejectingInit();
         var nodeA = ScriptedNode.serving(a);
         var coordinator = new Coordinator(config, new DirectNetworkModel(), sink)) {
      coordinator.connect("bad", bad.address(), null);
      coordinator.connect("a", nodeA.address(), null);

      SimulationSummary summary = coordinator.run(2 * SECOND, SECOND);

      assertThat(summary.node("bad").failure().kind()).isEqualTo(NodeFailure.ErrorKind.PROTOCOL);
      assertThat(summary.node("bad").failure().cycle()).isZero();
      assertThat(a.targets()).containsExactly(SECOND, 2 * SECOND);
    }
  }

  @Test
  public void silentInitTimesOut() throws IOException {
    RecordingNode a = new RecordingNode();
    try (var mute = ScriptedNode.silentOnInit();
         var nodeA = ScriptedNode.serving(a);
         var coordinator = new Coordinator(config.withInitTimeout(Duration.ofMillis(300)),
             new DirectNetworkModel(), sink)) {
      coordinator.connect("mute", mute.address(), null);
      coordinator.connect("a", nodeA.address(), null);

      SimulationSummary summary = coordinator.run(2 * SECOND, SECOND);

      assertThat(summary.node("mute").failure().kind()).isEqualTo(NodeFailure.ErrorKind.TIMEOUT);
      assertThat(summary.node("mute").failure().cycle()).isZero();
      assertThat(a.targets()).containsExactly(SECOND, 2 * SECOND);
    }
  }

  @Test
  public void unreachableNodeIsReportedNotFatal() throws IOException {
    int closedPort;
    try (var listener = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      closedPort = listener.getLocalPort();
    }
    try (var live = ScriptedNode.serving(new RecordingNode());
         var coordinator = new Coordinator(config.withConnectRetries(2, Duration.ofMillis(10)),
             new DirectNetworkModel(), sink)) {
      Scenario scenario = new Scenario(2 * SECOND, SECOND, 7, List.of(
          new Scenario.NodeSpec("live", live.address()),
          new Scenario.NodeSpec("ghost", new NetworkAddress("127.0.0.1", closedPort))));
      coordinator.connectAll(scenario);

      SimulationSummary summary = coordinator.run(scenario);

      assertThat(summary.node("ghost").failure().kind()).isEqualTo(NodeFailure.ErrorKind.TRANSPORT);
      assertThat(summary.node("ghost").failure().cycle()).isZero();
      assertThat(summary.node("live").state()).isEqualTo(NodeState.SHUT_DOWN);
      assertThat(summary.exitCode()).isZero();
    }
  }

  @Test
  public void duplicateNodeIdsAreRejected() {
    try (var coordinator = new Coordinator(config, new DirectNetworkModel(), sink)) {
      coordinator.addNode("x", new ScriptedTransport());
      var second = new ScriptedTransport();
      assertThatThrownBy(() -> coordinator.addNode("x", second)).isInstanceOf(IllegalArgumentException.class);
      assertThat(second.closes).hasValue(1);
    }
  }

  @Test
  public void aCoordinatorRunsOnce() throws IOException {
    try (var server = ScriptedNode.serving(new RecordingNode());
         var coordinator = new Coordinator(config, new DirectNetworkModel(), sink)) {
      coordinator.connect("n", server.address(), null);
      coordinator.run(SECOND, SECOND);
      assertThatThrownBy(() -> coordinator.run(SECOND, SECOND)).isInstanceOf(IllegalStateException.class);
    }
  }

  @Test
  public void latencyModelDelaysDelivery() throws IOException {
    RecordingNode b = new RecordingNode();
    var network = new LatencyNetworkModel(new NetworkConfig(1_500_000, 0.0), 42);
    try (var nodeA = ScriptedNode.serving(new PeriodicNode());
         var nodeB = ScriptedNode.serving(b);
         var coordinator = new Coordinator(config, network, sink)) {
      coordinator.connect("a", nodeA.address(), sendTo("b"));
      coordinator.connect("b", nodeB.address(), null);

      SimulationSummary summary = coordinator.run(5 * SECOND, SECOND);

      List<RecordingNode.Delivery> deliveries = b.deliveries();
      assertThat(deliveries).extracting(d -> d.inbound().size()).containsExactly(0, 0, 1, 1, 1);
      assertThat(times(b.inbound())).containsExactly(2_500_000L, 3_500_000L, 4_500_000L);
      assertThat(summary.network().packetsSent()).isEqualTo(4);
      assertThat(summary.network().packetsDelivered()).isEqualTo(3);
      assertThat(summary.network().packetsInFlight()).isEqualTo(1);
      assertThat(summary.network().averageLatencyUs()).isEqualTo(1_500_000.0);
    }
  }

  static final String LATEST_EVENT = "[{\"event_type\":\"LATE\",\"time_us\":9223372036854775806,"
      + "\"source\":\"far\",\"destination\":\"b\",\"payload\":{}}]";

  @Test
  public void eventAtTheEndOfTimeStaysInFlight() throws IOException {
    RecordingNode b = new RecordingNode();
    var network = new LatencyNetworkModel(new NetworkConfig(500, 0.0), 1);
    try (var far = ScriptedNode.emittingOnce(LATEST_EVENT);
         var nodeB = ScriptedNode.serving(b);
         var coordinator = new Coordinator(config, network, sink)) {
      coordinator.connect("far", far.address(), null);
      coordinator.connect("b", nodeB.address(), null);

      SimulationSummary summary = coordinator.run(3 * SECOND, SECOND);

      assertThat(summary.finalTimeUs()).isEqualTo(3 * SECOND);
      assertThat(summary.exitCode()).isZero();
      assertThat(summary.node("far").state()).isEqualTo(NodeState.SHUT_DOWN);
      assertThat(b.inbound()).isEmpty();
      assertThat(summary.network().packetsInFlight()).isEqualTo(1);
    }
  }

  /// Fails on every event it is asked to route.
  static final class RejectingNetworkModel implements NetworkModel {
    @Override
    public List<Event> route(Event event) {
      throw new IllegalArgumentException("cannot route " + event);
    }

    @Override
    public List<Event> advanceTo(long limitUs) {
      return List.of();
    }

    @Override
    public void reset() {
    }

    @Override
    public NetworkMetrics.Snapshot metrics() {
      return new NetworkMetrics().snapshot();
    }
  }

  @Test
  public void routingErrorSendsTheEventToTheSink() throws IOException {
    RecordingNode b = new RecordingNode();
    try (var ticker = ScriptedNode.serving(new PeriodicNode());
         var nodeB = ScriptedNode.serving(b);
         var coordinator = new Coordinator(config, new RejectingNetworkModel(), sink)) {
      coordinator.connect("ticker", ticker.address(), sendTo("b"));
      coordinator.connect("b", nodeB.address(), null);

      SimulationSummary summary = coordinator.run(3 * SECOND, SECOND);

      assertThat(summary.exitCode()).isZero();
      assertThat(b.inbound()).isEmpty();
      assertThat(times(sink.events())).containsExactly(SECOND, 2 * SECOND);
      assertThat(sink.events()).extracting(Event::destination).containsOnly("b");
    }
  }

  List<String> lossyRun(long seed) throws IOException {
    RecordingNode b = new RecordingNode();
    var network = new LatencyNetworkModel(new NetworkConfig(250_000, 0.3), seed);
    var collected = new CollectingEventSink();
    try (var nodeA = ScriptedNode.serving(new PeriodicNode());
         var nodeB = ScriptedNode.serving(b);
         var coordinator = new Coordinator(config.withSeed(seed), network, collected)) {
      ObjectNode fast = sendTo("b");
      fast.put("period_us", 100_000);
      coordinator.connect("a", nodeA.address(), fast);
      coordinator.connect("b", nodeB.address(), null);
      coordinator.run(5 * SECOND, SECOND);
    }
    return collected.events().stream().map(ProtocolCodec::encodeEvent).toList();
  }

  @Test
  public void sameSeedSameRun() throws IOException {
    List<String> first = lossyRun(11);
    List<String> second = lossyRun(11);

    assertThat(first).isNotEmpty();
    assertThat(second).isEqualTo(first);
  }

  @Test
  public void lossDropsSomeEvents() throws IOException {
    // 30 ticks reach b before its last cycle and each one that survives is answered with a SEEN
    assertThat(lossyRun(11).size()).isBetween(1, 29);
  }
}
