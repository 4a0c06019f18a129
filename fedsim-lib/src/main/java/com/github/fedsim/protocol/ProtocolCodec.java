// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.protocol;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.fedsim.Event;

import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.github.fedsim.FedSimLogger.LOGGER;

/// Encodes and strictly decodes the line oriented node protocol:
///
/// ```
/// Coordinator -> Node:  INIT <node_id> <config-json>
/// Node -> Coordinator:  READY
/// Coordinator -> Node:  ADVANCE <target_time_us>
/// Coordinator -> Node:  <json-array-of-inbound-events>
/// Node -> Coordinator:  DONE
/// Node -> Coordinator:  <json-array-of-outbound-events>
/// Coordinator -> Node:  SHUTDOWN
/// ```
///
/// Anything that is not exactly one of these keywords, or not a JSON array of well formed events where one is
/// expected, is a [ProtocolException]. Nothing is skipped or repaired. Encoding is deterministic: event fields are
/// always written in the same order and payload keys keep their insertion order, so equal event streams are byte
/// identical on the wire.
public final class ProtocolCodec {

  public static final String INIT = "INIT";
  public static final String READY = "READY";
  public static final String ADVANCE = "ADVANCE";
  public static final String DONE = "DONE";
  public static final String SHUTDOWN = "SHUTDOWN";

  static final String EVENT_TYPE = "event_type";
  static final String TIME_US = "time_us";
  static final String SOURCE = "source";
  static final String DESTINATION = "destination";
  static final String PAYLOAD = "payload";

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
      .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);

  private ProtocolCodec() {
  }

  /// @return the shared, fully configured mapper. Callers must not reconfigure it.
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  // ---------------------------------------------------------------------------------------------------------------
  // encoding
  // ---------------------------------------------------------------------------------------------------------------

  /// @return the wire lines of the message without their newlines.
  public static List<String> encode(ProtocolMessage message) {
    if (message instanceof ProtocolMessage.Init init) {
      return List.of(INIT + " " + init.nodeId() + " " + toJson(init.config()));
    } else if (message instanceof ProtocolMessage.Advance advance) {
      return List.of(ADVANCE + " " + advance.targetTimeUs(), encodeEvents(advance.events()));
    } else if (message instanceof ProtocolMessage.Shutdown) {
      return List.of(SHUTDOWN);
    } else if (message instanceof ProtocolMessage.Ready) {
      return List.of(READY);
    } else if (message instanceof ProtocolMessage.Done done) {
      return List.of(DONE, encodeEvents(done.events()));
    }
    throw new IllegalArgumentException("unknown message " + message);
  }

  /// Writes every line of the message followed by `\n` and flushes.
  public static void write(OutputStream out, ProtocolMessage message) throws IOException {
    final var sb = new StringBuilder();
    for (String line : encode(message)) {
      sb.append(line).append('\n');
    }
    out.write(sb.toString().getBytes(StandardCharsets.UTF_8));
    out.flush();
  }

  public static String encodeEvents(List<Event> events) {
    final ArrayNode array = MAPPER.createArrayNode();
    for (Event event : events) {
      array.add(toJsonNode(event));
    }
    return toJson(array);
  }

  /// @return one event as a single JSON object line.
  public static String encodeEvent(Event event) {
    return toJson(toJsonNode(event));
  }

  public static ObjectNode toJsonNode(Event event) {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put(EVENT_TYPE, event.eventType());
    node.put(TIME_US, event.timeUs());
    node.put(SOURCE, event.source());
    if (event.destination() == null) {
      node.putNull(DESTINATION);
    } else {
      node.put(DESTINATION, event.destination());
    }
    node.set(PAYLOAD, event.payload());
    return node;
  }

  private static String toJson(JsonNode node) {
    try {
      return MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      // a tree we built ourselves always serialises
      throw new IllegalStateException(e);
    }
  }

  // ---------------------------------------------------------------------------------------------------------------
  // decoding
  // ---------------------------------------------------------------------------------------------------------------

  /// Reads the next coordinator command, including the event array line that follows `ADVANCE`.
  ///
  /// @return empty on a clean end of stream before a command line.
  public static Optional<ProtocolMessage.Command> readCommand(LineSource source) throws IOException {
    final String line = source.readLine();
    if (line == null) {
      return Optional.empty();
    }
    if (line.equals(SHUTDOWN)) {
      return Optional.of(new ProtocolMessage.Shutdown());
    }
    if (line.startsWith(INIT + " ")) {
      return Optional.of(decodeInit(line.substring(INIT.length() + 1)));
    }
    if (line.startsWith(ADVANCE + " ")) {
      final long target = parseTime(line.substring(ADVANCE.length() + 1));
      final List<Event> events = decodeEvents(requireLine(source, "event array after " + ADVANCE));
      return Optional.of(new ProtocolMessage.Advance(target, events));
    }
    throw new ProtocolException("unexpected command line: " + abbreviate(line));
  }

  /// Reads the next node response, including the event array line that follows `DONE`. The node closing the stream
  /// here is an [EOFException] because a response is always owed.
  public static ProtocolMessage.Response readResponse(LineSource source) throws IOException {
    final String line = requireLine(source, "response");
    if (line.equals(READY)) {
      return new ProtocolMessage.Ready();
    }
    if (line.equals(DONE)) {
      return new ProtocolMessage.Done(decodeEvents(requireLine(source, "event array after " + DONE)));
    }
    throw new ProtocolException("unexpected response line: " + abbreviate(line));
  }

  public static void expectReady(LineSource source) throws IOException {
    final var response = readResponse(source);
    if (!(response instanceof ProtocolMessage.Ready)) {
      throw new ProtocolException("expected " + READY + " but got " + response);
    }
  }

  public static List<Event> expectDone(LineSource source) throws IOException {
    final var response = readResponse(source);
    if (response instanceof ProtocolMessage.Done done) {
      return done.events();
    }
    throw new ProtocolException("expected " + DONE + " but got " + response);
  }

  /// Decodes one JSON array line of events. `[]` is the common empty case.
  public static List<Event> decodeEvents(String line) throws ProtocolException {
    final JsonNode tree = parse(line);
    if (!tree.isArray()) {
      throw new ProtocolException("expected a JSON array of events but got: " + abbreviate(line));
    }
    final List<Event> events = new ArrayList<>(tree.size());
    int index = 0;
    for (JsonNode element : tree) {
      events.add(fromJsonNode(element, index++));
    }
    LOGGER.finest(() -> "decoded " + events.size() + " events");
    return events;
  }

  /// Decodes one event written by [#encodeEvent(Event)].
  public static Event decodeEvent(String json) throws ProtocolException {
    return fromJsonNode(parse(json), 0);
  }

  static Event fromJsonNode(JsonNode node, int index) throws ProtocolException {
    if (!node.isObject()) {
      throw new ProtocolException("event " + index + " is not a JSON object: " + node);
    }
    final String eventType = requireText(node, EVENT_TYPE, index);
    final String source = requireText(node, SOURCE, index);
    final JsonNode time = node.get(TIME_US);
    if (time == null || !time.isIntegralNumber() || !time.canConvertToLong()) {
      throw new ProtocolException("event " + index + " field " + TIME_US + " must be an integer: " + time);
    }
    final JsonNode destination = node.get(DESTINATION);
    if (destination != null && !destination.isNull() && !destination.isTextual()) {
      throw new ProtocolException("event " + index + " field " + DESTINATION + " must be a string or null");
    }
    final JsonNode payload = node.get(PAYLOAD);
    if (payload != null && !payload.isObject()) {
      throw new ProtocolException("event " + index + " field " + PAYLOAD + " must be an object");
    }
    try {
      return new Event(
          eventType,
          time.longValue(),
          source,
          destination == null || destination.isNull() ? null : destination.textValue(),
          (ObjectNode) payload);
    } catch (IllegalArgumentException e) {
      throw new ProtocolException("event " + index + " is invalid: " + e.getMessage(), e);
    }
  }

  private static ProtocolMessage.Init decodeInit(String rest) throws ProtocolException {
    final int space = rest.indexOf(' ');
    if (space <= 0) {
      throw new ProtocolException("INIT needs a node id and a config object: " + abbreviate(rest));
    }
    final String nodeId = rest.substring(0, space);
    final JsonNode config = parse(rest.substring(space + 1));
    if (!config.isObject()) {
      throw new ProtocolException("INIT config must be a JSON object: " + abbreviate(rest));
    }
    try {
      return new ProtocolMessage.Init(nodeId, (ObjectNode) config);
    } catch (IllegalArgumentException e) {
      throw new ProtocolException(e.getMessage(), e);
    }
  }

  private static long parseTime(String text) throws ProtocolException {
    if (text.isEmpty() || !text.chars().allMatch(c -> c >= '0' && c <= '9')) {
      throw new ProtocolException("target time must be a non-negative decimal integer: " + abbreviate(text));
    }
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException e) {
      throw new ProtocolException("target time out of range: " + abbreviate(text), e);
    }
  }

  private static JsonNode parse(String json) throws ProtocolException {
    try {
      final JsonNode tree = MAPPER.readTree(json);
      if (tree == null || tree.isMissingNode()) {
        throw new ProtocolException("expected JSON but got an empty line");
      }
      return tree;
    } catch (JsonProcessingException e) {
      throw new ProtocolException("malformed JSON: " + abbreviate(json), e);
    }
  }

  private static String requireText(JsonNode node, String field, int index) throws ProtocolException {
    final JsonNode value = node.get(field);
    if (value == null || !value.isTextual()) {
      throw new ProtocolException("event " + index + " field " + field + " must be a string: " + value);
    }
    return value.textValue();
  }

  private static String requireLine(LineSource source, String what) throws IOException {
    final String line = source.readLine();
    if (line == null) {
      throw new EOFException("stream closed while waiting for " + what);
    }
    return line;
  }

  static String abbreviate(String line) {
    return line.length() <= 120 ? "'" + line + "'" : "'" + line.substring(0, 117) + "...' (" + line.length() + " chars)";
  }
}
