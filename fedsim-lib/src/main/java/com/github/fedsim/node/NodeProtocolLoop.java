// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.node;

import com.github.fedsim.Event;
import com.github.fedsim.SchedulingException;
import com.github.fedsim.protocol.LineFramer;
import com.github.fedsim.protocol.ProtocolCodec;
import com.github.fedsim.protocol.ProtocolException;
import com.github.fedsim.protocol.ProtocolMessage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;

import static com.github.fedsim.FedSimLogger.LOGGER;

/// Serves one [SimNode] to a coordinator over a pair of streams. The loop only ever writes in reply to a command.
/// Logging goes through JUL which node processes must point at stderr because stdout may be the protocol stream.
public final class NodeProtocolLoop {

  public enum Outcome {
    /// The coordinator sent `SHUTDOWN`.
    SHUTDOWN,
    /// The coordinator closed the stream between commands.
    END_OF_STREAM,
    /// A malformed command or an error raised by the node. The caller should close the connection which the
    /// coordinator then sees as a failure of this node.
    ERROR
  }

  private final SimNode node;

  public NodeProtocolLoop(SimNode node) {
    this.node = node;
  }

  /// @throws IOException when the transport itself fails.
  public Outcome run(InputStream in, OutputStream out) throws IOException {
    final LineFramer lines = new LineFramer(in);
    String nodeId = null;
    long nowUs = 0L;
    try {
      while (true) {
        final Optional<ProtocolMessage.Command> next = ProtocolCodec.readCommand(lines);
        if (next.isEmpty()) {
          final String id = nodeId;
          LOGGER.info(() -> "node=" + id + " coordinator closed the stream");
          return Outcome.END_OF_STREAM;
        }
        final ProtocolMessage.Command command = next.get();
        if (command instanceof ProtocolMessage.Init init) {
          if (nodeId != null) {
            throw new ProtocolException("second INIT for node " + nodeId);
          }
          nodeId = init.nodeId();
          node.init(init.nodeId(), init.config());
          ProtocolCodec.write(out, new ProtocolMessage.Ready());
          final String id = nodeId;
          LOGGER.info(() -> "node=" + id + " ready deterministic=" + node.deterministic());
        } else if (command instanceof ProtocolMessage.Advance advance) {
          if (nodeId == null) {
            throw new ProtocolException("ADVANCE before INIT");
          }
          if (advance.targetTimeUs() < nowUs) {
            throw new ProtocolException("target " + advance.targetTimeUs() + " is before node time " + nowUs);
          }
          final List<Event> emitted = node.advance(advance.targetTimeUs(), advance.events());
          nowUs = advance.targetTimeUs();
          ProtocolCodec.write(out, new ProtocolMessage.Done(emitted));
        } else if (command instanceof ProtocolMessage.Shutdown) {
          node.shutdown();
          final String id = nodeId;
          LOGGER.info(() -> "node=" + id + " shut down");
          return Outcome.SHUTDOWN;
        }
      }
    } catch (ProtocolException | SchedulingException | IllegalArgumentException e) {
      LOGGER.log(Level.SEVERE, "node=" + nodeId + " stopping: " + e.getMessage(), e);
      return Outcome.ERROR;
    }
  }
}
