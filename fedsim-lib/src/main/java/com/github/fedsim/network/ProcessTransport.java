// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.network;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Runs a node as a child process and speaks the protocol over its stdin and stdout. The child's stderr is inherited
/// so that its logs end up next to the coordinator's. This is how backends packaged as containers or scripts are
/// attached.
public final class ProcessTransport implements NodeTransport {
  private static final Logger LOGGER = Logger.getLogger(ProcessTransport.class.getName());

  private final Process process;
  private final String description;
  private final Duration destroyGrace;
  private final OutputStream out;

  ProcessTransport(Process process, String description, Duration destroyGrace) {
    this.process = process;
    this.description = description;
    this.destroyGrace = destroyGrace;
    this.out = new BufferedOutputStream(process.getOutputStream());
  }

  public static ProcessTransport start(List<String> command, Duration destroyGrace) throws IOException {
    if (command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    final Process process = new ProcessBuilder(command)
        .redirectError(ProcessBuilder.Redirect.INHERIT)
        .start();
    final String description = "process:" + process.pid() + ":" + command.get(0);
    LOGGER.fine(() -> "started " + description + " " + command);
    return new ProcessTransport(process, description, destroyGrace);
  }

  @Override
  public InputStream input() {
    return process.getInputStream();
  }

  @Override
  public OutputStream output() {
    return out;
  }

  @Override
  public String describe() {
    return description;
  }

  public boolean isAlive() {
    return process.isAlive();
  }

  /// Closes stdin, which a well behaved node treats as the end of the run, then destroys the process and its
  /// children if it has not exited within the grace period. Stdin is closed from its own thread: a worker blocked
  /// writing to a child that stopped reading holds the stream's lock until the child is destroyed.
  @Override
  public void close() {
    final Thread closer = new Thread(this::closeStdin, "fedsim-stdin-" + process.pid());
    closer.setDaemon(true);
    closer.start();
    try {
      if (!process.waitFor(destroyGrace.toMillis(), TimeUnit.MILLISECONDS)) {
        LOGGER.warning(() -> description + " did not exit within " + destroyGrace + ", destroying it");
        destroy();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      destroy();
    }
  }

  private void closeStdin() {
    try {
      out.close();
    } catch (IOException e) {
      LOGGER.log(Level.FINE, "stdin of " + description + " already closed", e);
    }
  }

  private void destroy() {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
  }
}
