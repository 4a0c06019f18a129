// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.network;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/// TCP transport to a node that listens on a port and accepts a single coordinator connection.
public final class SocketTransport implements NodeTransport {
  private static final Logger LOGGER = Logger.getLogger(SocketTransport.class.getName());

  private final Socket socket;
  private final String description;
  private final OutputStream out;

  public SocketTransport(Socket socket) throws IOException {
    this.socket = socket;
    this.socket.setTcpNoDelay(true);
    this.description = "tcp:" + socket.getInetAddress().getHostAddress() + ":" + socket.getPort();
    this.out = new BufferedOutputStream(socket.getOutputStream());
  }

  /// Connects to a node, retrying refused connections because node processes are usually started alongside the
  /// coordinator and may not be listening yet.
  ///
  /// @param attempts   total number of connection attempts, at least one
  /// @param retryDelay pause between attempts
  public static SocketTransport connect(NetworkAddress address, int attempts, Duration retryDelay) throws IOException {
    if (attempts < 1) {
      throw new IllegalArgumentException("attempts must be at least 1: " + attempts);
    }
    ConnectException last = null;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      final Socket socket = new Socket();
      try {
        socket.connect(new InetSocketAddress(address.host(), address.port()));
        LOGGER.fine(() -> "connected to " + address);
        return new SocketTransport(socket);
      } catch (ConnectException e) {
        closeQuietly(socket);
        last = e;
        final int tried = attempt;
        LOGGER.fine(() -> "connection to " + address + " refused on attempt " + tried + " of " + attempts);
        if (attempt < attempts) {
          sleep(retryDelay);
        }
      } catch (IOException e) {
        closeQuietly(socket);
        throw e;
      }
    }
    throw new ConnectException("could not connect to " + address + " after " + attempts + " attempts: "
        + last.getMessage());
  }

  private static void sleep(Duration delay) throws InterruptedIOException {
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted while waiting to retry connection");
    }
  }

  private static void closeQuietly(Socket socket) {
    try {
      socket.close();
    } catch (IOException e) {
      LOGGER.log(Level.FINEST, "ignoring error closing unconnected socket", e);
    }
  }

  @Override
  public InputStream input() throws IOException {
    return socket.getInputStream();
  }

  @Override
  public OutputStream output() {
    return out;
  }

  @Override
  public String describe() {
    return description;
  }

  @Override
  public void close() {
    try {
      socket.close();
    } catch (IOException e) {
      LOGGER.log(Level.WARNING, "error closing " + description, e);
    }
  }
}
