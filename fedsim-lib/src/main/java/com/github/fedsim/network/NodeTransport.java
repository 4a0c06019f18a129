// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.network;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/// A byte stream connection to one node. The coordinator owns exactly one transport per node and closes it exactly
/// once. Closing must unblock a thread that is blocked reading from [#input()].
public interface NodeTransport extends Closeable {

  InputStream input() throws IOException;

  OutputStream output() throws IOException;

  /// @return a short human readable description for logs such as `tcp:localhost:7001`.
  String describe();

  /// Closes without throwing. Errors while closing are logged.
  @Override
  void close();
}
