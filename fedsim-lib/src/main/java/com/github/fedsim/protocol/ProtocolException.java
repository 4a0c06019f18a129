// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.protocol;

import java.io.IOException;

/// A line on the wire that is not exactly what the protocol allows at that point: an unknown keyword, a keyword that
/// is not valid in the current state, or something other than a JSON array of events where one is expected.
public class ProtocolException extends IOException {
  public ProtocolException(String message) {
    super(message);
  }

  public ProtocolException(String message, Throwable cause) {
    super(message, cause);
  }
}
