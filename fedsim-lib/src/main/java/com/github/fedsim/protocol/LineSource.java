// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.protocol;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;

/// Something that yields complete protocol lines without their newline.
@FunctionalInterface
public interface LineSource {
  /// @return the next complete line or null at a clean end of stream.
  String readLine() throws IOException;

  static LineSource of(List<String> lines) {
    final Iterator<String> iterator = List.copyOf(lines).iterator();
    return () -> iterator.hasNext() ? iterator.next() : null;
  }
}
