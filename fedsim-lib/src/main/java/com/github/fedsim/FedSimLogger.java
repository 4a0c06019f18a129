// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim;

import java.util.logging.Logger;

/// We are using JUL logging to reduce dependencies. You can configure JUL logging to bridge to your chosen logging
/// framework.
public final class FedSimLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.fedsim");

  private FedSimLogger() {
  }
}
