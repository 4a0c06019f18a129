// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.coordinator;

import java.time.Duration;
import java.util.Objects;

/// Knobs of one coordinator run. The timeouts are wall clock bounds on blocking I/O and never influence virtual time.
///
/// @param seed              the scenario seed sent to every node in `INIT`
/// @param initTimeout       how long all nodes together have to answer `INIT` with `READY`
/// @param advanceTimeout    how long all nodes together have to answer one `ADVANCE` with `DONE`
/// @param shutdownGrace     how long a node has to close its stream after `SHUTDOWN` before it is force closed
/// @param connectAttempts   number of TCP connection attempts per node
/// @param connectRetryDelay pause between connection attempts
public record CoordinatorConfig(
    long seed,
    Duration initTimeout,
    Duration advanceTimeout,
    Duration shutdownGrace,
    int connectAttempts,
    Duration connectRetryDelay
) {
  public static final long DEFAULT_SEED = 42L;

  public CoordinatorConfig {
    requirePositive(initTimeout, "initTimeout");
    requirePositive(advanceTimeout, "advanceTimeout");
    requirePositive(shutdownGrace, "shutdownGrace");
    Objects.requireNonNull(connectRetryDelay, "connectRetryDelay");
    if (connectRetryDelay.isNegative()) {
      throw new IllegalArgumentException("connectRetryDelay must not be negative: " + connectRetryDelay);
    }
    if (connectAttempts < 1) {
      throw new IllegalArgumentException("connectAttempts must be at least 1: " + connectAttempts);
    }
  }

  public static CoordinatorConfig defaults() {
    return new CoordinatorConfig(DEFAULT_SEED, Duration.ofSeconds(10), Duration.ofSeconds(10), Duration.ofSeconds(2),
        10, Duration.ofMillis(500));
  }

  public CoordinatorConfig withSeed(long seed) {
    return new CoordinatorConfig(seed, initTimeout, advanceTimeout, shutdownGrace, connectAttempts, connectRetryDelay);
  }

  public CoordinatorConfig withInitTimeout(Duration timeout) {
    return new CoordinatorConfig(seed, timeout, advanceTimeout, shutdownGrace, connectAttempts, connectRetryDelay);
  }

  public CoordinatorConfig withAdvanceTimeout(Duration timeout) {
    return new CoordinatorConfig(seed, initTimeout, timeout, shutdownGrace, connectAttempts, connectRetryDelay);
  }

  public CoordinatorConfig withShutdownGrace(Duration grace) {
    return new CoordinatorConfig(seed, initTimeout, advanceTimeout, grace, connectAttempts, connectRetryDelay);
  }

  public CoordinatorConfig withConnectRetries(int attempts, Duration delay) {
    return new CoordinatorConfig(seed, initTimeout, advanceTimeout, shutdownGrace, attempts, delay);
  }

  private static void requirePositive(Duration duration, String name) {
    Objects.requireNonNull(duration, name);
    if (duration.isZero() || duration.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive: " + duration);
    }
  }
}
