// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.coordinator;

import com.github.fedsim.SchedulingException;

/// The global virtual time of one run. Only the coordinator loop holds a reference, so no node and no routing code
/// can move it.
final class ScenarioClock {
  private final long quantumUs;
  private long globalTimeUs = 0L;

  ScenarioClock(long quantumUs) {
    if (quantumUs <= 0) {
      throw new IllegalArgumentException("quantumUs must be positive: " + quantumUs);
    }
    this.quantumUs = quantumUs;
  }

  long globalTimeUs() {
    return globalTimeUs;
  }

  long quantumUs() {
    return quantumUs;
  }

  /// @return one quantum ahead, clamped so that the last cycle ends exactly at the duration.
  long nextTarget(long durationUs) {
    return durationUs - globalTimeUs < quantumUs ? durationUs : globalTimeUs + quantumUs;
  }

  void advanceTo(long targetUs) {
    if (targetUs <= globalTimeUs) {
      throw new SchedulingException("global time must move forward from " + globalTimeUs + " not to " + targetUs);
    }
    if (targetUs - globalTimeUs > quantumUs) {
      throw new SchedulingException("global time cannot jump more than one quantum from " + globalTimeUs + " to "
          + targetUs);
    }
    globalTimeUs = targetUs;
  }
}
