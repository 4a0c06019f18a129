// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The coordinator that advances a shared virtual clock across independent node processes.
///
/// Key types:
/// - `Coordinator`: the lockstep barrier loop and the routing of events between cycles
/// - `NodeHandle`: the per-node protocol state machine which turns every node error into a failed state
/// - `SimulationSummary`: what every node reached and which ones degraded from which cycle
///
/// Design characteristics:
/// 1. Node I/O runs concurrently with one task per node and one bounded barrier per cycle
/// 2. Routing runs on one thread strictly after the barrier
/// 3. One failed node never aborts the run for the others
package com.github.fedsim.coordinator;
