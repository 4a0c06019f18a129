// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Federated lockstep simulation: a coordinator advances a shared virtual clock across independent node processes
/// in fixed quanta and routes events between them at the cycle boundaries.
///
/// This package holds the time and ordering primitives shared by both sides of the protocol:
/// - `Event`: an immutable timestamped event with routing fields and an opaque JSON payload
/// - `EventQueue`: the `(timeUs, insertionSequence)` ordered queue that deterministic nodes run on
/// - `DeterministicSeed`: run independent seeds derived from a node id and the scenario seed
package com.github.fedsim;
