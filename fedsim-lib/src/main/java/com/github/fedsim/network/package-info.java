// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// How the coordinator reaches nodes and how events travel between them.
///
/// Key interfaces:
/// - `NodeTransport`: byte stream to one node, implemented over TCP and over a child process' stdio
/// - `NetworkModel`: the simulated network that carries directed events between nodes
///
/// The network models are part of the simulation and so obey the same determinism rules as the nodes. Transports are
/// not: their timing may vary between runs without changing any event stream.
package com.github.fedsim.network;
