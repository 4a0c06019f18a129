// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The node side of the protocol: the contract a node implements, a base class for deterministic nodes, the loop
/// that serves a node over a pair of streams, and an in-memory harness that checks a node is reproducible.
package com.github.fedsim.node;
