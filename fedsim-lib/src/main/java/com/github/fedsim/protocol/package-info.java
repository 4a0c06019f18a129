// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The wire protocol between the coordinator and the nodes.
///
/// Key types:
/// - `ProtocolMessage`: sealed hierarchy of the commands and responses
/// - `LineFramer`: turns a byte stream into complete lines regardless of how reads are split
/// - `ProtocolCodec`: strict encoding and decoding of lines and event arrays
///
/// Design characteristics:
/// 1. Text lines in UTF-8, one command or response keyword per line
/// 2. Event lists travel as exactly one JSON array line after `ADVANCE` and `DONE`
/// 3. Every deviation is a `ProtocolException`, never a silent skip
package com.github.fedsim.protocol;
