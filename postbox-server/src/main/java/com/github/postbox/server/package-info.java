// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The network side of the postbox server.
///
/// - 'ConnectionMultiplexer': The single threaded NIO selector loop that owns every client socket.
/// - 'Connection' and 'ParseState': One socket and where it is in its request and response exchange.
/// - 'ServerConfig': Settings parsed from the command line and the port file.
/// - 'PostboxServer': The entry point which wires the MVStore mailbox to the multiplexer.
package com.github.postbox.server;
