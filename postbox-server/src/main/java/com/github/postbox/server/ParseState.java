// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.server;

/// Where a [Connection] is in its single request and response exchange.
///
/// ```
/// AWAITING_HEADER -> AWAITING_PAYLOAD -> READY_TO_DISPATCH -> (DISPATCHING) -> AWAITING_WRITE -> CLOSED
/// ```
///
/// A malformed frame jumps straight to AWAITING_WRITE with an error response. End of stream or an I/O error jumps to
/// CLOSED from anywhere.
public enum ParseState {
  AWAITING_HEADER,
  AWAITING_PAYLOAD,
  READY_TO_DISPATCH,
  /// Only used when requests are handled on the dispatch pool.
  DISPATCHING,
  AWAITING_WRITE,
  CLOSED
}
