// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.wire;

/// The fixed size header of a response frame as a client reads it. The code is kept raw so that a client can
/// report codes it does not know.
public record ResponseHeader(int version, int code, long payloadSize) {
}
