// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.wire;

import com.github.postbox.ClientId;

import java.util.Objects;

/// The fixed size header that starts every request frame.
///
/// @param clientId    The identity the caller presents. All zeros before registration.
/// @param version     The client protocol version.
/// @param code        The request code.
/// @param payloadSize The number of payload bytes that follow the header.
public record RequestHeader(ClientId clientId, int version, RequestCode code, int payloadSize) {

  public RequestHeader {
    Objects.requireNonNull(clientId, "clientId cannot be null");
    Objects.requireNonNull(code, "code cannot be null");
    if (payloadSize < 0) {
      throw new IllegalArgumentException("payloadSize cannot be negative: " + payloadSize);
    }
  }
}
