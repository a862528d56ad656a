// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.wire;

import java.util.Objects;

/// A response frame: the server version and a body whose code goes in the header.
public record Response(byte version, ResponseBody body) {

  public Response {
    Objects.requireNonNull(body, "body cannot be null");
  }

  public Response(ResponseBody body) {
    this(WireProtocol.SERVER_VERSION, body);
  }

  public ResponseCode code() {
    return body.code();
  }
}
