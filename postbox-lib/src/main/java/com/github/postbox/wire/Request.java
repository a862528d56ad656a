// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.wire;

import java.util.Objects;

/// A fully decoded request frame.
public record Request(RequestHeader header, RequestBody body) {

  public Request {
    Objects.requireNonNull(header, "header cannot be null");
    Objects.requireNonNull(body, "body cannot be null");
    if (header.code() != body.code()) {
      throw new IllegalArgumentException("header code " + header.code() + " does not match body " + body.code());
    }
  }
}
