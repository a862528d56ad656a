// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.wire;

public class MalformedPayloadException extends MalformedFrameException {

  private final RequestCode code;

  public MalformedPayloadException(RequestCode code, String message) {
    super(code + ": " + message);
    this.code = code;
  }

  public RequestCode code() {
    return code;
  }
}
