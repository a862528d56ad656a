// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.wire;

import java.util.Arrays;
import java.util.Optional;

public enum RequestCode {
  REGISTER(600),
  CLIENT_LIST(601),
  PUBLIC_KEY(602),
  SEND_MESSAGE(603),
  PENDING_MESSAGES(604);

  private final int code;

  RequestCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static Optional<RequestCode> fromCode(int code) {
    return Arrays.stream(values()).filter(c -> c.code == code).findFirst();
  }
}
