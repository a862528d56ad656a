// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.wire;

import java.util.Arrays;
import java.util.Optional;

public enum ResponseCode {
  REGISTERED(2100),
  CLIENT_LIST(2101),
  PUBLIC_KEY(2102),
  MESSAGE_SENT(2103),
  PENDING_MESSAGES(2104),
  GENERIC_ERROR(9000),
  NAME_TAKEN(9001),
  UNKNOWN_CLIENT(9002),
  MALFORMED_REQUEST(9003);

  private final int code;

  ResponseCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isError() {
    return code >= GENERIC_ERROR.code;
  }

  public static Optional<ResponseCode> fromCode(int code) {
    return Arrays.stream(values()).filter(c -> c.code == code).findFirst();
  }
}
