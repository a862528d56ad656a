// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox;

import java.util.Arrays;
import java.util.Optional;

/// The message types the clients agree on. The server does not act on them, any non-zero type is stored and
/// delivered as is.
public enum MessageType {
  SYMMETRIC_KEY_REQUEST((byte) 1),
  SYMMETRIC_KEY_SEND((byte) 2),
  TEXT((byte) 3),
  FILE((byte) 4);

  private final byte code;

  MessageType(byte code) {
    this.code = code;
  }

  public byte code() {
    return code;
  }

  public static Optional<MessageType> fromCode(byte code) {
    return Arrays.stream(values()).filter(t -> t.code == code).findFirst();
  }

  static String describe(byte code) {
    return fromCode(code).map(Enum::name).orElse(Integer.toString(code & 0xFF));
  }
}
