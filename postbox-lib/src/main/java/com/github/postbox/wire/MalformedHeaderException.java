// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.wire;

public class MalformedHeaderException extends MalformedFrameException {

  public MalformedHeaderException(String message) {
    super(message);
  }
}
