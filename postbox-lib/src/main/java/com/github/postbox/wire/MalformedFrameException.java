// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.wire;

import com.github.postbox.ErrorKind;
import com.github.postbox.PostboxException;

/// Bytes received from a client that do not form a valid frame. The connection is answered with an error and closed.
public abstract class MalformedFrameException extends PostboxException {

  protected MalformedFrameException(String message) {
    super(message);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.MALFORMED_REQUEST;
  }
}
