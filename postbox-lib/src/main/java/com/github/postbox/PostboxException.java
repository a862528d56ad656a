// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox;

/// Root of the failures the server reports back to clients. Each subclass maps to one [ErrorKind].
public abstract class PostboxException extends RuntimeException {

  protected PostboxException(String message) {
    super(message);
  }

  protected PostboxException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract ErrorKind kind();
}
