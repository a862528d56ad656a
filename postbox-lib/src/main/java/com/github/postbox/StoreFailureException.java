// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox;

/// The backing store could not complete an operation. The transaction has been rolled back.
public class StoreFailureException extends PostboxException {

  public StoreFailureException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.GENERIC;
  }
}
