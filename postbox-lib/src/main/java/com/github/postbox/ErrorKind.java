// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox;

/// The categories of failure a client can be told about.
public enum ErrorKind {
  NAME_TAKEN,
  UNKNOWN_CLIENT,
  MALFORMED_REQUEST,
  GENERIC
}
