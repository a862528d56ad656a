// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox;

public class UnknownClientException extends PostboxException {

  private final ClientId clientId;

  public UnknownClientException(ClientId clientId) {
    super("no client registered with id " + clientId.hex());
    this.clientId = clientId;
  }

  public ClientId clientId() {
    return clientId;
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.UNKNOWN_CLIENT;
  }
}
