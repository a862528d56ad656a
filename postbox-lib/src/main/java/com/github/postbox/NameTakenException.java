// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox;

public class NameTakenException extends PostboxException {

  private final String name;

  public NameTakenException(String name) {
    super("name already registered: " + name);
    this.name = name;
  }

  public String name() {
    return name;
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.NAME_TAKEN;
  }
}
