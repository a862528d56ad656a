// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/// A registered client.
///
/// @param id        The server issued identity. Never reused.
/// @param name      The unique, case-sensitive, ASCII user name chosen at registration.
/// @param publicKey The opaque public key blob the client registered with. Other clients fetch it to encrypt
///                  messages; the server never interprets it.
/// @param lastSeen  When the server last completed a request from this client.
public record Client(ClientId id, String name, byte[] publicKey, Instant lastSeen) {

  public static final int PUBLIC_KEY_SIZE = 160;
  /// The wire field is 255 bytes and must hold a NUL terminator.
  public static final int MAX_NAME_LENGTH = 254;

  public Client {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(name, "name cannot be null");
    Objects.requireNonNull(publicKey, "publicKey cannot be null");
    Objects.requireNonNull(lastSeen, "lastSeen cannot be null");
    if (name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
      throw new IllegalArgumentException("name must be between 1 and " + MAX_NAME_LENGTH + " characters");
    }
    if (publicKey.length != PUBLIC_KEY_SIZE) {
      throw new IllegalArgumentException("publicKey must be " + PUBLIC_KEY_SIZE + " bytes but was " + publicKey.length);
    }
  }

  public Client seenAt(Instant when) {
    return new Client(id, name, publicKey, when);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Client)) return false;
    Client that = (Client) o;
    return id.equals(that.id)
        && name.equals(that.name)
        && Arrays.equals(publicKey, that.publicKey)
        && lastSeen.equals(that.lastSeen);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(id, name, lastSeen);
    result = 31 * result + Arrays.hashCode(publicKey);
    return result;
  }

  @Override
  public String toString() {
    return String.format("Client[id=%s, name='%s', publicKey=byte[%d], lastSeen=%s]",
        id.hex(), name, publicKey.length, lastSeen);
  }
}
