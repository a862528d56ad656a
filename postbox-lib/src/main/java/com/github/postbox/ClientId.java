// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.UUID;

/// The 16 byte opaque identity the server issues to a client at registration. The bytes are carried on the wire
/// unchanged so we hold them as the most and least significant halves of a [UUID].
public record ClientId(UUID uuid) {

  public static final int SIZE = 16;

  /// Clients that have not registered yet send all zero bytes as their identity.
  public static final ClientId UNREGISTERED = new ClientId(new UUID(0L, 0L));

  public ClientId {
    Objects.requireNonNull(uuid, "uuid cannot be null");
  }

  public static ClientId random() {
    return new ClientId(UUID.randomUUID());
  }

  public static ClientId fromBytes(byte[] bytes) {
    if (bytes == null || bytes.length != SIZE) {
      throw new IllegalArgumentException("client id must be exactly " + SIZE + " bytes");
    }
    final var buffer = ByteBuffer.wrap(bytes);
    return new ClientId(new UUID(buffer.getLong(), buffer.getLong()));
  }

  /// Reads the next 16 bytes of the buffer. The byte order of the buffer is ignored as the id is opaque.
  public static ClientId read(ByteBuffer buffer) {
    final byte[] bytes = new byte[SIZE];
    buffer.get(bytes);
    return fromBytes(bytes);
  }

  public byte[] toBytes() {
    return ByteBuffer.allocate(SIZE)
        .putLong(uuid.getMostSignificantBits())
        .putLong(uuid.getLeastSignificantBits())
        .array();
  }

  public void write(ByteBuffer buffer) {
    buffer.put(toBytes());
  }

  public String hex() {
    return uuid.toString().replace("-", "");
  }

  @Override
  public String toString() {
    return "ClientId[" + hex() + "]";
  }
}
