// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.store;

import com.github.postbox.Client;
import com.github.postbox.ClientId;
import com.github.postbox.Message;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/// Pickle serializes the records that [MVStoreMailbox] keeps in its maps. MVStore can persist plain objects but
/// that goes through Java serialization which we avoid. This class does things the boilerplate way.
public class Pickle {

  // epoch seconds (8 bytes) + nanos (4 bytes)
  private static final int INSTANT_SIZE = Long.BYTES + Integer.BYTES;

  public static byte[] writeClient(Client client) {
    final byte[] name = client.name().getBytes(StandardCharsets.US_ASCII);
    final ByteBuffer buffer = ByteBuffer.allocate(ClientId.SIZE + Short.BYTES + name.length
        + Client.PUBLIC_KEY_SIZE + INSTANT_SIZE);
    client.id().write(buffer);
    buffer.putShort((short) name.length);
    buffer.put(name);
    buffer.put(client.publicKey());
    write(client.lastSeen(), buffer);
    return buffer.array();
  }

  public static Client readClient(byte[] pickled) {
    final ByteBuffer buffer = ByteBuffer.wrap(pickled);
    final ClientId id = ClientId.read(buffer);
    final byte[] name = new byte[buffer.getShort()];
    buffer.get(name);
    final byte[] publicKey = new byte[Client.PUBLIC_KEY_SIZE];
    buffer.get(publicKey);
    return new Client(id, new String(name, StandardCharsets.US_ASCII), publicKey, readInstant(buffer));
  }

  public static byte[] writeMessage(Message message) {
    final ByteBuffer buffer = ByteBuffer.allocate(Long.BYTES + 2 * ClientId.SIZE + 1 + INSTANT_SIZE
        + Integer.BYTES + message.content().length);
    buffer.putLong(message.id());
    message.recipient().write(buffer);
    message.sender().write(buffer);
    buffer.put(message.type());
    write(message.createdAt(), buffer);
    buffer.putInt(message.content().length);
    buffer.put(message.content());
    return buffer.array();
  }

  public static Message readMessage(byte[] pickled) {
    final ByteBuffer buffer = ByteBuffer.wrap(pickled);
    final long id = buffer.getLong();
    final ClientId recipient = ClientId.read(buffer);
    final ClientId sender = ClientId.read(buffer);
    final byte type = buffer.get();
    final Instant createdAt = readInstant(buffer);
    final byte[] content = new byte[buffer.getInt()];
    buffer.get(content);
    return new Message(id, recipient, sender, type, content, createdAt);
  }

  static void write(Instant instant, ByteBuffer buffer) {
    buffer.putLong(instant.getEpochSecond());
    buffer.putInt(instant.getNano());
  }

  static Instant readInstant(ByteBuffer buffer) {
    return Instant.ofEpochSecond(buffer.getLong(), buffer.getInt());
  }
}
