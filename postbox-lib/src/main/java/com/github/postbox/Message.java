// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.zip.CRC32;

/// A message waiting in a recipient's mailbox. The content is end-to-end encrypted by the clients so it is opaque
/// to the server. The type byte is passed through; see [MessageType] for the values clients use.
///
/// @param id        Server assigned, strictly increasing and never reused.
/// @param recipient The client whose mailbox holds the message.
/// @param sender    The client id presented in the header of the request that deposited the message.
/// @param type      The non-zero message type byte.
/// @param content   The opaque content.
/// @param createdAt When the message was deposited.
public record Message(long id, ClientId recipient, ClientId sender, byte type, byte[] content, Instant createdAt) {

  public Message {
    Objects.requireNonNull(recipient, "recipient cannot be null");
    Objects.requireNonNull(sender, "sender cannot be null");
    Objects.requireNonNull(content, "content cannot be null");
    Objects.requireNonNull(createdAt, "createdAt cannot be null");
    if (type == 0) {
      throw new IllegalArgumentException("message type zero is reserved");
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Message)) return false;
    Message that = (Message) o;
    return id == that.id
        && type == that.type
        && recipient.equals(that.recipient)
        && sender.equals(that.sender)
        && Arrays.equals(content, that.content)
        && createdAt.equals(that.createdAt);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(id, recipient, sender, type, createdAt);
    result = 31 * result + Arrays.hashCode(content);
    return result;
  }

  @Override
  public String toString() {
    CRC32 crc32 = new CRC32();
    crc32.update(content);
    return String.format("Message[id=%d, recipient=%s, sender=%s, type=%s, content=byte[%d]:CRC32=%d]",
        id, recipient.hex(), sender.hex(), MessageType.describe(type), content.length, crc32.getValue());
  }
}
