// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.wire;

import com.github.postbox.ClientId;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// The payload of a response. Each shape carries exactly one [ResponseCode] apart from [Error] which carries
/// whichever error code applies and no payload bytes.
public sealed interface ResponseBody {

  ResponseCode code();

  record Registered(ClientId clientId) implements ResponseBody {
    public Registered {
      Objects.requireNonNull(clientId, "clientId cannot be null");
    }

    @Override
    public ResponseCode code() {
      return ResponseCode.REGISTERED;
    }
  }

  record ClientListEntry(ClientId clientId, String name) {
    public ClientListEntry {
      Objects.requireNonNull(clientId, "clientId cannot be null");
      Objects.requireNonNull(name, "name cannot be null");
    }
  }

  record ClientList(List<ClientListEntry> clients) implements ResponseBody {
    public ClientList {
      clients = List.copyOf(clients);
    }

    @Override
    public ResponseCode code() {
      return ResponseCode.CLIENT_LIST;
    }
  }

  record PublicKey(ClientId clientId, byte[] publicKey) implements ResponseBody {
    public PublicKey {
      Objects.requireNonNull(clientId, "clientId cannot be null");
      Objects.requireNonNull(publicKey, "publicKey cannot be null");
    }

    @Override
    public ResponseCode code() {
      return ResponseCode.PUBLIC_KEY;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof PublicKey)) return false;
      PublicKey that = (PublicKey) o;
      return clientId.equals(that.clientId) && Arrays.equals(publicKey, that.publicKey);
    }

    @Override
    public int hashCode() {
      return 31 * clientId.hashCode() + Arrays.hashCode(publicKey);
    }
  }

  /// @param messageId The unsigned 32 bit message id as it appears on the wire.
  record MessageSent(ClientId recipient, long messageId) implements ResponseBody {
    public MessageSent {
      Objects.requireNonNull(recipient, "recipient cannot be null");
    }

    @Override
    public ResponseCode code() {
      return ResponseCode.MESSAGE_SENT;
    }
  }

  /// @param messageId The unsigned 32 bit message id as it appears on the wire.
  record PendingMessage(ClientId sender, long messageId, byte type, byte[] content) {
    public PendingMessage {
      Objects.requireNonNull(sender, "sender cannot be null");
      Objects.requireNonNull(content, "content cannot be null");
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof PendingMessage)) return false;
      PendingMessage that = (PendingMessage) o;
      return messageId == that.messageId
          && type == that.type
          && sender.equals(that.sender)
          && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
      return 31 * Objects.hash(sender, messageId, type) + Arrays.hashCode(content);
    }
  }

  record PendingMessages(List<PendingMessage> messages) implements ResponseBody {
    public PendingMessages {
      messages = List.copyOf(messages);
    }

    @Override
    public ResponseCode code() {
      return ResponseCode.PENDING_MESSAGES;
    }
  }

  record Error(ResponseCode code) implements ResponseBody {
    public Error {
      Objects.requireNonNull(code, "code cannot be null");
      if (!code.isError()) {
        throw new IllegalArgumentException(code + " is not an error code");
      }
    }
  }
}
