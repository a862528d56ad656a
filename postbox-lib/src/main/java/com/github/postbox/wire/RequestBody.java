// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.wire;

import com.github.postbox.Client;
import com.github.postbox.ClientId;

import java.util.Arrays;
import java.util.Objects;

/// The decoded payload of a request. The shape depends on the [RequestCode].
public sealed interface RequestBody {

  RequestCode code();

  record Register(String name, byte[] publicKey) implements RequestBody {
    public Register {
      Objects.requireNonNull(name, "name cannot be null");
      Objects.requireNonNull(publicKey, "publicKey cannot be null");
      if (publicKey.length != Client.PUBLIC_KEY_SIZE) {
        throw new IllegalArgumentException("publicKey must be " + Client.PUBLIC_KEY_SIZE + " bytes");
      }
    }

    @Override
    public RequestCode code() {
      return RequestCode.REGISTER;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Register)) return false;
      Register that = (Register) o;
      return name.equals(that.name) && Arrays.equals(publicKey, that.publicKey);
    }

    @Override
    public int hashCode() {
      return 31 * name.hashCode() + Arrays.hashCode(publicKey);
    }

    @Override
    public String toString() {
      return "Register[name='" + name + "', publicKey=byte[" + publicKey.length + "]]";
    }
  }

  record ClientList() implements RequestBody {
    public static final ClientList INSTANCE = new ClientList();

    @Override
    public RequestCode code() {
      return RequestCode.CLIENT_LIST;
    }
  }

  record PublicKey(ClientId target) implements RequestBody {
    public PublicKey {
      Objects.requireNonNull(target, "target cannot be null");
    }

    @Override
    public RequestCode code() {
      return RequestCode.PUBLIC_KEY;
    }
  }

  record SendMessage(ClientId recipient, byte type, byte[] content) implements RequestBody {
    public SendMessage {
      Objects.requireNonNull(recipient, "recipient cannot be null");
      Objects.requireNonNull(content, "content cannot be null");
    }

    @Override
    public RequestCode code() {
      return RequestCode.SEND_MESSAGE;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof SendMessage)) return false;
      SendMessage that = (SendMessage) o;
      return type == that.type && recipient.equals(that.recipient) && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
      return 31 * Objects.hash(recipient, type) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
      return "SendMessage[recipient=" + recipient.hex() + ", type=" + type + ", content=byte[" + content.length + "]]";
    }
  }

  record PendingMessages() implements RequestBody {
    public static final PendingMessages INSTANCE = new PendingMessages();

    @Override
    public RequestCode code() {
      return RequestCode.PENDING_MESSAGES;
    }
  }
}
