// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox;

import java.util.List;
import java.util.Objects;

/// The result of handling one request. Exactly one outcome is produced per request and the [Failure] variant
/// carries the error kind so that the response layer never sees an exception.
public sealed interface Outcome {

  record Registered(Client client) implements Outcome {
    public Registered {
      Objects.requireNonNull(client, "client cannot be null");
    }
  }

  /// @param clients Every client except the caller, ordered by name.
  record ClientList(List<Client> clients) implements Outcome {
    public ClientList {
      clients = List.copyOf(clients);
    }
  }

  record PublicKey(Client client) implements Outcome {
    public PublicKey {
      Objects.requireNonNull(client, "client cannot be null");
    }
  }

  record MessageSent(ClientId recipient, long messageId) implements Outcome {
    public MessageSent {
      Objects.requireNonNull(recipient, "recipient cannot be null");
    }
  }

  /// @param messages The drained mailbox in enqueue order. Possibly empty.
  record PendingMessages(List<Message> messages) implements Outcome {
    public PendingMessages {
      messages = List.copyOf(messages);
    }
  }

  record Failure(ErrorKind kind, String detail) implements Outcome {
    public Failure {
      Objects.requireNonNull(kind, "kind cannot be null");
      Objects.requireNonNull(detail, "detail cannot be null");
    }

    public static Failure of(PostboxException e) {
      return new Failure(e.kind(), String.valueOf(e.getMessage()));
    }
  }

  default boolean isFailure() {
    return this instanceof Failure;
  }
}
