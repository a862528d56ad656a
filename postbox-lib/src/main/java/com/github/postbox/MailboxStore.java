// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox;

import java.util.List;
import java.util.function.Supplier;
import java.util.function.ToLongFunction;

/// The mailbox store is the storage layer of the server and the only state shared between connections. Writes must
/// be crash-proof: when a write method returns the change is durable, when it throws nothing has changed.
///
/// Implementations must be safe to call from many threads. In particular [#enqueueMessage] and [#drainMessages] for
/// the same recipient must be strictly serialised so that every message is handed out by exactly one drain, in the
/// order it was enqueued.
///
/// Request handlers that make more than one call, such as a send followed by a [#touch] of the sender, wrap them in
/// [#transaction] so that the request as a whole either happens or does not.
public interface MailboxStore extends AutoCloseable {

  /// Registers a new client under a freshly allocated id that has never been issued before.
  ///
  /// @param name      The user name. Must not already be registered.
  /// @param publicKey The client's public key.
  /// @return The new client with `lastSeen` set to now.
  /// @throws NameTakenException if the name is already registered.
  Client createClient(String name, byte[] publicKey);

  /// @throws UnknownClientException if no client has the id.
  Client getClient(ClientId id);

  /// A consistent snapshot of every client except `excluding`, ordered by name.
  List<Client> listClients(ClientId excluding);

  /// Records that the client has just been seen. Unknown ids are ignored.
  void touch(ClientId id);

  /// Appends a message to the recipient's mailbox.
  ///
  /// @return The id assigned to the message.
  /// @throws UnknownClientException if the recipient is not registered.
  long enqueueMessage(ClientId recipient, ClientId sender, byte type, byte[] content);

  /// Atomically removes and returns every message in the recipient's mailbox in the order they were enqueued. The
  /// returned list is exactly the set removed.
  default List<Message> drainMessages(ClientId recipient) {
    return drainMessages(recipient, Long.MAX_VALUE, message -> 0L);
  }

  /// Atomically removes and returns the oldest messages in the recipient's mailbox whose summed sizes fit within
  /// `budget`, in the order they were enqueued. The first message is always taken so that an oversized message
  /// cannot block the mailbox. Messages that do not fit stay queued for the next drain.
  ///
  /// @param budget The most the returned messages may add up to.
  /// @param sizer  The size each message counts against the budget.
  List<Message> drainMessages(ClientId recipient, long budget, ToLongFunction<Message> sizer);

  int clientCount();

  /// Runs the work as one atomic unit. Calls to this store made by the work join the same transaction. Nested
  /// transactions join the outermost one which alone commits or rolls back.
  <T> T transaction(Supplier<T> work);

  @Override
  void close();
}
