// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.store;

import com.github.postbox.Client;
import com.github.postbox.ClientId;
import com.github.postbox.MailboxStore;
import com.github.postbox.Message;
import com.github.postbox.NameTakenException;
import com.github.postbox.PostboxException;
import com.github.postbox.StoreFailureException;
import com.github.postbox.UnknownClientException;
import org.h2.mvstore.Cursor;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.ToLongFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/// A [MailboxStore] on an embedded H2 MVStore.
///
/// The maps are:
///
/// - `clients`: client id hex to the pickled [Client].
/// - `names`: user name to client id hex. This is the uniqueness index and, as MVStore maps are sorted, it also gives
///   the client list ordered by name.
/// - `messages`: message id to the pickled [Message].
/// - `mailbox`: `recipient hex#zero padded message id` to message id. Sorted keys make each recipient's mailbox a
///   contiguous, enqueue ordered range.
/// - `sequence`: the last message id handed out.
///
/// Auto-commit is disabled. Every public operation runs in a transaction that holds a single lock for its whole
/// duration and ends in a commit, or a rollback if anything failed. So the store serialises all writers and a
/// successful return means the change is on disk.
public class MVStoreMailbox implements MailboxStore {

  private static final Logger LOGGER = Logger.getLogger(MVStoreMailbox.class.getName());

  static final String MAP_PREFIX = "com.github.postbox.store#";
  private static final String MESSAGE_SEQUENCE = "message";

  private final MVStore store;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  private final MVMap<String, byte[]> clients;
  private final MVMap<String, String> names;
  private final MVMap<Long, byte[]> messages;
  private final MVMap<String, Long> mailbox;
  private final MVMap<String, Long> sequence;

  public MVStoreMailbox(MVStore store, Clock clock) {
    this.store = Objects.requireNonNull(store, "store cannot be null");
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    this.clients = store.openMap(MAP_PREFIX + "clients");
    this.names = store.openMap(MAP_PREFIX + "names");
    this.messages = store.openMap(MAP_PREFIX + "messages");
    this.mailbox = store.openMap(MAP_PREFIX + "mailbox");
    this.sequence = store.openMap(MAP_PREFIX + "sequence");
    LOGGER.fine(() -> "Opened mailbox store with " + clients.size() + " clients and " + messages.size() + " pending messages");
  }

  /// Opens, or creates, the store file.
  public static MVStoreMailbox open(Path file) {
    final MVStore store = new MVStore.Builder()
        .fileName(file.toString())
        .autoCommitDisabled()
        .open();
    return new MVStoreMailbox(store, Clock.systemUTC());
  }

  public static MVStoreMailbox inMemory() {
    return new MVStoreMailbox(new MVStore.Builder().autoCommitDisabled().open(), Clock.systemUTC());
  }

  @Override
  public <T> T transaction(Supplier<T> work) {
    lock.lock();
    final boolean outermost = lock.getHoldCount() == 1;
    try {
      final T result = work.get();
      if (outermost) {
        store.commit();
      }
      return result;
    } catch (PostboxException e) {
      if (outermost) {
        rollback(e);
      }
      throw e;
    } catch (RuntimeException e) {
      if (outermost) {
        rollback(e);
      }
      throw new StoreFailureException("mailbox store operation failed: " + e.getMessage(), e);
    } finally {
      lock.unlock();
    }
  }

  private void rollback(RuntimeException cause) {
    try {
      if (!store.isClosed()) {
        store.rollback();
      }
    } catch (RuntimeException e) {
      LOGGER.log(Level.SEVERE, "Rollback failed", e);
      cause.addSuppressed(e);
    }
  }

  @Override
  public Client createClient(String name, byte[] publicKey) {
    return transaction(() -> {
      if (names.containsKey(name)) {
        throw new NameTakenException(name);
      }
      ClientId id = ClientId.random();
      while (id.equals(ClientId.UNREGISTERED) || clients.containsKey(id.hex())) {
        id = ClientId.random();
      }
      final Client client = new Client(id, name, publicKey, clock.instant());
      clients.put(id.hex(), Pickle.writeClient(client));
      names.put(name, id.hex());
      LOGGER.fine(() -> "Registered " + client);
      return client;
    });
  }

  @Override
  public Client getClient(ClientId id) {
    return transaction(() -> {
      final byte[] pickled = clients.get(id.hex());
      if (pickled == null) {
        throw new UnknownClientException(id);
      }
      return Pickle.readClient(pickled);
    });
  }

  @Override
  public List<Client> listClients(ClientId excluding) {
    return transaction(() -> {
      final String excluded = excluding.hex();
      final List<Client> result = new ArrayList<>(names.size());
      for (Map.Entry<String, String> entry : names.entrySet()) {
        if (!entry.getValue().equals(excluded)) {
          result.add(Pickle.readClient(clients.get(entry.getValue())));
        }
      }
      return result;
    });
  }

  @Override
  public void touch(ClientId id) {
    transaction(() -> {
      final byte[] pickled = clients.get(id.hex());
      if (pickled != null) {
        clients.put(id.hex(), Pickle.writeClient(Pickle.readClient(pickled).seenAt(clock.instant())));
      }
      return null;
    });
  }

  @Override
  public long enqueueMessage(ClientId recipient, ClientId sender, byte type, byte[] content) {
    return transaction(() -> {
      if (!clients.containsKey(recipient.hex())) {
        throw new UnknownClientException(recipient);
      }
      final long id = nextMessageId();
      final Message message = new Message(id, recipient, sender, type, content, clock.instant());
      messages.put(id, Pickle.writeMessage(message));
      mailbox.put(mailboxKey(recipient, id), id);
      LOGGER.finer(() -> "Enqueued " + message);
      return id;
    });
  }

  private long nextMessageId() {
    final long id = sequence.getOrDefault(MESSAGE_SEQUENCE, 0L) + 1;
    sequence.put(MESSAGE_SEQUENCE, id);
    return id;
  }

  @Override
  public List<Message> drainMessages(ClientId recipient, long budget, ToLongFunction<Message> sizer) {
    return transaction(() -> {
      final String prefix = mailboxPrefix(recipient);
      final List<String> keys = new ArrayList<>();
      final List<Message> drained = new ArrayList<>();
      final Cursor<String, Long> cursor = mailbox.cursor(prefix);
      long used = 0;
      while (cursor.hasNext()) {
        final String key = cursor.next();
        if (!key.startsWith(prefix)) {
          break;
        }
        final Message message = Pickle.readMessage(messages.get(cursor.getValue()));
        used += sizer.applyAsLong(message);
        if (!drained.isEmpty() && used > budget) {
          LOGGER.fine(() -> "Drain budget of " + budget + " reached for " + recipient.hex() + ", leaving the rest queued");
          break;
        }
        keys.add(key);
        drained.add(message);
      }
      for (int i = 0; i < keys.size(); i++) {
        mailbox.remove(keys.get(i));
        messages.remove(drained.get(i).id());
      }
      LOGGER.finer(() -> "Drained " + drained.size() + " messages for " + recipient.hex());
      return drained;
    });
  }

  @Override
  public int clientCount() {
    return transaction(clients::size);
  }

  /// The number of messages waiting across every mailbox.
  public int pendingCount() {
    return transaction(messages::size);
  }

  static String mailboxPrefix(ClientId recipient) {
    return recipient.hex() + "#";
  }

  static String mailboxKey(ClientId recipient, long messageId) {
    return mailboxPrefix(recipient) + String.format(Locale.ROOT, "%019d", messageId);
  }

  /// Waits for any running transaction then commits and closes the file.
  @Override
  public void close() {
    lock.lock();
    try {
      if (!store.isClosed()) {
        store.close();
        LOGGER.fine("Closed mailbox store");
      }
    } finally {
      lock.unlock();
    }
  }
}
