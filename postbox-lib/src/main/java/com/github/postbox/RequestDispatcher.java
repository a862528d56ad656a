// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox;

import com.github.postbox.wire.Request;
import com.github.postbox.wire.RequestBody;
import com.github.postbox.wire.WireProtocol;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Maps a decoded request to one store interaction. Each request runs in a single store transaction together with
/// a touch of the caller so that a failure leaves the store exactly as it was. The dispatcher holds no state of its
/// own and may be called from many threads at once.
///
/// A pending messages response is capped at `maxResponsePayload` bytes. Messages that would push it past the cap stay
/// in the mailbox for the next request.
public class RequestDispatcher {

  private static final Logger LOGGER = Logger.getLogger(RequestDispatcher.class.getName());

  private final MailboxStore store;
  private final long maxResponsePayload;

  public RequestDispatcher(MailboxStore store, long maxResponsePayload) {
    this.store = Objects.requireNonNull(store, "store cannot be null");
    if (maxResponsePayload <= 0) {
      throw new IllegalArgumentException("maxResponsePayload must be positive but was " + maxResponsePayload);
    }
    this.maxResponsePayload = maxResponsePayload;
  }

  public RequestDispatcher(MailboxStore store) {
    this(store, WireProtocol.DEFAULT_MAX_PAYLOAD_SIZE);
  }

  /// Handles the request. Never throws: every failure comes back as an [Outcome.Failure].
  public @NotNull Outcome dispatch(Request request) {
    final ClientId caller = request.header().clientId();
    try {
      final Outcome outcome = store.transaction(() -> {
        final Outcome result = handle(caller, request.body());
        store.touch(caller);
        return result;
      });
      LOGGER.fine(() -> request.header().code() + " from " + caller.hex() + " -> " + outcome.getClass().getSimpleName());
      return outcome;
    } catch (StoreFailureException e) {
      LOGGER.log(Level.WARNING, "Store failure handling " + request.header().code() + " from " + caller.hex(), e);
      return Outcome.Failure.of(e);
    } catch (PostboxException e) {
      LOGGER.fine(() -> request.header().code() + " from " + caller.hex() + " rejected: " + e.getMessage());
      return Outcome.Failure.of(e);
    } catch (RuntimeException e) {
      LOGGER.log(Level.SEVERE, "Unexpected failure handling " + request.header().code() + " from " + caller.hex(), e);
      return new Outcome.Failure(ErrorKind.GENERIC, String.valueOf(e.getMessage()));
    }
  }

  Outcome handle(ClientId caller, RequestBody body) {
    if (body instanceof RequestBody.Register register) {
      return new Outcome.Registered(store.createClient(register.name(), register.publicKey()));
    } else if (body instanceof RequestBody.ClientList) {
      return new Outcome.ClientList(store.listClients(caller));
    } else if (body instanceof RequestBody.PublicKey key) {
      return new Outcome.PublicKey(store.getClient(key.target()));
    } else if (body instanceof RequestBody.SendMessage send) {
      final long id = store.enqueueMessage(send.recipient(), caller, send.type(), send.content());
      return new Outcome.MessageSent(send.recipient(), id);
    } else if (body instanceof RequestBody.PendingMessages) {
      return new Outcome.PendingMessages(store.drainMessages(caller, maxResponsePayload,
          message -> WireProtocol.PENDING_ENTRY_PREFIX_SIZE + message.content().length));
    }
    throw new IllegalArgumentException("unhandled request body " + body);
  }
}
