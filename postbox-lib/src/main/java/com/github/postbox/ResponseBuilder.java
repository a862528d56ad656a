// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox;

import com.github.postbox.wire.MalformedFrameException;
import com.github.postbox.wire.Response;
import com.github.postbox.wire.ResponseBody;
import com.github.postbox.wire.ResponseCode;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Turns a handler [Outcome] into the response frame sent back to the client.
///
/// When `collapseErrorCodes` is set every failure is reported as [ResponseCode#GENERIC_ERROR] which is the only
/// error code older clients understand.
public class ResponseBuilder {

  private static final Logger LOGGER = Logger.getLogger(ResponseBuilder.class.getName());

  private final boolean collapseErrorCodes;

  public ResponseBuilder(boolean collapseErrorCodes) {
    this.collapseErrorCodes = collapseErrorCodes;
  }

  public ResponseBuilder() {
    this(false);
  }

  /// Never throws. Anything that cannot be built is answered with a generic error.
  public Response build(Outcome outcome) {
    try {
      return new Response(body(outcome));
    } catch (RuntimeException e) {
      LOGGER.log(Level.SEVERE, "Failed to build response for " + outcome, e);
      return error(ErrorKind.GENERIC);
    }
  }

  /// The response for bytes that did not decode into a request.
  public Response malformed(MalformedFrameException e) {
    LOGGER.fine(() -> "Malformed request: " + e.getMessage());
    return error(e.kind());
  }

  public Response error(ErrorKind kind) {
    return new Response(new ResponseBody.Error(errorCode(kind)));
  }

  ResponseCode errorCode(ErrorKind kind) {
    if (collapseErrorCodes) {
      return ResponseCode.GENERIC_ERROR;
    }
    return switch (kind) {
      case NAME_TAKEN -> ResponseCode.NAME_TAKEN;
      case UNKNOWN_CLIENT -> ResponseCode.UNKNOWN_CLIENT;
      case MALFORMED_REQUEST -> ResponseCode.MALFORMED_REQUEST;
      case GENERIC -> ResponseCode.GENERIC_ERROR;
    };
  }

  private ResponseBody body(Outcome outcome) {
    if (outcome instanceof Outcome.Registered registered) {
      return new ResponseBody.Registered(registered.client().id());
    } else if (outcome instanceof Outcome.ClientList list) {
      final List<ResponseBody.ClientListEntry> entries = list.clients().stream()
          .map(c -> new ResponseBody.ClientListEntry(c.id(), c.name()))
          .collect(Collectors.toList());
      return new ResponseBody.ClientList(entries);
    } else if (outcome instanceof Outcome.PublicKey key) {
      return new ResponseBody.PublicKey(key.client().id(), key.client().publicKey());
    } else if (outcome instanceof Outcome.MessageSent sent) {
      return new ResponseBody.MessageSent(sent.recipient(), wireMessageId(sent.messageId()));
    } else if (outcome instanceof Outcome.PendingMessages pending) {
      final List<ResponseBody.PendingMessage> messages = pending.messages().stream()
          .map(m -> new ResponseBody.PendingMessage(m.sender(), wireMessageId(m.id()), m.type(), m.content()))
          .collect(Collectors.toList());
      return new ResponseBody.PendingMessages(messages);
    } else if (outcome instanceof Outcome.Failure failure) {
      return new ResponseBody.Error(errorCode(failure.kind()));
    }
    throw new IllegalArgumentException("unknown outcome " + outcome);
  }

  /// Message ids are longs in the store but only the low 32 bits fit on the wire.
  static long wireMessageId(long id) {
    return id & 0xFFFF_FFFFL;
  }
}
