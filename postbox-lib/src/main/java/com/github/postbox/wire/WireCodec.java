// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.wire;

import com.github.postbox.ClientId;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// ## Postbox Wire Format
///
/// Every connection carries exactly one request frame and one response frame. All integers are little-endian.
///
/// ```
/// Request header (23 bytes):
///   client id:     16 bytes - identity issued at registration, zeros before
///   version:        1 byte  - client protocol version
///   code:           2 bytes - unsigned request code
///   payload size:   4 bytes - unsigned count of the bytes that follow
///
/// Response header (7 bytes):
///   version:        1 byte  - server protocol version
///   code:           2 bytes - unsigned response code
///   payload size:   4 bytes - unsigned count of the bytes that follow
///
/// Request payloads:
///   600 REGISTER:          name(255, NUL terminated ASCII) public key(160)
///   601 CLIENT_LIST:       empty
///   602 PUBLIC_KEY:        target id(16)
///   603 SEND_MESSAGE:      recipient id(16) type(1) content size(4) content(N)
///   604 PENDING_MESSAGES:  empty
///
/// Response payloads:
///   2100 REGISTERED:       client id(16)
///   2101 CLIENT_LIST:      { client id(16) name(255) }*
///   2102 PUBLIC_KEY:       client id(16) public key(160)
///   2103 MESSAGE_SENT:     recipient id(16) message id(4)
///   2104 PENDING_MESSAGES: { sender id(16) message id(4) type(1) content size(4) content(N) }*
///   9000 - 9003 errors:    empty
/// ```
///
/// Decoding never pads or truncates: a payload whose length does not match the shape its code demands is rejected.
/// The codec is pure and may be shared between threads.
public final class WireCodec implements WireProtocol {

  private static final Logger LOGGER = Logger.getLogger(WireCodec.class.getName());

  private final int maxPayloadSize;

  public WireCodec(int maxPayloadSize) {
    if (maxPayloadSize < REGISTER_PAYLOAD_SIZE) {
      throw new IllegalArgumentException("maxPayloadSize must allow a registration payload of "
          + REGISTER_PAYLOAD_SIZE + " bytes but was " + maxPayloadSize);
    }
    this.maxPayloadSize = maxPayloadSize;
  }

  public WireCodec() {
    this(DEFAULT_MAX_PAYLOAD_SIZE);
  }

  public int maxPayloadSize() {
    return maxPayloadSize;
  }

  // -- server side --

  /// Decodes the 23 byte request header at the buffer's position.
  ///
  /// @throws MalformedHeaderException if there are too few bytes, the version is not supported, the code is
  ///                                  unknown or the payload size exceeds the configured maximum.
  public RequestHeader decodeHeader(ByteBuffer buffer) {
    if (buffer.remaining() < REQUEST_HEADER_SIZE) {
      throw new MalformedHeaderException("header needs " + REQUEST_HEADER_SIZE + " bytes but only "
          + buffer.remaining() + " available");
    }
    buffer.order(BYTE_ORDER);
    final ClientId clientId = ClientId.read(buffer);
    final int version = Byte.toUnsignedInt(buffer.get());
    final int code = Short.toUnsignedInt(buffer.getShort());
    final long payloadSize = Integer.toUnsignedLong(buffer.getInt());

    if (version < MIN_CLIENT_VERSION || version > MAX_CLIENT_VERSION) {
      throw new MalformedHeaderException("unsupported protocol version " + version);
    }
    final RequestCode requestCode = RequestCode.fromCode(code)
        .orElseThrow(() -> new MalformedHeaderException("unknown request code " + code));
    if (payloadSize > maxPayloadSize) {
      throw new MalformedHeaderException("payload size " + payloadSize + " exceeds maximum " + maxPayloadSize);
    }
    final var header = new RequestHeader(clientId, version, requestCode, (int) payloadSize);
    LOGGER.finest(() -> "Decoded " + header);
    return header;
  }

  /// Decodes a request payload. The buffer must hold exactly the payload bytes announced in the header.
  ///
  /// @throws MalformedPayloadException if the bytes do not match the shape demanded by the code.
  public RequestBody decodePayload(RequestCode code, ByteBuffer buffer) {
    buffer.order(BYTE_ORDER);
    return switch (code) {
      case REGISTER -> decodeRegister(buffer);
      case CLIENT_LIST -> {
        expectSize(code, buffer, 0);
        yield RequestBody.ClientList.INSTANCE;
      }
      case PUBLIC_KEY -> {
        expectSize(code, buffer, ClientId.SIZE);
        yield new RequestBody.PublicKey(ClientId.read(buffer));
      }
      case SEND_MESSAGE -> decodeSendMessage(buffer);
      case PENDING_MESSAGES -> {
        expectSize(code, buffer, 0);
        yield RequestBody.PendingMessages.INSTANCE;
      }
    };
  }

  private static RequestBody decodeRegister(ByteBuffer buffer) {
    expectSize(RequestCode.REGISTER, buffer, REGISTER_PAYLOAD_SIZE);
    final byte[] nameField = new byte[NAME_FIELD_SIZE];
    buffer.get(nameField);
    final byte[] publicKey = new byte[PUBLIC_KEY_SIZE];
    buffer.get(publicKey);
    return new RequestBody.Register(decodeName(nameField), publicKey);
  }

  /// Names are C strings: ASCII up to the first NUL. Whatever follows the NUL is padding.
  static String decodeName(byte[] field) {
    int length = 0;
    while (length < field.length && field[length] != 0) {
      if (field[length] < 0) {
        throw new MalformedPayloadException(RequestCode.REGISTER, "name is not ASCII");
      }
      length++;
    }
    if (length == field.length) {
      throw new MalformedPayloadException(RequestCode.REGISTER, "name is not NUL terminated");
    }
    if (length == 0) {
      throw new MalformedPayloadException(RequestCode.REGISTER, "name is empty");
    }
    return new String(field, 0, length, StandardCharsets.US_ASCII);
  }

  private static RequestBody decodeSendMessage(ByteBuffer buffer) {
    if (buffer.remaining() < SEND_PREFIX_SIZE) {
      throw new MalformedPayloadException(RequestCode.SEND_MESSAGE, "payload of " + buffer.remaining()
          + " bytes is shorter than the " + SEND_PREFIX_SIZE + " byte message header");
    }
    final ClientId recipient = ClientId.read(buffer);
    final byte type = buffer.get();
    final long contentSize = Integer.toUnsignedLong(buffer.getInt());
    if (type == 0) {
      throw new MalformedPayloadException(RequestCode.SEND_MESSAGE, "message type zero is reserved");
    }
    if (contentSize != buffer.remaining()) {
      throw new MalformedPayloadException(RequestCode.SEND_MESSAGE, "content size " + contentSize
          + " does not match the " + buffer.remaining() + " content bytes received");
    }
    final byte[] content = new byte[(int) contentSize];
    buffer.get(content);
    return new RequestBody.SendMessage(recipient, type, content);
  }

  private static void expectSize(RequestCode code, ByteBuffer buffer, int expected) {
    if (buffer.remaining() != expected) {
      throw new MalformedPayloadException(code, "expected " + expected + " payload bytes but got " + buffer.remaining());
    }
  }

  /// Encodes a response frame. The returned buffer is flipped, ready to be written, and holds exactly
  /// `RESPONSE_HEADER_SIZE + payload size` bytes.
  public ByteBuffer encode(Response response) {
    final ResponseBody body = response.body();
    final int payloadSize = frameSize(sizeOf(body), RESPONSE_HEADER_SIZE);
    final ByteBuffer buffer = ByteBuffer.allocate(RESPONSE_HEADER_SIZE + payloadSize).order(BYTE_ORDER);
    buffer.put(response.version());
    buffer.putShort((short) body.code().code());
    buffer.putInt(payloadSize);
    writeBody(body, buffer);
    buffer.flip();
    return buffer;
  }

  static long sizeOf(ResponseBody body) {
    if (body instanceof ResponseBody.Registered) {
      return ClientId.SIZE;
    } else if (body instanceof ResponseBody.ClientList) {
      return (long) ((ResponseBody.ClientList) body).clients().size() * CLIENT_LIST_ENTRY_SIZE;
    } else if (body instanceof ResponseBody.PublicKey) {
      return ClientId.SIZE + ((ResponseBody.PublicKey) body).publicKey().length;
    } else if (body instanceof ResponseBody.MessageSent) {
      return ClientId.SIZE + MESSAGE_ID_SIZE;
    } else if (body instanceof ResponseBody.PendingMessages) {
      return ((ResponseBody.PendingMessages) body).messages().stream()
          .mapToLong(m -> PENDING_ENTRY_PREFIX_SIZE + (long) m.content().length)
          .sum();
    }
    return 0;
  }

  /// @throws IllegalArgumentException if the frame would not fit in one buffer.
  static int frameSize(long payloadSize, int headerSize) {
    if (payloadSize > Integer.MAX_VALUE - headerSize) {
      throw new IllegalArgumentException("payload of " + payloadSize + " bytes does not fit in one frame");
    }
    return (int) payloadSize;
  }

  private static void writeBody(ResponseBody body, ByteBuffer buffer) {
    if (body instanceof ResponseBody.Registered registered) {
      registered.clientId().write(buffer);
    } else if (body instanceof ResponseBody.ClientList list) {
      for (ResponseBody.ClientListEntry entry : list.clients()) {
        entry.clientId().write(buffer);
        buffer.put(encodeName(entry.name()));
      }
    } else if (body instanceof ResponseBody.PublicKey key) {
      key.clientId().write(buffer);
      buffer.put(key.publicKey());
    } else if (body instanceof ResponseBody.MessageSent sent) {
      sent.recipient().write(buffer);
      buffer.putInt((int) sent.messageId());
    } else if (body instanceof ResponseBody.PendingMessages pending) {
      for (ResponseBody.PendingMessage message : pending.messages()) {
        message.sender().write(buffer);
        buffer.putInt((int) message.messageId());
        buffer.put(message.type());
        buffer.putInt(message.content().length);
        buffer.put(message.content());
      }
    }
  }

  /// Pads the name with NUL bytes to the fixed field width, keeping at least one terminating NUL.
  static byte[] encodeName(String name) {
    final byte[] field = new byte[NAME_FIELD_SIZE];
    final byte[] ascii = name.getBytes(StandardCharsets.US_ASCII);
    System.arraycopy(ascii, 0, field, 0, Math.min(ascii.length, NAME_FIELD_SIZE - 1));
    return field;
  }

  // -- client side --

  /// Encodes a complete request frame as a client would send it.
  public static ByteBuffer encodeRequest(ClientId clientId, int version, RequestBody body) {
    final int payloadSize = sizeOf(body);
    final ByteBuffer buffer = ByteBuffer.allocate(REQUEST_HEADER_SIZE + payloadSize).order(BYTE_ORDER);
    clientId.write(buffer);
    buffer.put((byte) version);
    buffer.putShort((short) body.code().code());
    buffer.putInt(payloadSize);
    if (body instanceof RequestBody.Register register) {
      buffer.put(encodeName(register.name()));
      buffer.put(register.publicKey());
    } else if (body instanceof RequestBody.PublicKey key) {
      key.target().write(buffer);
    } else if (body instanceof RequestBody.SendMessage send) {
      send.recipient().write(buffer);
      buffer.put(send.type());
      buffer.putInt(send.content().length);
      buffer.put(send.content());
    }
    buffer.flip();
    return buffer;
  }

  static int sizeOf(RequestBody body) {
    if (body instanceof RequestBody.Register) {
      return REGISTER_PAYLOAD_SIZE;
    } else if (body instanceof RequestBody.PublicKey) {
      return ClientId.SIZE;
    } else if (body instanceof RequestBody.SendMessage) {
      return SEND_PREFIX_SIZE + ((RequestBody.SendMessage) body).content().length;
    }
    return 0;
  }

  public static ResponseHeader decodeResponseHeader(ByteBuffer buffer) {
    if (buffer.remaining() < RESPONSE_HEADER_SIZE) {
      throw new IllegalArgumentException("response header needs " + RESPONSE_HEADER_SIZE + " bytes but only "
          + buffer.remaining() + " available");
    }
    buffer.order(BYTE_ORDER);
    return new ResponseHeader(
        Byte.toUnsignedInt(buffer.get()),
        Short.toUnsignedInt(buffer.getShort()),
        Integer.toUnsignedLong(buffer.getInt()));
  }

  /// Decodes a response payload as a client would. The buffer must hold exactly the payload bytes.
  ///
  /// @throws IllegalArgumentException if the code is unknown or the payload does not match its shape.
  public static ResponseBody decodeResponseBody(int code, ByteBuffer buffer) {
    buffer.order(BYTE_ORDER);
    final ResponseCode responseCode = ResponseCode.fromCode(code)
        .orElseThrow(() -> new IllegalArgumentException("unknown response code " + code));
    final ResponseBody body;
    try {
      body = decodeResponsePayload(responseCode, buffer);
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException("truncated " + responseCode + " payload", e);
    }
    if (buffer.hasRemaining()) {
      throw new IllegalArgumentException(buffer.remaining() + " unexpected trailing bytes after " + responseCode);
    }
    return body;
  }

  private static ResponseBody decodeResponsePayload(ResponseCode responseCode, ByteBuffer buffer) {
    return switch (responseCode) {
      case REGISTERED -> new ResponseBody.Registered(ClientId.read(buffer));
      case CLIENT_LIST -> {
        if (buffer.remaining() % CLIENT_LIST_ENTRY_SIZE != 0) {
          throw new IllegalArgumentException("client list of " + buffer.remaining() + " bytes is not a whole number of entries");
        }
        final List<ResponseBody.ClientListEntry> entries = new ArrayList<>();
        while (buffer.hasRemaining()) {
          final ClientId id = ClientId.read(buffer);
          final byte[] name = new byte[NAME_FIELD_SIZE];
          buffer.get(name);
          entries.add(new ResponseBody.ClientListEntry(id, decodeName(name)));
        }
        yield new ResponseBody.ClientList(entries);
      }
      case PUBLIC_KEY -> {
        final ClientId id = ClientId.read(buffer);
        final byte[] key = new byte[PUBLIC_KEY_SIZE];
        buffer.get(key);
        yield new ResponseBody.PublicKey(id, key);
      }
      case MESSAGE_SENT -> new ResponseBody.MessageSent(ClientId.read(buffer), Integer.toUnsignedLong(buffer.getInt()));
      case PENDING_MESSAGES -> {
        final List<ResponseBody.PendingMessage> messages = new ArrayList<>();
        while (buffer.hasRemaining()) {
          final ClientId sender = ClientId.read(buffer);
          final long messageId = Integer.toUnsignedLong(buffer.getInt());
          final byte type = buffer.get();
          final byte[] content = new byte[buffer.getInt()];
          buffer.get(content);
          messages.add(new ResponseBody.PendingMessage(sender, messageId, type, content));
        }
        yield new ResponseBody.PendingMessages(messages);
      }
      case GENERIC_ERROR, NAME_TAKEN, UNKNOWN_CLIENT, MALFORMED_REQUEST -> new ResponseBody.Error(responseCode);
    };
  }
}
