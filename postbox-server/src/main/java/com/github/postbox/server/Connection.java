// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.server;

import com.github.postbox.wire.MalformedFrameException;
import com.github.postbox.wire.Request;
import com.github.postbox.wire.RequestHeader;
import com.github.postbox.wire.WireCodec;
import com.github.postbox.wire.WireProtocol;

import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;

/// One client socket and the bytes in flight on it. Only the selector thread touches a connection apart from
/// reading [#request()] once it is handed to the dispatch pool.
///
/// The payload buffer starts small and doubles as bytes arrive, so memory follows what the peer has actually sent
/// rather than the size its header claims.
final class Connection {

  static final int INITIAL_PAYLOAD_CAPACITY = 4096;

  private final SocketChannel channel;
  private final SelectionKey key;
  private final SocketAddress remote;
  private final ByteBuffer header = ByteBuffer.allocate(WireProtocol.REQUEST_HEADER_SIZE).order(WireProtocol.BYTE_ORDER);

  private ParseState state = ParseState.AWAITING_HEADER;
  private ByteBuffer payload;
  private RequestHeader requestHeader;
  private Request request;
  private ByteBuffer outbound;
  private long lastActivityNanos;

  Connection(SocketChannel channel, SelectionKey key, SocketAddress remote, long nowNanos) {
    this.channel = channel;
    this.key = key;
    this.remote = remote;
    this.lastActivityNanos = nowNanos;
  }

  /// Moves the received bytes into the frame being assembled, decoding the header and then the payload as each
  /// completes. Bytes beyond the first complete frame are left in `received` and ignored by the caller.
  ///
  /// @return true once a whole request has been decoded.
  /// @throws MalformedFrameException if the header or payload does not decode.
  boolean receive(ByteBuffer received, WireCodec codec) {
    while (true) {
      if (state == ParseState.AWAITING_HEADER && !header.hasRemaining()) {
        header.flip();
        requestHeader = codec.decodeHeader(header);
        payload = ByteBuffer.allocate(Math.min(requestHeader.payloadSize(), INITIAL_PAYLOAD_CAPACITY))
            .order(WireProtocol.BYTE_ORDER);
        state = ParseState.AWAITING_PAYLOAD;
      }
      if (state == ParseState.AWAITING_PAYLOAD && payload.position() == requestHeader.payloadSize()) {
        payload.flip();
        request = new Request(requestHeader, codec.decodePayload(requestHeader.code(), payload));
        payload = null;
        state = ParseState.READY_TO_DISPATCH;
        return true;
      }
      if (!received.hasRemaining()) {
        return false;
      }
      final ByteBuffer target = state == ParseState.AWAITING_HEADER ? header : payloadWithRoom(received.remaining());
      final int count = Math.min(target.remaining(), received.remaining());
      final int limit = received.limit();
      received.limit(received.position() + count);
      target.put(received);
      received.limit(limit);
    }
  }

  private ByteBuffer payloadWithRoom(int arriving) {
    if (payload.hasRemaining()) {
      return payload;
    }
    final long wanted = Math.max(2L * payload.capacity(), (long) payload.position() + arriving);
    final ByteBuffer grown = ByteBuffer.allocate((int) Math.min(requestHeader.payloadSize(), wanted))
        .order(WireProtocol.BYTE_ORDER);
    payload.flip();
    grown.put(payload);
    payload = grown;
    return payload;
  }

  /// Bytes reserved for the payload being assembled, zero when none is.
  int payloadCapacity() {
    return payload == null ? 0 : payload.capacity();
  }

  void dispatching() {
    state = ParseState.DISPATCHING;
  }

  void respond(ByteBuffer encoded) {
    outbound = encoded;
    state = ParseState.AWAITING_WRITE;
  }

  void closed() {
    state = ParseState.CLOSED;
    payload = null;
    outbound = null;
  }

  boolean isReading() {
    return state == ParseState.AWAITING_HEADER || state == ParseState.AWAITING_PAYLOAD;
  }

  void touch(long nowNanos) {
    lastActivityNanos = nowNanos;
  }

  boolean idleSince(long nowNanos, long timeoutNanos) {
    return state != ParseState.DISPATCHING && nowNanos - lastActivityNanos > timeoutNanos;
  }

  SocketChannel channel() {
    return channel;
  }

  SelectionKey key() {
    return key;
  }

  SocketAddress remote() {
    return remote;
  }

  ParseState state() {
    return state;
  }

  Request request() {
    return request;
  }

  ByteBuffer outbound() {
    return outbound;
  }

  @Override
  public String toString() {
    return "Connection[" + remote + ", " + state + "]";
  }
}
