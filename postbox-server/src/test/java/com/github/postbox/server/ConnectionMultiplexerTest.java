// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.server;

import com.github.postbox.Client;
import com.github.postbox.ClientId;
import com.github.postbox.MailboxStore;
import com.github.postbox.Message;
import com.github.postbox.MessageType;
import com.github.postbox.store.MVStoreMailbox;
import com.github.postbox.wire.RequestBody;
import com.github.postbox.wire.ResponseBody;
import com.github.postbox.wire.ResponseCode;
import com.github.postbox.wire.WireCodec;
import com.github.postbox.wire.WireProtocol;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.function.ToLongFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConnectionMultiplexerTest {

  static final ServerConfig CONFIG = ServerConfig.defaults()
      .withPort(0)
      .withDatabase(ServerConfig.IN_MEMORY);

  final List<AutoCloseable> resources = new ArrayList<>();

  @AfterEach
  void tearDown() throws Exception {
    for (int i = resources.size() - 1; i >= 0; i--) {
      resources.get(i).close();
    }
  }

  ConnectionMultiplexer start(ServerConfig config) throws IOException {
    final MVStoreMailbox store = MVStoreMailbox.inMemory();
    resources.add(store);
    final ConnectionMultiplexer multiplexer = new ConnectionMultiplexer(config, store);
    resources.add(multiplexer);
    multiplexer.start();
    return multiplexer;
  }

  static byte[] text(String s) {
    return s.getBytes(StandardCharsets.US_ASCII);
  }

  static byte[] header(ClientId id, int version, int code, long payloadSize) {
    final ByteBuffer buffer = ByteBuffer.allocate(WireProtocol.REQUEST_HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
    id.write(buffer);
    buffer.put((byte) version);
    buffer.putShort((short) code);
    buffer.putInt((int) payloadSize);
    return buffer.array();
  }

  void aliceAndBobExchangeMessages(int port) throws IOException {
    final TestClient alice = new TestClient(port);
    final TestClient bob = new TestClient(port);
    final ClientId aliceId = alice.register("alice");
    final ClientId bobId = bob.register("bob");
    assertThat(aliceId).isNotEqualTo(bobId);

    assertThat(alice.clientList()).containsExactly(new ResponseBody.ClientListEntry(bobId, "bob"));

    final TestClient.Reply key = alice.send(new RequestBody.PublicKey(bobId));
    assertThat(key.body()).isEqualTo(new ResponseBody.PublicKey(bobId, TestClient.key("bob")));

    final long keyRequest = alice.sendMessage(bobId, MessageType.SYMMETRIC_KEY_REQUEST.code(), new byte[0]);
    final long hello = alice.sendMessage(bobId, MessageType.TEXT.code(), text("hello bob"));
    assertThat(hello).isGreaterThan(keyRequest);

    assertThat(bob.pendingMessages()).containsExactly(
        new ResponseBody.PendingMessage(aliceId, keyRequest, MessageType.SYMMETRIC_KEY_REQUEST.code(), new byte[0]),
        new ResponseBody.PendingMessage(aliceId, hello, MessageType.TEXT.code(), text("hello bob")));
    assertThat(bob.pendingMessages()).isEmpty();
    assertThat(alice.pendingMessages()).isEmpty();
  }

  @Test
  public void aliceAndBobExchangeMessagesOnTheSelectorThread() throws IOException {
    aliceAndBobExchangeMessages(start(CONFIG).port());
  }

  @Test
  public void aliceAndBobExchangeMessagesOnTheDispatchPool() throws IOException {
    aliceAndBobExchangeMessages(start(CONFIG.withDispatchThreads(2)).port());
  }

  @Test
  public void duplicateRegistrationGetsNameTaken() throws IOException {
    final int port = start(CONFIG).port();
    new TestClient(port).register("alice");

    final TestClient.Reply reply = new TestClient(port).send(new RequestBody.Register("alice", TestClient.key("x")));

    assertThat(reply.code()).isEqualTo(ResponseCode.NAME_TAKEN.code());
    assertThat(reply.header().payloadSize()).isZero();
  }

  @Test
  public void legacyModeReportsEveryErrorAsGeneric() throws IOException {
    final int port = start(CONFIG.withCollapseErrorCodes(true)).port();
    new TestClient(port).register("alice");

    assertThat(new TestClient(port).send(new RequestBody.Register("alice", TestClient.key("x"))).code())
        .isEqualTo(ResponseCode.GENERIC_ERROR.code());
    assertThat(new TestClient(port).exchange(header(ClientId.UNREGISTERED, 2, 777, 0)).code())
        .isEqualTo(ResponseCode.GENERIC_ERROR.code());
  }

  @Test
  public void sendToUnknownClientGetsUnknownClient() throws IOException {
    final int port = start(CONFIG).port();
    final TestClient alice = new TestClient(port);
    alice.register("alice");

    final TestClient.Reply reply = alice.send(new RequestBody.SendMessage(ClientId.random(), (byte) 3, text("lost")));

    assertThat(reply.code()).isEqualTo(ResponseCode.UNKNOWN_CLIENT.code());
  }

  @Test
  public void unknownRequestCodeIsRejectedAndServerKeepsAccepting() throws IOException {
    final int port = start(CONFIG).port();

    final TestClient.Reply reply = new TestClient(port).exchange(header(ClientId.UNREGISTERED, 2, 700, 0));

    assertThat(reply.code()).isEqualTo(ResponseCode.MALFORMED_REQUEST.code());
    assertThat(reply.header().version()).isEqualTo(WireProtocol.SERVER_VERSION);
    assertThat(new TestClient(port).register("alice")).isNotEqualTo(ClientId.UNREGISTERED);
  }

  @Test
  public void unsupportedVersionIsRejected() throws IOException {
    final int port = start(CONFIG).port();
    assertThat(new TestClient(port).exchange(header(ClientId.UNREGISTERED, 9, 601, 0)).code())
        .isEqualTo(ResponseCode.MALFORMED_REQUEST.code());
  }

  @Test
  public void oversizedPayloadIsRejectedFromTheHeaderAlone() throws IOException {
    final int port = start(CONFIG.withMaxPayloadSize(1024)).port();

    final TestClient.Reply reply = new TestClient(port).exchange(header(ClientId.UNREGISTERED, 2, 603, 1025));

    assertThat(reply.code()).isEqualTo(ResponseCode.MALFORMED_REQUEST.code());
    assertThat(new TestClient(port).register("alice")).isNotEqualTo(ClientId.UNREGISTERED);
  }

  @Test
  public void malformedPayloadIsRejected() throws IOException {
    final int port = start(CONFIG).port();
    final ByteBuffer frame = ByteBuffer.allocate(WireProtocol.REQUEST_HEADER_SIZE + 3);
    frame.put(header(ClientId.UNREGISTERED, 2, 601, 3));

    final TestClient.Reply reply = new TestClient(port).exchange(frame.array());

    assertThat(reply.code()).isEqualTo(ResponseCode.MALFORMED_REQUEST.code());
  }

  @Test
  public void frameDeliveredOneByteAtATimeIsStillAnswered() throws Exception {
    final int port = start(CONFIG).port();
    final byte[] frame = TestClient.bytes(WireCodec.encodeRequest(ClientId.UNREGISTERED, 2,
        new RequestBody.Register("slowpoke", TestClient.key("slowpoke"))));

    try (Socket socket = new TestClient(port).connect()) {
      final OutputStream out = socket.getOutputStream();
      for (byte b : frame) {
        out.write(b);
        out.flush();
        if (b % 16 == 0) {
          Thread.sleep(1);
        }
      }
      final TestClient.Reply reply = TestClient.readReply(socket.getInputStream());
      assertThat(reply.code()).isEqualTo(ResponseCode.REGISTERED.code());
    }
  }

  @Test
  public void bytesAfterTheFirstFrameAreIgnored() throws IOException {
    final int port = start(CONFIG).port();
    final byte[] frame = TestClient.bytes(WireCodec.encodeRequest(ClientId.UNREGISTERED, 2,
        new RequestBody.Register("alice", TestClient.key("alice"))));
    final byte[] withTrailer = new byte[frame.length + 4];
    System.arraycopy(frame, 0, withTrailer, 0, frame.length);

    assertThat(new TestClient(port).exchange(withTrailer).code()).isEqualTo(ResponseCode.REGISTERED.code());
  }

  @Test
  public void idleConnectionIsClosedWithoutAResponse() throws IOException {
    final int port = start(CONFIG.withIdleTimeout(Duration.ofMillis(300))).port();

    try (Socket socket = new TestClient(port).connect()) {
      socket.getOutputStream().write(new byte[5]);
      socket.getOutputStream().flush();
      final long started = System.nanoTime();
      final InputStream in = socket.getInputStream();

      assertThat(in.read()).isEqualTo(-1);
      assertThat(Duration.ofNanos(System.nanoTime() - started)).isGreaterThanOrEqualTo(Duration.ofMillis(200));
    }
    assertThat(new TestClient(port).register("alice")).isNotEqualTo(ClientId.UNREGISTERED);
  }

  @Test
  public void clientHangingUpEarlyDoesNotDisturbOthers() throws IOException {
    final int port = start(CONFIG).port();
    try (Socket socket = new TestClient(port).connect()) {
      socket.getOutputStream().write(header(ClientId.UNREGISTERED, 2, 600, WireProtocol.REGISTER_PAYLOAD_SIZE));
    }
    assertThat(new TestClient(port).register("alice")).isNotEqualTo(ClientId.UNREGISTERED);
  }

  @Test
  public void headersClaimingHugePayloadsDoNotReserveMemory() throws IOException {
    final int port = start(CONFIG).port();
    final List<Socket> claimants = new ArrayList<>();
    try {
      for (int i = 0; i < 40; i++) {
        final Socket socket = new TestClient(port).connect();
        claimants.add(socket);
        socket.getOutputStream().write(header(ClientId.UNREGISTERED, 2, 603, WireProtocol.DEFAULT_MAX_PAYLOAD_SIZE));
        socket.getOutputStream().flush();
      }
      assertThat(new TestClient(port).register("after")).isNotEqualTo(ClientId.UNREGISTERED);
    } finally {
      for (Socket socket : claimants) {
        socket.close();
      }
    }
  }

  @Test
  public void manyConcurrentSendersAllReachTheMailbox() throws Exception {
    final int port = start(CONFIG.withDispatchThreads(4)).port();
    final TestClient bob = new TestClient(port);
    final ClientId bobId = bob.register("bob");
    final int senders = 20;

    final ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      final List<Future<Long>> sent = new ArrayList<>();
      for (int i = 0; i < senders; i++) {
        final String name = "sender" + i;
        sent.add(executor.submit(() -> {
          final TestClient sender = new TestClient(port);
          sender.register(name);
          return sender.sendMessage(bobId, MessageType.TEXT.code(), text(name));
        }));
      }
      final List<Long> ids = new ArrayList<>();
      for (Future<Long> future : sent) {
        ids.add(future.get(30, TimeUnit.SECONDS));
      }

      final List<ResponseBody.PendingMessage> pending = bob.pendingMessages();
      assertThat(pending).extracting(ResponseBody.PendingMessage::messageId).containsExactlyInAnyOrderElementsOf(ids);
      assertThat(pending).extracting(ResponseBody.PendingMessage::messageId).isSorted();
    } finally {
      executor.shutdownNow();
    }
  }

  /// A close may arrive as end of stream or, when the server had unread bytes, as a reset.
  static boolean closedByServer(Socket socket) {
    try {
      return socket.getInputStream().read() == -1;
    } catch (IOException e) {
      return true;
    }
  }

  @Test
  public void shutdownStopsAcceptingWithinTheGracePeriod() throws Exception {
    final ConnectionMultiplexer multiplexer = start(CONFIG);
    final int port = multiplexer.port();
    new TestClient(port).register("alice");

    // a connection that never completes its frame
    try (Socket stalled = new TestClient(port).connect()) {
      stalled.getOutputStream().write(new byte[3]);
      final long started = System.nanoTime();

      multiplexer.shutdown();

      assertThat(multiplexer.awaitTermination(Duration.ofSeconds(5))).isTrue();
      assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(CONFIG.shutdownGrace().plusSeconds(1));
      assertThat(closedByServer(stalled)).isTrue();
    }
    assertThatThrownBy(() -> new Socket(InetAddress.getLoopbackAddress(), port).close())
        .isInstanceOf(IOException.class);
  }

  @Test
  public void shutdownLetsARunningHandlerSendItsResponse() throws Exception {
    final MVStoreMailbox mailbox = MVStoreMailbox.inMemory();
    resources.add(mailbox);
    final HeldRegistrationStore store = new HeldRegistrationStore(mailbox);
    final ServerConfig config = new ServerConfig(0, ServerConfig.IN_MEMORY, WireProtocol.DEFAULT_MAX_PAYLOAD_SIZE,
        Duration.ofSeconds(30), Duration.ofSeconds(10), 1, false, ServerConfig.DEFAULT_BACKLOG);
    final ConnectionMultiplexer multiplexer = new ConnectionMultiplexer(config, store);
    resources.add(multiplexer);
    multiplexer.start();
    final int port = multiplexer.port();

    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<TestClient.Reply> reply = executor.submit(() -> new TestClient(port)
          .send(new RequestBody.Register("alice", TestClient.key("alice"))));
      assertThat(store.entered.await(5, TimeUnit.SECONDS)).isTrue();

      multiplexer.shutdown();
      awaitRefused(port);
      store.release.countDown();

      assertThat(reply.get(5, TimeUnit.SECONDS).code()).isEqualTo(ResponseCode.REGISTERED.code());
      assertThat(multiplexer.awaitTermination(Duration.ofSeconds(5))).isTrue();
      assertThat(mailbox.clientCount()).isEqualTo(1);
    } finally {
      store.release.countDown();
      executor.shutdownNow();
    }
  }

  @Test
  public void responseTooLargeToEncodeBecomesGenericErrorAndServerCarriesOn() throws IOException {
    final MVStoreMailbox mailbox = MVStoreMailbox.inMemory();
    resources.add(mailbox);
    // the same 1 MiB message 2100 times is more than one frame can carry
    final Message big = new Message(1L, ClientId.random(), ClientId.random(), (byte) 3, new byte[1024 * 1024],
        Instant.EPOCH);
    final MailboxStore store = new DelegatingStore(mailbox) {
      @Override
      public List<Message> drainMessages(ClientId recipient, long budget, ToLongFunction<Message> sizer) {
        return Collections.nCopies(2100, big);
      }
    };
    final ConnectionMultiplexer multiplexer = new ConnectionMultiplexer(CONFIG, store);
    resources.add(multiplexer);
    multiplexer.start();
    final int port = multiplexer.port();

    final TestClient.Reply reply = new TestClient(port).send(RequestBody.PendingMessages.INSTANCE);

    assertThat(reply.code()).isEqualTo(ResponseCode.GENERIC_ERROR.code());
    assertThat(new TestClient(port).register("alice")).isNotEqualTo(ClientId.UNREGISTERED);
  }

  static void awaitRefused(int port) throws InterruptedException {
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (System.nanoTime() < deadline) {
      try (Socket ignored = new Socket(InetAddress.getLoopbackAddress(), port)) {
        Thread.sleep(20);
      } catch (IOException e) {
        return;
      }
    }
    throw new AssertionError("server still accepting on " + port);
  }

  static class DelegatingStore implements MailboxStore {
    final MailboxStore delegate;

    DelegatingStore(MailboxStore delegate) {
      this.delegate = delegate;
    }

    @Override
    public Client createClient(String name, byte[] publicKey) {
      return delegate.createClient(name, publicKey);
    }

    @Override
    public Client getClient(ClientId id) {
      return delegate.getClient(id);
    }

    @Override
    public List<Client> listClients(ClientId excluding) {
      return delegate.listClients(excluding);
    }

    @Override
    public void touch(ClientId id) {
      delegate.touch(id);
    }

    @Override
    public long enqueueMessage(ClientId recipient, ClientId sender, byte type, byte[] content) {
      return delegate.enqueueMessage(recipient, sender, type, content);
    }

    @Override
    public List<Message> drainMessages(ClientId recipient, long budget, ToLongFunction<Message> sizer) {
      return delegate.drainMessages(recipient, budget, sizer);
    }

    @Override
    public int clientCount() {
      return delegate.clientCount();
    }

    @Override
    public <T> T transaction(Supplier<T> work) {
      return delegate.transaction(work);
    }

    @Override
    public void close() {
      delegate.close();
    }
  }

  /// Holds every registration until released.
  static class HeldRegistrationStore extends DelegatingStore {
    final CountDownLatch entered = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);

    HeldRegistrationStore(MailboxStore delegate) {
      super(delegate);
    }

    @Override
    public Client createClient(String name, byte[] publicKey) {
      entered.countDown();
      try {
        if (!release.await(10, TimeUnit.SECONDS)) {
          throw new IllegalStateException("registration never released");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException(e);
      }
      return super.createClient(name, publicKey);
    }
  }
}
