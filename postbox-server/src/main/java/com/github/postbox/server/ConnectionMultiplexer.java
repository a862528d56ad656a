// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.server;

import com.github.postbox.ErrorKind;
import com.github.postbox.MailboxStore;
import com.github.postbox.RequestDispatcher;
import com.github.postbox.ResponseBuilder;
import com.github.postbox.wire.MalformedFrameException;
import com.github.postbox.wire.Request;
import com.github.postbox.wire.Response;
import com.github.postbox.wire.WireCodec;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// ## Connection Multiplexer
///
/// Serves every client socket from a single selector thread. Each connection carries exactly one exchange: the
/// client writes one request frame, the server writes one response frame and closes the socket.
///
/// The loop waits in a bounded `select` and after each wake-up it:
///
/// 1. runs tasks queued by other threads, which are the results of handlers run on the dispatch pool,
/// 2. services ready keys by accepting, reading or writing,
/// 3. closes connections that have made no progress within the idle timeout.
///
/// Requests are handled inline on the loop unless `dispatchThreads` is set. Then they run on a bounded pool and the
/// result is handed back through the task queue so that only the loop thread touches channels and keys.
///
/// On shutdown the listening socket is closed at once. Connections with a response pending, or a handler still
/// running, get the grace period to finish; everything else is closed straight away.
public class ConnectionMultiplexer implements Runnable, AutoCloseable {

  private static final Logger LOGGER = Logger.getLogger(ConnectionMultiplexer.class.getName());

  static final long SELECT_TIMEOUT_MS = 100;
  static final int READ_BUFFER_SIZE = 64 * 1024;
  static final int DISPATCH_QUEUE_SIZE = 1000;

  private final ServerConfig config;
  private final WireCodec codec;
  private final RequestDispatcher dispatcher;
  private final ResponseBuilder responses;

  private final ServerSocketChannel serverChannel;
  private final Selector selector;
  private final int port;
  private final ThreadPoolExecutor dispatchPool;

  // loop thread only
  private final Set<Connection> connections = new HashSet<>();
  private final ByteBuffer readBuffer = ByteBuffer.allocateDirect(READ_BUFFER_SIZE);

  private final ConcurrentLinkedQueue<Runnable> pendingTasks = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean started = new AtomicBoolean();
  private final CountDownLatch terminated = new CountDownLatch(1);
  private volatile boolean shutdownRequested;

  /// Binds the listening socket.
  ///
  /// @throws IOException if the port cannot be bound. This is fatal to the server.
  public ConnectionMultiplexer(ServerConfig config, MailboxStore store) throws IOException {
    this.config = config;
    this.codec = new WireCodec(config.maxPayloadSize());
    this.dispatcher = new RequestDispatcher(store, config.maxPayloadSize());
    this.responses = new ResponseBuilder(config.collapseErrorCodes());

    this.serverChannel = ServerSocketChannel.open();
    try {
      serverChannel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
      serverChannel.bind(new InetSocketAddress(config.port()), config.backlog());
      serverChannel.configureBlocking(false);
      this.selector = Selector.open();
      serverChannel.register(selector, SelectionKey.OP_ACCEPT);
    } catch (IOException e) {
      serverChannel.close();
      throw e;
    }
    this.port = ((InetSocketAddress) serverChannel.getLocalAddress()).getPort();
    this.dispatchPool = config.dispatchThreads() > 0 ? dispatchPool(config.dispatchThreads()) : null;
  }

  private static ThreadPoolExecutor dispatchPool(int threads) {
    final AtomicInteger counter = new AtomicInteger();
    return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(DISPATCH_QUEUE_SIZE),
        runnable -> {
          final Thread thread = new Thread(runnable, "postbox-dispatch-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }

  /// The port actually bound. Differs from the configured port when that was zero.
  public int port() {
    return port;
  }

  /// Runs the loop on its own platform thread.
  public void start() {
    markStarted();
    final Thread thread = new Thread(this::loop, "postbox-selector");
    thread.start();
  }

  /// Runs the loop on the calling thread until shutdown.
  @Override
  public void run() {
    markStarted();
    loop();
  }

  private void markStarted() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("multiplexer already started");
    }
  }

  private void loop() {
    LOGGER.info(() -> "Listening on port " + port
        + (dispatchPool == null ? "" : " with " + config.dispatchThreads() + " dispatch threads"));
    try {
      while (!shutdownRequested) {
        selector.select(SELECT_TIMEOUT_MS);
        runPendingTasks();
        processSelectedKeys();
        closeIdleConnections(System.nanoTime());
      }
      drain();
    } catch (IOException | ClosedSelectorException e) {
      LOGGER.log(Level.SEVERE, "Selector loop failed", e);
    } finally {
      closeAll();
      terminated.countDown();
      LOGGER.info("Stopped");
    }
  }

  /// Asks the loop to stop. Safe to call from any thread, more than once.
  public void shutdown() {
    if (!shutdownRequested) {
      LOGGER.fine("Shutdown requested");
    }
    shutdownRequested = true;
    selector.wakeup();
  }

  /// @return false if the loop is still running after the timeout.
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /// Shuts down and waits for the loop to exit. A multiplexer that was never started just releases its socket.
  @Override
  public void close() {
    shutdown();
    if (started.get()) {
      try {
        if (!awaitTermination(config.shutdownGrace().plusSeconds(5))) {
          LOGGER.warning("Selector loop did not stop in time");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    } else if (terminated.getCount() > 0) {
      closeAll();
      terminated.countDown();
    }
  }

  private void runOnLoop(Runnable task) {
    pendingTasks.offer(task);
    selector.wakeup();
  }

  private void runPendingTasks() {
    Runnable task;
    while ((task = pendingTasks.poll()) != null) {
      try {
        task.run();
      } catch (RuntimeException e) {
        LOGGER.log(Level.SEVERE, "Task failed on selector thread", e);
      }
    }
  }

  private void processSelectedKeys() {
    final Iterator<SelectionKey> selectedKeys = selector.selectedKeys().iterator();
    while (selectedKeys.hasNext()) {
      final SelectionKey key = selectedKeys.next();
      selectedKeys.remove();
      if (!key.isValid()) {
        continue;
      }
      try {
        if (key.isAcceptable()) {
          accept();
        } else {
          final Connection connection = (Connection) key.attachment();
          if (key.isReadable()) {
            onReadable(connection);
          }
          if (key.isValid() && key.isWritable()) {
            onWritable(connection);
          }
        }
      } catch (CancelledKeyException e) {
        if (key.attachment() instanceof Connection connection) {
          close(connection);
        }
      } catch (RuntimeException e) {
        if (key.attachment() instanceof Connection connection) {
          LOGGER.log(Level.SEVERE, "Closing " + connection + " after unexpected failure", e);
          close(connection);
        } else {
          LOGGER.log(Level.SEVERE, "Unexpected failure accepting connections", e);
        }
      }
    }
  }

  private void accept() {
    while (!shutdownRequested) {
      final SocketChannel channel;
      try {
        channel = serverChannel.accept();
      } catch (IOException e) {
        LOGGER.warning(() -> "Accept failed: " + e.getMessage());
        return;
      }
      if (channel == null) {
        return;
      }
      try {
        channel.configureBlocking(false);
        final SocketAddress remote = channel.getRemoteAddress();
        final SelectionKey key = channel.register(selector, SelectionKey.OP_READ);
        final Connection connection = new Connection(channel, key, remote, System.nanoTime());
        key.attach(connection);
        connections.add(connection);
        LOGGER.finer(() -> "Accepted " + remote);
      } catch (IOException e) {
        LOGGER.fine(() -> "Failed to register accepted connection: " + e.getMessage());
        closeQuietly(channel);
      }
    }
  }

  private void onReadable(Connection connection) {
    final int read;
    try {
      readBuffer.clear();
      read = connection.channel().read(readBuffer);
    } catch (IOException e) {
      LOGGER.fine(() -> "Read failed on " + connection + ": " + e.getMessage());
      close(connection);
      return;
    }
    if (read < 0) {
      LOGGER.finer(() -> "Peer closed " + connection);
      close(connection);
      return;
    }
    if (read == 0 || !connection.isReading()) {
      return;
    }
    connection.touch(System.nanoTime());
    readBuffer.flip();
    try {
      if (connection.receive(readBuffer, codec)) {
        dispatch(connection);
      }
    } catch (MalformedFrameException e) {
      respond(connection, responses.malformed(e));
    }
  }

  private void dispatch(Connection connection) {
    final Request request = connection.request();
    if (dispatchPool == null) {
      respond(connection, responses.build(dispatcher.dispatch(request)));
      return;
    }
    connection.dispatching();
    connection.key().interestOps(0);
    try {
      dispatchPool.execute(() -> {
        final Response response = responses.build(dispatcher.dispatch(request));
        runOnLoop(() -> respond(connection, response));
      });
    } catch (RejectedExecutionException e) {
      LOGGER.warning(() -> "Dispatch pool is full, rejecting " + request.header().code() + " from " + connection);
      respond(connection, responses.error(ErrorKind.GENERIC));
    }
  }

  private void respond(Connection connection, Response response) {
    if (connection.state() == ParseState.CLOSED) {
      return;
    }
    ByteBuffer encoded;
    try {
      encoded = codec.encode(response);
    } catch (RuntimeException e) {
      LOGGER.log(Level.SEVERE, "Could not encode " + response.code() + " for " + connection.remote(), e);
      encoded = codec.encode(responses.error(ErrorKind.GENERIC));
    }
    connection.respond(encoded);
    connection.touch(System.nanoTime());
    connection.key().interestOps(SelectionKey.OP_WRITE);
    LOGGER.fine(() -> "Responding " + response.code() + " to " + connection.remote());
  }

  private void onWritable(Connection connection) {
    if (connection.state() != ParseState.AWAITING_WRITE) {
      return;
    }
    final ByteBuffer outbound = connection.outbound();
    try {
      final int written = connection.channel().write(outbound);
      if (written > 0) {
        connection.touch(System.nanoTime());
      }
    } catch (IOException e) {
      LOGGER.fine(() -> "Write failed on " + connection + ": " + e.getMessage());
      close(connection);
      return;
    }
    if (!outbound.hasRemaining()) {
      LOGGER.finer(() -> "Completed " + connection);
      close(connection);
    }
  }

  private void closeIdleConnections(long nowNanos) {
    final long timeoutNanos = config.idleTimeout().toNanos();
    final List<Connection> idle = connections.stream()
        .filter(c -> c.idleSince(nowNanos, timeoutNanos))
        .collect(Collectors.toList());
    for (Connection connection : idle) {
      LOGGER.fine(() -> "Closing idle " + connection);
      close(connection);
    }
  }

  /// Runs on the loop thread once shutdown is requested.
  private void drain() throws IOException {
    LOGGER.info("Shutting down, no longer accepting connections");
    closeQuietly(serverChannel);
    final long deadline = System.nanoTime() + config.shutdownGrace().toNanos();
    closeUnfinished();
    while (!connections.isEmpty()) {
      final long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
      if (remainingMs <= 0) {
        LOGGER.warning(() -> "Grace period elapsed with " + connections.size() + " connections still open");
        break;
      }
      selector.select(Math.min(remainingMs, SELECT_TIMEOUT_MS));
      runPendingTasks();
      processSelectedKeys();
      closeUnfinished();
    }
  }

  /// Closes connections that have neither a response pending nor a handler running.
  private void closeUnfinished() {
    final List<Connection> unfinished = connections.stream()
        .filter(c -> c.state() != ParseState.AWAITING_WRITE && c.state() != ParseState.DISPATCHING)
        .collect(Collectors.toList());
    unfinished.forEach(this::close);
  }

  private void close(Connection connection) {
    if (connection.state() == ParseState.CLOSED) {
      return;
    }
    connection.closed();
    connection.key().cancel();
    closeQuietly(connection.channel());
    connections.remove(connection);
  }

  private void closeAll() {
    new ArrayList<>(connections).forEach(this::close);
    closeQuietly(serverChannel);
    try {
      selector.close();
    } catch (IOException e) {
      LOGGER.fine(() -> "Error closing selector: " + e.getMessage());
    }
    if (dispatchPool != null) {
      dispatchPool.shutdown();
      try {
        if (!dispatchPool.awaitTermination(config.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
          dispatchPool.shutdownNow();
        }
      } catch (InterruptedException e) {
        dispatchPool.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  private static void closeQuietly(java.nio.channels.Channel channel) {
    try {
      channel.close();
    } catch (IOException e) {
      LOGGER.fine(() -> "Error closing channel: " + e.getMessage());
    }
  }

  /// Number of open client connections. Only meaningful on the loop thread or after it has stopped.
  int connectionCount() {
    return connections.size();
  }
}
