// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.server;

import com.github.postbox.MailboxStore;
import com.github.postbox.store.MVStoreMailbox;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/// The postbox server: an MVStore backed mailbox behind a [ConnectionMultiplexer].
///
/// Typing `q` on the console, or stopping the JVM, shuts the server down gracefully.
public class PostboxServer implements AutoCloseable {

  static {
    LoggerConfig.initialize();
  }

  private static final Logger LOGGER = Logger.getLogger(PostboxServer.class.getName());

  private final MailboxStore store;
  private final ConnectionMultiplexer multiplexer;

  /// Opens the store and binds the port.
  ///
  /// @throws IOException if the port cannot be bound. The store is closed again before this is thrown.
  public PostboxServer(ServerConfig config) throws IOException {
    this.store = config.inMemory() ? MVStoreMailbox.inMemory() : MVStoreMailbox.open(Path.of(config.database()));
    try {
      this.multiplexer = new ConnectionMultiplexer(config, store);
    } catch (IOException | RuntimeException e) {
      store.close();
      throw e;
    }
    LOGGER.info(() -> "Mailbox store " + config.database() + " has " + store.clientCount() + " registered clients");
  }

  public int port() {
    return multiplexer.port();
  }

  public void start() {
    multiplexer.start();
  }

  public void shutdown() {
    multiplexer.shutdown();
  }

  /// Blocks until the selector loop has exited.
  public void awaitTermination() throws InterruptedException {
    while (!multiplexer.awaitTermination(Duration.ofSeconds(1))) {
      LOGGER.finest("Waiting for selector loop to stop");
    }
  }

  /// Stops the loop then closes the store so that any transaction in flight completes first.
  @Override
  public void close() {
    multiplexer.close();
    store.close();
  }

  /// Watches the console for a line reading `q`. End of input just stops watching.
  static Thread consoleListener(InputStream in, Runnable onQuit) {
    final Thread thread = new Thread(() -> {
      try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
        String line;
        while ((line = reader.readLine()) != null) {
          if ("q".equalsIgnoreCase(line.trim())) {
            LOGGER.info("Quit requested from console");
            onQuit.run();
            return;
          }
        }
      } catch (IOException e) {
        LOGGER.fine(() -> "Console listener stopped: " + e.getMessage());
      }
    }, "postbox-console");
    thread.setDaemon(true);
    return thread;
  }

  public static void main(String[] args) {
    final CommandLineParser parser = new CommandLineParser().parse(args);
    if (parser.hasOption("help") || parser.hasOption("h")) {
      System.out.println(ServerConfig.help());
      return;
    }

    final ServerConfig config;
    try {
      config = ServerConfig.from(parser);
    } catch (IllegalArgumentException | ArithmeticException e) {
      System.err.println("Invalid options: " + e.getMessage());
      System.err.println(ServerConfig.help());
      System.exit(2);
      return;
    }

    final PostboxServer server;
    try {
      server = new PostboxServer(config);
    } catch (IOException e) {
      LOGGER.log(Level.SEVERE, "Could not listen on port " + config.port(), e);
      System.exit(1);
      return;
    } catch (RuntimeException e) {
      LOGGER.log(Level.SEVERE, "Could not open mailbox store " + config.database(), e);
      System.exit(1);
      return;
    }

    Runtime.getRuntime().addShutdownHook(new Thread(server::close, "postbox-shutdown"));
    consoleListener(System.in, server::shutdown).start();
    server.start();
    try {
      server.awaitTermination();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    server.close();
  }
}
