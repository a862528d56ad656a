// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.server;

import com.github.postbox.wire.WireProtocol;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// The immutable server settings. Built once at startup and passed by reference to the parts that need them.
///
/// @param port               The TCP port to listen on. Zero picks a free port.
/// @param database           The MVStore file, or [#IN_MEMORY] for a store that is lost on exit.
/// @param maxPayloadSize     The largest request payload accepted. Larger declared sizes are rejected from the header.
/// @param idleTimeout        Connections that make no progress for this long are closed without a response.
/// @param shutdownGrace      How long shutdown waits for queued responses to flush.
/// @param dispatchThreads    Zero handles requests on the selector thread, otherwise the size of the handler pool.
/// @param collapseErrorCodes Report every error as the generic error code for clients that know no other.
/// @param backlog            The listen backlog.
public record ServerConfig(int port,
                           String database,
                           int maxPayloadSize,
                           Duration idleTimeout,
                           Duration shutdownGrace,
                           int dispatchThreads,
                           boolean collapseErrorCodes,
                           int backlog) {

  private static final Logger LOGGER = Logger.getLogger(ServerConfig.class.getName());

  public static final int DEFAULT_PORT = 1357;
  public static final String DEFAULT_PORT_FILE = "myport.info";
  public static final String DEFAULT_DATABASE = "defensive.db";
  public static final String IN_MEMORY = ":memory:";
  public static final int DEFAULT_BACKLOG = 100;

  static final String PORT = "port";
  static final String PORT_FILE = "port-file";
  static final String DB = "db";
  static final String MAX_PAYLOAD = "max-payload";
  static final String IDLE_TIMEOUT_MS = "idle-timeout-ms";
  static final String SHUTDOWN_GRACE_MS = "shutdown-grace-ms";
  static final String DISPATCH_THREADS = "dispatch-threads";
  static final String COLLAPSE_ERROR_CODES = "collapse-error-codes";

  public ServerConfig {
    Objects.requireNonNull(database, "database cannot be null");
    Objects.requireNonNull(idleTimeout, "idleTimeout cannot be null");
    Objects.requireNonNull(shutdownGrace, "shutdownGrace cannot be null");
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("port must be between 0 and 65535 but was " + port);
    }
    if (maxPayloadSize < WireProtocol.REGISTER_PAYLOAD_SIZE) {
      throw new IllegalArgumentException("maxPayloadSize must be at least " + WireProtocol.REGISTER_PAYLOAD_SIZE);
    }
    if (idleTimeout.isNegative() || idleTimeout.isZero()) {
      throw new IllegalArgumentException("idleTimeout must be positive");
    }
    if (shutdownGrace.isNegative()) {
      throw new IllegalArgumentException("shutdownGrace cannot be negative");
    }
    if (dispatchThreads < 0) {
      throw new IllegalArgumentException("dispatchThreads cannot be negative");
    }
    if (backlog < 1) {
      throw new IllegalArgumentException("backlog must be positive");
    }
  }

  public static ServerConfig defaults() {
    return new ServerConfig(DEFAULT_PORT, DEFAULT_DATABASE, WireProtocol.DEFAULT_MAX_PAYLOAD_SIZE,
        Duration.ofSeconds(30), Duration.ofSeconds(2), 0, false, DEFAULT_BACKLOG);
  }

  public boolean inMemory() {
    return IN_MEMORY.equals(database);
  }

  public ServerConfig withPort(int port) {
    return new ServerConfig(port, database, maxPayloadSize, idleTimeout, shutdownGrace, dispatchThreads,
        collapseErrorCodes, backlog);
  }

  public ServerConfig withDatabase(String database) {
    return new ServerConfig(port, database, maxPayloadSize, idleTimeout, shutdownGrace, dispatchThreads,
        collapseErrorCodes, backlog);
  }

  public ServerConfig withIdleTimeout(Duration idleTimeout) {
    return new ServerConfig(port, database, maxPayloadSize, idleTimeout, shutdownGrace, dispatchThreads,
        collapseErrorCodes, backlog);
  }

  public ServerConfig withDispatchThreads(int dispatchThreads) {
    return new ServerConfig(port, database, maxPayloadSize, idleTimeout, shutdownGrace, dispatchThreads,
        collapseErrorCodes, backlog);
  }

  public ServerConfig withMaxPayloadSize(int maxPayloadSize) {
    return new ServerConfig(port, database, maxPayloadSize, idleTimeout, shutdownGrace, dispatchThreads,
        collapseErrorCodes, backlog);
  }

  public ServerConfig withCollapseErrorCodes(boolean collapseErrorCodes) {
    return new ServerConfig(port, database, maxPayloadSize, idleTimeout, shutdownGrace, dispatchThreads,
        collapseErrorCodes, backlog);
  }

  /// Builds the settings from the command line. The port comes from `--port`, else the first line of the port
  /// file, else [#DEFAULT_PORT].
  ///
  /// @throws IllegalArgumentException if an option value is invalid or there are positional arguments.
  public static ServerConfig fromArgs(String[] args) {
    return from(new CommandLineParser().parse(args));
  }

  static ServerConfig from(CommandLineParser parser) {
    if (!parser.positional().isEmpty()) {
      throw new IllegalArgumentException("unexpected arguments " + parser.positional());
    }
    final ServerConfig defaults = defaults();
    final Path portFile = Path.of(parser.option(PORT_FILE).orElse(DEFAULT_PORT_FILE));
    final int port = parser.longOption(PORT)
        .map(Math::toIntExact)
        .orElseGet(() -> portFromFile(portFile));
    return new ServerConfig(
        port,
        parser.option(DB).orElse(defaults.database()),
        parser.longOption(MAX_PAYLOAD).map(Math::toIntExact).orElse(defaults.maxPayloadSize()),
        parser.longOption(IDLE_TIMEOUT_MS).map(Duration::ofMillis).orElse(defaults.idleTimeout()),
        parser.longOption(SHUTDOWN_GRACE_MS).map(Duration::ofMillis).orElse(defaults.shutdownGrace()),
        parser.longOption(DISPATCH_THREADS).map(Math::toIntExact).orElse(defaults.dispatchThreads()),
        parser.flag(COLLAPSE_ERROR_CODES),
        DEFAULT_BACKLOG);
  }

  /// Reads the port from the first line of the file. A missing file silently gives the default; an unreadable,
  /// empty or non-numeric one logs a warning first.
  static int portFromFile(Path portFile) {
    if (!Files.exists(portFile)) {
      LOGGER.fine(() -> "No port file " + portFile + ", using default port " + DEFAULT_PORT);
      return DEFAULT_PORT;
    }
    try {
      final List<String> lines = Files.readAllLines(portFile, StandardCharsets.US_ASCII);
      if (lines.isEmpty() || lines.get(0).isBlank()) {
        LOGGER.warning(() -> "Port file " + portFile + " is empty, using default port " + DEFAULT_PORT);
        return DEFAULT_PORT;
      }
      final int port = Integer.parseInt(lines.get(0).trim());
      if (port < 1 || port > 65535) {
        LOGGER.warning(() -> "Port file " + portFile + " holds out of range port " + port + ", using default port " + DEFAULT_PORT);
        return DEFAULT_PORT;
      }
      return port;
    } catch (NumberFormatException e) {
      LOGGER.warning(() -> "Port file " + portFile + " does not hold a number, using default port " + DEFAULT_PORT);
      return DEFAULT_PORT;
    } catch (IOException e) {
      LOGGER.warning(() -> "Could not read port file " + portFile + ": " + e.getMessage() + ", using default port " + DEFAULT_PORT);
      return DEFAULT_PORT;
    }
  }

  static String help() {
    return String.join(System.lineSeparator(),
        "Usage: java " + PostboxServer.class.getName() + " [options]",
        "  --" + PORT + "=1357                TCP port to listen on (default: first line of the port file, else 1357)",
        "  --" + PORT_FILE + "=myport.info    File holding the port",
        "  --" + DB + "=defensive.db            MVStore file, or " + IN_MEMORY + " for an in-memory store",
        "  --" + MAX_PAYLOAD + "=16777216      Largest accepted request payload in bytes",
        "  --" + IDLE_TIMEOUT_MS + "=30000     Close connections idle for this long",
        "  --" + SHUTDOWN_GRACE_MS + "=2000    How long shutdown lets responses flush",
        "  --" + DISPATCH_THREADS + "=0        Handler pool size, 0 handles requests on the selector thread",
        "  --" + COLLAPSE_ERROR_CODES + "      Report every error as code 9000",
        "  -h, --help                  Show this help message");
  }
}
