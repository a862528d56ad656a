// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.server;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Optional;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/// Replaces the JUL root handlers with a single console handler on stdout. The level comes from the `LOG_LEVEL`
/// environment variable, for example `LOG_LEVEL=FINE`, and defaults to INFO.
public class LoggerConfig {

  static {
    try {
      Logger rootLogger = Logger.getLogger("");

      for (Handler handler : rootLogger.getHandlers()) {
        rootLogger.removeHandler(handler);
      }

      ConsoleHandler consoleHandler = new ConsoleHandler() {{
        setOutputStream(System.out);
      }};

      final var levelString = Optional.ofNullable(System.getenv("LOG_LEVEL"))
          .orElse("INFO");
      Level level = parseLevel(levelString);

      consoleHandler.setLevel(level);
      rootLogger.setLevel(level);
      rootLogger.addHandler(consoleHandler);

      consoleHandler.setFormatter(new SimpleFormatter() {
        @Override
        public String format(LogRecord record) {
          final String message = formatMessage(record);
          if (record.getThrown() == null) {
            return String.format("[%s] %s%n", record.getLevel().getName(), message);
          }
          final StringWriter trace = new StringWriter();
          record.getThrown().printStackTrace(new PrintWriter(trace));
          return String.format("[%s] %s%n%s", record.getLevel().getName(), message, trace);
        }
      });

    } catch (Exception e) {
      System.err.println("Failed to configure logger: " + e.getMessage());
    }
  }

  static Level parseLevel(String levelString) {
    try {
      return Level.parse(levelString.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      System.err.println("Unknown LOG_LEVEL '" + levelString + "', using INFO");
      return Level.INFO;
    }
  }

  public static void initialize() {
    // Method to trigger static initialization which will configure the logger
  }
}
