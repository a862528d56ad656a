// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.postbox.server;

import com.github.postbox.wire.WireProtocol;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ServerConfigTest {

  @TempDir
  Path dir;

  Path portFile(String content) throws IOException {
    final Path file = dir.resolve("myport.info");
    Files.writeString(file, content);
    return file;
  }

  String[] args(String... args) {
    return args;
  }

  @Test
  public void defaultsMatchTheLegacyServer() {
    final ServerConfig config = ServerConfig.fromArgs(args("--port-file", dir.resolve("missing").toString()));
    assertThat(config.port()).isEqualTo(1357);
    assertThat(config.database()).isEqualTo("defensive.db");
    assertThat(config.inMemory()).isFalse();
    assertThat(config.maxPayloadSize()).isEqualTo(WireProtocol.DEFAULT_MAX_PAYLOAD_SIZE);
    assertThat(config.idleTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.shutdownGrace()).isEqualTo(Duration.ofSeconds(2));
    assertThat(config.dispatchThreads()).isZero();
    assertThat(config.collapseErrorCodes()).isFalse();
    assertThat(config.backlog()).isEqualTo(100);
  }

  @Test
  public void portComesFromTheFirstLineOfThePortFile() throws IOException {
    final Path file = portFile("4242\nignored\n");
    assertThat(ServerConfig.fromArgs(args("--port-file=" + file)).port()).isEqualTo(4242);
  }

  @Test
  public void commandLinePortBeatsThePortFile() throws IOException {
    final Path file = portFile("4242");
    assertThat(ServerConfig.fromArgs(args("--port-file=" + file, "--port", "5151")).port()).isEqualTo(5151);
  }

  @Test
  public void badPortFilesFallBackToTheDefault() throws IOException {
    assertThat(ServerConfig.portFromFile(portFile(""))).isEqualTo(ServerConfig.DEFAULT_PORT);
    assertThat(ServerConfig.portFromFile(portFile("   \n"))).isEqualTo(ServerConfig.DEFAULT_PORT);
    assertThat(ServerConfig.portFromFile(portFile("port=80"))).isEqualTo(ServerConfig.DEFAULT_PORT);
    assertThat(ServerConfig.portFromFile(portFile("70000"))).isEqualTo(ServerConfig.DEFAULT_PORT);
    assertThat(ServerConfig.portFromFile(portFile(" 2020 "))).isEqualTo(2020);
  }

  @Test
  public void parsesEveryOption() {
    final ServerConfig config = ServerConfig.fromArgs(args(
        "--port=0",
        "--db", ":memory:",
        "--max-payload=2048",
        "--idle-timeout-ms", "500",
        "--shutdown-grace-ms=100",
        "--dispatch-threads", "4",
        "--collapse-error-codes"));

    assertThat(config).isEqualTo(new ServerConfig(0, ":memory:", 2048, Duration.ofMillis(500),
        Duration.ofMillis(100), 4, true, ServerConfig.DEFAULT_BACKLOG));
    assertThat(config.inMemory()).isTrue();
  }

  @Test
  public void rejectsInvalidValues() {
    assertThatThrownBy(() -> ServerConfig.fromArgs(args("--port", "http")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("--port");
    assertThatThrownBy(() -> ServerConfig.fromArgs(args("--port=70000")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ServerConfig.fromArgs(args("--port=0", "--max-payload=10")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ServerConfig.fromArgs(args("--port=0", "--idle-timeout-ms=0")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void rejectsPositionalArguments() {
    assertThatThrownBy(() -> ServerConfig.fromArgs(args("--port=0", "defensive.db")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("defensive.db");
    final CommandLineParser parser = new CommandLineParser().parse(args("stray", "--flag", "-x", "1", "tail"));
    assertThat(parser.positional()).containsExactly("stray", "tail");
    assertThat(parser.flag("flag")).isTrue();
  }

  @Test
  public void parserHandlesLongShortAndFlagForms() {
    final CommandLineParser parser = new CommandLineParser().parse(args("--a=1", "--b", "2", "--c", "-d", "4", "-e", "rest"));
    assertThat(parser.option("a")).contains("1");
    assertThat(parser.option("b")).contains("2");
    assertThat(parser.flag("c")).isTrue();
    assertThat(parser.option("d")).contains("4");
    assertThat(parser.option("e")).contains("rest");
    assertThat(parser.hasOption("z")).isFalse();
    assertThat(parser.flag("z")).isFalse();
  }

  @Test
  public void helpListsEveryOption() {
    assertThat(ServerConfig.help())
        .contains("--port", "--port-file", "--db", "--max-payload", "--idle-timeout-ms", "--shutdown-grace-ms",
            "--dispatch-threads", "--collapse-error-codes", "--help");
  }
}
