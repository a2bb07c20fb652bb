package com.consullo.daemon.node.bitcoind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import com.consullo.daemon.node.Network;
import com.consullo.daemon.node.RpcAuth;
import com.consullo.daemon.runner.DaemonRunnerConfig;
import com.consullo.daemon.runner.Status;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Runs {@link BitcoindDaemon} against a shell script standing in for bitcoind.
 *
 * @since 1.0
 */
public class BitcoindDaemonTest {

  private static final DaemonRunnerConfig NO_DELAY = new DaemonRunnerConfig(Duration.ZERO, "test");

  private static Path fakeBitcoind(final Path dir) throws Exception {
    final Path script = dir.resolve("fake-bitcoind");
    Files.writeString(script,
        "#!/bin/sh\n"
            + "echo \"Bitcoin Core starting\"\n"
            + "echo \"args: $*\" >&2\n"
            + "echo \"Warning: fake node\" >&2\n",
        StandardCharsets.UTF_8);
    Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
    return script;
  }

  @Test
  @DisplayName("Should write bitcoin.conf, pass it on the command line and collect stderr")
  void start_FakeNode_WritesConfigAndCollectsStderr(@TempDir final Path dir) throws Exception {
    final Path datadir = dir.resolve("node");
    final BitcoindConfig config = BitcoindConfig.builder()
        .datadir(datadir)
        .network(Network.REGTEST)
        .rpcPort(18443)
        .rpcCookie(datadir.resolve(".cookie").toString())
        .build();

    try (BitcoindDaemon daemon = BitcoindDaemon.named("alice", fakeBitcoind(dir), config, NO_DELAY)) {
      assertThat(daemon).hasToString("bitcoind \"alice\"");
      assertThat(daemon.takeStderr()).isEmpty();

      daemon.start();
      await().atMost(Duration.ofSeconds(10)).until(() -> daemon.status().isStopped());
      daemon.runner().awaitReaders(Duration.ofSeconds(10));

      final Path confFile = datadir.resolve(BitcoindConfig.CONFIG_FILENAME);
      assertThat(Files.readString(confFile)).startsWith("datadir=" + datadir + "\nregtest=1\n[regtest]\n");
      assertThat(daemon.takeStderr()).isEqualTo(
          "args: -conf=" + confFile + " -printtoconsole=1\nWarning: fake node\n");
      assertThat(daemon.takeStderr()).isEmpty();
      assertThat(daemon.status()).isEqualTo(Status.stopped(0));
      assertThat(daemon.rpcInfo()).hasValueSatisfying(info -> {
        assertThat(info.url()).isEqualTo("http://127.0.0.1:18443");
        assertThat(info.auth().type()).isEqualTo(RpcAuth.Type.COOKIE_FILE);
      });
    }
  }

  @Test
  @DisplayName("Should write the config file only once across restarts")
  void restart_FakeNode_ConfigWrittenOnce(@TempDir final Path dir) throws Exception {
    final Path datadir = dir.resolve("node");
    final BitcoindConfig config = BitcoindConfig.builder().datadir(datadir).build();

    try (BitcoindDaemon daemon = BitcoindDaemon.named("", fakeBitcoind(dir), config, NO_DELAY)) {
      assertThat(daemon).hasToString("<unnamed> bitcoind");
      daemon.start();
      await().atMost(Duration.ofSeconds(10)).until(() -> daemon.status().isStopped());

      final Path confFile = datadir.resolve(BitcoindConfig.CONFIG_FILENAME);
      Files.writeString(confFile, "edited\n");
      daemon.restart();
      await().atMost(Duration.ofSeconds(10)).until(() -> daemon.status().isStopped());

      assertThat(Files.readString(confFile)).isEqualTo("edited\n");
    }
  }

  @Test
  @DisplayName("Should reject a relative datadir")
  void create_RelativeDatadir_Rejected() {
    final BitcoindConfig config = BitcoindConfig.builder().datadir(Path.of("relative/dir")).build();

    assertThatThrownBy(() -> BitcoindDaemon.create(Path.of("bitcoind"), config))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("datadir should be an absolute path");
  }
}
