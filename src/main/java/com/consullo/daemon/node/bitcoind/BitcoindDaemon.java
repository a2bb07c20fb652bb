package com.consullo.daemon.node.bitcoind;

import com.consullo.daemon.node.NodeDaemon;
import com.consullo.daemon.node.NodeState;
import com.consullo.daemon.runner.DaemonRunnerConfig;
import java.nio.file.Path;

/**
 * Supervised Bitcoin Core node.
 *
 * <pre>{@code
 * try (BitcoindDaemon d = BitcoindDaemon.create(Path.of("bitcoind"), config)) {
 *   d.start();
 *   ...
 *   d.stop();
 * }
 * }</pre>
 *
 * @since 1.0
 */
public final class BitcoindDaemon extends NodeDaemon<BitcoindConfig, NodeState> {

  private BitcoindDaemon(final BitcoindAdapter adapter, final DaemonRunnerConfig runnerConfig) {
    super(adapter, runnerConfig);
  }

  public static BitcoindDaemon create(final Path executable, final BitcoindConfig config) {
    return named("", executable, config);
  }

  public static BitcoindDaemon named(final String name, final Path executable, final BitcoindConfig config) {
    return named(name, executable, config, DaemonRunnerConfig.defaults());
  }

  /**
   * Creates an unstarted daemon.
   *
   * @param name name used in logs, empty for unnamed
   * @param executable path to the {@code bitcoind} binary
   * @param config node config; its datadir must be absolute
   * @param runnerConfig runner tuning values
   * @return daemon
   * @throws IllegalArgumentException if the datadir is not absolute
   */
  public static BitcoindDaemon named(
      final String name,
      final Path executable,
      final BitcoindConfig config,
      final DaemonRunnerConfig runnerConfig) {
    return new BitcoindDaemon(new BitcoindAdapter(name, executable, config), runnerConfig);
  }
}
