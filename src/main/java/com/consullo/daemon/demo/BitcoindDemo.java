package com.consullo.daemon.demo;

import com.consullo.daemon.node.Network;
import com.consullo.daemon.node.bitcoind.BitcoindConfig;
import com.consullo.daemon.node.bitcoind.BitcoindDaemon;
import com.consullo.daemon.runner.Status;
import com.consullo.daemon.util.FreePorts;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal demo that starts a regtest bitcoind, logs how to reach it, and stops it again.
 *
 * <p>Usage: {@code BitcoindDemo <bitcoind-executable> <absolute-datadir>}
 *
 * @since 1.0
 */
public final class BitcoindDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(BitcoindDemo.class);

  private BitcoindDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args executable and datadir
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    if (args.length != 2) {
      System.err.println("usage: BitcoindDemo <bitcoind-executable> <absolute-datadir>");
      System.exit(2);
    }

    final BitcoindConfig config = BitcoindConfig.builder()
        .network(Network.REGTEST)
        .datadir(Path.of(args[1]))
        .rpcPort(FreePorts.findFreePort())
        .rpcUser("demo")
        .rpcPass("demo")
        .build();

    try (BitcoindDaemon daemon = BitcoindDaemon.named("demo", Path.of(args[0]), config)) {
      System.out.println("starting...");
      daemon.start();
      System.out.println("started!");

      TimeUnit.SECONDS.sleep(10);

      LOGGER.info("PID={} status={} rpc={}", daemon.pid().orElse(-1L), daemon.status(), daemon.rpcInfo().orElse(null));

      System.out.println("stopping...");
      daemon.stop();
      Status status = daemon.status();
      for (int i = 0; i < 50 && status.isRunning(); i++) {
        TimeUnit.MILLISECONDS.sleep(200);
        status = daemon.status();
      }
      System.out.println("stopped! " + status);

      final String stderr = daemon.takeStderr();
      if (!stderr.isEmpty()) {
        LOGGER.info("stderr:\n{}", stderr);
      }
    }
  }
}
