package com.consullo.daemon.util;

import java.io.IOException;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks ports for test daemons.
 *
 * @since 1.0
 */
public final class FreePorts {

  private static final Logger LOGGER = LoggerFactory.getLogger(FreePorts.class);

  /** First port of the IANA dynamic range. */
  public static final int MIN_PORT = 49152;

  /** Exclusive upper bound. */
  public static final int MAX_PORT = 65535;

  private FreePorts() {
  }

  /**
   * Finds a random port in the dynamic range that can currently be bound on 127.0.0.1.
   *
   * <p>The port is released again before returning, so another process may grab it in between.
   *
   * @return port
   */
  public static int findFreePort() {
    final ThreadLocalRandom random = ThreadLocalRandom.current();
    while (true) {
      final int port = random.nextInt(MIN_PORT, MAX_PORT);
      if (isFree(port)) {
        return port;
      }
    }
  }

  private static boolean isFree(final int port) {
    try (DatagramSocket socket = new DatagramSocket(new InetSocketAddress(InetAddress.getLoopbackAddress(), port))) {
      return true;
    } catch (final IOException e) {
      LOGGER.trace("port {} is taken: {}", port, e.getMessage());
      return false;
    }
  }
}
