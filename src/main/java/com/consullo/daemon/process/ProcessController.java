package com.consullo.daemon.process;

import java.io.InputStream;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;

/**
 * Owned handle to a spawned daemon process.
 *
 * <p>Implementations must provide:
 * - access to the stdout and stderr pipes
 * - a non-blocking exit check
 * - polite termination
 * - kill-on-close: {@link #close()} always attempts to kill the process and never fails because it already exited
 *
 * @since 1.0
 */
public interface ProcessController extends AutoCloseable {

  /**
   * Returns the read end of the process' stdout pipe. Ownership passes to the caller on the first call.
   *
   * @return stdout stream
   */
  InputStream getStdout();

  /**
   * Returns the read end of the process' stderr pipe. Ownership passes to the caller on the first call.
   *
   * @return stderr stream
   */
  InputStream getStderr();

  long pid();

  boolean isAlive();

  /**
   * Non-blocking exit check.
   *
   * @return the exit code, or empty while the process is still running
   */
  OptionalInt tryWait();

  CompletableFuture<Integer> onExit();

  /**
   * Sends a termination request (SIGTERM on POSIX) and returns without waiting for exit.
   */
  void terminate();

  /**
   * Forcibly kills the process, ignoring any failure.
   */
  @Override
  void close();
}
