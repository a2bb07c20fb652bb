package com.consullo.daemon.process;

import java.io.IOException;
import java.io.InputStream;
import java.lang.ref.Cleaner;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process controller implemented with {@link ProcessBuilder}.
 *
 * <p>This controller spawns a subprocess with:
 * - stdout and stderr redirected to separate pipes
 * - stdin inherited from the JVM
 *
 * <p>The spawned process is killed when the controller is closed. A controller that becomes unreachable without
 * being closed is killed by a {@link Cleaner} action, so an abandoned handle never leaks a running daemon.
 *
 * @since 1.0
 */
public final class ProcessControllerJdk implements ProcessController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessControllerJdk.class);

  private static final Cleaner CLEANER = Cleaner.create();

  private final Process process;
  private final Cleaner.Cleanable killer;

  /**
   * Spawns a process.
   *
   * @param config process configuration (command, working directory, environment)
   * @throws IOException if the OS refuses to create the process
   */
  public ProcessControllerJdk(final ProcessConfig config) throws IOException {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(config.command(), "command must not be null");
    Validate.isTrue(!config.command().isEmpty(), "command must not be empty");

    final ProcessBuilder builder = new ProcessBuilder(config.command());
    if (config.workingDirectory() != null) {
      builder.directory(config.workingDirectory().toFile());
    }
    if (config.environment() != null) {
      final Map<String, String> env = new HashMap<>(config.environment());
      builder.environment().putAll(env);
    }
    builder.redirectInput(ProcessBuilder.Redirect.INHERIT);
    builder.redirectOutput(ProcessBuilder.Redirect.PIPE);
    builder.redirectError(ProcessBuilder.Redirect.PIPE);

    this.process = builder.start();
    this.killer = CLEANER.register(this, new KillAction(this.process));
  }

  @Override
  public InputStream getStdout() {
    return this.process.getInputStream();
  }

  @Override
  public InputStream getStderr() {
    return this.process.getErrorStream();
  }

  @Override
  public long pid() {
    return this.process.pid();
  }

  @Override
  public boolean isAlive() {
    return this.process.isAlive();
  }

  @Override
  public OptionalInt tryWait() {
    if (this.process.isAlive()) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(this.process.exitValue());
  }

  @Override
  public CompletableFuture<Integer> onExit() {
    return this.process.onExit().thenApply(Process::exitValue);
  }

  @Override
  public void terminate() {
    this.process.destroy();
  }

  @Override
  public void close() {
    this.killer.clean();
  }

  /**
   * Kill action shared by {@link #close()} and the cleaner. Must not reference the controller itself.
   */
  private static final class KillAction implements Runnable {

    private final Process process;

    private KillAction(final Process process) {
      this.process = process;
    }

    @Override
    public void run() {
      try {
        this.process.destroyForcibly();
      } catch (final RuntimeException e) {
        // Usually the process already exited.
        LOGGER.debug("Kill of PID {} failed: {}", this.process.pid(), e.getMessage());
      }
    }
  }
}
