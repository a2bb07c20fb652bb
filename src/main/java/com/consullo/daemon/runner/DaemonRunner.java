package com.consullo.daemon.runner;

import com.consullo.daemon.process.ProcessConfig;
import com.consullo.daemon.process.ProcessController;
import com.consullo.daemon.process.ProcessLauncher;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Function;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supervises one external daemon process.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>the lifecycle state machine ({@link Status})</li>
 * <li>the runtime record shared with the stdout and stderr reader loops</li>
 * </ul>
 * </p>
 *
 * <p>
 * The daemon's state is created on the first {@link #start()} and kept across {@link #stop()} and
 * {@link #restart()}. A running process never outlives its handle: {@link #close()} kills it, and so does garbage
 * collection of an abandoned runner.
 * </p>
 *
 * @param <S> daemon-defined state type
 * @since 1.0
 */
public final class DaemonRunner<S> implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(DaemonRunner.class);

  private final DaemonAdapter<S> adapter;
  private final DaemonRunnerConfig config;
  private final ProcessLauncher launcher;

  private final Object lock = new Object();

  // null while Init
  private RuntimeData<S> runtime;

  public DaemonRunner(final DaemonAdapter<S> adapter) {
    this(adapter, DaemonRunnerConfig.defaults(), ProcessLauncher.JDK);
  }

  public DaemonRunner(final DaemonAdapter<S> adapter, final DaemonRunnerConfig config) {
    this(adapter, config, ProcessLauncher.JDK);
  }

  /**
   * Creates a runner.
   *
   * @param adapter daemon-specific hooks
   * @param config runner tuning values
   * @param launcher process factory
   */
  public DaemonRunner(final DaemonAdapter<S> adapter, final DaemonRunnerConfig config, final ProcessLauncher launcher) {
    Validate.notNull(adapter, "adapter must not be null");
    Validate.notNull(config, "config must not be null");
    Validate.notNull(launcher, "launcher must not be null");
    this.adapter = adapter;
    this.config = config;
    this.launcher = launcher;
  }

  /**
   * Starts the daemon for the first time. Only valid from {@link Status.Phase#INIT}; use {@link #restart()} to run
   * a stopped daemon again.
   *
   * @throws DaemonException {@link InvalidStateException} if already started, {@link SpawnException} if the process
   *     cannot be created, {@link ErrorKind#ADAPTER_FAILURE} if preparation fails
   */
  public void start() throws DaemonException {
    synchronized (lock) {
      final Status status = statusLocked();
      if (!status.isInit()) {
        throw new InvalidStateException("start", status);
      }

      try {
        adapter.prepare();
      } catch (final DaemonException e) {
        throw e;
      } catch (final Exception e) {
        throw new DaemonException(ErrorKind.ADAPTER_FAILURE, "failed to prepare " + adapter + ": " + e.getMessage(), e);
      }

      final RuntimeData<S> rt = new RuntimeData<>(adapter.initialState());
      startUp(rt);
      this.runtime = rt;
    }
  }

  /**
   * Runs the daemon again with the state accumulated so far. A running daemon is stopped first.
   *
   * @throws DaemonException {@link InvalidStateException} if never started, {@link SpawnException} if the process
   *     cannot be created
   */
  public void restart() throws DaemonException {
    synchronized (lock) {
      final Status status = statusLocked();
      if (status.isInit()) {
        throw new InvalidStateException("restart", status);
      }
      if (status.isRunning()) {
        stopLocked();
      }
      startUp(runtime);
    }
  }

  /**
   * Sends a termination signal to the daemon and returns without waiting for it to exit. The state stays readable
   * and the daemon can be restarted. Stopping a stopped daemon is a no-op.
   *
   * @throws DaemonException {@link InvalidStateException} if never started
   */
  public void stop() throws DaemonException {
    synchronized (lock) {
      final Status status = statusLocked();
      if (status.isInit()) {
        throw new InvalidStateException("stop", status);
      }
      if (status.isStopped()) {
        return;
      }
      stopLocked();
    }
  }

  /**
   * Returns the current status. Polls the process without blocking; this is the only operation that observes a
   * {@code RUNNING -> STOPPED} transition.
   *
   * @return status
   */
  public Status status() {
    synchronized (lock) {
      return statusLocked();
    }
  }

  /**
   * Returns the OS process id of the current (or last) daemon process.
   *
   * @return pid, empty while Init
   */
  public OptionalLong pid() {
    synchronized (lock) {
      return runtime == null ? OptionalLong.empty() : OptionalLong.of(runtime.pid());
    }
  }

  /**
   * Reads the daemon state under the runtime record lock.
   *
   * @param fn function applied to the state; must not block
   * @param <R> result type
   * @return the function result, empty while Init or if the function returned null
   */
  public <R> Optional<R> withState(final Function<? super S, ? extends R> fn) {
    Validate.notNull(fn, "fn must not be null");
    final RuntimeData<S> rt;
    synchronized (lock) {
      rt = runtime;
    }
    if (rt == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(rt.withState(fn));
  }

  /**
   * Waits for the current reader loops to drain their pipes. {@link #stop()} does not wait for this; callers that
   * need every line of a stopped daemon folded into the state call this afterwards.
   *
   * @param timeout maximum time to wait
   * @return true if both loops retired (or none exist yet)
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitReaders(final Duration timeout) throws InterruptedException {
    Validate.notNull(timeout, "timeout must not be null");
    final RuntimeData<S> rt;
    synchronized (lock) {
      rt = runtime;
    }
    return rt == null || rt.awaitLoops(timeout);
  }

  public DaemonAdapter<S> adapter() {
    return adapter;
  }

  /**
   * Kills the daemon process if one exists. The state remains readable.
   */
  @Override
  public void close() {
    synchronized (lock) {
      if (runtime != null) {
        runtime.release();
      }
    }
  }

  @Override
  public String toString() {
    return "DaemonRunner[" + adapter + "]";
  }

  private Status statusLocked() {
    return runtime == null ? Status.INIT : runtime.pollStatus();
  }

  private void stopLocked() {
    LOGGER.info("Stopping daemon {}...", adapter);
    runtime.terminate();
    LOGGER.info("Daemon {} stopped", adapter);
  }

  /**
   * Spawns the process and its reader loops into the given record.
   */
  private void startUp(final RuntimeData<S> rt) throws SpawnException {
    LOGGER.info("Starting daemon {}...", adapter);

    final ProcessConfig command = adapter.buildCommand();
    Validate.notNull(command, "adapter returned a null command");
    LOGGER.debug("Launching daemon {} with command: {}", adapter, command.command());

    final ProcessController process;
    try {
      process = launcher.launch(command);
    } catch (final IOException e) {
      throw new SpawnException(command.command(), e);
    }
    final long pid = process.pid();

    final Thread stdoutLoop = new StreamReaderLoop<>(
        threadName("stdout"), process.getStdout(), rt, adapter::handleStdoutLine, config.readerStartDelay())
        .newThread();
    final Thread stderrLoop = new StreamReaderLoop<>(
        threadName("stderr"), process.getStderr(), rt, adapter::handleStderrLine, config.readerStartDelay())
        .newThread();
    rt.install(process, stdoutLoop, stderrLoop);

    LOGGER.info("Daemon {} started. PID: {}", adapter, pid);
  }

  private String threadName(final String stream) {
    return config.threadNamePrefix() + " " + stream + " for " + adapter;
  }
}
