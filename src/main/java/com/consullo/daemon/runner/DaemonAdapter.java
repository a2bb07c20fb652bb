package com.consullo.daemon.runner;

import com.consullo.daemon.process.ProcessConfig;

/**
 * Daemon-specific hooks consumed by {@link DaemonRunner}.
 *
 * <p>The runner never parses configuration syntax or log formats itself; an adapter supplies:
 * - preparation (directories, config files)
 * - the command line
 * - the initial state
 * - line handlers that fold output lines into that state
 *
 * <p>{@link #toString()} is used to name the daemon in log messages and reader thread names.
 *
 * @param <S> daemon-defined state type, mutated in place by the line handlers
 * @since 1.0
 */
public interface DaemonAdapter<S> {

  /**
   * Prepares the daemon for running. Called on every {@link DaemonRunner#start()} before the first successful spawn,
   * so implementations must be idempotent: a second call before any process exists is a no-op.
   *
   * @throws Exception if preparation fails; reported to the caller as {@link ErrorKind#ADAPTER_FAILURE}
   */
  void prepare() throws Exception;

  /**
   * Returns the command to spawn. Called on every start-up, including restarts.
   *
   * @return process configuration
   */
  ProcessConfig buildCommand();

  /**
   * Creates the zero-value state for a fresh runtime record. Called after {@link #prepare()}.
   *
   * @return initial state
   */
  S initialState();

  /**
   * Folds one stdout line into the state. Runs under the runtime record lock and must not block.
   * Unrecognized lines are ignored.
   *
   * @param state state to mutate
   * @param line line without its terminator
   */
  void handleStdoutLine(S state, String line);

  /**
   * Folds one stderr line into the state. Same contract as {@link #handleStdoutLine(Object, String)}.
   *
   * @param state state to mutate
   * @param line line without its terminator
   */
  void handleStderrLine(S state, String line);
}
