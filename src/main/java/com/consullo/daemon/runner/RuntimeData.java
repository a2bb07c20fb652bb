package com.consullo.daemon.runner;

import com.consullo.daemon.process.ProcessController;
import java.time.Duration;
import java.util.OptionalInt;
import java.util.function.BiConsumer;
import java.util.function.Function;
import org.apache.commons.lang3.Validate;

/**
 * Mutable record shared between a {@link DaemonRunner} and its two reader loops.
 *
 * <p>Every field is guarded by {@link #lock}. The process handle and both loop threads are replaced together during
 * start-up, so no holder observes a new process paired with old loops. The state survives restarts.
 *
 * @param <S> daemon-defined state type
 * @since 1.0
 */
final class RuntimeData<S> {

  private final Object lock = new Object();

  private final S state;

  // null only until the first successful spawn
  private ProcessController process;
  private Thread stdoutLoop;
  private Thread stderrLoop;

  RuntimeData(final S state) {
    this.state = state;
  }

  /**
   * Installs a freshly spawned process and starts its reader loops. The previous process handle, if any, is
   * released (killed).
   *
   * @param newProcess spawned process
   * @param stdoutLoop unstarted stdout reader thread
   * @param stderrLoop unstarted stderr reader thread
   */
  void install(final ProcessController newProcess, final Thread stdoutLoop, final Thread stderrLoop) {
    Validate.notNull(newProcess, "newProcess must not be null");
    synchronized (lock) {
      if (this.process != null) {
        this.process.close();
      }
      this.process = newProcess;
      this.stdoutLoop = stdoutLoop;
      this.stderrLoop = stderrLoop;
      stdoutLoop.start();
      stderrLoop.start();
    }
  }

  /**
   * Delivers one line to a handler with the lock held.
   */
  void applyLine(final BiConsumer<S, String> handler, final String line) {
    synchronized (lock) {
      handler.accept(state, line);
    }
  }

  <R> R withState(final Function<? super S, ? extends R> fn) {
    synchronized (lock) {
      return fn.apply(state);
    }
  }

  /**
   * Non-blocking liveness check.
   *
   * @return {@link Status#RUNNING} or {@link Status#stopped(int)}
   */
  Status pollStatus() {
    synchronized (lock) {
      Validate.validState(process != null, "runtime record has no process");
      final OptionalInt code = process.tryWait();
      return code.isPresent() ? Status.stopped(code.getAsInt()) : Status.RUNNING;
    }
  }

  long pid() {
    synchronized (lock) {
      Validate.validState(process != null, "runtime record has no process");
      return process.pid();
    }
  }

  void terminate() {
    synchronized (lock) {
      Validate.validState(process != null, "runtime record has no process");
      process.terminate();
    }
  }

  void release() {
    synchronized (lock) {
      if (process != null) {
        process.close();
      }
    }
  }

  /**
   * Waits for the current reader loops to retire. Must be called without the lock held, since the loops need it
   * to deliver their remaining lines.
   *
   * @param timeout overall timeout
   * @return true if both loops retired in time
   * @throws InterruptedException if interrupted while waiting
   */
  boolean awaitLoops(final Duration timeout) throws InterruptedException {
    final Thread out;
    final Thread err;
    synchronized (lock) {
      out = stdoutLoop;
      err = stderrLoop;
    }
    final long deadline = System.nanoTime() + timeout.toNanos();
    for (final Thread t : new Thread[] { out, err }) {
      if (t == null) {
        continue;
      }
      final long remainingMillis = Math.max(0L, (deadline - System.nanoTime()) / 1_000_000L);
      if (remainingMillis > 0L) {
        t.join(remainingMillis);
      }
      if (t.isAlive()) {
        return false;
      }
    }
    return true;
  }
}
