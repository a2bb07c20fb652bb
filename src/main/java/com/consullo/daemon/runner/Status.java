package com.consullo.daemon.runner;

import java.util.OptionalInt;

/**
 * Lifecycle status of a supervised daemon.
 *
 * <p>Transitions are {@code INIT -> RUNNING -> STOPPED}. A stopped daemon returns to {@code RUNNING} only through
 * {@link DaemonRunner#restart()}.
 *
 * @param phase lifecycle phase
 * @param exitCode OS exit status, only present when {@code phase == STOPPED}
 * @since 1.0
 */
public record Status(Phase phase, OptionalInt exitCode) {

  public enum Phase {
    INIT,
    RUNNING,
    STOPPED
  }

  public static final Status INIT = new Status(Phase.INIT, OptionalInt.empty());

  public static final Status RUNNING = new Status(Phase.RUNNING, OptionalInt.empty());

  public Status {
    if (phase == null || exitCode == null) {
      throw new IllegalArgumentException("phase/exitCode must not be null.");
    }
    if (exitCode.isPresent() != (phase == Phase.STOPPED)) {
      throw new IllegalArgumentException("exitCode must be present exactly when stopped.");
    }
  }

  /**
   * Creates a stopped status.
   *
   * @param exitCode exit value as reported by the JVM (128 + signal for signal-terminated processes)
   * @return stopped status
   */
  public static Status stopped(final int exitCode) {
    return new Status(Phase.STOPPED, OptionalInt.of(exitCode));
  }

  public boolean isInit() {
    return phase == Phase.INIT;
  }

  public boolean isRunning() {
    return phase == Phase.RUNNING;
  }

  public boolean isStopped() {
    return phase == Phase.STOPPED;
  }

  @Override
  public String toString() {
    switch (phase) {
      case INIT:
        return "Init";
      case RUNNING:
        return "Running";
      default:
        return "Stopped(" + exitCode.getAsInt() + ")";
    }
  }
}
