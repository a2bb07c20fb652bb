package com.consullo.daemon.runner;

import java.time.Duration;

/**
 * Runner tuning values.
 *
 * @param readerStartDelay delay before a reader loop performs its first read; tolerates daemons that are slow to
 *     produce output right after spawn
 * @param threadNamePrefix prefix of the reader thread names
 * @since 1.0
 */
public record DaemonRunnerConfig(
    Duration readerStartDelay,
    String threadNamePrefix) {

  public static final Duration DEFAULT_READER_START_DELAY = Duration.ofSeconds(1);

  public DaemonRunnerConfig {
    if (readerStartDelay == null || readerStartDelay.isNegative()) {
      throw new IllegalArgumentException("readerStartDelay must be non-negative.");
    }
    if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
      throw new IllegalArgumentException("threadNamePrefix must not be blank.");
    }
  }

  public static DaemonRunnerConfig defaults() {
    return new DaemonRunnerConfig(DEFAULT_READER_START_DELAY, "daemon-runner");
  }

  public DaemonRunnerConfig withReaderStartDelay(final Duration delay) {
    return new DaemonRunnerConfig(delay, threadNamePrefix);
  }
}
