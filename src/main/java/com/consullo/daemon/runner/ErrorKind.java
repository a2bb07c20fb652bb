package com.consullo.daemon.runner;

/**
 * Classification of supervisor failures.
 *
 * @since 1.0
 */
public enum ErrorKind {

  /** Operation attempted from a lifecycle status that forbids it. */
  INVALID_STATE,

  /** The OS refused to create the process. */
  SPAWN_FAILURE,

  /** Pipe read or signal-send failure. */
  IO_FAILURE,

  /** Failure raised by the adapter's prepare hook. */
  ADAPTER_FAILURE,

  /** Non-text data on a monitored output stream. */
  DECODE_FAILURE
}
