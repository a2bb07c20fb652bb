package com.consullo.daemon.runner;

/**
 * Raised when a lifecycle operation is not allowed from the current status.
 *
 * <p>The message names both, e.g. {@code "cannot start: already Running"}.
 *
 * @since 1.0
 */
public final class InvalidStateException extends DaemonException {

  private static final long serialVersionUID = 1L;

  private final String operation;
  private final transient Status status;

  public InvalidStateException(final String operation, final Status status) {
    super(ErrorKind.INVALID_STATE, message(operation, status));
    this.operation = operation;
    this.status = status;
  }

  public String operation() {
    return operation;
  }

  public Status status() {
    return status;
  }

  private static String message(final String operation, final Status status) {
    if (status.isInit()) {
      return "cannot " + operation + ": daemon is " + status + " (never started)";
    }
    return "cannot " + operation + ": already " + status;
  }
}
