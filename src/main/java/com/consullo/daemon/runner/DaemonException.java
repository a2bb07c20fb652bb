package com.consullo.daemon.runner;

/**
 * Checked failure of a supervisor operation.
 *
 * @since 1.0
 */
public class DaemonException extends Exception {

  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  public DaemonException(final ErrorKind kind, final String message) {
    super(message);
    this.kind = kind;
  }

  public DaemonException(final ErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}
