package com.consullo.daemon.runner;

import java.io.IOException;
import java.util.List;

/**
 * Raised when the OS cannot create the daemon process.
 *
 * @since 1.0
 */
public final class SpawnException extends DaemonException {

  private static final long serialVersionUID = 1L;

  private final List<String> command;

  public SpawnException(final List<String> command, final IOException cause) {
    super(ErrorKind.SPAWN_FAILURE, "failed to run command " + command + ": " + cause.getMessage(), cause);
    this.command = List.copyOf(command);
  }

  public List<String> command() {
    return command;
  }
}
