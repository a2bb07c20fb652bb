package com.consullo.daemon.process;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Configuration for spawning a daemon process with piped output streams.
 *
 * @param command executable followed by its arguments (e.g., ["bitcoind", "-conf=/tmp/bitcoin.conf"])
 * @param workingDirectory working directory for the spawned process (null inherits the JVM's)
 * @param environment environment variables to add/override (may be null)
 * @since 1.0
 */
public record ProcessConfig(
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment) {

  /**
   * Creates a config for the given command with inherited working directory and environment.
   *
   * @param command command and arguments
   * @return config
   */
  public static ProcessConfig of(final List<String> command) {
    return new ProcessConfig(command, null, null);
  }
}
