package com.consullo.daemon.process;

import java.io.IOException;

/**
 * Spawns a {@link ProcessController} for a configuration.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ProcessLauncher {

  /**
   * Default launcher backed by {@link ProcessControllerJdk}.
   */
  ProcessLauncher JDK = ProcessControllerJdk::new;

  /**
   * Spawns the process described by the config.
   *
   * @param config process configuration
   * @return controller owning the new process
   * @throws IOException if the OS refuses to create the process
   */
  ProcessController launch(ProcessConfig config) throws IOException;
}
