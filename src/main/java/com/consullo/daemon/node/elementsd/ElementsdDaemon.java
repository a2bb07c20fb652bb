package com.consullo.daemon.node.elementsd;

import com.consullo.daemon.node.NodeDaemon;
import com.consullo.daemon.runner.DaemonRunnerConfig;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Supervised Elements / Liquid node.
 *
 * @since 1.0
 */
public final class ElementsdDaemon extends NodeDaemon<ElementsdConfig, ElementsdState> {

  private ElementsdDaemon(final ElementsdAdapter adapter, final DaemonRunnerConfig runnerConfig) {
    super(adapter, runnerConfig);
  }

  public static ElementsdDaemon create(final Path executable, final ElementsdConfig config) {
    return named("", executable, config);
  }

  public static ElementsdDaemon named(final String name, final Path executable, final ElementsdConfig config) {
    return named(name, executable, config, DaemonRunnerConfig.defaults());
  }

  public static ElementsdDaemon named(
      final String name,
      final Path executable,
      final ElementsdConfig config,
      final DaemonRunnerConfig runnerConfig) {
    return new ElementsdDaemon(new ElementsdAdapter(name, executable, config), runnerConfig);
  }

  /**
   * Last chain tip announced on stdout.
   *
   * @return tip, empty before the first UpdateTip line or before start
   */
  public Optional<UpdateTip> lastUpdateTip() {
    return runner().withState(s -> s.lastUpdateTip().orElse(null));
  }
}
