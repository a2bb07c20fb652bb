package com.consullo.daemon.node;

import com.consullo.daemon.process.ProcessConfig;
import com.consullo.daemon.runner.DaemonAdapter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DaemonAdapter} for config-file driven node daemons.
 *
 * <p>Preparation creates the datadir and writes the config file into it once. The daemon is launched as
 * {@code <executable> -conf=<file> -printtoconsole=1}, so its log goes to stdout. Every stderr line is kept.
 *
 * <p>Adapters hold no reference to the runner that drives them.
 *
 * @param <C> config type
 * @param <S> state type
 * @since 1.0
 */
public abstract class NodeAdapter<C extends NodeConfig, S extends NodeState> implements DaemonAdapter<S> {

  private static final Logger LOGGER = LoggerFactory.getLogger(NodeAdapter.class);

  private final String name;
  private final Path executable;
  private final C config;

  // null until prepare() wrote it
  private volatile Path configFile;

  protected NodeAdapter(final String name, final Path executable, final C config) {
    Validate.notNull(name, "name must not be null");
    Validate.notNull(executable, "executable must not be null");
    Validate.notNull(config, "config must not be null");
    Validate.isTrue(config.datadir().isAbsolute(), "datadir should be an absolute path: %s", config.datadir());
    this.name = name;
    this.executable = executable;
    this.config = config;
  }

  /**
   * Daemon kind used in log messages, e.g. {@code bitcoind}.
   */
  protected abstract String kind();

  @Override
  public synchronized void prepare() throws Exception {
    if (configFile != null) {
      return;
    }
    Files.createDirectories(config.datadir());

    final Path path = config.datadir().resolve(config.fileName());
    try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      config.writeInto(w);
    }
    LOGGER.debug("Wrote config for {} to {}", this, path);
    configFile = path;
  }

  @Override
  public ProcessConfig buildCommand() {
    final Path file = configFile;
    Validate.validState(file != null, "config file of %s not written yet", this);
    return ProcessConfig.of(List.of(executable.toString(), "-conf=" + file, "-printtoconsole=1"));
  }

  @Override
  public void handleStdoutLine(final S state, final String line) {
    // Plain nodes expose nothing from stdout.
  }

  @Override
  public void handleStderrLine(final S state, final String line) {
    LOGGER.trace("stderr line of {}: {}", this, line);
    state.appendStderr(line);
  }

  public C config() {
    return config;
  }

  public Path executable() {
    return executable;
  }

  /**
   * @return path of the written config file, null before {@link #prepare()}
   */
  public Path configFile() {
    return configFile;
  }

  @Override
  public String toString() {
    if (name.isEmpty()) {
      return "<unnamed> " + kind();
    }
    return kind() + " \"" + name + "\"";
  }
}
