package com.consullo.daemon.node;

import com.consullo.daemon.runner.DaemonException;
import com.consullo.daemon.runner.DaemonRunner;
import com.consullo.daemon.runner.DaemonRunnerConfig;
import com.consullo.daemon.runner.Status;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A supervised node daemon: a {@link NodeAdapter} bound to its own {@link DaemonRunner}.
 *
 * @param <C> config type
 * @param <S> state type
 * @since 1.0
 */
public abstract class NodeDaemon<C extends NodeConfig, S extends NodeState> implements AutoCloseable {

  private final NodeAdapter<C, S> adapter;
  private final DaemonRunner<S> runner;

  protected NodeDaemon(final NodeAdapter<C, S> adapter, final DaemonRunnerConfig runnerConfig) {
    this.adapter = adapter;
    this.runner = new DaemonRunner<>(adapter, runnerConfig);
  }

  public void start() throws DaemonException {
    runner.start();
  }

  public void restart() throws DaemonException {
    runner.restart();
  }

  public void stop() throws DaemonException {
    runner.stop();
  }

  public Status status() {
    return runner.status();
  }

  public OptionalLong pid() {
    return runner.pid();
  }

  public DaemonRunner<S> runner() {
    return runner;
  }

  public C config() {
    return adapter.config();
  }

  public Path datadir() {
    return adapter.config().datadir();
  }

  /**
   * Connection info for an RPC client. Only meaningful once the daemon is started.
   *
   * @return info, empty if the config has no RPC port or credentials
   */
  public Optional<RpcInfo> rpcInfo() {
    return adapter.config().rpc().rpcInfo();
  }

  /**
   * Returns the stderr output collected since the last call and clears it.
   *
   * @return stderr text, empty before the first start
   */
  public String takeStderr() {
    return runner.withState(NodeState::takeStderr).orElse("");
  }

  @Override
  public void close() {
    runner.close();
  }

  @Override
  public String toString() {
    return adapter.toString();
  }
}
