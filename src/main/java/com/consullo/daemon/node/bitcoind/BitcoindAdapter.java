package com.consullo.daemon.node.bitcoind;

import com.consullo.daemon.node.NodeAdapter;
import com.consullo.daemon.node.NodeState;
import java.nio.file.Path;

/**
 * Hooks for {@code bitcoind}: only stderr is collected.
 *
 * @since 1.0
 */
public final class BitcoindAdapter extends NodeAdapter<BitcoindConfig, NodeState> {

  public BitcoindAdapter(final String name, final Path executable, final BitcoindConfig config) {
    super(name, executable, config);
  }

  @Override
  protected String kind() {
    return "bitcoind";
  }

  @Override
  public NodeState initialState() {
    return new NodeState();
  }
}
