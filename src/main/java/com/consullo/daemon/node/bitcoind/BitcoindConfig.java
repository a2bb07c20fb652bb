package com.consullo.daemon.node.bitcoind;

import com.consullo.daemon.node.ConfigLines;
import com.consullo.daemon.node.Network;
import com.consullo.daemon.node.NodeConfig;
import java.io.IOException;
import java.io.Writer;
import java.util.Optional;

/**
 * Bitcoin Core ({@code bitcoind}) configuration, rendered to {@code bitcoin.conf}.
 *
 * <p>From 0.17 on, network-specific settings must live in a {@code [testnet]} or {@code [regtest]} section, so the
 * section header is written after the network flag for versions above {@code 17_00_00}.
 *
 * @since 1.0
 */
public final class BitcoindConfig extends NodeConfig {

  public static final String CONFIG_FILENAME = "bitcoin.conf";

  public static final long DEFAULT_VERSION = 18_00_00L;

  private static final long SECTIONS_VERSION = 17_00_00L;

  private final Network network;

  private BitcoindConfig(final Builder b) {
    super(b);
    this.network = b.network;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return the network, empty for mainnet by default
   */
  public Optional<Network> network() {
    return Optional.ofNullable(network);
  }

  @Override
  public String fileName() {
    return CONFIG_FILENAME;
  }

  @Override
  protected long defaultVersion() {
    return DEFAULT_VERSION;
  }

  @Override
  public void writeInto(final Writer out) throws IOException {
    final long version = effectiveVersion();
    final ConfigLines lines = new ConfigLines(out);

    lines.put("datadir", datadir());

    if (network == Network.TESTNET) {
      lines.put("testnet", "1");
      if (version > SECTIONS_VERSION) {
        lines.section("testnet");
      }
    } else if (network == Network.REGTEST) {
      lines.put("regtest", "1");
      if (version > SECTIONS_VERSION) {
        lines.section("regtest");
      }
    }

    writeNodeSettings(lines);
    writeConnect(lines);
    writeRpcSettings(lines);
    writeFeeSettings(lines);
    lines.flush();
  }

  public static final class Builder extends NodeConfig.Builder<Builder> {

    private Network network;

    private Builder() {
    }

    @Override
    protected Builder self() {
      return this;
    }

    public Builder network(final Network network) {
      this.network = network;
      return this;
    }

    public BitcoindConfig build() {
      return new BitcoindConfig(this);
    }
  }
}
