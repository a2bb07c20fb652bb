package com.consullo.daemon.node.bitcoind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.consullo.daemon.node.Network;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for bitcoin.conf rendering.
 *
 * @since 1.0
 */
public class BitcoindConfigTest {

  private static String render(final BitcoindConfig config) throws Exception {
    final StringWriter out = new StringWriter();
    config.writeInto(out);
    return out.toString();
  }

  @Test
  @DisplayName("Should write a regtest section for the default version")
  void writeInto_RegtestDefaultVersion_WritesSection() throws Exception {
    final BitcoindConfig config = BitcoindConfig.builder()
        .datadir(Path.of("/data/btc"))
        .network(Network.REGTEST)
        .connect("127.0.0.1:1234")
        .rpcPort(18443)
        .rpcUser("u")
        .rpcPass("p")
        .minRelayTxFee(0.00001)
        .build();

    assertThat(render(config)).isEqualTo(
        "datadir=/data/btc\n"
            + "regtest=1\n"
            + "[regtest]\n"
            + "debug=0\n"
            + "printtoconsole=0\n"
            + "daemon=0\n"
            + "listen=0\n"
            + "txindex=0\n"
            + "connect=127.0.0.1:1234\n"
            + "server=1\n"
            + "rpcport=18443\n"
            + "rpcuser=u\n"
            + "rpcpassword=p\n"
            + "minrelaytxfee=0.00001\n");
  }

  @Test
  @DisplayName("Should omit the network section for 0.17 and older")
  void writeInto_OldVersionTestnet_NoSection() throws Exception {
    final BitcoindConfig config = BitcoindConfig.builder()
        .version(17_00_00L)
        .datadir(Path.of("/data/btc"))
        .network(Network.TESTNET)
        .listen(true)
        .port(18333)
        .txindex(true)
        .build();

    assertThat(render(config)).isEqualTo(
        "datadir=/data/btc\n"
            + "testnet=1\n"
            + "debug=0\n"
            + "printtoconsole=0\n"
            + "daemon=0\n"
            + "listen=1\n"
            + "port=18333\n"
            + "txindex=1\n");
  }

  @Test
  @DisplayName("Should write no network lines for mainnet and enable the server for cookie auth")
  void writeInto_MainnetCookie_ServerEnabled() throws Exception {
    final BitcoindConfig config = BitcoindConfig.builder()
        .datadir(Path.of("/data/btc"))
        .debug(true)
        .rpcCookie("/data/btc/.cookie")
        .addressType("bech32")
        .blockMinTxFee(0.0001)
        .build();

    assertThat(render(config)).isEqualTo(
        "datadir=/data/btc\n"
            + "debug=1\n"
            + "printtoconsole=0\n"
            + "daemon=0\n"
            + "listen=0\n"
            + "txindex=0\n"
            + "server=1\n"
            + "rpccookiefile=/data/btc/.cookie\n"
            + "addresstype=bech32\n"
            + "blockmintxfee=0.0001\n");
    assertThat(config.network()).isEmpty();
    assertThat(config.effectiveVersion()).isEqualTo(BitcoindConfig.DEFAULT_VERSION);
  }

  @Test
  @DisplayName("Should require a datadir")
  void build_NoDatadir_Rejected() {
    assertThatThrownBy(() -> BitcoindConfig.builder().build()).isInstanceOf(NullPointerException.class);
  }
}
