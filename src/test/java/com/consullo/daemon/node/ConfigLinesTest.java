package com.consullo.daemon.node;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.StringWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for config line formatting.
 *
 * @since 1.0
 */
public class ConfigLinesTest {

  @Test
  @DisplayName("Should write flags as 0/1, skip absent values and keep decimals plain")
  void write_MixedValues_Formatted() throws Exception {
    final StringWriter out = new StringWriter();

    new ConfigLines(out)
        .flag("listen", true)
        .flag("txindex", false)
        .putIfPresent("port", null)
        .decimalIfPresent("minrelaytxfee", 0.00001)
        .decimalIfPresent("blockmintxfee", 1.0)
        .section("regtest")
        .put("rpcport", 18443);

    assertThat(out.toString()).isEqualTo(
        "listen=1\ntxindex=0\nminrelaytxfee=0.00001\nblockmintxfee=1\n[regtest]\nrpcport=18443\n");
  }
}
