package com.consullo.daemon.node;

/**
 * Bitcoin network a node daemon runs on.
 *
 * @since 1.0
 */
public enum Network {
  BITCOIN,
  TESTNET,
  REGTEST
}
