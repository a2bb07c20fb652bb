package com.consullo.daemon.node.elementsd;

/**
 * Chain tip announced by an {@code UpdateTip} log line.
 *
 * @param height block height
 * @param blockHash block hash, 64 lowercase hex characters
 * @since 1.0
 */
public record UpdateTip(long height, String blockHash) {
}
