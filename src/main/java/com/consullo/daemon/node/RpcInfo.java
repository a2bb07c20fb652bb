package com.consullo.daemon.node;

/**
 * Everything an RPC client needs to reach a running node.
 *
 * @param url endpoint URL, e.g. {@code http://127.0.0.1:18443}
 * @param auth credentials
 * @since 1.0
 */
public record RpcInfo(String url, RpcAuth auth) {
}
