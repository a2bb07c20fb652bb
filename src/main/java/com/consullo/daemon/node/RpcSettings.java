package com.consullo.daemon.node;

import java.nio.file.Path;
import java.util.Optional;

/**
 * RPC-related values of a node config.
 *
 * @param cookieFile {@code rpccookiefile} (nullable)
 * @param port {@code rpcport} (nullable)
 * @param user {@code rpcuser} (nullable)
 * @param password {@code rpcpassword} (nullable)
 * @since 1.0
 */
public record RpcSettings(String cookieFile, Integer port, String user, String password) {

  /**
   * Whether the RPC server must be enabled ({@code server=1}).
   *
   * @return true if a cookie file or a user is configured
   */
  public boolean serverEnabled() {
    return cookieFile != null || user != null;
  }

  /**
   * Derives connection info. A cookie file takes precedence over a user/password pair.
   *
   * @return info, empty if no port is configured or no usable credentials are
   */
  public Optional<RpcInfo> rpcInfo() {
    if (port == null) {
      return Optional.empty();
    }
    final String url = "http://127.0.0.1:" + port;
    if (cookieFile != null) {
      return Optional.of(new RpcInfo(url, RpcAuth.cookieFile(Path.of(cookieFile))));
    }
    if (user != null && password != null) {
      return Optional.of(new RpcInfo(url, RpcAuth.userPass(user, password)));
    }
    return Optional.empty();
  }
}
