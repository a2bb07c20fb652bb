package com.consullo.daemon.node;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.commons.lang3.Validate;

/**
 * Settings shared by the Bitcoin Core family of node daemons.
 *
 * <p>{@code version} is not written to the file; it selects the file format. Two digits per version component:
 * 0.18.1 is {@code 18_01_00}. Zero means the daemon's default version.
 *
 * @since 1.0
 */
public abstract class NodeConfig {

  private static final Pattern HEX = Pattern.compile("^(?:[0-9a-fA-F]{2})*$");

  private final long version;
  private final Path datadir;
  private final boolean debug;
  private final boolean printToConsole;
  private final boolean daemon;
  private final boolean listen;
  private final Integer port;
  private final boolean txindex;
  private final List<String> connect;
  private final RpcSettings rpc;
  private final String addressType;
  private final Double blockMinTxFee;
  private final Double minRelayTxFee;

  protected NodeConfig(final Builder<?> b) {
    Validate.notNull(b.datadir, "datadir must not be null");
    Validate.isTrue(b.version >= 0, "version must not be negative");
    this.version = b.version;
    this.datadir = b.datadir;
    this.debug = b.debug;
    this.printToConsole = b.printToConsole;
    this.daemon = b.daemon;
    this.listen = b.listen;
    this.port = b.port;
    this.txindex = b.txindex;
    this.connect = List.copyOf(b.connect);
    this.rpc = new RpcSettings(b.rpcCookie, b.rpcPort, b.rpcUser, b.rpcPass);
    this.addressType = b.addressType;
    this.blockMinTxFee = b.blockMinTxFee;
    this.minRelayTxFee = b.minRelayTxFee;
  }

  /**
   * Renders the config file.
   *
   * @param out destination
   * @throws IOException if writing fails
   */
  public abstract void writeInto(Writer out) throws IOException;

  /**
   * Name of the config file inside the datadir.
   */
  public abstract String fileName();

  protected abstract long defaultVersion();

  /**
   * @return the configured version, or the daemon's default when unset
   */
  public long effectiveVersion() {
    return version > 0 ? version : defaultVersion();
  }

  /**
   * Writes the general node settings ({@code debug} through {@code txindex}).
   */
  protected void writeNodeSettings(final ConfigLines lines) throws IOException {
    lines.flag("debug", debug)
        .flag("printtoconsole", printToConsole)
        .flag("daemon", daemon)
        .flag("listen", listen)
        .putIfPresent("port", port)
        .flag("txindex", txindex);
  }

  protected void writeConnect(final ConfigLines lines) throws IOException {
    for (final String c : connect) {
      lines.put("connect", c);
    }
  }

  protected void writeRpcSettings(final ConfigLines lines) throws IOException {
    if (rpc.serverEnabled()) {
      lines.put("server", "1");
    }
    lines.putIfPresent("rpccookiefile", rpc.cookieFile())
        .putIfPresent("rpcport", rpc.port())
        .putIfPresent("rpcuser", rpc.user())
        .putIfPresent("rpcpassword", rpc.password());
  }

  protected void writeFeeSettings(final ConfigLines lines) throws IOException {
    lines.putIfPresent("addresstype", addressType)
        .decimalIfPresent("blockmintxfee", blockMinTxFee)
        .decimalIfPresent("minrelaytxfee", minRelayTxFee);
  }

  protected static boolean isHex(final String s) {
    return s != null && HEX.matcher(s).matches();
  }

  public long version() {
    return version;
  }

  public Path datadir() {
    return datadir;
  }

  public RpcSettings rpc() {
    return rpc;
  }

  public List<String> connect() {
    return connect;
  }

  /**
   * Builder for the shared settings.
   *
   * @param <B> concrete builder type
   */
  public abstract static class Builder<B extends Builder<B>> {

    private long version;
    private Path datadir;
    private boolean debug;
    private boolean printToConsole;
    private boolean daemon;
    private boolean listen;
    private Integer port;
    private boolean txindex;
    private final List<String> connect = new ArrayList<>();
    private String rpcCookie;
    private Integer rpcPort;
    private String rpcUser;
    private String rpcPass;
    private String addressType;
    private Double blockMinTxFee;
    private Double minRelayTxFee;

    protected abstract B self();

    public B version(final long version) {
      this.version = version;
      return self();
    }

    public B datadir(final Path datadir) {
      this.datadir = datadir;
      return self();
    }

    public B debug(final boolean debug) {
      this.debug = debug;
      return self();
    }

    public B printToConsole(final boolean printToConsole) {
      this.printToConsole = printToConsole;
      return self();
    }

    public B daemon(final boolean daemon) {
      this.daemon = daemon;
      return self();
    }

    public B listen(final boolean listen) {
      this.listen = listen;
      return self();
    }

    public B port(final Integer port) {
      this.port = port;
      return self();
    }

    public B txindex(final boolean txindex) {
      this.txindex = txindex;
      return self();
    }

    public B connect(final String peer) {
      Validate.notBlank(peer, "peer must not be blank");
      this.connect.add(peer);
      return self();
    }

    public B rpcCookie(final String rpcCookie) {
      this.rpcCookie = rpcCookie;
      return self();
    }

    public B rpcPort(final Integer rpcPort) {
      this.rpcPort = rpcPort;
      return self();
    }

    public B rpcUser(final String rpcUser) {
      this.rpcUser = rpcUser;
      return self();
    }

    public B rpcPass(final String rpcPass) {
      this.rpcPass = rpcPass;
      return self();
    }

    public B addressType(final String addressType) {
      this.addressType = addressType;
      return self();
    }

    public B blockMinTxFee(final Double blockMinTxFee) {
      this.blockMinTxFee = blockMinTxFee;
      return self();
    }

    public B minRelayTxFee(final Double minRelayTxFee) {
      this.minRelayTxFee = minRelayTxFee;
      return self();
    }
  }
}
