package com.consullo.daemon.node.elementsd;

import com.consullo.daemon.node.ConfigLines;
import com.consullo.daemon.node.NodeConfig;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.commons.lang3.Validate;

/**
 * Elements ({@code elementsd}) configuration, rendered to {@code elements.conf}.
 *
 * <p>Version-dependent format:
 * <ul>
 * <li>a {@code [chain]} section header from 0.17 on</li>
 * <li>concatenated {@code pak=<online><offline>} entries from dynafed (0.18.1) on, colon-separated before</li>
 * <li>legacy Liquid releases (2.x, 3.x) use neither</li>
 * </ul>
 *
 * @since 1.0
 */
public final class ElementsdConfig extends NodeConfig {

  public static final String CONFIG_FILENAME = "elements.conf";

  /** Older Liquid nodes were released as 2.x.x and 3.x.x versions. */
  public static final long OLD_LIQUID_VERSION = 2_00_00_00L;

  /** The dynafed activation version. */
  public static final long DYNAFED_VERSION = 18_01_00L;

  public static final long DEFAULT_VERSION = 18_01_00L;

  private static final long SECTIONS_VERSION = 17_00_00L;

  private final String chain;
  private final boolean validatePegin;
  private final String signBlockScript;
  private final Integer conMaxBlockSigSize;
  private final String fedpegScript;
  private final List<PakPair> pakPubkeys;
  private final Long conDynaDeployStart;
  private final Long conNMinerConfirmationWindow;
  private final Long conNRuleChangeActivationThreshold;
  private final String mainchainRpcHost;
  private final Integer mainchainRpcPort;
  private final String mainchainRpcUser;
  private final String mainchainRpcPass;

  private ElementsdConfig(final Builder b) {
    super(b);
    Validate.notBlank(b.chain, "chain must not be blank");
    Validate.isTrue(b.signBlockScript == null || isHex(b.signBlockScript), "signBlockScript must be hex");
    Validate.isTrue(b.fedpegScript == null || isHex(b.fedpegScript), "fedpegScript must be hex");
    this.chain = b.chain;
    this.validatePegin = b.validatePegin;
    this.signBlockScript = lower(b.signBlockScript);
    this.conMaxBlockSigSize = b.conMaxBlockSigSize;
    this.fedpegScript = lower(b.fedpegScript);
    this.pakPubkeys = List.copyOf(b.pakPubkeys);
    this.conDynaDeployStart = b.conDynaDeployStart;
    this.conNMinerConfirmationWindow = b.conNMinerConfirmationWindow;
    this.conNRuleChangeActivationThreshold = b.conNRuleChangeActivationThreshold;
    this.mainchainRpcHost = b.mainchainRpcHost;
    this.mainchainRpcPort = b.mainchainRpcPort;
    this.mainchainRpcUser = b.mainchainRpcUser;
    this.mainchainRpcPass = b.mainchainRpcPass;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String chain() {
    return chain;
  }

  public boolean validatePegin() {
    return validatePegin;
  }

  public List<PakPair> pakPubkeys() {
    return pakPubkeys;
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
    final boolean modern = version < OLD_LIQUID_VERSION;
    final ConfigLines lines = new ConfigLines(out);

    lines.put("datadir", datadir());
    lines.put("chain", chain);
    if (version >= SECTIONS_VERSION && modern) {
      lines.section(chain);
    }

    writeNodeSettings(lines);

    lines.putIfPresent("signblockscript", signBlockScript)
        .putIfPresent("con_max_block_sig_size", conMaxBlockSigSize)
        .putIfPresent("fedpegscript", fedpegScript);
    for (final PakPair pair : pakPubkeys) {
      if (version >= DYNAFED_VERSION && modern) {
        lines.put("pak", pair.online() + pair.offline());
      } else {
        lines.put("pak", pair.online() + ":" + pair.offline());
      }
    }
    lines.putIfPresent("con_dyna_deploy_start", conDynaDeployStart)
        .putIfPresent("con_nminerconfirmationwindow", conNMinerConfirmationWindow)
        .putIfPresent("con_nrulechangeactivationthreshold", conNRuleChangeActivationThreshold);

    writeConnect(lines);
    writeRpcSettings(lines);

    lines.flag("validatepegin", validatePegin);
    if (validatePegin) {
      lines.putIfPresent("mainchainrpchost", mainchainRpcHost)
          .putIfPresent("mainchainrpcport", mainchainRpcPort)
          .putIfPresent("mainchainrpcuser", mainchainRpcUser)
          .putIfPresent("mainchainrpcpassword", mainchainRpcPass);
    }

    writeFeeSettings(lines);
    lines.flush();
  }

  private static String lower(final String hex) {
    return hex == null ? null : hex.toLowerCase(Locale.ROOT);
  }

  public static final class Builder extends NodeConfig.Builder<Builder> {

    private String chain;
    private boolean validatePegin;
    private String signBlockScript;
    private Integer conMaxBlockSigSize;
    private String fedpegScript;
    private final List<PakPair> pakPubkeys = new ArrayList<>();
    private Long conDynaDeployStart;
    private Long conNMinerConfirmationWindow;
    private Long conNRuleChangeActivationThreshold;
    private String mainchainRpcHost;
    private Integer mainchainRpcPort;
    private String mainchainRpcUser;
    private String mainchainRpcPass;

    private Builder() {
    }

    @Override
    protected Builder self() {
      return this;
    }

    public Builder chain(final String chain) {
      this.chain = chain;
      return this;
    }

    public Builder validatePegin(final boolean validatePegin) {
      this.validatePegin = validatePegin;
      return this;
    }

    public Builder signBlockScript(final String hex) {
      this.signBlockScript = hex;
      return this;
    }

    public Builder conMaxBlockSigSize(final Integer size) {
      this.conMaxBlockSigSize = size;
      return this;
    }

    public Builder fedpegScript(final String hex) {
      this.fedpegScript = hex;
      return this;
    }

    public Builder pak(final PakPair pair) {
      Validate.notNull(pair, "pair must not be null");
      this.pakPubkeys.add(pair);
      return this;
    }

    public Builder conDynaDeployStart(final Long height) {
      this.conDynaDeployStart = height;
      return this;
    }

    public Builder conNMinerConfirmationWindow(final Long window) {
      this.conNMinerConfirmationWindow = window;
      return this;
    }

    public Builder conNRuleChangeActivationThreshold(final Long threshold) {
      this.conNRuleChangeActivationThreshold = threshold;
      return this;
    }

    public Builder mainchainRpcHost(final String host) {
      this.mainchainRpcHost = host;
      return this;
    }

    public Builder mainchainRpcPort(final Integer port) {
      this.mainchainRpcPort = port;
      return this;
    }

    public Builder mainchainRpcUser(final String user) {
      this.mainchainRpcUser = user;
      return this;
    }

    public Builder mainchainRpcPass(final String pass) {
      this.mainchainRpcPass = pass;
      return this;
    }

    public ElementsdConfig build() {
      return new ElementsdConfig(this);
    }
  }
}
