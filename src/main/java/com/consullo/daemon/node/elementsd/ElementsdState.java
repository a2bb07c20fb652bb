package com.consullo.daemon.node.elementsd;

import com.consullo.daemon.node.NodeState;
import java.util.Optional;

/**
 * Node state plus the last chain tip seen on stdout.
 *
 * @since 1.0
 */
public final class ElementsdState extends NodeState {

  private UpdateTip lastUpdateTip;

  public Optional<UpdateTip> lastUpdateTip() {
    return Optional.ofNullable(lastUpdateTip);
  }

  public void setLastUpdateTip(final UpdateTip tip) {
    this.lastUpdateTip = tip;
  }
}
