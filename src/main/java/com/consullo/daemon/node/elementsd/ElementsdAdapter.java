package com.consullo.daemon.node.elementsd;

import com.consullo.daemon.node.NodeAdapter;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hooks for {@code elementsd}: tracks the chain tip from stdout and collects stderr.
 *
 * @since 1.0
 */
public final class ElementsdAdapter extends NodeAdapter<ElementsdConfig, ElementsdState> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ElementsdAdapter.class);

  public ElementsdAdapter(final String name, final Path executable, final ElementsdConfig config) {
    super(name, executable, config);
  }

  @Override
  protected String kind() {
    return "elementsd";
  }

  @Override
  public ElementsdState initialState() {
    return new ElementsdState();
  }

  @Override
  public void handleStdoutLine(final ElementsdState state, final String line) {
    final Optional<UpdateTip> tip = UpdateTipParser.parse(line);
    if (tip.isPresent()) {
      LOGGER.trace("Setting new elementsd tip: {}", tip.get());
      state.setLastUpdateTip(tip.get());
    }
  }
}
