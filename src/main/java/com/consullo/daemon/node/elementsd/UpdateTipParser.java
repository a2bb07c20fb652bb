package com.consullo.daemon.node.elementsd;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recognizes {@code UpdateTip: new best=<hash> height=<n> version=...} log lines.
 *
 * @since 1.0
 */
public final class UpdateTipParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(UpdateTipParser.class);

  private static final Pattern UPDATE_TIP =
      Pattern.compile(".*UpdateTip: new best=([0-9a-f]+) height=([0-9]+) version=.*$");

  private static final int BLOCK_HASH_HEX_LENGTH = 64;

  private static final long MAX_HEIGHT = 0xFFFF_FFFFL;

  private UpdateTipParser() {
  }

  /**
   * Parses a log line.
   *
   * @param line log line
   * @return the announced tip, empty if the line is not a well-formed UpdateTip line
   */
  public static Optional<UpdateTip> parse(final String line) {
    if (line == null) {
      return Optional.empty();
    }
    final Matcher m = UPDATE_TIP.matcher(line);
    if (!m.matches()) {
      return Optional.empty();
    }

    final String hash = m.group(1);
    if (hash.length() != BLOCK_HASH_HEX_LENGTH) {
      LOGGER.warn("invalid blockhash in UpdateTip: {}", hash);
      return Optional.empty();
    }
    final long height;
    try {
      height = Long.parseLong(m.group(2));
    } catch (final NumberFormatException e) {
      LOGGER.warn("invalid height in UpdateTip: {}", m.group(2));
      return Optional.empty();
    }
    if (height > MAX_HEIGHT) {
      LOGGER.warn("invalid height in UpdateTip: {}", height);
      return Optional.empty();
    }
    return Optional.of(new UpdateTip(height, hash));
  }
}
