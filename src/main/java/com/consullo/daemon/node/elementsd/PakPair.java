package com.consullo.daemon.node.elementsd;

import java.util.regex.Pattern;

/**
 * Pegout authorization key pair ({@code pak=} entry).
 *
 * @param online online public key, hex
 * @param offline offline public key, hex
 * @since 1.0
 */
public record PakPair(String online, String offline) {

  private static final Pattern PUBKEY = Pattern.compile("^(?:[0-9a-fA-F]{66}|[0-9a-fA-F]{130})$");

  public PakPair {
    if (online == null || !PUBKEY.matcher(online).matches()) {
      throw new IllegalArgumentException("online must be a hex public key: " + online);
    }
    if (offline == null || !PUBKEY.matcher(offline).matches()) {
      throw new IllegalArgumentException("offline must be a hex public key: " + offline);
    }
  }
}
