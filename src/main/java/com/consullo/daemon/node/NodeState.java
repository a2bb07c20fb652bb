package com.consullo.daemon.node;

/**
 * Output state accumulated for a node daemon: every stderr line, in arrival order.
 *
 * <p>Not thread-safe on its own; the runner only touches it under the runtime record lock.
 *
 * @since 1.0
 */
public class NodeState {

  private final StringBuilder stderr = new StringBuilder();

  public void appendStderr(final String line) {
    stderr.append(line).append('\n');
  }

  /**
   * Returns the accumulated stderr text and clears the buffer.
   *
   * @return stderr lines, each newline-terminated
   */
  public String takeStderr() {
    final String out = stderr.toString();
    stderr.setLength(0);
    return out;
  }

  public String stderr() {
    return stderr.toString();
  }
}
