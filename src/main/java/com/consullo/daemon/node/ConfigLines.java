package com.consullo.daemon.node;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;

/**
 * Writes {@code key=value} lines of a node config file.
 *
 * @since 1.0
 */
public final class ConfigLines {

  private final Writer out;

  public ConfigLines(final Writer out) {
    if (out == null) {
      throw new IllegalArgumentException("out must not be null.");
    }
    this.out = out;
  }

  public ConfigLines put(final String key, final Object value) throws IOException {
    out.write(key);
    out.write('=');
    out.write(String.valueOf(value));
    out.write('\n');
    return this;
  }

  /**
   * Writes a boolean as {@code 0} or {@code 1}.
   */
  public ConfigLines flag(final String key, final boolean value) throws IOException {
    return put(key, value ? "1" : "0");
  }

  /**
   * Writes the line only when the value is non-null.
   */
  public ConfigLines putIfPresent(final String key, final Object value) throws IOException {
    if (value != null) {
      put(key, value);
    }
    return this;
  }

  /**
   * Writes a decimal in plain notation ({@code 0.00001}, never {@code 1.0E-5}) when the value is non-null.
   */
  public ConfigLines decimalIfPresent(final String key, final Double value) throws IOException {
    if (value != null) {
      put(key, BigDecimal.valueOf(value).stripTrailingZeros().toPlainString());
    }
    return this;
  }

  public ConfigLines section(final String name) throws IOException {
    out.write('[');
    out.write(name);
    out.write("]\n");
    return this;
  }

  public void flush() throws IOException {
    out.flush();
  }
}
