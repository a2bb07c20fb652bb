package com.consullo.daemon.runner;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for line splitting and failure handling of the reader loop, run on the calling thread.
 *
 * @since 1.0
 */
public class StreamReaderLoopTest {

  private static List<String> drain(final byte[] data) {
    final RuntimeData<List<String>> runtime = new RuntimeData<>(new ArrayList<>());
    final StreamReaderLoop<List<String>> loop = new StreamReaderLoop<>(
        "test-loop", new ByteArrayInputStream(data), runtime, List::add, Duration.ZERO);
    loop.run();
    return runtime.withState(lines -> List.copyOf(lines));
  }

  @Test
  @DisplayName("Should split on LF and CRLF and keep a final unterminated line")
  void run_MixedTerminators_SplitsLines() {
    final byte[] data = "a\nb\r\nc".getBytes(StandardCharsets.UTF_8);

    assertThat(drain(data)).containsExactly("a", "b", "c");
  }

  @Test
  @DisplayName("Should keep a bare carriage return inside the line")
  void run_BareCarriageReturn_NotALineTerminator() {
    final byte[] data = "progress 10%\rprogress 20%\n".getBytes(StandardCharsets.UTF_8);

    assertThat(drain(data)).containsExactly("progress 10%\rprogress 20%");
  }

  @Test
  @DisplayName("Should strip only one carriage return before LF")
  void run_DoubleCarriageReturn_StripsOne() {
    final byte[] data = "x\r\r\n".getBytes(StandardCharsets.UTF_8);

    assertThat(drain(data)).containsExactly("x\r");
  }

  @Test
  @DisplayName("Should decode multi-byte UTF-8 text")
  void run_Utf8Text_DeliveredIntact() {
    final byte[] data = "blöck ✓\n".getBytes(StandardCharsets.UTF_8);

    assertThat(drain(data)).containsExactly("blöck ✓");
  }

  @Test
  @DisplayName("Should stop delivering lines at undecodable input")
  void run_MalformedUtf8_LoopRetires() {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(new byte[] { (byte) 0xff, (byte) 0xfe, '\n' });
    out.writeBytes("after\n".getBytes(StandardCharsets.UTF_8));

    assertThat(drain(out.toByteArray())).isEmpty();
  }

  @Test
  @DisplayName("Should deliver every line read before undecodable input")
  void run_MalformedLineAfterValidLines_ValidLinesDelivered() {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes("READY\nok2\n".getBytes(StandardCharsets.UTF_8));
    out.writeBytes(new byte[] { (byte) 0xff, '\n' });
    out.writeBytes("after\n".getBytes(StandardCharsets.UTF_8));

    assertThat(drain(out.toByteArray())).containsExactly("READY", "ok2");
  }

  @Test
  @DisplayName("Should deliver nothing for an empty stream")
  void run_EmptyStream_NoLines() {
    assertThat(drain(new byte[0])).isEmpty();
  }

  @Test
  @DisplayName("Should deliver empty lines")
  void run_BlankLines_Delivered() {
    assertThat(drain("\n\nx\n".getBytes(StandardCharsets.UTF_8))).containsExactly("", "", "x");
  }
}
