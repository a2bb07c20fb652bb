package com.consullo.daemon.runner;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.lang.ref.WeakReference;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains one output pipe of a daemon line by line into the shared state.
 *
 * <p>The loop has no cancellation signal. It retires when the pipe reports end-of-stream, which normally happens
 * when the process exits. A decode or read failure retires the loop early: the failure is logged, the state simply
 * stops receiving lines from this stream, and the process and the other loop are unaffected.
 *
 * <p>Lines are split on LF and decoded one at a time as strict UTF-8, so every line before an undecodable one is
 * delivered.
 *
 * <p>The loop only weakly references the runtime record, so a running loop does not keep an abandoned runner's
 * process handle reachable.
 *
 * @param <S> daemon-defined state type
 * @since 1.0
 */
final class StreamReaderLoop<S> implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamReaderLoop.class);

  private static final int LF = '\n';
  private static final int CR = '\r';

  private final String name;
  private final InputStream pipe;
  private final WeakReference<RuntimeData<S>> runtime;
  private final BiConsumer<S, String> handler;
  private final Duration startDelay;

  StreamReaderLoop(
      final String name,
      final InputStream pipe,
      final RuntimeData<S> runtime,
      final BiConsumer<S, String> handler,
      final Duration startDelay) {
    this.name = name;
    this.pipe = pipe;
    this.runtime = new WeakReference<>(runtime);
    this.handler = handler;
    this.startDelay = startDelay;
  }

  /**
   * Wraps the loop in an unstarted daemon thread.
   *
   * @return thread
   */
  Thread newThread() {
    final Thread t = new Thread(this, name);
    t.setDaemon(true);
    return t;
  }

  @Override
  public void run() {
    if (!startDelay.isZero()) {
      try {
        Thread.sleep(startDelay.toMillis());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        LOGGER.warn("{} interrupted before first read", name);
        return;
      }
    }

    final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);

    try (InputStream in = new BufferedInputStream(pipe)) {
      final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
      byte[] raw;
      while ((raw = readLine(in, buffer)) != null) {
        final String line = decoder.decode(ByteBuffer.wrap(raw)).toString();
        if (!deliver(line)) {
          LOGGER.trace("{} stopped: runtime record released", name);
          return;
        }
      }
    } catch (final CharacterCodingException e) {
      LOGGER.warn("{} stopped: {} ({})", name, ErrorKind.DECODE_FAILURE, e.toString());
      return;
    } catch (final IOException e) {
      LOGGER.warn("{} stopped: {} ({})", name, ErrorKind.IO_FAILURE, e.toString());
      return;
    }
    LOGGER.trace("{} stopped", name);
  }

  /**
   * Reads the bytes of one line. Only LF terminates a line; a single CR right before it is dropped. A final
   * unterminated line is returned at end of stream.
   *
   * @return line bytes without terminator, or null at end of stream
   */
  private static byte[] readLine(final InputStream in, final ByteArrayOutputStream buffer) throws IOException {
    buffer.reset();
    int b;
    while ((b = in.read()) != -1) {
      if (b == LF) {
        return stripCr(buffer.toByteArray());
      }
      buffer.write(b);
    }
    return buffer.size() == 0 ? null : stripCr(buffer.toByteArray());
  }

  private static byte[] stripCr(final byte[] line) {
    if (line.length > 0 && line[line.length - 1] == CR) {
      return Arrays.copyOf(line, line.length - 1);
    }
    return line;
  }

  private boolean deliver(final String line) {
    final RuntimeData<S> rt = runtime.get();
    if (rt == null) {
      return false;
    }
    try {
      rt.applyLine(handler, line);
    } catch (final RuntimeException e) {
      LOGGER.warn("{}: line handler failed, line discarded: {}", name, e.toString());
    }
    return true;
  }
}
