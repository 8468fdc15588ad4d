/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.spring3;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.WriteListener;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;

/**
 * Response wrapper that counts body bytes written through {@link #getOutputStream()} and {@link
 * #getWriter()}.
 *
 * <p>Nothing is buffered: every write goes straight to the container's stream or writer, so
 * commit, flush and streaming behave as without the wrapper. Writer output is counted in encoded
 * bytes of the response charset.
 *
 * <p><strong>Fallback:</strong> when nothing passed through the wrapper (error pages rendered by
 * the container, {@code sendfile}), {@link #getBodyBytes()} reports the {@code Content-Length}
 * header if one was set.
 *
 * <p><strong>Thread Safety:</strong> the counter is atomic; async handlers may write from another
 * thread than the one that reads the count.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
final class CountingResponseWrapper extends HttpServletResponseWrapper {

  private final AtomicLong bytesWritten = new AtomicLong();

  private ServletOutputStream outputStream;
  private PrintWriter writer;

  CountingResponseWrapper(final HttpServletResponse response) {
    super(response);
  }

  @Override
  public ServletOutputStream getOutputStream() throws IOException {
    if (outputStream == null) {
      outputStream = new CountingOutputStream(super.getOutputStream(), bytesWritten);
    }
    return outputStream;
  }

  @Override
  public PrintWriter getWriter() throws IOException {
    if (writer == null) {
      final String encoding = getCharacterEncoding();
      final Charset charset =
          encoding != null ? Charset.forName(encoding) : StandardCharsets.ISO_8859_1;
      writer = new PrintWriter(new CountingWriter(super.getWriter(), charset, bytesWritten));
    }
    return writer;
  }

  /**
   * Body bytes written so far, or the declared {@code Content-Length} if nothing was written
   * through the wrapper.
   *
   * @return response body size in bytes
   */
  long getBodyBytes() {
    final long counted = bytesWritten.get();
    if (counted > 0) {
      return counted;
    }
    final String contentLength = getHeader("Content-Length");
    if (contentLength == null) {
      return 0;
    }
    try {
      return Math.max(0, Long.parseLong(contentLength.trim()));
    } catch (final NumberFormatException e) {
      return 0;
    }
  }

  private static final class CountingOutputStream extends ServletOutputStream {

    private final ServletOutputStream delegate;
    private final AtomicLong counter;

    CountingOutputStream(final ServletOutputStream delegate, final AtomicLong counter) {
      this.delegate = delegate;
      this.counter = counter;
    }

    @Override
    public void write(final int b) throws IOException {
      delegate.write(b);
      counter.incrementAndGet();
    }

    @Override
    public void write(final byte[] b, final int off, final int len) throws IOException {
      delegate.write(b, off, len);
      counter.addAndGet(len);
    }

    @Override
    public void flush() throws IOException {
      delegate.flush();
    }

    @Override
    public void close() throws IOException {
      delegate.close();
    }

    @Override
    public boolean isReady() {
      return delegate.isReady();
    }

    @Override
    public void setWriteListener(final WriteListener writeListener) {
      delegate.setWriteListener(writeListener);
    }
  }

  /** Counts encoded bytes; a surrogate pair split across two writes is counted per half. */
  private static final class CountingWriter extends Writer {

    private final PrintWriter delegate;
    private final Charset charset;
    private final AtomicLong counter;

    CountingWriter(final PrintWriter delegate, final Charset charset, final AtomicLong counter) {
      this.delegate = delegate;
      this.charset = charset;
      this.counter = counter;
    }

    @Override
    public void write(final char[] cbuf, final int off, final int len) throws IOException {
      delegate.write(cbuf, off, len);
      counter.addAndGet(charset.encode(CharBuffer.wrap(cbuf, off, len)).remaining());
    }

    @Override
    public void write(final String str, final int off, final int len) throws IOException {
      delegate.write(str, off, len);
      counter.addAndGet(str.substring(off, off + len).getBytes(charset).length);
    }

    @Override
    public void flush() throws IOException {
      delegate.flush();
    }

    @Override
    public void close() throws IOException {
      delegate.close();
    }
  }
}
