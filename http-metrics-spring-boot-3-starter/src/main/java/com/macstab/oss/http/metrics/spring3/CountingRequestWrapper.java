/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.spring3;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import com.macstab.oss.http.metrics.RequestObservation;

import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;

/**
 * Request wrapper that reports every body byte the application consumes to the request's {@link
 * RequestObservation}.
 *
 * <p>Bytes are counted as they are read; nothing is buffered. Bodies the container consumes on its
 * own (form parameters) bypass the wrapper; {@link HttpMetricsFilter} falls back to the declared
 * {@code Content-Length} for those.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
final class CountingRequestWrapper extends HttpServletRequestWrapper {

  private final RequestObservation observation;

  private ServletInputStream inputStream;
  private BufferedReader reader;

  CountingRequestWrapper(final HttpServletRequest request, final RequestObservation observation) {
    super(request);
    this.observation = observation;
  }

  @Override
  public ServletInputStream getInputStream() throws IOException {
    if (reader != null) {
      throw new IllegalStateException("getReader() has already been called for this request");
    }
    if (inputStream == null) {
      inputStream = new CountingInputStream(super.getInputStream(), observation);
    }
    return inputStream;
  }

  @Override
  public BufferedReader getReader() throws IOException {
    if (inputStream != null) {
      throw new IllegalStateException("getInputStream() has already been called for this request");
    }
    if (reader == null) {
      final String encoding = getCharacterEncoding();
      final Charset charset =
          encoding != null ? Charset.forName(encoding) : StandardCharsets.ISO_8859_1;
      reader =
          new BufferedReader(
              new InputStreamReader(
                  new CountingInputStream(super.getInputStream(), observation), charset));
    }
    return reader;
  }

  /** Counting delegate; non-blocking read listeners pass through untouched. */
  private static final class CountingInputStream extends ServletInputStream {

    private final ServletInputStream delegate;
    private final RequestObservation observation;

    CountingInputStream(final ServletInputStream delegate, final RequestObservation observation) {
      this.delegate = delegate;
      this.observation = observation;
    }

    @Override
    public int read() throws IOException {
      final int b = delegate.read();
      if (b >= 0) {
        observation.addRequestBodyBytes(1);
      }
      return b;
    }

    @Override
    public int read(final byte[] b, final int off, final int len) throws IOException {
      final int n = delegate.read(b, off, len);
      if (n > 0) {
        observation.addRequestBodyBytes(n);
      }
      return n;
    }

    @Override
    public int readLine(final byte[] b, final int off, final int len) throws IOException {
      final int n = delegate.readLine(b, off, len);
      if (n > 0) {
        observation.addRequestBodyBytes(n);
      }
      return n;
    }

    @Override
    public int available() throws IOException {
      return delegate.available();
    }

    @Override
    public void close() throws IOException {
      delegate.close();
    }

    @Override
    public boolean isFinished() {
      return delegate.isFinished();
    }

    @Override
    public boolean isReady() {
      return delegate.isReady();
    }

    @Override
    public void setReadListener(final ReadListener readListener) {
      delegate.setReadListener(readListener);
    }
  }
}
