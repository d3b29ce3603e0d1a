/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

/**
 * Instrumented by {@link LineSender} and the HTTP transports, so that callers can see how many
 * rows were written, sent and lost.
 *
 * <p>See {@link InMemorySenderMetrics} for a simple implementation. The
 * {@code ilp-sender-metrics-micrometer} module binds these to a Micrometer registry.
 */
public interface SenderMetrics {

  /** Increments the count of rows closed with {@code at} or {@code atNow}. */
  void incrementRows(int quantity);

  /** Increments the count of encoded bytes of closed rows. */
  void incrementRowBytes(int quantity);

  /**
   * Increments count of flushes that handed data to the transport, whether or not they succeeded.
   * An empty buffer doesn't count.
   */
  void incrementFlushes();

  /** Increments the count of bytes in flushes that succeeded. */
  void incrementFlushBytes(int quantity);

  /**
   * Increments count of flushes that failed. Ex host unavailable, peer disconnect or a rejected
   * request.
   */
  void incrementFlushesFailed(Throwable cause);

  /** Increments the count of HTTP request attempts repeated after a transient failure. */
  void incrementRetries();

  /**
   * Increments the count of rows dropped for any reason. For example, a failed flush, a
   * {@code reset} or closing with rows still buffered.
   */
  void incrementRowsDropped(int quantity);

  /** Updates the count of complete rows buffered, following a row or flush. */
  void updateBufferedRows(int update);

  /** Updates the count of bytes buffered, following a row or flush. */
  void updateBufferedBytes(int update);

  SenderMetrics NOOP_METRICS = new SenderMetrics() {

    @Override public void incrementRows(int quantity) {
    }

    @Override public void incrementRowBytes(int quantity) {
    }

    @Override public void incrementFlushes() {
    }

    @Override public void incrementFlushBytes(int quantity) {
    }

    @Override public void incrementFlushesFailed(Throwable cause) {
    }

    @Override public void incrementRetries() {
    }

    @Override public void incrementRowsDropped(int quantity) {
    }

    @Override public void updateBufferedRows(int update) {
    }

    @Override public void updateBufferedBytes(int update) {
    }

    @Override public String toString() {
      return "NoOpSenderMetrics";
    }
  };
}
