/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

import ilp.sender.internal.RowBuffer;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import static ilp.sender.internal.Throwables.propagateIfFatal;
import static java.lang.String.format;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * Writes rows in InfluxDB Line Protocol, and sends them in batches over a {@link Transport}.
 *
 * <h3>Usage</h3>
 *
 * <pre>{@code
 * try (LineSender sender = LineSender.fromConfig("http::addr=localhost:9000;")) {
 *   sender.table("trades")
 *     .symbol("symbol", "ETH-USD")
 *     .doubleColumn("price", 2615.54)
 *     .at(Instant.now());
 *   sender.flush();
 * }
 * }</pre>
 *
 * <p>A row starts with {@link #table(String)}, continues with symbols and then columns, and ends
 * with {@link #at(long, TimeUnit)} or {@link #atNow()}. Calls out of that order fail with {@link
 * ProtocolOrderException}. A call that fails leaves rows written before it intact.
 *
 * <p>When a row is closed, the sender flushes if {@code auto_flush_rows} rows are pending, or if
 * {@code auto_flush_interval} elapsed since the last successful flush. There is no background
 * thread: an idle sender doesn't flush until the next row or an explicit {@link #flush()}.
 *
 * <h3>Implementation Notes</h3>
 *
 * <p>This type is not thread-safe and must be used by one thread at a time. To write from several
 * threads, create a sender per thread. {@link #close()} does not flush: pending rows are dropped.
 */
public final class LineSender implements Closeable {
  public static final int DEFAULT_AUTO_FLUSH_INTERVAL = 1000;

  /** Creates a sender from a configuration string, such as {@code tcp::addr=localhost:9009;}. */
  public static LineSender fromConfig(String config) {
    return create(SenderOptions.parse(config));
  }

  /** Like {@link #fromConfig(String)}, reading the {@code QDB_CLIENT_CONF} environment variable. */
  public static LineSender fromEnv() {
    return create(SenderOptions.fromEnv());
  }

  /**
   * Creates a sender and its transport. HTTP transports are looked up with {@link
   * HttpTransportFactory#load(SenderOptions)}. TCP senders must be {@link #connect() connected}
   * before rows are flushed.
   *
   * <p>Unless {@code protocol_version} is set, HTTP senders ask the server which version to use
   * before returning.
   *
   * @throws LineSenderException if the protocol version could not be resolved
   */
  public static LineSender create(SenderOptions options) {
    Transport transport = options.protocol().isHttp()
      ? HttpTransportFactory.load(options)
      : TcpTransport.create(options);
    try {
      Builder builder = newBuilder(transport).options(options);
      if (options.protocolVersion() == null) {
        builder.protocolVersion(transport.negotiateProtocolVersion());
      }
      return builder.build();
    } catch (IOException e) {
      transport.close();
      throw new LineSenderException(
        "Could not resolve the protocol version of " + transport + ": " + e.getMessage(), e);
    } catch (RuntimeException | Error e) {
      transport.close();
      throw e;
    }
  }

  public static Builder newBuilder(Transport transport) {
    return new Builder(transport);
  }

  public static final class Builder {
    final Transport transport;
    BufferMode bufferMode = BufferMode.COPY_ON_FLUSH;
    ProtocolVersion protocolVersion = ProtocolVersion.V1;
    boolean autoFlush = true;
    int autoFlushRows;
    int autoFlushInterval = DEFAULT_AUTO_FLUSH_INTERVAL;
    int initBufferSize = RowBuffer.DEFAULT_INIT_BUF_SIZE;
    int maxBufferSize = RowBuffer.DEFAULT_MAX_BUF_SIZE;
    int maxNameLength = RowBuffer.DEFAULT_MAX_NAME_LEN;
    SenderMetrics metrics = SenderMetrics.NOOP_METRICS;
    Logger logger = Logger.getLogger(LineSender.class.getName());
    Clock clock = Clock.systemUTC();

    Builder(Transport transport) {
      if (transport == null) throw new NullPointerException("transport == null");
      this.transport = transport;
      this.autoFlushRows = transport.defaultAutoFlushRows();
    }

    /** Applies the flush policy, buffer and name length settings of a configuration string. */
    public Builder options(SenderOptions options) {
      if (options == null) throw new NullPointerException("options == null");
      autoFlush = options.autoFlush();
      if (options.autoFlushRows() != -1) autoFlushRows = options.autoFlushRows();
      if (options.autoFlushInterval() != -1) autoFlushInterval = options.autoFlushInterval();
      if (options.initBufferSize() != -1) initBufferSize = options.initBufferSize();
      if (options.maxBufferSize() != -1) maxBufferSize = options.maxBufferSize();
      if (options.maxNameLength() != -1) maxNameLength = options.maxNameLength();
      bufferMode = options.bufferMode();
      if (options.protocolVersion() != null) protocolVersion = options.protocolVersion();
      return this;
    }

    /**
     * Default {@link ProtocolVersion#V1}. {@link ProtocolVersion#V2} writes doubles in binary and
     * allows {@linkplain LineSender#arrayColumn(String, double[]) arrays}.
     */
    public Builder protocolVersion(ProtocolVersion protocolVersion) {
      if (protocolVersion == null) throw new NullPointerException("protocolVersion == null");
      this.protocolVersion = protocolVersion;
      return this;
    }

    /** Default {@link BufferMode#COPY_ON_FLUSH}. */
    public Builder bufferMode(BufferMode bufferMode) {
      if (bufferMode == null) throw new NullPointerException("bufferMode == null");
      this.bufferMode = bufferMode;
      return this;
    }

    /** Default true. False means rows are only sent on {@link LineSender#flush()}. */
    public Builder autoFlush(boolean autoFlush) {
      this.autoFlush = autoFlush;
      return this;
    }

    /**
     * Flushes when this many rows are pending. Zero disables this trigger. Defaults to the
     * transport's {@link Transport#defaultAutoFlushRows()}: 75000 for HTTP and 600 for TCP.
     */
    public Builder autoFlushRows(int autoFlushRows) {
      if (autoFlushRows < 0) throw new IllegalArgumentException("autoFlushRows < 0");
      this.autoFlushRows = autoFlushRows;
      return this;
    }

    /**
     * Flushes when a row is closed this many milliseconds after the last successful flush. Zero
     * disables this trigger. Default 1000.
     */
    public Builder autoFlushInterval(int autoFlushIntervalMillis) {
      if (autoFlushIntervalMillis < 0) {
        throw new IllegalArgumentException("autoFlushInterval < 0");
      }
      this.autoFlushInterval = autoFlushIntervalMillis;
      return this;
    }

    /** Initial buffer size in bytes. Default 64KiB. */
    public Builder initBufferSize(int initBufferSize) {
      if (initBufferSize < 1) throw new IllegalArgumentException("initBufferSize < 1");
      this.initBufferSize = initBufferSize;
      return this;
    }

    /** Size the buffer can grow to, before rows fail with {@link BufferLimitException}. Default 100MiB. */
    public Builder maxBufferSize(int maxBufferSize) {
      if (maxBufferSize < 1) throw new IllegalArgumentException("maxBufferSize < 1");
      this.maxBufferSize = maxBufferSize;
      return this;
    }

    /** Longest table or column name accepted, in characters. Default 127. */
    public Builder maxNameLength(int maxNameLength) {
      if (maxNameLength < 1) throw new IllegalArgumentException("maxNameLength < 1");
      this.maxNameLength = maxNameLength;
      return this;
    }

    /** Aggregates and reports sender metrics to a monitoring system. Defaults to no-op. */
    public Builder metrics(SenderMetrics metrics) {
      if (metrics == null) throw new NullPointerException("metrics == null");
      this.metrics = metrics;
      return this;
    }

    /** Where flush failures and dropped rows are logged. */
    public Builder logger(Logger logger) {
      if (logger == null) throw new NullPointerException("logger == null");
      this.logger = logger;
      return this;
    }

    // visible for testing
    Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    public LineSender build() {
      return new LineSender(this);
    }
  }

  final Transport transport;
  final RowBuffer buffer;
  final boolean autoFlush;
  final int autoFlushRows, autoFlushInterval;
  final SenderMetrics metrics;
  final Logger logger;
  final Clock clock;

  long lastFlushTime;
  boolean closed;
  boolean shouldWarnException = true;

  LineSender(Builder builder) {
    buffer = new RowBuffer(builder.initBufferSize, builder.maxBufferSize, builder.maxNameLength,
      builder.bufferMode, builder.protocolVersion);
    transport = builder.transport;
    autoFlush = builder.autoFlush;
    autoFlushRows = builder.autoFlushRows;
    autoFlushInterval = builder.autoFlushInterval;
    metrics = builder.metrics;
    logger = builder.logger;
    clock = builder.clock;
    lastFlushTime = clock.millis();
  }

  /**
   * Connects the transport. TCP transports authenticate here, if a key is configured. This is a
   * no-op for HTTP.
   *
   * @throws AuthFailureException if the server didn't accept the authentication handshake
   * @throws IllegalStateException if already connected
   */
  public void connect() throws IOException {
    checkOpen();
    transport.connect();
  }

  /** Starts a row. */
  public LineSender table(String table) {
    checkOpen();
    buffer.table(table);
    return this;
  }

  /** Writes a symbol, which must come before any column of the row. */
  public LineSender symbol(String name, String value) {
    checkOpen();
    buffer.symbol(name, value);
    return this;
  }

  public LineSender stringColumn(String name, String value) {
    checkOpen();
    buffer.stringColumn(name, value);
    return this;
  }

  public LineSender boolColumn(String name, boolean value) {
    checkOpen();
    buffer.boolColumn(name, value);
    return this;
  }

  /** @throws InvalidValueException if the value is NaN or infinite */
  public LineSender doubleColumn(String name, double value) {
    checkOpen();
    buffer.doubleColumn(name, value);
    return this;
  }

  /**
   * Writes a one-dimensional array of doubles. Null writes a null value.
   *
   * @throws LineSenderException if the sender writes {@link ProtocolVersion#V1}
   */
  public LineSender arrayColumn(String name, double[] values) {
    checkOpen();
    buffer.arrayColumn(name, values);
    return this;
  }

  /** Writes a two-dimensional array of doubles, whose rows must all have the same length. */
  public LineSender arrayColumn(String name, double[][] values) {
    checkOpen();
    buffer.arrayColumn(name, values);
    return this;
  }

  /**
   * Writes an array of doubles of any shape, with values in row-major order. For example, shape
   * {@code {2, 3}} takes six values, the first three being the first row.
   */
  public LineSender arrayColumn(String name, int[] shape, double[] values) {
    checkOpen();
    buffer.arrayColumn(name, shape, values);
    return this;
  }

  public ProtocolVersion protocolVersion() {
    return buffer.protocolVersion();
  }

  public LineSender longColumn(String name, long value) {
    checkOpen();
    buffer.longColumn(name, value);
    return this;
  }

  /** Writes a timestamp column, stored with microsecond precision. */
  public LineSender timestampColumn(String name, long value, TimeUnit unit) {
    checkOpen();
    buffer.timestampColumn(name, value, unit);
    return this;
  }

  public LineSender timestampColumn(String name, Instant value) {
    checkOpen();
    buffer.timestampColumn(name, value);
    return this;
  }

  /** Closes the row with a designated timestamp in epoch nanoseconds. */
  public void at(long timestampNanos) {
    at(timestampNanos, TimeUnit.NANOSECONDS);
  }

  /**
   * Closes the row with a designated timestamp, which may trigger a flush.
   *
   * @throws InvalidTimestampException if the timestamp is negative or overflows nanoseconds
   * @throws FlushFailedException if the row triggered a flush which failed. The row itself was
   * written, and was part of the failed flush.
   */
  public void at(long timestamp, TimeUnit unit) {
    checkOpen();
    int start = buffer.endOfLastRow();
    buffer.at(timestamp, unit);
    rowClosed(start);
  }

  public void at(Instant timestamp) {
    checkOpen();
    int start = buffer.endOfLastRow();
    buffer.at(timestamp);
    rowClosed(start);
  }

  /** Closes the row without a timestamp, so that the server assigns one. */
  public void atNow() {
    checkOpen();
    int start = buffer.endOfLastRow();
    buffer.atNow();
    rowClosed(start);
  }

  void rowClosed(int start) {
    metrics.incrementRows(1);
    metrics.incrementRowBytes(buffer.endOfLastRow() - start);
    metrics.updateBufferedRows(buffer.rowCount());
    metrics.updateBufferedBytes(buffer.position());
    if (shouldAutoFlush()) flush();
  }

  boolean shouldAutoFlush() {
    if (!autoFlush) return false;
    int pending = buffer.rowCount();
    if (pending == 0) return false;
    if (autoFlushRows > 0 && pending >= autoFlushRows) return true;
    return autoFlushInterval > 0 && clock.millis() - lastFlushTime >= autoFlushInterval;
  }

  /**
   * Sends all complete rows. A row still under construction stays in the buffer.
   *
   * <p>On failure, the rows that were being sent are removed from the buffer and returned by
   * {@link FlushFailedException#unsentData()}. Whether to send them again is up to the caller.
   *
   * @return false if there was nothing to send
   * @throws FlushFailedException if the transport failed, after any retries
   */
  public boolean flush() {
    checkOpen();
    int rowCount = buffer.rowCount();
    ByteBuffer rows = buffer.toSendable();
    if (rows == null) return false;
    int length = rows.remaining();

    metrics.incrementFlushes();
    try {
      transport.send(rows.duplicate());
    } catch (Throwable t) {
      propagateIfFatal(t);
      byte[] unsent = new byte[length];
      rows.duplicate().get(unsent);
      if (buffer.bufferMode() == BufferMode.REUSE_IN_PLACE) buffer.compact();
      flushFailed(t, rowCount);
      if (t instanceof ClosedSenderException) throw (ClosedSenderException) t;
      throw new FlushFailedException(
        format("Failed to flush %s rows: %s", rowCount, describe(t)), t, unsent, rowCount);
    }

    if (buffer.bufferMode() == BufferMode.REUSE_IN_PLACE) buffer.compact();
    lastFlushTime = clock.millis();
    metrics.incrementFlushBytes(length);
    updateBufferedMetrics();
    return true;
  }

  void flushFailed(Throwable t, int rowCount) {
    metrics.incrementFlushesFailed(t);
    metrics.incrementRowsDropped(rowCount);
    updateBufferedMetrics();

    Level logLevel = FINE;
    if (shouldWarnException) {
      logger.log(WARNING, "Rows were dropped due to exceptions. "
        + "All subsequent errors will be logged at FINE level.");
      logLevel = WARNING;
      shouldWarnException = false;
    }
    if (logger.isLoggable(logLevel)) {
      logger.log(logLevel, format("Dropped %s rows due to %s", rowCount, describe(t)), t);
    }
  }

  static String describe(Throwable t) {
    return t.getClass().getSimpleName() + "(" + (t.getMessage() == null ? "" : t.getMessage())
      + ")";
  }

  void updateBufferedMetrics() {
    metrics.updateBufferedRows(buffer.rowCount());
    metrics.updateBufferedBytes(buffer.position());
  }

  /**
   * Resizes the buffer. It never shrinks below what was already written.
   *
   * @throws BufferLimitException if the size is larger than the maximum buffer size
   */
  public void resize(int newSize) {
    checkOpen();
    buffer.resize(newSize);
  }

  /** Discards all rows, including one under construction, and restarts the flush interval. */
  public void reset() {
    checkOpen();
    int dropped = buffer.rowCount();
    buffer.reset();
    lastFlushTime = clock.millis();
    metrics.incrementRowsDropped(dropped);
    updateBufferedMetrics();
  }

  /** Count of complete rows not yet flushed. */
  public int pendingRows() {
    return buffer.rowCount();
  }

  /** Bytes written and not yet flushed, including a row under construction. */
  public int bufferedBytes() {
    return buffer.position();
  }

  /** Current size of the buffer in bytes. */
  public int bufferCapacity() {
    return buffer.capacity();
  }

  /**
   * Closes the transport. Rows that weren't flushed are dropped, so call {@link #flush()} first to
   * send them. Subsequent calls are no-ops.
   */
  @Override public void close() {
    if (closed) return;
    closed = true;
    int dropped = buffer.rowCount();
    if (dropped > 0) {
      logger.warning("Dropped " + dropped + " rows due to LineSender.close()");
      metrics.incrementRowsDropped(dropped);
    }
    buffer.reset();
    updateBufferedMetrics();
    transport.close();
  }

  void checkOpen() {
    if (closed) throw new ClosedSenderException();
  }

  @Override public String toString() {
    return "LineSender{" + transport + "}";
  }
}
