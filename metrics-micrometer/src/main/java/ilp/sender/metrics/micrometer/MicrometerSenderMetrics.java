/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender.metrics.micrometer;

import ilp.sender.SenderMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

public class MicrometerSenderMetrics implements SenderMetrics {

  private static final String PREFIX = "ilp.sender.";

  final MeterRegistry meterRegistry;
  final Iterable<Tag> extraTags;

  final Counter rows;
  final Counter rowBytes;
  final Counter flushes;
  final Counter flushBytes;
  final Counter retries;
  final Counter rowsDropped;
  final AtomicInteger bufferedRows;
  final AtomicInteger bufferedBytes;

  /**
   * Creates a {@link MicrometerSenderMetrics} instance that registers all metrics to the given
   * {@link MeterRegistry}. To add tags, use {@link #builder(MeterRegistry)} instead.
   *
   * @param meterRegistry all metrics will be registered to this registry
   */
  public static MicrometerSenderMetrics create(MeterRegistry meterRegistry) {
    return new Builder(meterRegistry).build();
  }

  /** Like {@link #create(MeterRegistry)} but returns a builder to add extra tags. */
  public static Builder builder(MeterRegistry meterRegistry) {
    return new Builder(meterRegistry);
  }

  private MicrometerSenderMetrics(MeterRegistry meterRegistry, Tag... extraTags) {
    this.meterRegistry = meterRegistry;
    this.extraTags = Arrays.asList(extraTags);

    rows = Counter.builder(PREFIX + "rows.total")
      .description("Rows written")
      .tags(this.extraTags).register(meterRegistry);
    rowBytes = Counter.builder(PREFIX + "rows")
      .description("Total bytes of encoded rows written")
      .baseUnit("bytes")
      .tags(this.extraTags).register(meterRegistry);
    flushes = Counter.builder(PREFIX + "flushes.total")
      .description("Flushes sent (or attempted to be sent)")
      .tags(this.extraTags).register(meterRegistry);
    flushBytes = Counter.builder(PREFIX + "flushes")
      .description("Total bytes of flushes sent")
      .baseUnit("bytes")
      .tags(this.extraTags).register(meterRegistry);
    retries = Counter.builder(PREFIX + "retries")
      .description("HTTP requests repeated after a transient failure")
      .tags(this.extraTags).register(meterRegistry);
    rowsDropped = Counter.builder(PREFIX + "rows.dropped")
      .description("Rows dropped (failed to send, reset or closed before flushing)")
      .tags(this.extraTags).register(meterRegistry);
    bufferedRows = new AtomicInteger();
    Gauge.builder(PREFIX + "buffer.rows", bufferedRows, AtomicInteger::get)
      .description("Complete rows buffered for sending")
      .tags(this.extraTags).register(meterRegistry);
    bufferedBytes = new AtomicInteger();
    Gauge.builder(PREFIX + "buffer.bytes", bufferedBytes, AtomicInteger::get)
      .description("Bytes buffered for sending")
      .baseUnit("bytes")
      .tags(this.extraTags).register(meterRegistry);
  }

  @Override
  public void incrementRows(int i) {
    rows.increment(i);
  }

  @Override
  public void incrementRowBytes(int i) {
    rowBytes.increment(i);
  }

  @Override
  public void incrementFlushes() {
    flushes.increment();
  }

  @Override
  public void incrementFlushBytes(int i) {
    flushBytes.increment(i);
  }

  @Override
  public void incrementFlushesFailed(Throwable cause) {
    Iterable<Tag> tags = Tags.concat(extraTags, "cause", cause.getClass().getSimpleName());
    meterRegistry.counter(PREFIX + "flushes.failed", tags).increment();
  }

  @Override
  public void incrementRetries() {
    retries.increment();
  }

  @Override
  public void incrementRowsDropped(int i) {
    rowsDropped.increment(i);
  }

  @Override
  public void updateBufferedRows(int i) {
    bufferedRows.set(i);
  }

  @Override
  public void updateBufferedBytes(int i) {
    bufferedBytes.set(i);
  }

  public static final class Builder {
    final MeterRegistry meterRegistry;
    Tag[] extraTags = new Tag[0];

    Builder(MeterRegistry meterRegistry) {
      if (meterRegistry == null) throw new NullPointerException("meterRegistry == null");
      this.meterRegistry = meterRegistry;
    }

    /** Additional tags to attach to all sender metrics, such as the target database. */
    public Builder extraTags(Tag... extraTags) {
      this.extraTags = extraTags;
      return this;
    }

    public MicrometerSenderMetrics build() {
      return new MicrometerSenderMetrics(meterRegistry, extraTags);
    }
  }
}
