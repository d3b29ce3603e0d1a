/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public final class InMemorySenderMetrics implements SenderMetrics {
  enum MetricKey {
    rows,
    rowBytes,
    flushes,
    flushBytes,
    retries,
    rowsDropped,
    rowsBuffered,
    bytesBuffered
  }

  private final ConcurrentHashMap<MetricKey, AtomicLong> metrics = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<Class<? extends Throwable>, AtomicLong> flushesFailed =
    new ConcurrentHashMap<>();

  @Override public void incrementRows(int quantity) {
    increment(MetricKey.rows, quantity);
  }

  public long rows() {
    return get(MetricKey.rows);
  }

  @Override public void incrementRowBytes(int quantity) {
    increment(MetricKey.rowBytes, quantity);
  }

  public long rowBytes() {
    return get(MetricKey.rowBytes);
  }

  @Override public void incrementFlushes() {
    increment(MetricKey.flushes, 1);
  }

  public long flushes() {
    return get(MetricKey.flushes);
  }

  @Override public void incrementFlushBytes(int quantity) {
    increment(MetricKey.flushBytes, quantity);
  }

  public long flushBytes() {
    return get(MetricKey.flushBytes);
  }

  @Override public void incrementFlushesFailed(Throwable cause) {
    increment(flushesFailed, cause.getClass(), 1);
  }

  public Map<Class<? extends Throwable>, Long> flushesFailedByCause() {
    Map<Class<? extends Throwable>, Long> result = new LinkedHashMap<>(flushesFailed.size());
    for (Map.Entry<Class<? extends Throwable>, AtomicLong> kv : flushesFailed.entrySet()) {
      result.put(kv.getKey(), kv.getValue().longValue());
    }
    return result;
  }

  public long flushesFailed() {
    long result = 0L;
    for (AtomicLong count : flushesFailed.values()) {
      result += count.longValue();
    }
    return result;
  }

  @Override public void incrementRetries() {
    increment(MetricKey.retries, 1);
  }

  public long retries() {
    return get(MetricKey.retries);
  }

  @Override public void incrementRowsDropped(int quantity) {
    increment(MetricKey.rowsDropped, quantity);
  }

  public long rowsDropped() {
    return get(MetricKey.rowsDropped);
  }

  @Override public void updateBufferedRows(int update) {
    update(MetricKey.rowsBuffered, update);
  }

  public long bufferedRows() {
    return get(MetricKey.rowsBuffered);
  }

  @Override public void updateBufferedBytes(int update) {
    update(MetricKey.bytesBuffered, update);
  }

  public long bufferedBytes() {
    return get(MetricKey.bytesBuffered);
  }

  public void clear() {
    metrics.clear();
    flushesFailed.clear();
  }

  private long get(MetricKey key) {
    AtomicLong atomic = metrics.get(key);
    return atomic == null ? 0 : atomic.get();
  }

  private void increment(MetricKey key, int quantity) {
    increment(metrics, key, quantity);
  }

  static <K> void increment(ConcurrentHashMap<K, AtomicLong> metrics, K key, int quantity) {
    if (quantity == 0) return;
    metrics.computeIfAbsent(key, k -> new AtomicLong()).addAndGet(quantity);
  }

  private void update(MetricKey key, int update) {
    metrics.computeIfAbsent(key, k -> new AtomicLong()).set(update);
  }

  @Override public String toString() {
    return "InMemorySenderMetrics{rows=" + rows() + ", flushes=" + flushes()
      + ", flushesFailed=" + flushesFailed() + ", rowsDropped=" + rowsDropped() + "}";
  }
}
