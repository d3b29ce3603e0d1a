/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

import java.io.IOException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class InMemorySenderMetricsTest {
  InMemorySenderMetrics metrics = new InMemorySenderMetrics();

  @Test void counters() {
    metrics.incrementRows(2);
    metrics.incrementRows(3);
    metrics.incrementRowBytes(40);
    metrics.incrementFlushes();
    metrics.incrementFlushBytes(40);
    metrics.incrementRetries();
    metrics.incrementRetries();
    metrics.incrementRowsDropped(5);

    assertThat(metrics.rows()).isEqualTo(5);
    assertThat(metrics.rowBytes()).isEqualTo(40);
    assertThat(metrics.flushes()).isEqualTo(1);
    assertThat(metrics.flushBytes()).isEqualTo(40);
    assertThat(metrics.retries()).isEqualTo(2);
    assertThat(metrics.rowsDropped()).isEqualTo(5);
  }

  @Test void gaugesAreReplaced() {
    metrics.updateBufferedRows(10);
    metrics.updateBufferedBytes(100);
    metrics.updateBufferedRows(0);
    metrics.updateBufferedBytes(0);

    assertThat(metrics.bufferedRows()).isZero();
    assertThat(metrics.bufferedBytes()).isZero();
  }

  @Test void flushesFailedByCause() {
    metrics.incrementFlushesFailed(new IOException());
    metrics.incrementFlushesFailed(new IOException());
    metrics.incrementFlushesFailed(new IllegalStateException());

    assertThat(metrics.flushesFailedByCause()).containsOnly(
      entry(IOException.class, 2L),
      entry(IllegalStateException.class, 1L)
    );
    assertThat(metrics.flushesFailed()).isEqualTo(3);
  }

  @Test void clear() {
    metrics.incrementRows(1);
    metrics.incrementFlushesFailed(new IOException());

    metrics.clear();

    assertThat(metrics.rows()).isZero();
    assertThat(metrics.flushesFailed()).isZero();
    assertThat(metrics.flushesFailedByCause()).isEmpty();
  }
}
