/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender.metrics.micrometer;

import ilp.sender.FlushFailedException;
import ilp.sender.LineSender;
import ilp.sender.Transport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.net.ConnectException;
import java.nio.ByteBuffer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MicrometerSenderMetricsTest {
  MeterRegistry meterRegistry = new SimpleMeterRegistry();
  MicrometerSenderMetrics metrics = MicrometerSenderMetrics.create(meterRegistry);

  @Test void expectedMetricsRegistered() {
    assertThat(meterRegistry.getMeters())
      .extracting(Meter::getId).extracting(Meter.Id::getName)
      .containsExactlyInAnyOrder(
        "ilp.sender.rows.total",
        "ilp.sender.rows",
        "ilp.sender.flushes.total",
        "ilp.sender.flushes",
        "ilp.sender.retries",
        "ilp.sender.rows.dropped",
        "ilp.sender.buffer.rows",
        "ilp.sender.buffer.bytes"
      );
  }

  @Test void extraTags() {
    MeterRegistry registry = new SimpleMeterRegistry();
    MicrometerSenderMetrics.builder(registry).extraTags(Tag.of("db", "trades")).build()
      .incrementRows(3);

    assertThat(registry.get("ilp.sender.rows.total").tag("db", "trades").counter().count())
      .isEqualTo(3);
  }

  @Test void incrementFlushesFailed_sameExceptionTypeIsNotTaggedMoreThanOnce() {
    metrics.incrementFlushesFailed(new IOException("boo"));
    metrics.incrementFlushesFailed(new IOException("shh"));
    metrics.incrementFlushesFailed(new IllegalStateException());

    assertThat(meterRegistry.get("ilp.sender.flushes.failed").counters())
      .hasSize(2); // two distinct meters for each cause
    assertThat(meterRegistry.get("ilp.sender.flushes.failed")
      .tag("cause", IOException.class.getSimpleName()).counter().count()).isEqualTo(2);
    assertThat(meterRegistry.get("ilp.sender.flushes.failed")
      .tag("cause", IllegalStateException.class.getSimpleName()).counter().count()).isEqualTo(1);
    double total = meterRegistry.get("ilp.sender.flushes.failed").counters().stream()
      .mapToDouble(Counter::count).sum();
    assertThat(total).isEqualTo(3);
  }

  @Test void gaugesSurviveGc() {
    metrics.updateBufferedBytes(53);
    metrics.updateBufferedRows(2);

    System.gc();

    assertThat(meterRegistry.get("ilp.sender.buffer.bytes").gauge().value()).isEqualTo(53);
    assertThat(meterRegistry.get("ilp.sender.buffer.rows").gauge().value()).isEqualTo(2);
  }

  @Test void recordsSenderActivity() {
    FailingTransport transport = new FailingTransport();
    LineSender sender = LineSender.newBuilder(transport)
      .autoFlush(false)
      .metrics(metrics)
      .build();

    sender.table("t").longColumn("v", 1).atNow(); // "t v=1i\n"
    sender.table("t").longColumn("v", 2).atNow();
    assertThat(meterRegistry.get("ilp.sender.buffer.rows").gauge().value()).isEqualTo(2);
    assertThat(meterRegistry.get("ilp.sender.buffer.bytes").gauge().value()).isEqualTo(14);

    sender.flush();
    transport.fail = true;
    sender.table("t").longColumn("v", 3).atNow();
    assertThatThrownBy(sender::flush).isInstanceOf(FlushFailedException.class);

    assertThat(meterRegistry.get("ilp.sender.rows.total").counter().count()).isEqualTo(3);
    assertThat(meterRegistry.get("ilp.sender.rows").counter().count()).isEqualTo(21);
    assertThat(meterRegistry.get("ilp.sender.flushes.total").counter().count()).isEqualTo(2);
    assertThat(meterRegistry.get("ilp.sender.flushes").counter().count()).isEqualTo(14);
    assertThat(meterRegistry.get("ilp.sender.rows.dropped").counter().count()).isEqualTo(1);
    assertThat(meterRegistry.get("ilp.sender.flushes.failed")
      .tag("cause", "ConnectException").counter().count()).isEqualTo(1);
    assertThat(meterRegistry.get("ilp.sender.buffer.rows").gauge().value()).isZero();
  }

  static final class FailingTransport implements Transport {
    boolean fail;

    @Override public void connect() {
    }

    @Override public void send(ByteBuffer rows) throws IOException {
      if (fail) throw new ConnectException("Connection refused");
    }

    @Override public int defaultAutoFlushRows() {
      return 0;
    }

    @Override public void close() {
    }
  }
}
