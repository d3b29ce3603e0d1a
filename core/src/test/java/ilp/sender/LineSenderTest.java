/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.ConnectException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LineSenderTest {
  FakeTransport transport = new FakeTransport();
  InMemorySenderMetrics metrics = new InMemorySenderMetrics();
  MutableClock clock = new MutableClock();
  List<LogRecord> logRecords = new ArrayList<>();
  Logger logger = Logger.getLogger(LineSenderTest.class.getName());

  {
    logger.setUseParentHandlers(false);
    logger.setLevel(Level.FINE);
    logger.addHandler(new Handler() {
      @Override public void publish(LogRecord record) {
        logRecords.add(record);
      }

      @Override public void flush() {
      }

      @Override public void close() {
      }
    });
  }

  LineSender sender = LineSender.newBuilder(transport)
    .autoFlush(false)
    .metrics(metrics)
    .logger(logger)
    .clock(clock)
    .build();

  @AfterEach void clearHandlers() {
    for (Handler handler : logger.getHandlers()) logger.removeHandler(handler);
  }

  @Test void flush_sendsCompleteRows() {
    sender.table("trades").symbol("sym", "ETH-USD").doubleColumn("price", 2615.54)
      .at(1700000000000000000L);

    assertThat(sender.flush()).isTrue();

    assertThat(transport.sent)
      .containsExactly("trades,sym=ETH-USD price=2615.54 1700000000000000000\n");
    assertThat(sender.pendingRows()).isZero();
    assertThat(sender.bufferedBytes()).isZero();
  }

  @Test void flush_emptyReturnsFalse() {
    assertThat(sender.flush()).isFalse();
    assertThat(transport.sent).isEmpty();
    assertThat(metrics.flushes()).isZero();
  }

  @Test void flush_keepsRowUnderConstruction() {
    sender.table("t").longColumn("v", 1).atNow();
    sender.table("t").longColumn("v", 2);

    sender.flush();
    sender.atNow();
    sender.flush();

    assertThat(transport.sent).containsExactly("t v=1i\n", "t v=2i\n");
  }

  @ParameterizedTest(name = "{0}")
  @EnumSource(BufferMode.class)
  void flush_bufferModes(BufferMode bufferMode) {
    LineSender sender = LineSender.newBuilder(transport).autoFlush(false)
      .bufferMode(bufferMode).build();

    sender.table("t").longColumn("v", 1).atNow();
    sender.table("t").longColumn("v", 2);
    sender.flush();
    sender.atNow();
    sender.table("t").longColumn("v", 3).atNow();
    sender.flush();

    assertThat(transport.sent).containsExactly("t v=1i\n", "t v=2i\nt v=3i\n");
  }

  @ParameterizedTest(name = "{0}")
  @EnumSource(BufferMode.class)
  void flush_failureCarriesUnsentRows(BufferMode bufferMode) {
    LineSender sender = LineSender.newBuilder(transport).autoFlush(false)
      .bufferMode(bufferMode).metrics(metrics).logger(logger).build();
    sender.table("t").longColumn("v", 1).atNow();
    sender.table("t").longColumn("v", 2).atNow();
    sender.table("t").longColumn("v", 3);
    ConnectException cause = new ConnectException("Connection refused");
    transport.exceptionToThrow = cause;

    assertThatThrownBy(sender::flush)
      .isInstanceOf(FlushFailedException.class)
      .hasCause(cause)
      .satisfies(e -> {
        FlushFailedException flushFailed = (FlushFailedException) e;
        assertThat(new String(flushFailed.unsentData(), StandardCharsets.UTF_8))
          .isEqualTo("t v=1i\nt v=2i\n");
        assertThat(flushFailed.rowCount()).isEqualTo(2);
      });

    // failed rows are dropped, the partial row is kept
    assertThat(sender.pendingRows()).isZero();
    transport.exceptionToThrow = null;
    sender.atNow();
    sender.flush();
    assertThat(transport.sent).containsExactly("t v=3i\n");

    assertThat(metrics.flushesFailedByCause()).containsEntry(ConnectException.class, 1L);
    assertThat(metrics.rowsDropped()).isEqualTo(2);
  }

  @Test void flush_logsFirstErrorAsWarn() {
    transport.exceptionToThrow = new IOException("boom");

    sender.table("t").longColumn("v", 1).atNow();
    assertThatThrownBy(sender::flush).isInstanceOf(FlushFailedException.class);
    sender.table("t").longColumn("v", 2).atNow();
    assertThatThrownBy(sender::flush).isInstanceOf(FlushFailedException.class);

    assertThat(logRecords).hasSize(3);
    assertThat(logRecords.get(0).getLevel()).isEqualTo(Level.WARNING);

    assertThat(logRecords.get(1).getLevel()).isEqualTo(Level.WARNING);
    assertThat(logRecords.get(1).getMessage()).isEqualTo("Dropped 1 rows due to IOException(boom)");

    assertThat(logRecords.get(2).getLevel()).isEqualTo(Level.FINE);
    assertThat(logRecords.get(2).getMessage()).contains("IOException");
  }

  @Test void autoFlush_rows() {
    LineSender sender = LineSender.newBuilder(transport)
      .autoFlushRows(2)
      .autoFlushInterval(0)
      .build();

    sender.table("t").longColumn("v", 1).atNow();
    assertThat(transport.sent).isEmpty();

    sender.table("t").longColumn("v", 2).atNow();
    assertThat(transport.sent).containsExactly("t v=1i\nt v=2i\n");

    sender.table("t").longColumn("v", 3).atNow();
    assertThat(transport.sent).hasSize(1);
    assertThat(sender.pendingRows()).isEqualTo(1);
  }

  @Test void autoFlush_defaultRowsComeFromTransport() {
    LineSender sender = LineSender.newBuilder(new FakeTransport(3)).build();

    assertThat(sender.autoFlushRows).isEqualTo(3);
    assertThat(sender.autoFlushInterval).isEqualTo(LineSender.DEFAULT_AUTO_FLUSH_INTERVAL);
  }

  @Test void autoFlush_interval() {
    LineSender sender = LineSender.newBuilder(transport)
      .autoFlushRows(0)
      .autoFlushInterval(1000)
      .clock(clock)
      .build();

    sender.table("t").longColumn("v", 1).atNow();
    clock.advance(999);
    sender.table("t").longColumn("v", 2).atNow();
    assertThat(transport.sent).isEmpty();

    clock.advance(1);
    sender.table("t").longColumn("v", 3).atNow();
    assertThat(transport.sent).containsExactly("t v=1i\nt v=2i\nt v=3i\n");
  }

  @Test void autoFlush_intervalMeasuredFromLastSuccessfulFlush() {
    LineSender sender = LineSender.newBuilder(transport)
      .autoFlushRows(0)
      .autoFlushInterval(1000)
      .clock(clock)
      .build();
    transport.exceptionToThrow = new IOException("down");

    clock.advance(1000);
    sender.table("t").longColumn("v", 1);
    assertThatThrownBy(sender::atNow).isInstanceOf(FlushFailedException.class);

    // the failed flush didn't restart the interval
    transport.exceptionToThrow = null;
    sender.table("t").longColumn("v", 2).atNow();
    assertThat(transport.sent).containsExactly("t v=2i\n");
  }

  @Test void autoFlush_off() {
    LineSender sender = LineSender.newBuilder(transport)
      .autoFlush(false)
      .autoFlushRows(1)
      .autoFlushInterval(1)
      .build();

    sender.table("t").longColumn("v", 1).atNow();
    sender.table("t").longColumn("v", 2).atNow();

    assertThat(transport.sent).isEmpty();
    assertThat(sender.pendingRows()).isEqualTo(2);
  }

  @Test void timestamps() {
    sender.table("t").longColumn("v", 1).at(5, TimeUnit.MICROSECONDS);
    sender.table("t").longColumn("v", 2).at(Instant.ofEpochSecond(2));
    sender.flush();

    assertThat(transport.sent).containsExactly("t v=1i 5000\nt v=2i 2000000000\n");
  }

  @Test void validationErrorsKeepPriorRows() {
    sender.table("t").longColumn("v", 1).atNow();

    assertThatThrownBy(() -> sender.table("bad/table")).isInstanceOf(InvalidNameException.class);
    assertThatThrownBy(() -> sender.longColumn("v", 1))
      .isInstanceOf(ProtocolOrderException.class);
    sender.flush();

    assertThat(transport.sent).containsExactly("t v=1i\n");
  }

  @Test void maxNameLength() {
    LineSender sender = LineSender.newBuilder(transport).maxNameLength(3).build();

    assertThatThrownBy(() -> sender.table("long")).isInstanceOf(InvalidNameException.class);
  }

  @Test void bufferLimit() {
    LineSender sender = LineSender.newBuilder(transport).autoFlush(false)
      .initBufferSize(8).maxBufferSize(16).build();
    sender.table("t");

    assertThatThrownBy(() -> sender.stringColumn("s", "0123456789abcdef"))
      .isInstanceOf(BufferLimitException.class);
  }

  @Test void resize() {
    sender.resize(8);
    assertThat(sender.bufferCapacity()).isEqualTo(8);

    sender.table("t").stringColumn("s", "0123456789").atNow();
    sender.resize(4);
    assertThat(sender.bufferCapacity()).isEqualTo(sender.bufferedBytes());
  }

  @Test void reset_dropsRows() {
    sender.table("t").longColumn("v", 1).atNow();
    sender.table("t").longColumn("v", 2);

    sender.reset();

    assertThat(sender.flush()).isFalse();
    assertThat(sender.bufferedBytes()).isZero();
    assertThat(metrics.rowsDropped()).isEqualTo(1);
  }

  @Test void connect_delegatesToTransport() throws IOException {
    sender.connect();

    assertThat(transport.connects).isEqualTo(1);
  }

  @Test void close_dropsPendingRowsAndClosesTransport() {
    sender.table("t").longColumn("v", 1).atNow();

    sender.close();

    assertThat(transport.sent).isEmpty();
    assertThat(transport.closed).isTrue();
    assertThat(metrics.rowsDropped()).isEqualTo(1);
    assertThat(logRecords).extracting(LogRecord::getMessage)
      .containsExactly("Dropped 1 rows due to LineSender.close()");
  }

  @Test void close_twiceIsNoop() {
    sender.close();
    sender.close();

    assertThat(logRecords).isEmpty();
  }

  @Test void useAfterClose() {
    sender.close();

    assertThatThrownBy(() -> sender.table("t")).isInstanceOf(ClosedSenderException.class);
    assertThatThrownBy(sender::flush).isInstanceOf(ClosedSenderException.class);
    assertThatThrownBy(sender::connect).isInstanceOf(ClosedSenderException.class);
    assertThatThrownBy(sender::reset).isInstanceOf(ClosedSenderException.class);
    assertThatThrownBy(() -> sender.resize(10)).isInstanceOf(ClosedSenderException.class);
  }

  @Test void metrics() {
    sender.table("t").longColumn("v", 1).atNow();
    sender.table("t").longColumn("v", 2).atNow();

    assertThat(metrics.rows()).isEqualTo(2);
    assertThat(metrics.rowBytes()).isEqualTo(14);
    assertThat(metrics.bufferedRows()).isEqualTo(2);
    assertThat(metrics.bufferedBytes()).isEqualTo(14);

    sender.flush();

    assertThat(metrics.flushes()).isEqualTo(1);
    assertThat(metrics.flushBytes()).isEqualTo(14);
    assertThat(metrics.bufferedRows()).isZero();
    assertThat(metrics.bufferedBytes()).isZero();
  }

  @Test void protocolVersion_defaultsToVersion1() {
    assertThat(sender.protocolVersion()).isEqualTo(ProtocolVersion.V1);

    assertThatThrownBy(() -> sender.table("t").arrayColumn("a", new double[] {1.0}))
      .isInstanceOf(LineSenderException.class)
      .hasMessage("Arrays of column 'a' require protocol version 2, configured: 1");
  }

  @Test void protocolVersion2_arrays() {
    LineSender sender = LineSender.newBuilder(transport)
      .protocolVersion(ProtocolVersion.V2)
      .autoFlush(false)
      .build();

    sender.table("t")
      .arrayColumn("a", new double[][] {{1.5, 2.5}, {3.5, 4.5}})
      .longColumn("n", 1)
      .at(1L, TimeUnit.NANOSECONDS);
    sender.flush();

    ByteArrayOutputStream expected = new ByteArrayOutputStream();
    expected.writeBytes("t a==".getBytes(StandardCharsets.US_ASCII));
    expected.write(14); // array
    expected.write(10); // of doubles
    expected.write(2); // dimensions
    ByteBuffer body = ByteBuffer.allocate(2 * 4 + 4 * 8).order(ByteOrder.LITTLE_ENDIAN);
    body.putInt(2).putInt(2).putDouble(1.5).putDouble(2.5).putDouble(3.5).putDouble(4.5);
    expected.writeBytes(body.array());
    expected.writeBytes(",n=1i 1\n".getBytes(StandardCharsets.US_ASCII));

    assertThat(transport.sentBytes).hasSize(1);
    assertThat(transport.sentBytes.get(0)).isEqualTo(expected.toByteArray());
  }

  @Test void protocolVersion_fromConfig() {
    try (LineSender sender = LineSender.fromConfig("tcp::addr=localhost;protocol_version=2;")) {
      assertThat(sender.protocolVersion()).isEqualTo(ProtocolVersion.V2);
    }
    try (LineSender sender = LineSender.fromConfig("tcp::addr=localhost;protocol_version=auto;")) {
      assertThat(sender.protocolVersion()).isEqualTo(ProtocolVersion.V1);
    }
  }

  @Test void fromConfig_tcp() {
    try (LineSender sender = LineSender.fromConfig(
      "tcp::addr=localhost:9009;auto_flush_rows=10;auto_flush_interval=0;copy_buffer=off;")) {
      assertThat(sender.transport).isInstanceOf(TcpTransport.class);
      assertThat(sender.autoFlushRows).isEqualTo(10);
      assertThat(sender.autoFlushInterval).isZero();
      assertThat(sender.buffer.bufferMode()).isEqualTo(BufferMode.REUSE_IN_PLACE);
    }
  }

  @Test void fromConfig_tcpDefaults() {
    try (LineSender sender = LineSender.fromConfig("tcp::addr=localhost;")) {
      assertThat(sender.autoFlush).isTrue();
      assertThat(sender.autoFlushRows).isEqualTo(TcpTransport.DEFAULT_AUTO_FLUSH_ROWS);
      assertThat(sender.buffer.bufferMode()).isEqualTo(BufferMode.COPY_ON_FLUSH);
    }
  }

  @Test void fromConfig_httpWithoutTransportModule() {
    assertThatThrownBy(() -> LineSender.fromConfig("http::addr=localhost:9000;"))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageStartingWith("No HTTP transport found");
  }

  @Test void flush_tcpNotConnected() {
    try (LineSender sender = LineSender.fromConfig("tcp::addr=localhost:9009;")) {
      sender.table("t").longColumn("v", 1).atNow();

      assertThatThrownBy(sender::flush)
        .isInstanceOf(FlushFailedException.class)
        .hasMessageContaining("is not connected");
    }
  }

  static final class MutableClock extends Clock {
    long millis = 1_700_000_000_000L;

    void advance(long delta) {
      millis += delta;
    }

    @Override public long millis() {
      return millis;
    }

    @Override public Instant instant() {
      return Instant.ofEpochMilli(millis);
    }

    @Override public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override public Clock withZone(ZoneId zone) {
      return this;
    }
  }
}
