/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender.urlconnection;

import ilp.sender.ClosedSenderException;
import ilp.sender.HttpStatusException;
import ilp.sender.LineSender;
import ilp.sender.ProtocolVersion;
import ilp.sender.SenderOptions;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class URLConnectionTransportTest {
  MockWebServer server = new MockWebServer();
  String baseUrl = "http://" + server.getHostName() + ":" + server.getPort();
  URLConnectionTransport transport = URLConnectionTransport.create(baseUrl);

  @AfterEach void close() throws IOException {
    transport.close();
    server.close();
  }

  @Test void send() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(204));

    transport.send(rows("weather,city=London temp=21.5 1000\n"));

    RecordedRequest request = server.takeRequest();
    assertThat(request.getMethod()).isEqualTo("POST");
    assertThat(request.getPath()).isEqualTo("/write?precision=n");
    assertThat(request.getHeader("Content-Type")).isEqualTo("text/plain; charset=utf-8");
    assertThat(request.getHeader("Content-Length")).isEqualTo("35");
    assertThat(request.getBody().readUtf8()).isEqualTo("weather,city=London temp=21.5 1000\n");
  }

  @Test void basicAuth() throws Exception {
    transport = transport.toBuilder().basicAuth("admin", "quest").build();
    server.enqueue(new MockResponse().setResponseCode(204));

    transport.send(rows("t v=1i\n"));

    assertThat(server.takeRequest().getHeader("Authorization"))
      .isEqualTo("Basic YWRtaW46cXVlc3Q=");
  }

  @Test void bearerToken() throws Exception {
    transport = transport.toBuilder().token("abc").build();
    server.enqueue(new MockResponse().setResponseCode(204));

    transport.send(rows("t v=1i\n"));

    assertThat(server.takeRequest().getHeader("Authorization")).isEqualTo("Bearer abc");
  }

  @Test void retriesRetryableStatus() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(500).setBody("oops"));
    server.enqueue(new MockResponse().setResponseCode(200));

    transport.send(rows("t v=1i\n"));

    assertThat(server.getRequestCount()).isEqualTo(2);
    assertThat(server.takeRequest().getBody().readUtf8()).isEqualTo("t v=1i\n");
    assertThat(server.takeRequest().getBody().readUtf8()).isEqualTo("t v=1i\n");
  }

  @Test void doesNotRetryUnauthorized() {
    server.enqueue(new MockResponse().setResponseCode(401).setBody("unauthorized"));

    assertThatThrownBy(() -> transport.send(rows("t v=1i\n")))
      .isInstanceOf(HttpStatusException.class)
      .hasMessage("HTTP request failed, statusCode=401, error=unauthorized")
      .satisfies(e -> assertThat(((HttpStatusException) e).statusCode()).isEqualTo(401));
    assertThat(server.getRequestCount()).isEqualTo(1);
  }

  @Test void retryTimeoutZero_failsFast() {
    transport = transport.toBuilder().retryTimeout(0).build();
    server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));

    assertThatThrownBy(() -> transport.send(rows("t v=1i\n")))
      .isInstanceOf(IOException.class)
      .hasMessage("HTTP request failed, statusCode=503, error=busy");
    assertThat(server.getRequestCount()).isEqualTo(1);
  }

  @Test void closedTransport() {
    transport.close();

    assertThatThrownBy(() -> transport.send(rows("t v=1i\n")))
      .isInstanceOf(ClosedSenderException.class);
  }

  @Test void invalidEndpoint() {
    assertThatThrownBy(() -> URLConnectionTransport.create("localhost:9000"))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test void options() {
    transport = URLConnectionTransport.create(SenderOptions.parse("http::addr="
      + server.getHostName() + ":" + server.getPort() + ";request_timeout=500;"));

    assertThat(transport)
      .hasToString("URLConnectionTransport{" + baseUrl + "/write?precision=n}");
  }

  @Test void lineSender_stdlibHttp() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(204));

    try (LineSender sender = LineSender.fromConfig("http::addr=" + server.getHostName() + ":"
      + server.getPort() + ";stdlib_http=on;protocol_version=1;auto_flush_rows=2;"
      + "auto_flush_interval=0;")) {
      sender.table("t").longColumn("v", 1).at(1000L);
      assertThat(server.getRequestCount()).isZero();

      sender.table("t").longColumn("v", 2).at(2000L);
      assertThat(sender.pendingRows()).isZero();
    }

    assertThat(server.takeRequest().getBody().readUtf8())
      .isEqualTo("t v=1i 1000\nt v=2i 2000\n");
  }

  @Test void lineSender_negotiatesProtocolVersion() throws Exception {
    server.enqueue(new MockResponse()
      .setBody("{\"config\":{\"line.proto.support.versions\":[1,2]}}"));

    try (LineSender sender = LineSender.fromConfig("http::addr=" + server.getHostName() + ":"
      + server.getPort() + ";stdlib_http=on;username=admin;password=quest;")) {
      assertThat(sender.protocolVersion()).isEqualTo(ProtocolVersion.V2);
    }

    RecordedRequest request = server.takeRequest();
    assertThat(request.getMethod()).isEqualTo("GET");
    assertThat(request.getPath()).isEqualTo("/settings");
    assertThat(request.getHeader("Authorization")).isEqualTo("Basic YWRtaW46cXVlc3Q=");
  }

  @Test void negotiateProtocolVersion_noSettingsEndpoint() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(404).setBody("Not Found"));

    assertThat(transport.negotiateProtocolVersion()).isEqualTo(ProtocolVersion.V1);
  }

  @Test void connectTimeout_boundedByRequestTimeout() {
    assertThat(transport.connectTimeoutMillis(500)).isEqualTo(500);
    assertThat(transport.connectTimeoutMillis(60_000)).isEqualTo(10_000);
  }

  @Test void connectTimeoutZero_usesRequestTimeout() {
    transport = transport.toBuilder().connectTimeout(0).build();

    assertThat(transport.connectTimeoutMillis(500)).isEqualTo(500);
  }

  static ByteBuffer rows(String rows) {
    return ByteBuffer.wrap(rows.getBytes(StandardCharsets.UTF_8));
  }
}
