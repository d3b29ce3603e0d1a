/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender.urlconnection;

import ilp.sender.BaseHttpTransport;
import ilp.sender.SenderOptions;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import javax.net.ssl.HttpsURLConnection;
import javax.net.ssl.SSLSocketFactory;

/**
 * Sends rows to the database's HTTP endpoint with {@link HttpURLConnection}, so that no HTTP
 * library is needed. This is the transport selected by {@code stdlib_http=on}.
 *
 * <h3>Usage</h3>
 *
 * <pre>{@code
 * transport = URLConnectionTransport.create("http://localhost:9000");
 * sender = LineSender.newBuilder(transport).build();
 * }</pre>
 *
 * <h3>Implementation Notes</h3>
 *
 * <p>Keep-alive connections are pooled by the JDK, per host, across the whole process.
 */
public final class URLConnectionTransport extends BaseHttpTransport<URL, byte[]> {
  /** Creates a transport that posts to the given base URL, such as "http://localhost:9000". */
  public static URLConnectionTransport create(String endpoint) {
    return newBuilder().endpoint(endpoint).build();
  }

  /** Creates a transport from the {@code http} or {@code https} settings of a configuration string. */
  public static URLConnectionTransport create(SenderOptions options) {
    return newBuilder().options(options).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder extends BaseHttpTransport.Builder<Builder> {
    int connectTimeout = 10 * 1000;

    Builder() {
    }

    Builder(URLConnectionTransport transport) {
      super(transport);
      connectTimeout = transport.connectTimeout;
    }

    @Override protected Builder self() {
      return this;
    }

    /** Default 10 * 1000 milliseconds. 0 implies no timeout. */
    public Builder connectTimeout(int connectTimeout) {
      if (connectTimeout < 0) throw new IllegalArgumentException("connectTimeout < 0");
      this.connectTimeout = connectTimeout;
      return this;
    }

    public URLConnectionTransport build() {
      checkEndpoint();
      return new URLConnectionTransport(this);
    }
  }

  final int connectTimeout;
  final SSLSocketFactory sslSocketFactory; // null unless https

  URLConnectionTransport(Builder builder) {
    super(builder);
    connectTimeout = builder.connectTimeout;
    if ("https".equals(endpoint().getProtocol())) {
      try {
        sslSocketFactory = tlsConfig().sslContext().getSocketFactory();
      } catch (IOException e) {
        throw new IllegalArgumentException("Could not load TLS settings: " + e.getMessage(), e);
      }
    } else {
      sslSocketFactory = null;
    }
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override protected URL newEndpoint(String endpoint) {
    try {
      return new URL(endpoint);
    } catch (MalformedURLException e) {
      throw new IllegalArgumentException(e.getMessage());
    }
  }

  /** Copies the rows, as the body is written once per attempt. */
  @Override protected byte[] newBody(ByteBuffer rows) {
    byte[] body = new byte[rows.remaining()];
    rows.duplicate().get(body);
    return body;
  }

  @Override protected String postRows(URL endpoint, byte[] body, String authorization,
    int timeoutMillis) throws IOException {
    HttpURLConnection connection = open(endpoint, authorization, timeoutMillis);
    connection.setRequestMethod("POST");
    connection.setRequestProperty("Content-Type", CONTENT_TYPE);
    connection.setDoOutput(true);
    connection.setFixedLengthStreamingMode(body.length);
    try (OutputStream out = connection.getOutputStream()) {
      out.write(body);
    }
    return readResponse(connection);
  }

  @Override protected String getSettings(URL settingsEndpoint, String authorization,
    int timeoutMillis) throws IOException {
    HttpURLConnection connection = open(settingsEndpoint, authorization, timeoutMillis);
    connection.setRequestMethod("GET");
    return readResponse(connection);
  }

  HttpURLConnection open(URL url, String authorization, int timeoutMillis) throws IOException {
    // intentionally not disconnecting, to use keep-alives
    HttpURLConnection connection = (HttpURLConnection) url.openConnection();
    if (sslSocketFactory != null) {
      HttpsURLConnection https = (HttpsURLConnection) connection;
      https.setSSLSocketFactory(sslSocketFactory);
      if (!tlsConfig().verify()) https.setHostnameVerifier((hostname, session) -> true);
    }
    connection.setConnectTimeout(connectTimeoutMillis(timeoutMillis));
    connection.setReadTimeout(timeoutMillis);
    if (authorization != null) connection.setRequestProperty("Authorization", authorization);
    return connection;
  }

  /** Connecting never outlasts the request timeout, even when it has no timeout of its own. */
  int connectTimeoutMillis(int timeoutMillis) {
    return connectTimeout == 0 ? timeoutMillis : Math.min(connectTimeout, timeoutMillis);
  }

  static String readResponse(HttpURLConnection connection) throws IOException {
    int statusCode = connection.getResponseCode();
    if (statusCode / 100 == 2) {
      return readAll(connection.getInputStream());
    }
    throw statusException(statusCode, readAll(connection.getErrorStream()));
  }

  /** Reads the body, so that the connection can be reused. Null streams read as empty. */
  static String readAll(InputStream in) throws IOException {
    if (in == null) return ""; // null is possible, if the connection was dropped
    try (InputStream stream = in) {
      ByteArrayOutputStream result = new ByteArrayOutputStream();
      byte[] buffer = new byte[1024];
      for (int read; (read = stream.read(buffer)) != -1; ) {
        result.write(buffer, 0, read);
      }
      return new String(result.toByteArray(), StandardCharsets.UTF_8);
    }
  }
}
