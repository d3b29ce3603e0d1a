/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender.okhttp3;

import ilp.sender.BaseHttpTransport;
import ilp.sender.SenderOptions;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import javax.net.ssl.SSLContext;
import javax.net.ssl.X509TrustManager;
import okhttp3.Call;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSink;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Sends rows to the database's HTTP endpoint with OkHttp.
 *
 * <h3>Usage</h3>
 *
 * <p>Here's a simple configuration:
 *
 * <pre>{@code
 * transport = OkHttpTransport.create("http://localhost:9000");
 * sender = LineSender.newBuilder(transport).build();
 * }</pre>
 *
 * <p>Here's one with a bearer token over TLS, trusting a private CA:
 *
 * <pre>{@code
 * transport = OkHttpTransport.newBuilder()
 *   .endpoint("https://db.example.com:9000")
 *   .token("secret")
 *   .tlsConfig(TlsConfig.trustPem("/etc/ilp/ca.pem"))
 *   .build();
 * }</pre>
 *
 * <h3>Implementation Notes</h3>
 *
 * <p>Each transport has its own connection pool and dispatcher, which are never shared with
 * another transport, even when built from the same {@link Builder#clientBuilder()}.
 */
public final class OkHttpTransport extends BaseHttpTransport<HttpUrl, RequestBody> {
  static final MediaType MEDIA_TYPE = MediaType.get(CONTENT_TYPE);

  /** Creates a transport that posts to the given base URL, such as "http://localhost:9000". */
  public static OkHttpTransport create(String endpoint) {
    return newBuilder().endpoint(endpoint).build();
  }

  /** Creates a transport from the {@code http} or {@code https} settings of a configuration string. */
  public static OkHttpTransport create(SenderOptions options) {
    return newBuilder().options(options).build();
  }

  public static Builder newBuilder() {
    return new Builder(new OkHttpClient.Builder());
  }

  public static final class Builder extends BaseHttpTransport.Builder<Builder> {
    final OkHttpClient.Builder clientBuilder;

    Builder(OkHttpClient.Builder clientBuilder) {
      this.clientBuilder = clientBuilder;
    }

    Builder(OkHttpTransport transport) {
      super(transport);
      clientBuilder = transport.client.newBuilder();
    }

    @Override protected Builder self() {
      return this;
    }

    /** Sets the default connect timeout (in milliseconds) for new connections. Default 10000 */
    public Builder connectTimeout(int connectTimeoutMillis) {
      clientBuilder.connectTimeout(connectTimeoutMillis, MILLISECONDS);
      return this;
    }

    /**
     * Customizes the client, for example to add interceptors. The dispatcher, connection pool,
     * call timeout and TLS settings are replaced when the transport is built.
     */
    public OkHttpClient.Builder clientBuilder() {
      return clientBuilder;
    }

    public OkHttpTransport build() {
      checkEndpoint();
      return new OkHttpTransport(this);
    }
  }

  final OkHttpClient client;

  OkHttpTransport(Builder builder) {
    super(builder);
    try {
      client = newClient(builder.clientBuilder);
    } catch (IOException e) {
      throw new IllegalArgumentException("Could not load TLS settings: " + e.getMessage(), e);
    }
  }

  OkHttpClient newClient(OkHttpClient.Builder clientBuilder) throws IOException {
    // doing the extra "build" here prevents us from leaking our dispatcher to the builder
    OkHttpClient.Builder builder = clientBuilder.build().newBuilder()
      .dispatcher(newDispatcher())
      .connectionPool(new ConnectionPool())
      // retries are ours, so they honor retry_timeout
      .retryOnConnectionFailure(false)
      .readTimeout(requestTimeout(), MILLISECONDS)
      .writeTimeout(requestTimeout(), MILLISECONDS);
    if (endpoint().isHttps()) {
      X509TrustManager trustManager = tlsConfig().trustManager();
      SSLContext sslContext = tlsConfig().sslContext(trustManager);
      builder.sslSocketFactory(sslContext.getSocketFactory(), trustManager);
      if (!tlsConfig().verify()) builder.hostnameVerifier((hostname, session) -> true);
    }
    return builder.build();
  }

  /**
   * Creates a builder out of this object. Note: if the {@link Builder#clientBuilder()} was
   * customized, those customizations are kept.
   */
  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override protected HttpUrl newEndpoint(String endpoint) {
    HttpUrl parsed = HttpUrl.parse(endpoint);
    if (parsed == null) throw new IllegalArgumentException("invalid url: " + endpoint);
    return parsed;
  }

  @Override protected RequestBody newBody(ByteBuffer rows) {
    return new ByteBufferRequestBody(rows);
  }

  @Override protected String postRows(HttpUrl endpoint, RequestBody body, String authorization,
    int timeoutMillis) throws IOException {
    Request.Builder request = new Request.Builder().url(endpoint).post(body);
    if (authorization != null) request.header("Authorization", authorization);
    Call call = client.newCall(request.build());
    call.timeout().timeout(timeoutMillis, MILLISECONDS);
    try (Response response = call.execute()) {
      return parseResponse(response);
    }
  }

  @Override protected String getSettings(HttpUrl settingsEndpoint, String authorization,
    int timeoutMillis) throws IOException {
    Request.Builder request = new Request.Builder().url(settingsEndpoint).get();
    if (authorization != null) request.header("Authorization", authorization);
    Call call = client.newCall(request.build());
    call.timeout().timeout(timeoutMillis, MILLISECONDS);
    try (Response response = call.execute()) {
      return parseResponse(response);
    }
  }

  static String parseResponse(Response response) throws IOException {
    ResponseBody responseBody = response.body();
    String content = responseBody != null ? responseBody.string() : "";
    if (!response.isSuccessful()) throw statusException(response.code(), content);
    return content;
  }

  /** Writes the rows without copying them. Each write reads from the start of the rows. */
  static final class ByteBufferRequestBody extends RequestBody {
    final ByteBuffer rows;

    ByteBufferRequestBody(ByteBuffer rows) {
      this.rows = rows;
    }

    @Override public long contentLength() {
      return rows.remaining();
    }

    @Override public MediaType contentType() {
      return MEDIA_TYPE;
    }

    @Override public void writeTo(BufferedSink sink) throws IOException {
      ByteBuffer source = rows.duplicate();
      while (source.hasRemaining()) sink.write(source);
    }
  }

  /** Waits up to a second for in-flight requests to finish before cancelling them */
  @Override protected void doClose() {
    Dispatcher dispatcher = client.dispatcher();
    dispatcher.executorService().shutdown();
    try {
      if (!dispatcher.executorService().awaitTermination(1, TimeUnit.SECONDS)) {
        dispatcher.cancelAll();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    client.connectionPool().evictAll();
  }

  static Dispatcher newDispatcher() {
    // requests are synchronous, so the executor only runs for calls enqueued by interceptors
    ThreadPoolExecutor dispatchExecutor =
      new ThreadPoolExecutor(0, 1, 60, TimeUnit.SECONDS, new SynchronousQueue<Runnable>(),
        OkHttpTransportThreadFactory.INSTANCE);
    return new Dispatcher(dispatchExecutor);
  }

  enum OkHttpTransportThreadFactory implements ThreadFactory {
    INSTANCE;

    @Override public Thread newThread(Runnable r) {
      Thread thread = new Thread(r, "OkHttpTransport Dispatcher");
      thread.setDaemon(true);
      return thread;
    }
  }
}
