/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

import ilp.sender.internal.Backoff;
import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketException;
import java.net.URI;
import java.net.URL;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.cert.CertPathValidatorException;
import java.security.cert.CertificateException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLPeerUnverifiedException;

import static ilp.sender.internal.Throwables.propagateIfFatal;

/**
 * Sends rows to the database's HTTP {@code POST /write} endpoint. Each {@link #send(ByteBuffer)}
 * is one request, which the server applies in full or not at all.
 *
 * <p>Connection failures and responses with a retryable status are retried with exponential
 * backoff, until {@code retry_timeout} elapses since the first attempt. Other error responses and
 * certificate failures are not retried. A TLS failure caused by the connection dropping is a
 * connection failure.
 *
 * <p>Calls to {@linkplain #postRows(Object, Object, String, int)} happen on the thread that
 * flushes, but {@linkplain #close()} might be called from any thread.
 *
 * @param <U> The URL type for the HTTP client, such as {@linkplain URL} or {@linkplain URI}.
 * @param <B> The POST body, such as {@code byte[]} or an HTTP client-specific body type.
 */
public abstract class BaseHttpTransport<U, B> implements Transport {
  public static final String PATH = "/write?precision=n";
  /** Server settings, including the line protocol versions it accepts. */
  public static final String SETTINGS_PATH = "/settings";
  static final String SUPPORTED_VERSIONS_KEY = "\"line.proto.support.versions\"";
  public static final String CONTENT_TYPE = "text/plain; charset=utf-8";
  public static final int DEFAULT_AUTO_FLUSH_ROWS = 75_000;
  public static final int DEFAULT_REQUEST_MIN_THROUGHPUT = 100 * 1024;
  public static final int DEFAULT_REQUEST_TIMEOUT = 10_000;
  public static final int DEFAULT_RETRY_TIMEOUT = 10_000;

  /** Parent of builders for HTTP transports. */
  public abstract static class Builder<B extends Builder<B>> {
    String endpoint;
    String username, password, token;
    int requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    int requestMinThroughput = DEFAULT_REQUEST_MIN_THROUGHPUT;
    int retryTimeout = DEFAULT_RETRY_TIMEOUT;
    TlsConfig tlsConfig = TlsConfig.defaults();
    SenderMetrics metrics = SenderMetrics.NOOP_METRICS;

    protected Builder() {
    }

    protected Builder(BaseHttpTransport<?, ?> transport) {
      endpoint = transport.baseUrl;
      username = transport.username;
      password = transport.password;
      token = transport.token;
      requestTimeout = transport.requestTimeout;
      requestMinThroughput = transport.requestMinThroughput;
      retryTimeout = transport.retryTimeout;
      tlsConfig = transport.tlsConfig;
      metrics = transport.metrics;
    }

    protected abstract B self();

    /** Applies address, credentials, timeouts and TLS settings. */
    public B options(SenderOptions options) {
      if (options == null) throw new NullPointerException("options == null");
      if (!options.protocol().isHttp()) {
        throw new IllegalArgumentException("not an HTTP protocol: " + options.protocol().value());
      }
      endpoint = options.protocol().value() + "://" + options.host() + ":" + options.port();
      username = options.username();
      password = options.password();
      token = options.token();
      if (options.requestTimeout() != -1) requestTimeout = options.requestTimeout();
      if (options.requestMinThroughput() != -1) {
        requestMinThroughput = options.requestMinThroughput();
      }
      if (options.retryTimeout() != -1) retryTimeout = options.retryTimeout();
      tlsConfig = TlsConfig.create(options);
      return self();
    }

    /**
     * No default. The base URL of the database, such as "http://localhost:9000". The path {@value
     * #PATH} is appended to it.
     */
    public B endpoint(String endpoint) {
      if (endpoint == null) throw new NullPointerException("endpoint == null");
      while (endpoint.endsWith("/")) endpoint = endpoint.substring(0, endpoint.length() - 1);
      this.endpoint = endpoint;
      return self();
    }

    /** Sends {@code Authorization: Basic}, unless a {@link #token(String) token} is set. */
    public B basicAuth(String username, String password) {
      if (username == null) throw new NullPointerException("username == null");
      if (password == null) throw new NullPointerException("password == null");
      this.username = username;
      this.password = password;
      return self();
    }

    /** Sends {@code Authorization: Bearer} with this token. */
    public B token(String token) {
      if (token == null) throw new NullPointerException("token == null");
      this.token = token;
      return self();
    }

    /** Time budget for a request, before adding time for the payload. Default 10000ms. */
    public B requestTimeout(int requestTimeoutMillis) {
      if (requestTimeoutMillis < 1) {
        throw new IllegalArgumentException("requestTimeout < 1: " + requestTimeoutMillis);
      }
      this.requestTimeout = requestTimeoutMillis;
      return self();
    }

    /**
     * Expected lowest throughput in bytes per second, which extends the timeout of a request in
     * proportion to its size. Zero disables this. Default 102400.
     */
    public B requestMinThroughput(int bytesPerSecond) {
      if (bytesPerSecond < 0) {
        throw new IllegalArgumentException("requestMinThroughput < 0: " + bytesPerSecond);
      }
      this.requestMinThroughput = bytesPerSecond;
      return self();
    }

    /** How long to keep retrying a failed request. Zero disables retries. Default 10000ms. */
    public B retryTimeout(int retryTimeoutMillis) {
      if (retryTimeoutMillis < 0) {
        throw new IllegalArgumentException("retryTimeout < 0: " + retryTimeoutMillis);
      }
      this.retryTimeout = retryTimeoutMillis;
      return self();
    }

    /** Trust settings for {@code https} endpoints. */
    public B tlsConfig(TlsConfig tlsConfig) {
      if (tlsConfig == null) throw new NullPointerException("tlsConfig == null");
      this.tlsConfig = tlsConfig;
      return self();
    }

    /** Counts retries. Default no-op. */
    public B metrics(SenderMetrics metrics) {
      if (metrics == null) throw new NullPointerException("metrics == null");
      this.metrics = metrics;
      return self();
    }

    protected void checkEndpoint() {
      if (endpoint == null) throw new NullPointerException("endpoint == null");
    }
  }

  /** Blocks the calling thread between retries. */
  interface Sleeper {
    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
  }

  final Logger logger;
  final String baseUrl, username, password, token;
  final int requestTimeout, requestMinThroughput, retryTimeout;
  final TlsConfig tlsConfig;
  final SenderMetrics metrics;
  final String authorization;
  final U endpoint, settingsEndpoint;

  // visible for testing
  Clock clock = Clock.systemUTC();
  Sleeper sleeper = Sleeper.SYSTEM;
  Backoff.Factory backoffFactory = Backoff::new;

  /** close is typically called from a different thread */
  final AtomicBoolean closeCalled = new AtomicBoolean();

  /**
   * Called once on construction. Implementations should perform any validation needed here.
   *
   * @param endpoint the base URL followed by {@value #PATH}
   */
  protected abstract U newEndpoint(String endpoint);

  /**
   * Creates a POST body from the rows. The body may be posted more than once, when retrying.
   *
   * <p>The buffer is only valid until {@link #send(ByteBuffer)} returns.
   */
  protected abstract B newBody(ByteBuffer rows) throws IOException;

  /**
   * Implement to POST rows to the given endpoint, with the header {@code Content-Type: }{@value
   * #CONTENT_TYPE}.
   *
   * <p>Implementations should return the body of a 2xx response, and otherwise throw the result
   * of {@link #statusException(int, String)}.
   *
   * @param authorization value of the {@code Authorization} header, or null to not send one
   * @param timeoutMillis how long this attempt may take, from connecting to reading the response
   * @return the response body, possibly empty
   */
  protected abstract String postRows(U endpoint, B body, String authorization, int timeoutMillis)
    throws IOException;

  /**
   * Implement to GET the server's settings from the given endpoint.
   *
   * <p>Implementations should return the body of a 2xx response, and otherwise throw the result
   * of {@link #statusException(int, String)}.
   *
   * @param authorization value of the {@code Authorization} header, or null to not send one
   * @param timeoutMillis how long the request may take, from connecting to reading the response
   */
  protected abstract String getSettings(U settingsEndpoint, String authorization,
    int timeoutMillis) throws IOException;

  /** Override to close any resources. */
  protected void doClose() {
  }

  protected BaseHttpTransport(Builder<?> builder) {
    this(Logger.getLogger(BaseHttpTransport.class.getName()), builder);
  }

  BaseHttpTransport(Logger logger, Builder<?> builder) {
    builder.checkEndpoint();
    this.logger = logger;
    baseUrl = builder.endpoint;
    username = builder.username;
    password = builder.password;
    token = builder.token;
    requestTimeout = builder.requestTimeout;
    requestMinThroughput = builder.requestMinThroughput;
    retryTimeout = builder.retryTimeout;
    tlsConfig = builder.tlsConfig;
    metrics = builder.metrics;
    authorization = authorization(username, password, token);
    U endpoint = newEndpoint(baseUrl + PATH);
    if (endpoint == null) throw new NullPointerException("newEndpoint() returned null");
    this.endpoint = endpoint;
    settingsEndpoint = newEndpoint(baseUrl + SETTINGS_PATH);
  }

  /** Bearer wins over Basic. Returns null when there are no credentials. */
  static String authorization(String username, String password, String token) {
    if (token != null) return "Bearer " + token;
    if (username == null || password == null) return null;
    byte[] credentials = (username + ":" + password).getBytes(StandardCharsets.UTF_8);
    return "Basic " + Base64.getEncoder().encodeToString(credentials);
  }

  /** Classifies a non-2xx response. */
  public static IOException statusException(int statusCode, String responseBody) {
    if (isRetryable(statusCode)) {
      return new TransientTransportException(
        "HTTP request failed, statusCode=" + statusCode + ", error=" + responseBody, statusCode);
    }
    return new HttpStatusException(statusCode, responseBody);
  }

  /** Server errors that may succeed when retried. */
  public static boolean isRetryable(int statusCode) {
    switch (statusCode) {
      case 500: // Internal Server Error
      case 503: // Service Unavailable
      case 504: // Gateway Timeout
      case 507: // Insufficient Storage
      case 509: // Bandwidth Limit Exceeded
      case 523: // Origin is Unreachable
      case 524: // A Timeout Occurred
      case 529: // Site is overloaded
      case 599: // Network Connect Timeout Error
        return true;
      default:
        return false;
    }
  }

  /** The base URL followed by {@value #PATH}. */
  protected final U endpoint() {
    return endpoint;
  }

  /** Trust settings, for implementations that connect over TLS. */
  protected final TlsConfig tlsConfig() {
    return tlsConfig;
  }

  /** The configured request timeout, without the allowance for the payload size. */
  protected final int requestTimeout() {
    return requestTimeout;
  }

  /** HTTP is connectionless from the caller's perspective. */
  @Override public void connect() {
    if (closeCalled.get()) throw new ClosedSenderException();
  }

  @Override public int defaultAutoFlushRows() {
    return DEFAULT_AUTO_FLUSH_ROWS;
  }

  /** Sends rows as one HTTP POST request, retrying transient failures. */
  @Override public final void send(ByteBuffer rows) throws IOException {
    if (closeCalled.get()) throw new ClosedSenderException();
    if (rows == null) throw new NullPointerException("rows == null");
    int length = rows.remaining();
    B body = newBody(rows);
    if (body == null) throw new NullPointerException("newBody(rows) returned null");
    int timeoutMillis = requestTimeoutMillis(length);

    long start = clock.millis();
    Backoff backoff = null;
    while (true) {
      IOException failure;
      try {
        String response = postRows(endpoint, body, authorization, timeoutMillis);
        if (response != null && !response.isEmpty()) {
          logger.warning("Unexpected response from " + this + ": " + response);
        }
        return;
      } catch (HttpStatusException e) {
        throw e;
      } catch (IOException e) {
        if (e instanceof SSLException && !isConnectionFailure((SSLException) e)) throw e;
        failure = e;
      }

      long elapsed = clock.millis() - start;
      if (retryTimeout == 0 || elapsed > retryTimeout || closeCalled.get()) throw failure;
      if (backoff == null) backoff = backoffFactory.create();
      long delay = backoff.nextDelayMillis();
      if (logger.isLoggable(Level.FINE)) {
        logger.log(Level.FINE,
          "Retrying in " + delay + "ms after " + elapsed + "ms: " + failure.getMessage());
      }
      metrics.incrementRetries();
      sleep(delay, failure);
    }
  }

  /**
   * True when the TLS failure came from the connection, such as a reset during the handshake.
   * Certificate and peer verification failures are false, as they fail the same way again.
   */
  static boolean isConnectionFailure(SSLException e) {
    if (e instanceof SSLPeerUnverifiedException) return false;
    boolean dropped = false;
    for (Throwable cause = e.getCause(); cause != null && cause != cause.getCause();
      cause = cause.getCause()) {
      if (cause instanceof CertificateException || cause instanceof CertPathValidatorException) {
        return false;
      }
      if (cause instanceof SocketException || cause instanceof EOFException) dropped = true;
    }
    return dropped;
  }

  /**
   * Asks the server for the line protocol versions it accepts, and returns the highest one this
   * sender can write. Servers without a settings endpoint, or which list no versions, only accept
   * {@link ProtocolVersion#V1}.
   *
   * @throws LineSenderException if the server only lists versions this sender can't write
   */
  @Override public ProtocolVersion negotiateProtocolVersion() throws IOException {
    if (closeCalled.get()) throw new ClosedSenderException();
    String settings;
    try {
      settings = getSettings(settingsEndpoint, authorization, requestTimeout);
    } catch (HttpStatusException e) {
      if (e.statusCode() != 404) throw e;
      logger.fine("No settings endpoint at " + baseUrl + ", using protocol version 1");
      return ProtocolVersion.V1;
    }
    int[] versions = supportedVersions(settings);
    if (versions.length == 0) return ProtocolVersion.V1;
    ProtocolVersion result = ProtocolVersion.highest(versions);
    if (result == null) {
      throw new LineSenderException(
        "Unsupported protocol versions received from server: " + Arrays.toString(versions));
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Using protocol version " + result.value() + " with " + baseUrl);
    }
    return result;
  }

  /**
   * Reads the numbers listed under {@code "line.proto.support.versions"} in a settings response,
   * such as {@code {"config":{"line.proto.support.versions":[1,2]}}}. Returns an empty array when
   * the key is absent.
   */
  static int[] supportedVersions(String settings) throws IOException {
    int key = settings.indexOf(SUPPORTED_VERSIONS_KEY);
    if (key < 0) return new int[0];
    int i = skipWhitespace(settings, key + SUPPORTED_VERSIONS_KEY.length());
    if (i == settings.length() || settings.charAt(i) != ':') throw malformed(settings);
    i = skipWhitespace(settings, i + 1);
    if (settings.startsWith("null", i)) return new int[0];
    if (i == settings.length() || settings.charAt(i) != '[') throw malformed(settings);
    int end = settings.indexOf(']', i);
    if (end < 0) throw malformed(settings);
    String list = settings.substring(i + 1, end).trim();
    if (list.isEmpty()) return new int[0];
    List<Integer> result = new ArrayList<>();
    for (String item : list.split(",")) {
      String version = item.trim();
      if (version.length() > 1 && version.charAt(0) == '"' && version.endsWith("\"")) {
        version = version.substring(1, version.length() - 1);
      }
      try {
        result.add(Integer.parseInt(version));
      } catch (NumberFormatException e) {
        throw malformed(settings);
      }
    }
    int[] versions = new int[result.size()];
    for (int j = 0; j < versions.length; j++) versions[j] = result.get(j);
    return versions;
  }

  static int skipWhitespace(String text, int i) {
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
    return i;
  }

  static IOException malformed(String settings) {
    return new IOException("Malformed " + SUPPORTED_VERSIONS_KEY + " in settings: " + settings);
  }

  void sleep(long delayMillis, IOException failure) throws IOException {
    try {
      sleeper.sleep(delayMillis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      InterruptedIOException interrupted = new InterruptedIOException("interrupted retrying");
      interrupted.addSuppressed(failure);
      throw interrupted;
    }
  }

  /** The request timeout plus the time to transfer the payload at the minimum throughput. */
  int requestTimeoutMillis(int length) {
    long result = requestTimeout;
    if (requestMinThroughput > 0) result += (long) length * 1000 / requestMinThroughput;
    return (int) Math.min(result, Integer.MAX_VALUE);
  }

  @Override public final void close() {
    if (!closeCalled.compareAndSet(false, true)) return; // already closed
    try {
      doClose();
    } catch (RuntimeException | Error e) {
      propagateIfFatal(e);
      logger.log(Level.FINE, "ignoring error closing " + this, e);
    }
  }

  @Override public String toString() {
    return getClass().getSimpleName() + "{" + endpoint + "}";
  }
}
