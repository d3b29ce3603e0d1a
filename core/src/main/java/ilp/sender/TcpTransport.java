/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

import ilp.sender.internal.ChallengeSigner;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;

import static ilp.sender.internal.Throwables.propagateIfFatal;

/**
 * Streams rows over a single TCP connection, optionally over TLS.
 *
 * <h3>Usage</h3>
 *
 * <pre>{@code
 * transport = TcpTransport.newBuilder()
 *   .address("localhost", 9009)
 *   .auth("admin", "5UjEMuA0Pj5pjK8a-fa24dyIf-Es5mYny3oE_Wmus48")
 *   .build();
 * }</pre>
 *
 * <p>When a key is configured, {@link #connect()} authenticates before returning: it sends the key
 * id, reads a challenge up to a newline, and answers with the challenge signed by the private key.
 *
 * <h3>Implementation Notes</h3>
 *
 * <p>The protocol has no acknowledgement, so a successful {@link #send(ByteBuffer)} only means the
 * bytes were written to the socket. Rejected data shows up as a failure of a later write, after
 * the server closed the connection. Any write failure closes the socket: call {@link #connect()}
 * again to continue. Reconnecting is never automatic.
 *
 * <p>This type is not thread-safe, except {@link #close()}.
 */
public final class TcpTransport implements Transport {
  public static final int DEFAULT_AUTO_FLUSH_ROWS = 600;
  /** Longest challenge accepted from the server. */
  static final int MAX_CHALLENGE_LENGTH = 4096;

  /** Creates a transport to the given address, without TLS or authentication. */
  public static TcpTransport create(String host, int port) {
    return newBuilder().address(host, port).build();
  }

  /** Creates a transport from the {@code tcp} or {@code tcps} settings of a configuration string. */
  public static TcpTransport create(SenderOptions options) {
    return newBuilder().options(options).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    String host;
    int port = SenderOptions.DEFAULT_TCP_PORT;
    boolean tls;
    TlsConfig tlsConfig = TlsConfig.defaults();
    String keyId, privateKey;
    int requestTimeout = BaseHttpTransport.DEFAULT_REQUEST_TIMEOUT;
    Logger logger = Logger.getLogger(TcpTransport.class.getName());

    Builder() {
    }

    Builder(TcpTransport transport) {
      host = transport.host;
      port = transport.port;
      tls = transport.tls;
      tlsConfig = transport.tlsConfig;
      keyId = transport.keyId;
      privateKey = transport.privateKey;
      requestTimeout = transport.requestTimeout;
      logger = transport.logger;
    }

    /** Applies address, TLS, authentication and timeout settings. */
    public Builder options(SenderOptions options) {
      if (options == null) throw new NullPointerException("options == null");
      if (options.protocol().isHttp()) {
        throw new IllegalArgumentException("not a TCP protocol: " + options.protocol().value());
      }
      host = options.host();
      port = options.port();
      tls = options.protocol().isTls();
      tlsConfig = TlsConfig.create(options);
      if (options.token() != null) auth(options.username(), options.token());
      if (options.requestTimeout() != -1) requestTimeout = options.requestTimeout();
      return this;
    }

    /** No default. The host and ILP port of the database, usually 9009. */
    public Builder address(String host, int port) {
      if (host == null) throw new NullPointerException("host == null");
      if (port < 1 || port > 65535) throw new IllegalArgumentException("invalid port: " + port);
      this.host = host;
      this.port = port;
      return this;
    }

    /** Default false. True wraps the connection in TLS, using the {@link #tlsConfig(TlsConfig)}. */
    public Builder tls(boolean tls) {
      this.tls = tls;
      return this;
    }

    public Builder tlsConfig(TlsConfig tlsConfig) {
      if (tlsConfig == null) throw new NullPointerException("tlsConfig == null");
      this.tlsConfig = tlsConfig;
      return this;
    }

    /**
     * Authenticates each connection with an EC P-256 key.
     *
     * @param keyId the key id ({@code kid}), usually the user name
     * @param privateKey the private scalar ({@code d}) of the key, base64url encoded
     */
    public Builder auth(String keyId, String privateKey) {
      if (keyId == null) throw new NullPointerException("keyId == null");
      if (privateKey == null) throw new NullPointerException("privateKey == null");
      this.keyId = keyId;
      this.privateKey = privateKey;
      return this;
    }

    /** Bounds connecting and waiting for the authentication challenge. Default 10000ms. */
    public Builder requestTimeout(int requestTimeoutMillis) {
      if (requestTimeoutMillis < 1) {
        throw new IllegalArgumentException("requestTimeout < 1: " + requestTimeoutMillis);
      }
      this.requestTimeout = requestTimeoutMillis;
      return this;
    }

    public Builder logger(Logger logger) {
      if (logger == null) throw new NullPointerException("logger == null");
      this.logger = logger;
      return this;
    }

    /**
     * @throws IllegalArgumentException if the private key is not a valid P-256 key
     */
    public TcpTransport build() {
      if (host == null) throw new NullPointerException("host == null");
      return new TcpTransport(this);
    }
  }

  final String host;
  final int port;
  final boolean tls;
  final TlsConfig tlsConfig;
  final String keyId, privateKey;
  final ChallengeSigner signer;
  final int requestTimeout;
  final Logger logger;

  /** Null until connected, and again after a write failure or close. */
  volatile Connection connection;
  volatile boolean closeCalled;

  /** A socket with its output stream, so that a reader never sees one without the other. */
  static final class Connection {
    final Socket socket;
    final OutputStream out;

    Connection(Socket socket, OutputStream out) {
      this.socket = socket;
      this.out = out;
    }
  }

  TcpTransport(Builder builder) {
    host = builder.host;
    port = builder.port;
    tls = builder.tls;
    tlsConfig = builder.tlsConfig;
    keyId = builder.keyId;
    privateKey = builder.privateKey;
    signer = privateKey != null ? ChallengeSigner.create(privateKey) : null;
    requestTimeout = builder.requestTimeout;
    logger = builder.logger;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public boolean isConnected() {
    return connection != null;
  }

  @Override public void connect() throws IOException {
    if (closeCalled) throw new ClosedSenderException();
    if (connection != null) throw new IllegalStateException("already connected to " + this);

    Socket socket = tls ? newTlsSocket() : new Socket();
    try {
      socket.connect(new InetSocketAddress(host, port), requestTimeout);
      socket.setTcpNoDelay(true);
      if (tls) ((SSLSocket) socket).startHandshake();
      if (signer != null) authenticate(socket);
    } catch (IOException | RuntimeException | Error e) {
      closeQuietly(socket);
      throw e;
    }
    OutputStream out;
    try {
      out = socket.getOutputStream();
    } catch (IOException e) {
      closeQuietly(socket);
      throw e;
    }
    connection = new Connection(socket, out);
    if (closeCalled) { // close raced with connecting
      disconnect();
      throw new ClosedSenderException();
    }
    if (logger.isLoggable(Level.FINE)) logger.fine("Connected to " + this);
  }

  Socket newTlsSocket() throws IOException {
    SSLSocket socket = (SSLSocket) tlsConfig.sslContext().getSocketFactory().createSocket();
    if (tlsConfig.verify()) {
      SSLParameters parameters = socket.getSSLParameters();
      parameters.setEndpointIdentificationAlgorithm("HTTPS");
      socket.setSSLParameters(parameters);
    }
    return socket;
  }

  void authenticate(Socket socket) throws IOException {
    OutputStream out = socket.getOutputStream();
    out.write((keyId + "\n").getBytes(StandardCharsets.UTF_8));
    out.flush();

    byte[] challenge;
    socket.setSoTimeout(requestTimeout);
    try {
      challenge = readChallenge(socket.getInputStream());
    } catch (SocketTimeoutException e) {
      throw new AuthFailureException(
        "Timed out after " + requestTimeout + "ms waiting for the authentication challenge", e);
    } catch (EOFException e) {
      throw new AuthFailureException("Connection closed before the authentication challenge", e);
    } finally {
      socket.setSoTimeout(0);
    }

    String signature = signer.sign(challenge);
    out.write((signature + "\n").getBytes(StandardCharsets.US_ASCII));
    out.flush();
  }

  /** Reads bytes up to, and excluding, the next newline. */
  static byte[] readChallenge(InputStream in) throws IOException {
    ByteArrayOutputStream result = new ByteArrayOutputStream(64);
    while (true) {
      int b = in.read();
      if (b == -1) throw new EOFException("EOF before newline");
      if (b == '\n') return result.toByteArray();
      if (result.size() == MAX_CHALLENGE_LENGTH) {
        throw new AuthFailureException(
          "Authentication challenge is longer than " + MAX_CHALLENGE_LENGTH + " bytes");
      }
      result.write(b);
    }
  }

  @Override public void send(ByteBuffer rows) throws IOException {
    if (closeCalled) throw new ClosedSenderException();
    if (rows == null) throw new NullPointerException("rows == null");
    Connection connection = this.connection;
    if (connection == null) throw new IOException(this + " is not connected");
    OutputStream out = connection.out;
    try {
      if (rows.hasArray()) {
        out.write(rows.array(), rows.arrayOffset() + rows.position(), rows.remaining());
      } else {
        byte[] copy = new byte[rows.remaining()];
        rows.duplicate().get(copy);
        out.write(copy);
      }
      out.flush();
    } catch (IOException e) {
      // the server may have closed the connection after rejecting data
      disconnect();
      throw e;
    }
  }

  @Override public int defaultAutoFlushRows() {
    return DEFAULT_AUTO_FLUSH_ROWS;
  }

  @Override public void close() {
    if (closeCalled) return;
    closeCalled = true;
    disconnect();
  }

  void disconnect() {
    Connection connection = this.connection;
    this.connection = null;
    if (connection != null) closeQuietly(connection.socket);
  }

  void closeQuietly(Socket socket) {
    try {
      socket.close();
    } catch (Throwable t) {
      propagateIfFatal(t);
      logger.fine("ignoring error closing socket: " + t.getMessage());
    }
  }

  @Override public String toString() {
    return "TcpTransport{" + (tls ? "tcps" : "tcp") + "://" + host + ":" + port + "}";
  }
}
