/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Settings parsed from a configuration string, such as {@code
 * http::addr=localhost:9000;username=admin;password=quest;auto_flush_rows=1000;}.
 *
 * <p>The string starts with the protocol, then {@code ::}, then {@code key=value} pairs, each
 * terminated by {@code ;}. A literal {@code ;} inside a value is written as {@code ;;}. Keys are
 * case-sensitive.
 *
 * <p>Numeric settings that aren't present return {@code -1}, so the component that consumes them
 * can apply its own default. For example, the default of {@code auto_flush_rows} depends on the
 * protocol.
 */
public final class SenderOptions {
  /** Environment variable read by {@link #fromEnv()}. */
  public static final String ENV_VARIABLE = "QDB_CLIENT_CONF";

  public static final int DEFAULT_HTTP_PORT = 9000;
  public static final int DEFAULT_TCP_PORT = 9009;

  public enum Protocol {
    HTTP("http", false),
    HTTPS("https", true),
    TCP("tcp", false),
    TCPS("tcps", true);

    final String value;
    final boolean tls;

    Protocol(String value, boolean tls) {
      this.value = value;
      this.tls = tls;
    }

    public boolean isHttp() {
      return this == HTTP || this == HTTPS;
    }

    public boolean isTls() {
      return tls;
    }

    public int defaultPort() {
      return isHttp() ? DEFAULT_HTTP_PORT : DEFAULT_TCP_PORT;
    }

    /** The value as it appears in a configuration string, and as an HTTP URL scheme. */
    public String value() {
      return value;
    }

    static Protocol fromValue(String value) {
      for (Protocol protocol : values()) {
        if (protocol.value.equals(value)) return protocol;
      }
      throw new IllegalArgumentException("Invalid protocol: '" + value
        + "', accepted protocols: 'http', 'https', 'tcp', 'tcps'");
    }
  }

  public enum TlsVerify {
    ON,
    /** Trusts any server certificate and skips hostname checks. Only for testing. */
    UNSAFE_OFF
  }

  static final Set<String> VALID_KEYS = Collections.unmodifiableSet(new LinkedHashSet<>(
    Arrays.asList("addr", "protocol_version", "username", "password", "token", "token_x",
      "token_y", "auto_flush", "auto_flush_rows", "auto_flush_interval",
      "request_min_throughput", "request_timeout", "retry_timeout", "init_buf_size",
      "max_buf_size", "max_name_len", "copy_buffer", "stdlib_http", "tls_verify", "tls_ca",
      "tls_roots", "tls_roots_password")));

  /** Reads the configuration string from the {@value #ENV_VARIABLE} environment variable. */
  public static SenderOptions fromEnv() {
    String config = System.getenv(ENV_VARIABLE);
    if (config == null || config.isEmpty()) {
      throw new IllegalArgumentException(
        "Environment variable " + ENV_VARIABLE + " is not set or empty");
    }
    return parse(config);
  }

  /**
   * Parses a configuration string.
   *
   * @throws IllegalArgumentException on a syntax error, an unknown key, or an invalid value. The
   * message names the offending key.
   */
  public static SenderOptions parse(String config) {
    if (config == null || config.isEmpty()) {
      throw new IllegalArgumentException("Configuration string is missing or empty");
    }
    int separator = config.indexOf("::");
    if (separator < 0) {
      throw new IllegalArgumentException("Missing protocol, configuration string format: "
        + "'protocol::key1=value1;key2=value2;key3=value3;'");
    }
    Protocol protocol = Protocol.fromValue(config.substring(0, separator));
    Map<String, String> settings = parseSettings(config, separator + 2);
    return new SenderOptions(protocol, settings);
  }

  static Map<String, String> parseSettings(String config, int position) {
    Map<String, String> result = new LinkedHashMap<>();
    StringBuilder setting = new StringBuilder();
    int length = config.length();
    for (int i = position; i < length; i++) {
      char ch = config.charAt(i);
      if (ch != ';') {
        setting.append(ch);
      } else if (i + 1 < length && config.charAt(i + 1) == ';') {
        setting.append(';');
        i++;
      } else {
        addSetting(result, setting.toString());
        setting.setLength(0);
      }
    }
    if (setting.length() > 0) addSetting(result, setting.toString());
    return result;
  }

  static void addSetting(Map<String, String> result, String setting) {
    int equals = setting.indexOf('=');
    if (equals < 0) throw new IllegalArgumentException("Missing '=' sign in '" + setting + "'");
    String key = setting.substring(0, equals);
    String value = setting.substring(equals + 1);
    if (!VALID_KEYS.contains(key)) {
      throw new IllegalArgumentException("Unknown configuration key: '" + key + "'");
    }
    if (value.isEmpty()) {
      throw new IllegalArgumentException(
        "Invalid configuration, value is not set for '" + key + "'");
    }
    for (int i = 0; i < value.length(); i++) {
      char ch = value.charAt(i);
      if (ch < 0x20 || (ch > 0x7e && ch < 0xa0)) {
        throw new IllegalArgumentException(
          "Invalid configuration, control characters are not allowed in '" + key + "'");
      }
    }
    result.put(key, value);
  }

  final Protocol protocol;
  final ProtocolVersion protocolVersion;
  final String host;
  final int port;
  final String username, password, token, tokenX, tokenY;
  final boolean autoFlush, copyBuffer, stdlibHttp;
  final int autoFlushRows, autoFlushInterval;
  final int requestMinThroughput, requestTimeout, retryTimeout;
  final int initBufferSize, maxBufferSize, maxNameLength;
  final TlsVerify tlsVerify;
  final String tlsCa, tlsRoots, tlsRootsPassword;

  SenderOptions(Protocol protocol, Map<String, String> settings) {
    this.protocol = protocol;
    protocolVersion = parseProtocolVersion(protocol, settings.get("protocol_version"));

    String addr = settings.get("addr");
    if (addr == null) throw new IllegalArgumentException("Invalid configuration, 'addr' is required");
    int colon = addr.lastIndexOf(':');
    if (colon < 0) {
      host = addr;
      port = protocol.defaultPort();
    } else {
      host = addr.substring(0, colon);
      if (host.isEmpty()) throw new IllegalArgumentException("Host name is required in 'addr'");
      String portText = addr.substring(colon + 1);
      if (portText.isEmpty()) throw new IllegalArgumentException("Port is required in 'addr'");
      port = parseInt("addr", portText, 1);
      if (port > 65535) throw new IllegalArgumentException("Invalid port in 'addr': " + port);
    }

    username = settings.get("username");
    password = settings.get("password");
    token = settings.get("token");
    tokenX = settings.get("token_x");
    tokenY = settings.get("token_y");

    autoFlush = parseBoolean(settings, "auto_flush", "off", true);
    autoFlushRows = parseInt(settings, "auto_flush_rows", 0);
    autoFlushInterval = parseInt(settings, "auto_flush_interval", 0);
    requestMinThroughput = parseInt(settings, "request_min_throughput", 0);
    requestTimeout = parseInt(settings, "request_timeout", 1);
    retryTimeout = parseInt(settings, "retry_timeout", 0);
    initBufferSize = parseInt(settings, "init_buf_size", 1);
    maxBufferSize = parseInt(settings, "max_buf_size", 1);
    maxNameLength = parseInt(settings, "max_name_len", 1);
    copyBuffer = parseBoolean(settings, "copy_buffer", "off", true);
    stdlibHttp = parseBoolean(settings, "stdlib_http", "off", false);
    tlsVerify = parseBoolean(settings, "tls_verify", "unsafe_off", true)
      ? TlsVerify.ON : TlsVerify.UNSAFE_OFF;
    tlsCa = settings.get("tls_ca");
    tlsRoots = settings.get("tls_roots");
    tlsRootsPassword = settings.get("tls_roots_password");

    if (initBufferSize != -1 && maxBufferSize != -1 && initBufferSize > maxBufferSize) {
      throw new IllegalArgumentException("Invalid configuration, 'init_buf_size' ("
        + initBufferSize + ") is larger than 'max_buf_size' (" + maxBufferSize + ")");
    }
    if (tlsCa != null && tlsRoots != null) {
      throw new IllegalArgumentException(
        "Invalid configuration, only one of 'tls_ca' and 'tls_roots' can be set");
    }
    if (tlsRootsPassword != null && tlsRoots == null) {
      throw new IllegalArgumentException(
        "Invalid configuration, 'tls_roots_password' is set without 'tls_roots'");
    }
    if (!protocol.isTls() && (tlsCa != null || tlsRoots != null
      || settings.containsKey("tls_verify"))) {
      throw new IllegalArgumentException("Invalid configuration, TLS settings require protocol '"
        + protocol.value + "s'");
    }
    if (!protocol.isHttp()) {
      if (password != null) {
        throw new IllegalArgumentException(
          "Invalid configuration, 'password' is only supported by HTTP, use 'token' for TCP");
      }
      if (token != null && username == null) {
        throw new IllegalArgumentException(
          "Invalid configuration, 'username' is required as the key id of the TCP 'token'");
      }
    } else if (tokenX != null || tokenY != null) {
      throw new IllegalArgumentException(
        "Invalid configuration, 'token_x' and 'token_y' are only supported by TCP");
    } else if (token != null && (username != null || password != null)) {
      throw new IllegalArgumentException(
        "Invalid configuration, 'token' cannot be combined with 'username' and 'password'");
    } else if ((username == null) != (password == null)) {
      throw new IllegalArgumentException(
        "Invalid configuration, 'username' and 'password' must be set together");
    }
  }

  /** TCP can't ask the server, so {@code auto} means version 1 there. */
  static ProtocolVersion parseProtocolVersion(Protocol protocol, String value) {
    if (value == null || value.equals("auto")) {
      return protocol.isHttp() ? null : ProtocolVersion.V1;
    }
    if (value.equals("1")) return ProtocolVersion.V1;
    if (value.equals("2")) return ProtocolVersion.V2;
    throw new IllegalArgumentException("Invalid protocol_version: '" + value
      + "', accepted values: 'auto', '1', '2'");
  }

  static int parseInt(Map<String, String> settings, String key, int lowerBound) {
    String value = settings.get(key);
    return value == null ? -1 : parseInt(key, value, lowerBound);
  }

  static int parseInt(String key, String value, int lowerBound) {
    int result;
    try {
      result = Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
        "Invalid '" + key + "' option, not a number: '" + value + "'");
    }
    if (result < lowerBound) {
      throw new IllegalArgumentException("Invalid '" + key + "' option: " + result
        + ", must be at least " + lowerBound);
    }
    return result;
  }

  static boolean parseBoolean(Map<String, String> settings, String key, String offValue,
    boolean defaultValue) {
    String value = settings.get(key);
    if (value == null) return defaultValue;
    if (value.equals("on")) return true;
    if (value.equals(offValue)) return false;
    throw new IllegalArgumentException("Invalid '" + key + "' option: '" + value
      + "', accepted values: 'on', '" + offValue + "'");
  }

  public Protocol protocol() {
    return protocol;
  }

  /**
   * The configured line protocol version, or null when HTTP should ask the server with {@link
   * Transport#negotiateProtocolVersion()}.
   */
  public ProtocolVersion protocolVersion() {
    return protocolVersion;
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  public String username() {
    return username;
  }

  public String password() {
    return password;
  }

  /** Bearer token for HTTP, or the base64url private key {@code d} for TCP authentication. */
  public String token() {
    return token;
  }

  /** Public key coordinate, accepted for compatibility. Authentication only needs the private key. */
  public String tokenX() {
    return tokenX;
  }

  public String tokenY() {
    return tokenY;
  }

  public boolean autoFlush() {
    return autoFlush;
  }

  public int autoFlushRows() {
    return autoFlushRows;
  }

  public int autoFlushInterval() {
    return autoFlushInterval;
  }

  public int requestMinThroughput() {
    return requestMinThroughput;
  }

  public int requestTimeout() {
    return requestTimeout;
  }

  public int retryTimeout() {
    return retryTimeout;
  }

  public int initBufferSize() {
    return initBufferSize;
  }

  public int maxBufferSize() {
    return maxBufferSize;
  }

  public int maxNameLength() {
    return maxNameLength;
  }

  public BufferMode bufferMode() {
    return copyBuffer ? BufferMode.COPY_ON_FLUSH : BufferMode.REUSE_IN_PLACE;
  }

  public boolean stdlibHttp() {
    return stdlibHttp;
  }

  public TlsVerify tlsVerify() {
    return tlsVerify;
  }

  /** Path to a PEM file of trusted certificates. */
  public String tlsCa() {
    return tlsCa;
  }

  /** Path to a key store of trusted certificates. */
  public String tlsRoots() {
    return tlsRoots;
  }

  public String tlsRootsPassword() {
    return tlsRootsPassword;
  }

  @Override public String toString() {
    // secrets are omitted
    return "SenderOptions{" + protocol.value + "://" + host + ":" + port + "}";
  }
}
