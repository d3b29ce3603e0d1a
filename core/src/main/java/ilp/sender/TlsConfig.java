/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Collection;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;

/**
 * Trust settings for {@code https} and {@code tcps}: which server certificates are accepted, and
 * whether the host name is checked against them.
 *
 * <p>By default, the JVM's trust store is used and host names are verified.
 */
public final class TlsConfig {
  public static TlsConfig defaults() {
    return new TlsConfig(true, null, null, null);
  }

  /** Accepts any certificate and host name. Only use this against test servers. */
  public static TlsConfig insecure() {
    return new TlsConfig(false, null, null, null);
  }

  /** Trusts the certificates in the given PEM file, instead of the JVM's trust store. */
  public static TlsConfig trustPem(String caPath) {
    if (caPath == null) throw new NullPointerException("caPath == null");
    return new TlsConfig(true, caPath, null, null);
  }

  /** Trusts the certificates in the given key store file, instead of the JVM's trust store. */
  public static TlsConfig trustKeyStore(String keyStorePath, String password) {
    if (keyStorePath == null) throw new NullPointerException("keyStorePath == null");
    return new TlsConfig(true, null, keyStorePath, password);
  }

  /** Maps {@code tls_verify}, {@code tls_ca}, {@code tls_roots} and {@code tls_roots_password}. */
  public static TlsConfig create(SenderOptions options) {
    if (options.tlsVerify() == SenderOptions.TlsVerify.UNSAFE_OFF) return insecure();
    if (options.tlsCa() != null) return trustPem(options.tlsCa());
    if (options.tlsRoots() != null) {
      return trustKeyStore(options.tlsRoots(), options.tlsRootsPassword());
    }
    return defaults();
  }

  final boolean verify;
  final String caPath, keyStorePath, keyStorePassword;

  TlsConfig(boolean verify, String caPath, String keyStorePath, String keyStorePassword) {
    this.verify = verify;
    this.caPath = caPath;
    this.keyStorePath = keyStorePath;
    this.keyStorePassword = keyStorePassword;
  }

  /** False when certificates and host names are not checked. */
  public boolean verify() {
    return verify;
  }

  /**
   * Loads the trust material. This reads files, so call it once per transport.
   *
   * @throws IOException if a certificate or key store file can't be read or parsed
   */
  public X509TrustManager trustManager() throws IOException {
    if (!verify) return TrustAll.INSTANCE;
    try {
      TrustManagerFactory factory =
        TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
      factory.init(trustStore());
      for (TrustManager trustManager : factory.getTrustManagers()) {
        if (trustManager instanceof X509TrustManager) return (X509TrustManager) trustManager;
      }
      throw new IllegalStateException("No X509TrustManager in " + factory.getAlgorithm());
    } catch (GeneralSecurityException e) {
      throw new IOException("Could not load TLS trust material: " + e.getMessage(), e);
    }
  }

  /** Creates an SSL context over {@link #trustManager()}. */
  public SSLContext sslContext() throws IOException {
    return sslContext(trustManager());
  }

  /** Creates an SSL context over a trust manager from {@link #trustManager()}. */
  public SSLContext sslContext(X509TrustManager trustManager) throws IOException {
    try {
      SSLContext context = SSLContext.getInstance("TLS");
      context.init(null, new TrustManager[] {trustManager}, null);
      return context;
    } catch (GeneralSecurityException e) {
      throw new IOException("Could not initialize TLS: " + e.getMessage(), e);
    }
  }

  /** Returns null for the JVM's default trust store. */
  KeyStore trustStore() throws IOException, GeneralSecurityException {
    if (keyStorePath != null) {
      KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
      try (InputStream in = Files.newInputStream(Paths.get(keyStorePath))) {
        keyStore.load(in, keyStorePassword != null ? keyStorePassword.toCharArray() : null);
      }
      return keyStore;
    }
    if (caPath == null) return null;

    Collection<? extends Certificate> certificates;
    try (InputStream in = Files.newInputStream(Paths.get(caPath))) {
      certificates = CertificateFactory.getInstance("X.509").generateCertificates(in);
    }
    if (certificates.isEmpty()) throw new IOException("No certificates found in " + caPath);
    KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
    keyStore.load(null, null);
    int i = 0;
    for (Certificate certificate : certificates) {
      keyStore.setCertificateEntry("ca-" + i++, certificate);
    }
    return keyStore;
  }

  @Override public String toString() {
    if (!verify) return "TlsConfig{verify=false}";
    if (caPath != null) return "TlsConfig{ca=" + caPath + "}";
    if (keyStorePath != null) return "TlsConfig{roots=" + keyStorePath + "}";
    return "TlsConfig{}";
  }

  enum TrustAll implements X509TrustManager {
    INSTANCE;

    @Override public void checkClientTrusted(X509Certificate[] chain, String authType) {
    }

    @Override public void checkServerTrusted(X509Certificate[] chain, String authType) {
    }

    @Override public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
