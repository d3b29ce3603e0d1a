/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Creates an HTTP {@link Transport} from {@link SenderOptions}. Implementations are found with
 * {@link ServiceLoader}, so that {@link LineSender#fromConfig(String)} works with whichever HTTP
 * module is on the classpath.
 */
public interface HttpTransportFactory {
  /** Name of the transport backed by the JDK's HTTP client, selected by {@code stdlib_http=on}. */
  String URL_CONNECTION = "urlconnection";
  /** Name of the transport preferred when {@code stdlib_http} is off. */
  String OKHTTP = "okhttp3";

  /** Short name, such as {@value #OKHTTP}. */
  String name();

  Transport create(SenderOptions options);

  /**
   * Creates a transport using the factory found on the classpath, preferring the one named by
   * {@link SenderOptions#stdlibHttp()}.
   *
   * @throws IllegalStateException if no factory is registered
   */
  static Transport load(SenderOptions options) {
    return load(options, HttpTransportFactory.class.getClassLoader());
  }

  static Transport load(SenderOptions options, ClassLoader classLoader) {
    List<HttpTransportFactory> factories = new ArrayList<>();
    for (HttpTransportFactory factory : ServiceLoader.load(HttpTransportFactory.class, classLoader)) {
      factories.add(factory);
    }
    if (factories.isEmpty()) {
      throw new IllegalStateException("No HTTP transport found: add ilp-sender-okhttp3 or "
        + "ilp-sender-urlconnection to the classpath");
    }
    String preferred = options.stdlibHttp() ? URL_CONNECTION : OKHTTP;
    for (HttpTransportFactory factory : factories) {
      if (factory.name().equals(preferred)) return factory.create(options);
    }
    return factories.get(0).create(options);
  }
}
