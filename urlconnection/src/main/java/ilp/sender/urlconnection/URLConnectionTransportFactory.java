/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender.urlconnection;

import ilp.sender.HttpTransportFactory;
import ilp.sender.SenderOptions;
import ilp.sender.Transport;

/** Registered with {@link java.util.ServiceLoader}, and preferred when {@code stdlib_http=on}. */
public final class URLConnectionTransportFactory implements HttpTransportFactory {
  @Override public String name() {
    return URL_CONNECTION;
  }

  @Override public Transport create(SenderOptions options) {
    return URLConnectionTransport.create(options);
  }

  @Override public String toString() {
    return "URLConnectionTransportFactory";
  }
}
