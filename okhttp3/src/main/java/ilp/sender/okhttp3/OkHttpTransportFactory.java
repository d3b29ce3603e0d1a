/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender.okhttp3;

import ilp.sender.HttpTransportFactory;
import ilp.sender.SenderOptions;
import ilp.sender.Transport;

/** Registered with {@link java.util.ServiceLoader}, so it is used by default for HTTP. */
public final class OkHttpTransportFactory implements HttpTransportFactory {
  @Override public String name() {
    return OKHTTP;
  }

  @Override public Transport create(SenderOptions options) {
    return OkHttpTransport.create(options);
  }

  @Override public String toString() {
    return "OkHttpTransportFactory";
  }
}
