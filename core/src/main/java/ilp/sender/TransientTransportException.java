/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

import java.io.IOException;

/**
 * A send attempt got a response that may succeed if tried again, such as a 503. Dropped
 * connections surface as the plain {@link IOException} of the HTTP client. HTTP transports retry
 * both until the retry timeout elapses.
 */
public class TransientTransportException extends IOException {
  static final long serialVersionUID = 1620960926384718364L;

  final int statusCode;

  public TransientTransportException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  /** The retryable HTTP status code. */
  public int statusCode() {
    return statusCode;
  }
}
