/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

import java.io.IOException;

/**
 * The server answered with a status that won't change by retrying, usually a 4xx caused by
 * malformed rows or missing credentials. The whole request was rejected.
 */
public final class HttpStatusException extends IOException {
  static final long serialVersionUID = -3395632071240306946L;

  final int statusCode;

  public HttpStatusException(int statusCode, String responseBody) {
    super("HTTP request failed, statusCode=" + statusCode + ", error=" + responseBody);
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }
}
