/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

/**
 * Base type of errors raised by {@link LineSender} that are the result of how it was called or
 * configured, as opposed to transport I/O.
 *
 * <p>Validation and ordering errors abort only the offending call. Data already in the buffer is
 * left intact and nothing is retried.
 */
public class LineSenderException extends RuntimeException {
  static final long serialVersionUID = 4254513813620236389L;

  public LineSenderException(String message) {
    super(message);
  }

  public LineSenderException(String message, Throwable cause) {
    super(message, cause);
  }
}
