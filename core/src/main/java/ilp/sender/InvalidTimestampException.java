/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

/** Thrown when a designated timestamp is negative or doesn't fit in nanoseconds. */
public final class InvalidTimestampException extends LineSenderException {
  static final long serialVersionUID = 3155406416917470154L;

  public InvalidTimestampException(String message) {
    super(message);
  }
}
