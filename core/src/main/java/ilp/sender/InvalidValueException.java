/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

/**
 * Thrown when a column value has no line protocol representation, such as {@code NaN} or a string
 * containing a line break.
 */
public final class InvalidValueException extends LineSenderException {
  static final long serialVersionUID = -6917427187301733640L;

  public InvalidValueException(String message) {
    super(message);
  }
}
