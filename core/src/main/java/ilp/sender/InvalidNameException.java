/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

/** Thrown when a table or column name cannot be written in line protocol. */
public final class InvalidNameException extends LineSenderException {
  static final long serialVersionUID = -2293813506446339712L;

  public InvalidNameException(String message) {
    super(message);
  }
}
