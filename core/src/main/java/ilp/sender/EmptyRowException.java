/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

/** Thrown when a row is closed before any symbol or column was added to it. */
public final class EmptyRowException extends LineSenderException {
  static final long serialVersionUID = -1404325484396183012L;

  public EmptyRowException(String message) {
    super(message);
  }
}
