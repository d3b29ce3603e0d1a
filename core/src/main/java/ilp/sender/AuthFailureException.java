/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

/**
 * Thrown when the TCP challenge-response handshake could not be completed. The connection is closed
 * when this is raised, and is never re-opened automatically.
 */
public final class AuthFailureException extends LineSenderException {
  static final long serialVersionUID = -8315519916224337917L;

  public AuthFailureException(String message) {
    super(message);
  }

  public AuthFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
