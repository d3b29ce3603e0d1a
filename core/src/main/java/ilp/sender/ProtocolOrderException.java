/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

/**
 * Thrown when a row is built out of order. For example, a symbol after a column, or a second table
 * name in the same row.
 */
public final class ProtocolOrderException extends LineSenderException {
  static final long serialVersionUID = 7736081591384216337L;

  public ProtocolOrderException(String message) {
    super(message);
  }
}
