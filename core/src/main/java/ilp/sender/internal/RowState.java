/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender.internal;

import ilp.sender.EmptyRowException;
import ilp.sender.ProtocolOrderException;

/**
 * Where the row under construction is in the line protocol call sequence. Each transition method
 * returns the next state or throws, and never mutates anything, so callers can check a call is
 * legal before writing a single byte.
 *
 * <pre>{@code
 * EMPTY --table--> TABLE_SET --symbol--> IN_SYMBOLS --column--> IN_FIELDS --at--> EMPTY
 *                      |                                 ^
 *                      +-------------column--------------+
 * }</pre>
 */
public enum RowState {
  EMPTY,
  TABLE_SET,
  IN_SYMBOLS,
  IN_FIELDS;

  public RowState table() {
    if (this != EMPTY) throw new ProtocolOrderException("Table name has already been set");
    return TABLE_SET;
  }

  public RowState symbol() {
    if (this == EMPTY || this == IN_FIELDS) {
      throw new ProtocolOrderException(
        "Symbol can be added only after table name is set and before any column added");
    }
    return IN_SYMBOLS;
  }

  public RowState column() {
    if (this == EMPTY) {
      throw new ProtocolOrderException("Column can be set only after table name is set");
    }
    return IN_FIELDS;
  }

  /** Returns {@link #EMPTY}, as closing the row readies the buffer for the next one. */
  public RowState close() {
    if (this == EMPTY || this == TABLE_SET) {
      throw new EmptyRowException("The row must have a symbol or column set before it is closed");
    }
    return EMPTY;
  }

  /** True when a column was written, so the next one is separated by a comma, not a space. */
  boolean hasColumns() {
    return this == IN_FIELDS;
  }
}
