/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

/**
 * Thrown when complete rows could not be delivered. Over HTTP, this is raised after the retry
 * timeout elapsed, or immediately on a response that isn't retryable. Over TCP, it is raised on the
 * first write error, and the connection is closed.
 *
 * <p>The rows are no longer in the sender's buffer. They are available from {@link #unsentData()},
 * so that callers can persist them or retry the whole batch later. Since the server may have
 * accepted some of the rows sent over TCP before the failure, resending is at-least-once.
 */
public final class FlushFailedException extends LineSenderException {
  static final long serialVersionUID = -7790734120233498215L;

  final byte[] unsentData;
  final int rowCount;

  public FlushFailedException(String message, Throwable cause, byte[] unsentData, int rowCount) {
    super(message, cause);
    this.unsentData = unsentData;
    this.rowCount = rowCount;
  }

  /** Returns the line protocol bytes of the rows that were not delivered. */
  public byte[] unsentData() {
    return unsentData.clone();
  }

  /** Returns the number of rows in {@link #unsentData()}. */
  public int rowCount() {
    return rowCount;
  }
}
