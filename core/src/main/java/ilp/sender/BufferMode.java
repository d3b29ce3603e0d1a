/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

/**
 * Controls what a flush hands to the {@link Transport}.
 *
 * @see LineSender.Builder#bufferMode(BufferMode)
 */
public enum BufferMode {
  /**
   * Complete rows are copied out of the buffer before sending, and the buffer is compacted right
   * away. The transport owns the copy, so the buffer may be written to while it is in flight.
   * Costs one allocation and copy per flush.
   */
  COPY_ON_FLUSH,
  /**
   * The transport receives a view over the buffer's own array. Nothing may write to the buffer
   * until the send returns, and the buffer is compacted only after that. {@link LineSender} is
   * synchronous, so this holds as long as the sender is used from one thread.
   */
  REUSE_IN_PLACE
}
