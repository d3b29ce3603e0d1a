/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

/**
 * Thrown when the buffer would need to grow beyond its configured maximum size. This is a
 * configuration problem: either flush more often or raise the limit.
 */
public final class BufferLimitException extends LineSenderException {
  static final long serialVersionUID = 5946624393717311235L;

  final int maxBufferSize, requestedSize;

  public BufferLimitException(int maxBufferSize, int requestedSize) {
    super("Max buffer size is " + maxBufferSize + " bytes, requested buffer size: "
      + requestedSize);
    this.maxBufferSize = maxBufferSize;
    this.requestedSize = requestedSize;
  }

  public int maxBufferSize() {
    return maxBufferSize;
  }

  public int requestedSize() {
    return requestedSize;
  }
}
