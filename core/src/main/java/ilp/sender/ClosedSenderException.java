/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

/** An exception thrown when a {@link LineSender} or {@link Transport} is used after close. */
public final class ClosedSenderException extends IllegalStateException {
  static final long serialVersionUID = -4636520624634625689L;
}
