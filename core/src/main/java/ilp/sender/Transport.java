/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Delivers encoded line protocol to the database. Implementations own their network resources,
 * and are owned by exactly one {@link LineSender}.
 *
 * @see TcpTransport
 * @see BaseHttpTransport
 */
public interface Transport extends Closeable {

  /**
   * Opens the connection and authenticates, if the transport is connection oriented. HTTP
   * transports connect per request, so this is a no-op for them.
   *
   * @throws AuthFailureException if the server rejected the handshake
   * @throws IllegalStateException if already connected
   */
  void connect() throws IOException;

  /**
   * Sends complete rows. The buffer's content from its position to its limit is sent, and the
   * buffer is not retained after this returns.
   *
   * @throws ClosedSenderException if {@link #close() close} was called.
   */
  void send(ByteBuffer rows) throws IOException;

  /**
   * Resolves {@code protocol_version=auto} to the highest version both this sender and the server
   * accept. Transports that can't ask the server use {@link ProtocolVersion#V1}.
   */
  default ProtocolVersion negotiateProtocolVersion() throws IOException {
    return ProtocolVersion.V1;
  }

  /** Count of rows after which a sender flushes, unless configured otherwise. */
  int defaultAutoFlushRows();

  /** Releases network resources. Subsequent calls are no-ops. */
  @Override void close();
}
