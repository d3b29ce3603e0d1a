/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

/**
 * Line protocol versions this sender can write.
 *
 * <p>{@link #V1} is plain text. {@link #V2} writes doubles in binary and adds double arrays. Both
 * versions are accepted by HTTP and TCP endpoints of servers that support them.
 */
public enum ProtocolVersion {
  V1(1),
  V2(2);

  final int value;

  ProtocolVersion(int value) {
    this.value = value;
  }

  /** The number used in the {@code protocol_version} setting. */
  public int value() {
    return value;
  }

  /** Returns the highest version in the list, or null if none are known to this sender. */
  static ProtocolVersion highest(int... versions) {
    ProtocolVersion result = null;
    for (int version : versions) {
      for (ProtocolVersion candidate : values()) {
        if (candidate.value == version && (result == null || candidate.value > result.value)) {
          result = candidate;
        }
      }
    }
    return result;
  }
}
