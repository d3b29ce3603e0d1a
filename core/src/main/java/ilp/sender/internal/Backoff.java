/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender.internal;

import java.util.Random;

/**
 * Exponential backoff between retries of one request: starts at 10ms, doubles on each call and
 * is capped at one second. Each delay gets a random jitter of up to the configured amount in
 * either direction, never going below zero.
 *
 * <p>Create one instance per request. This type is not thread-safe.
 */
public final class Backoff {
  public interface Factory {
    Backoff create();
  }

  public static final long INITIAL_DELAY_MILLIS = 10;
  public static final long MAX_DELAY_MILLIS = 1000;
  public static final int DEFAULT_JITTER_MILLIS = 5;

  final int jitterMillis;
  final Random random;
  long delayMillis = INITIAL_DELAY_MILLIS;

  public Backoff() {
    this(DEFAULT_JITTER_MILLIS, new Random());
  }

  public Backoff(int jitterMillis, Random random) {
    if (jitterMillis < 0) throw new IllegalArgumentException("jitterMillis < 0: " + jitterMillis);
    if (random == null) throw new NullPointerException("random == null");
    this.jitterMillis = jitterMillis;
    this.random = random;
  }

  /** Returns how long to wait before the next attempt, and advances the base delay. */
  public long nextDelayMillis() {
    long base = delayMillis;
    delayMillis = Math.min(delayMillis * 2, MAX_DELAY_MILLIS);
    if (jitterMillis == 0) return base;
    long jitter = random.nextInt(jitterMillis * 2 + 1) - jitterMillis;
    return Math.max(0, base + jitter);
  }
}
