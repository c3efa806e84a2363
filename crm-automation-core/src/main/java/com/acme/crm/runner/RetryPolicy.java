package com.acme.crm.runner;

import java.time.Duration;

/** Exponential backoff: {@code min(max, base * 2^(attempt-1))}. */
public final class RetryPolicy {

  private static final int MAX_SHIFT = 20;

  private final Duration base;
  private final Duration max;

  public RetryPolicy(Duration base, Duration max) {
    this.base = base;
    this.max = max;
  }

  /**
   * @param attempt the attempt that just failed, starting at 1
   */
  public Duration backoffFor(int attempt) {
    int shift = Math.min(Math.max(attempt - 1, 0), MAX_SHIFT);
    long millis = base.toMillis() << shift;
    return Duration.ofMillis(Math.min(millis, max.toMillis()));
  }
}
