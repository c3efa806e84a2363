package com.acme.crm.dispatch;

public enum DispatchOutcome {
  /** A new job was queued */
  ENQUEUED,

  /** A job with the same dedupe key already exists */
  DUPLICATE,

  /** Suppressed by the conversation cool-down, not queued */
  RATE_LIMITED,

  /** Dry run: every check passed and the job would have been queued */
  WOULD_ENQUEUE;

  public boolean isSend() {
    return this == ENQUEUED || this == WOULD_ENQUEUE;
  }
}
