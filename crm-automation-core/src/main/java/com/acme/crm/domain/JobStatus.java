package com.acme.crm.domain;

/** Lifecycle of an outbound job. SENT and FAILED are terminal. */
public enum JobStatus {
  /** Waiting to be claimed by a runner */
  QUEUED,

  /** Claimed by exactly one runner, send in flight */
  PROCESSING,

  /** Provider accepted the message */
  SENT,

  /** Permanent failure or retries exhausted */
  FAILED;

  public boolean isTerminal() {
    return this == SENT || this == FAILED;
  }
}
