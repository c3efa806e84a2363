package com.acme.crm.dispatch;

public record DispatchResult(DispatchOutcome outcome, Long jobId, String dedupeKey) {

  static DispatchResult enqueued(long jobId, String dedupeKey) {
    return new DispatchResult(DispatchOutcome.ENQUEUED, jobId, dedupeKey);
  }

  static DispatchResult duplicate(long jobId, String dedupeKey) {
    return new DispatchResult(DispatchOutcome.DUPLICATE, jobId, dedupeKey);
  }

  static DispatchResult rateLimited(String dedupeKey) {
    return new DispatchResult(DispatchOutcome.RATE_LIMITED, null, dedupeKey);
  }

  static DispatchResult wouldEnqueue(String dedupeKey) {
    return new DispatchResult(DispatchOutcome.WOULD_ENQUEUE, null, dedupeKey);
  }
}
