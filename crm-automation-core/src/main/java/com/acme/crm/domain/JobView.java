package com.acme.crm.domain;

import java.time.Instant;

/** Operator view of a job: enough to answer "did this send, and if not, why". */
public record JobView(
    long jobId,
    JobStatus status,
    int attempts,
    int maxAttempts,
    String lastError,
    String dedupeKeyPrefix,
    String providerMessageId,
    Instant nextAttemptAt,
    Instant updatedAt) {

  public static JobView of(OutboundJob job) {
    return new JobView(
        job.getId(),
        job.getStatus(),
        job.getAttempts(),
        job.getMaxAttempts(),
        job.getLastError(),
        job.dedupeKeyPrefix(),
        job.getProviderMessageId(),
        job.getNextAttemptAt(),
        job.getUpdatedAt());
  }
}
