package com.acme.crm.dispatch;

import com.acme.crm.core.PermanentException;
import com.acme.crm.core.TransientException;
import com.acme.crm.dedupe.DedupeKeyGenerator;
import com.acme.crm.domain.JobStatus;
import com.acme.crm.domain.JobView;
import com.acme.crm.domain.OutboundJob;
import com.acme.crm.domain.OutboundPayload;
import com.acme.crm.repository.OutboundJobRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Idempotent enqueue over the outbound job table plus the operator-facing job operations. */
public class OutboundJobQueue {

  private static final Logger LOG = LoggerFactory.getLogger(OutboundJobQueue.class);

  private final OutboundJobRepository repository;
  private final DedupeKeyGenerator dedupeKeys;
  private final int maxAttempts;
  private final Clock clock;

  public OutboundJobQueue(
      OutboundJobRepository repository,
      DedupeKeyGenerator dedupeKeys,
      int maxAttempts,
      Clock clock) {
    this.repository = repository;
    this.dedupeKeys = dedupeKeys;
    this.maxAttempts = maxAttempts;
    this.clock = clock;
  }

  /**
   * Queue a job for the dedupe key. A second call with the same key is a no-op that returns the
   * existing job's id.
   */
  public EnqueueResult enqueue(String dedupeKey, OutboundPayload payload, long conversationId) {
    return insert(dedupeKey, payload, conversationId, null, 0);
  }

  public Optional<OutboundJob> findByDedupeKey(String dedupeKey) {
    return repository.findByDedupeKey(dedupeKey);
  }

  public Optional<JobView> describe(long jobId) {
    return repository.findById(jobId).map(JobView::of);
  }

  /**
   * Re-enqueue a FAILED job as a new job with a derived dedupe key. The failed job itself is left
   * untouched; calling this twice for the same job returns the same new job.
   */
  public EnqueueResult requeueFailed(long jobId) {
    OutboundJob failed =
        repository
            .findById(jobId)
            .orElseThrow(() -> new PermanentException("Outbound job not found: " + jobId));
    if (failed.getStatus() != JobStatus.FAILED) {
      throw new IllegalStateException(
          "Only FAILED jobs can be re-enqueued, job " + jobId + " is " + failed.getStatus());
    }
    int generation = failed.getGeneration() + 1;
    String derivedKey = dedupeKeys.derive(failed.getDedupeKey(), generation);
    LOG.info("Re-enqueueing failed job {} as generation {}", jobId, generation);
    return insert(derivedKey, failed.payload(), failed.getConversationId(), jobId, generation);
  }

  private EnqueueResult insert(
      String dedupeKey,
      OutboundPayload payload,
      long conversationId,
      Long parentJobId,
      int generation) {
    Instant now = clock.instant();
    OutboundJob job =
        OutboundJob.builder()
            .dedupeKey(dedupeKey)
            .conversationId(conversationId)
            .channel(payload.channel())
            .recipient(payload.recipient())
            .body(payload.text())
            .templateRef(payload.templateRef())
            .intent(payload.intent())
            .status(JobStatus.QUEUED)
            .attempts(0)
            .maxAttempts(maxAttempts)
            .nextAttemptAt(now)
            .parentJobId(parentJobId)
            .generation(generation)
            .createdAt(now)
            .updatedAt(now)
            .build();

    Optional<Long> inserted = repository.insertIfAbsent(job);
    if (inserted.isPresent()) {
      LOG.debug(
          "Enqueued job {} for conversation {} key={}",
          inserted.get(),
          conversationId,
          job.dedupeKeyPrefix());
      return new EnqueueResult(inserted.get(), false);
    }
    OutboundJob existing =
        repository
            .findByDedupeKey(dedupeKey)
            .orElseThrow(
                () ->
                    new TransientException(
                        "Dedupe key " + job.dedupeKeyPrefix() + " is taken but not readable yet"));
    LOG.debug(
        "Duplicate enqueue for key={} collapsed into job {}", job.dedupeKeyPrefix(), existing.getId());
    return new EnqueueResult(existing.getId(), true);
  }
}
