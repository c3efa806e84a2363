package com.acme.crm.runner;

import com.acme.crm.config.AutomationConfig;
import com.acme.crm.conversation.ConversationStateStore;
import com.acme.crm.core.PermanentException;
import com.acme.crm.core.StaleStateException;
import com.acme.crm.domain.OutboundJob;
import com.acme.crm.repository.OutboundJobRepository;
import com.acme.crm.spi.ConversationTarget;
import com.acme.crm.spi.MessagingProvider;
import com.acme.crm.spi.ProviderReceipt;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains a bounded batch of due jobs. Several runners may call this concurrently: each job is
 * claimed with a conditional update and a lost claim is skipped silently. The send happens outside
 * any transaction and the outcome is written back with claimer-guarded updates.
 */
public class OutboundJobRunner {

  private static final Logger LOG = LoggerFactory.getLogger(OutboundJobRunner.class);

  static final String STALE_CLAIM_ERROR = "claim expired, delivery state unknown";

  private enum Delivery {
    SENT,
    REQUEUED,
    FAILED
  }

  private final OutboundJobRepository repository;
  private final MessagingProvider provider;
  private final ConversationStateStore conversations;
  private final RetryPolicy retryPolicy;
  private final AutomationConfig config;
  private final Clock clock;

  public OutboundJobRunner(
      OutboundJobRepository repository,
      MessagingProvider provider,
      ConversationStateStore conversations,
      RetryPolicy retryPolicy,
      AutomationConfig config,
      Clock clock) {
    this.repository = repository;
    this.provider = provider;
    this.conversations = conversations;
    this.retryPolicy = retryPolicy;
    this.config = config;
    this.clock = clock;
  }

  public JobRunResult processOutboundJobs(int maxJobs) {
    String runnerId = config.getRunnerId();
    Instant now = clock.instant();

    int staleFailed =
        repository.failStaleClaims(
            now.minus(config.getStaleClaimTimeout()), STALE_CLAIM_ERROR, now);
    if (staleFailed > 0) {
      LOG.warn("Failed {} jobs whose claim expired mid-send", staleFailed);
    }

    List<Long> due = repository.findDueQueuedIds(maxJobs, now);
    if (due.isEmpty()) {
      return JobRunResult.empty(staleFailed);
    }

    List<Long> sent = new ArrayList<>();
    List<Long> failed = new ArrayList<>();
    List<Long> requeued = new ArrayList<>();
    int skipped = 0;

    for (Long id : due) {
      try {
        if (!repository.claim(id, runnerId, clock.instant())) {
          skipped++;
          continue;
        }
        Optional<OutboundJob> job = repository.findById(id);
        if (job.isEmpty()) {
          skipped++;
          continue;
        }
        switch (deliver(job.get(), runnerId)) {
          case SENT -> sent.add(id);
          case REQUEUED -> requeued.add(id);
          case FAILED -> failed.add(id);
        }
      } catch (RuntimeException e) {
        // bookkeeping failed; the claim stays PROCESSING until the stale sweep fails it
        LOG.error("Error processing outbound job {}: {}", id, e.getMessage(), e);
        failed.add(id);
      }
    }

    LOG.info(
        "Runner {} processed batch: sent={} requeued={} failed={} skipped={}",
        runnerId,
        sent.size(),
        requeued.size(),
        failed.size(),
        skipped);
    return new JobRunResult(
        sent.size(),
        failed.size(),
        requeued.size(),
        skipped,
        staleFailed,
        new JobRunResult.JobIds(sent, failed, requeued));
  }

  private Delivery deliver(OutboundJob job, String runnerId) {
    ConversationTarget target =
        new ConversationTarget(job.getConversationId(), job.getChannel(), job.getRecipient());
    try {
      ProviderReceipt receipt = provider.send(target, job.getBody());
      Instant now = clock.instant();
      if (!repository.markSent(job.getId(), runnerId, receipt.providerMessageId(), now)) {
        LOG.warn(
            "Job {} was sent as {} but its claim had already been released",
            job.getId(),
            receipt.providerMessageId());
      }
      recordOutbound(job, now);
      LOG.debug("Sent job {} provider id={}", job.getId(), receipt.providerMessageId());
      return Delivery.SENT;
    } catch (PermanentException e) {
      LOG.error("Job {} failed permanently: {}", job.getId(), e.getMessage());
      repository.markFailed(job.getId(), runnerId, e.getMessage(), clock.instant());
      return Delivery.FAILED;
    } catch (RuntimeException e) {
      // transient, or unknown and treated as transient
      String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      Instant now = clock.instant();
      if (job.attemptsRemaining()) {
        Instant nextAttemptAt = now.plus(retryPolicy.backoffFor(job.getAttempts()));
        LOG.warn(
            "Job {} attempt {}/{} failed, retrying at {}: {}",
            job.getId(),
            job.getAttempts(),
            job.getMaxAttempts(),
            nextAttemptAt,
            error);
        repository.requeue(job.getId(), runnerId, error, nextAttemptAt, now);
        return Delivery.REQUEUED;
      }
      LOG.error(
          "Job {} failed after {} attempts: {}", job.getId(), job.getAttempts(), error);
      repository.markFailed(
          job.getId(), runnerId, "retries exhausted: " + error, now);
      return Delivery.FAILED;
    }
  }

  private void recordOutbound(OutboundJob job, Instant sentAt) {
    try {
      conversations.mutate(
          job.getConversationId(), c -> c.withLastOutboundAt(sentAt).withUpdatedAt(sentAt));
    } catch (StaleStateException | PermanentException e) {
      LOG.warn(
          "Job {} sent but conversation {} was not stamped: {}",
          job.getId(),
          job.getConversationId(),
          e.getMessage());
    }
  }
}
