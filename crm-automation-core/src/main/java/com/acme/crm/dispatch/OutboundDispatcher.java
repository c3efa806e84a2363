package com.acme.crm.dispatch;

import com.acme.crm.domain.DispatchOrigin;
import com.acme.crm.domain.OutboundJob;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for every send: duplicate check, cool-down gate for automated sends, then enqueue.
 * In dry-run mode every check runs but nothing is written.
 */
public class OutboundDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(OutboundDispatcher.class);

  private final OutboundJobQueue queue;
  private final RateLimiter rateLimiter;

  public OutboundDispatcher(OutboundJobQueue queue, RateLimiter rateLimiter) {
    this.queue = queue;
    this.rateLimiter = rateLimiter;
  }

  public DispatchResult dispatch(DispatchRequest request) {
    return dispatch(request, false);
  }

  public DispatchResult dispatch(DispatchRequest request, boolean dryRun) {
    Optional<OutboundJob> existing = queue.findByDedupeKey(request.dedupeKey());
    if (existing.isPresent()) {
      return DispatchResult.duplicate(existing.get().getId(), request.dedupeKey());
    }

    if (dryRun) {
      if (request.origin() == DispatchOrigin.AUTOMATION
          && !rateLimiter.check(request.conversationId())) {
        return suppressed(request);
      }
      return DispatchResult.wouldEnqueue(request.dedupeKey());
    }

    Optional<RateLimiter.Slot> slot = Optional.empty();
    if (request.origin() == DispatchOrigin.AUTOMATION) {
      slot = rateLimiter.acquire(request.conversationId());
      if (slot.isEmpty()) {
        return suppressed(request);
      }
    }

    EnqueueResult result;
    try {
      result = queue.enqueue(request.dedupeKey(), request.payload(), request.conversationId());
    } catch (RuntimeException e) {
      if (slot.isPresent()) {
        LOG.warn(
            "Enqueue failed for conversation {}, releasing cool-down slot", request.conversationId());
        try {
          rateLimiter.release(slot.get());
        } catch (RuntimeException releaseFailure) {
          e.addSuppressed(releaseFailure);
        }
      }
      throw e;
    }
    return result.duplicate()
        ? DispatchResult.duplicate(result.jobId(), request.dedupeKey())
        : DispatchResult.enqueued(result.jobId(), request.dedupeKey());
  }

  private DispatchResult suppressed(DispatchRequest request) {
    LOG.info("Automated send for conversation {} suppressed by cool-down", request.conversationId());
    return DispatchResult.rateLimited(request.dedupeKey());
  }
}
