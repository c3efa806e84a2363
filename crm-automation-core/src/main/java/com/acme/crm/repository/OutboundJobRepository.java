package com.acme.crm.repository;

import com.acme.crm.domain.OutboundJob;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for outbound jobs. This table is shared by every runner instance, so all status
 * transitions are conditional updates guarded by the current status.
 */
public interface OutboundJobRepository {

  /**
   * Insert the job unless a job with the same dedupe key exists.
   *
   * @param job the job to insert, status QUEUED
   * @return the id of the inserted job, or empty when the dedupe key is already taken
   */
  Optional<Long> insertIfAbsent(OutboundJob job);

  /**
   * Find a job by id
   *
   * @param id the job id
   * @return the job, or empty if not found
   */
  Optional<OutboundJob> findById(long id);

  /**
   * Find a job by its dedupe key
   *
   * @param dedupeKey the full dedupe key
   * @return the job, or empty if no job has this key
   */
  Optional<OutboundJob> findByDedupeKey(String dedupeKey);

  /**
   * Ids of QUEUED jobs that are due, oldest first
   *
   * @param max maximum number of ids
   * @param now jobs with a next attempt time after this are not due yet
   * @return the due job ids
   */
  List<Long> findDueQueuedIds(int max, Instant now);

  /**
   * Atomically move a job from QUEUED to PROCESSING and count the attempt.
   *
   * @param id the job id
   * @param claimedBy the runner id
   * @param now claim time
   * @return true if this caller won the claim, false if the job was no longer QUEUED
   */
  boolean claim(long id, String claimedBy, Instant now);

  /**
   * PROCESSING to SENT, guarded by the claimer
   *
   * @return true if the transition happened
   */
  boolean markSent(long id, String claimedBy, String providerMessageId, Instant now);

  /**
   * PROCESSING back to QUEUED for a retry, guarded by the claimer
   *
   * @return true if the transition happened
   */
  boolean requeue(long id, String claimedBy, String error, Instant nextAttemptAt, Instant now);

  /**
   * PROCESSING to FAILED, guarded by the claimer
   *
   * @return true if the transition happened
   */
  boolean markFailed(long id, String claimedBy, String error, Instant now);

  /**
   * Fail jobs stuck in PROCESSING since before {@code claimedBefore}. Their delivery state is
   * unknown, so they are never put back in the queue.
   *
   * @return number of jobs failed
   */
  int failStaleClaims(Instant claimedBefore, String error, Instant now);
}
