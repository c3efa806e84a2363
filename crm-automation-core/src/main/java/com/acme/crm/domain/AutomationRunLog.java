package com.acme.crm.domain;

import java.time.Instant;

/**
 * Append-only ledger entry for one rule evaluation against a lead, or for a whole run when {@code
 * leadId} is null.
 */
public record AutomationRunLog(
    Long id,
    String ruleKey,
    Long leadId,
    String checkpointKey,
    TriggerSource source,
    RunStatus status,
    String message,
    int matched,
    int sent,
    int skipped,
    int failed,
    Instant createdAt) {

  public static AutomationRunLog forLead(
      String ruleKey,
      long leadId,
      String checkpointKey,
      TriggerSource source,
      RunStatus status,
      String message,
      int sent,
      Instant now) {
    return new AutomationRunLog(
        null,
        ruleKey,
        leadId,
        checkpointKey,
        source,
        status,
        message,
        1,
        sent,
        status == RunStatus.SKIPPED ? 1 : 0,
        status == RunStatus.FAILED || status == RunStatus.PARTIAL ? 1 : 0,
        now);
  }

  public static AutomationRunLog forRun(
      String runKey,
      TriggerSource source,
      RunStatus status,
      String message,
      int matched,
      int sent,
      int skipped,
      int failed,
      Instant now) {
    return new AutomationRunLog(
        null, runKey, null, null, source, status, message, matched, sent, skipped, failed, now);
  }
}
