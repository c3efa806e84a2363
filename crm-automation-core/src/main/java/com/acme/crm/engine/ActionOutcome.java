package com.acme.crm.engine;

import com.acme.crm.rule.ActionType;
import java.time.Instant;

/**
 * What one action did, or would do in a dry run. {@code text}, {@code dedupeKey} and {@code
 * effectiveAt} carry the exact planned effect.
 */
public record ActionOutcome(
    ActionType type,
    ActionStatus status,
    String detail,
    String dedupeKey,
    Long resultId,
    String text,
    Instant effectiveAt) {

  static ActionOutcome skipped(ActionType type, String detail) {
    return new ActionOutcome(type, ActionStatus.SKIPPED, detail, null, null, null, null);
  }

  static ActionOutcome failed(ActionType type, String detail) {
    return new ActionOutcome(type, ActionStatus.FAILED, detail, null, null, null, null);
  }

  public boolean tookEffect() {
    return status == ActionStatus.EXECUTED || status == ActionStatus.PLANNED;
  }
}
