package com.acme.crm.engine;

import com.acme.crm.domain.RunStatus;
import com.acme.crm.rule.ActionType;
import java.util.List;

/**
 * Result of evaluating one rule against one lead. {@code status} is null when the condition did not
 * match.
 */
public record RuleEvaluation(
    String ruleKey,
    long leadId,
    boolean matched,
    String checkpointKey,
    RunStatus status,
    RuleEvaluationStage stage,
    String message,
    List<ActionOutcome> actions) {

  public RuleEvaluation {
    actions = actions == null ? List.of() : List.copyOf(actions);
  }

  static RuleEvaluation notMatched(String ruleKey, long leadId, String reason) {
    return new RuleEvaluation(
        ruleKey,
        leadId,
        false,
        null,
        null,
        RuleEvaluationStage.CONDITION_CHECKED,
        reason,
        List.of());
  }

  RuleEvaluation logged() {
    return new RuleEvaluation(
        ruleKey,
        leadId,
        matched,
        checkpointKey,
        status,
        RuleEvaluationStage.LOGGED,
        message,
        actions);
  }

  /** Messages queued (or, in a dry run, planned) by this evaluation. */
  public int sends() {
    return (int)
        actions.stream()
            .filter(a -> a.type() == ActionType.SEND_AI_REPLY)
            .filter(ActionOutcome::tookEffect)
            .count();
  }
}
