package com.acme.crm.rule;

import java.time.Instant;
import java.util.List;

/**
 * A trigger condition plus an ordered list of actions, identified by a globally unique rule key.
 * Disabled rules are kept for audit and skipped by the engine.
 */
public record AutomationRule(
    Long id,
    String ruleKey,
    String name,
    String scheduleTag,
    TriggerCondition condition,
    List<RuleAction> actions,
    boolean enabled,
    boolean active,
    Instant createdAt,
    Instant updatedAt) {

  public static final String DAILY = "daily";
  public static final String HOURLY = "hourly";
  public static final String EVENT = "event";

  public AutomationRule {
    actions = actions == null ? List.of() : List.copyOf(actions);
  }

  public static AutomationRule define(
      String ruleKey,
      String name,
      String scheduleTag,
      TriggerCondition condition,
      List<RuleAction> actions) {
    return new AutomationRule(
        null, ruleKey, name, scheduleTag, condition, actions, true, true, null, null);
  }

  public TriggerType triggerType() {
    return condition == null ? null : condition.triggerType();
  }

  public boolean isRunnable() {
    return enabled && active;
  }

  public boolean hasSendAction() {
    return actions.stream().anyMatch(a -> a.type() == ActionType.SEND_AI_REPLY);
  }

  public AutomationRule withEnabled(boolean value) {
    return new AutomationRule(
        id, ruleKey, name, scheduleTag, condition, actions, value, active, createdAt, updatedAt);
  }

  public AutomationRule withId(Long value, Instant created, Instant updated) {
    return new AutomationRule(
        value, ruleKey, name, scheduleTag, condition, actions, enabled, active, created, updated);
  }
}
