package com.acme.crm.rule;

import com.acme.crm.core.RuleValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/** Rejects malformed rule definitions before they are stored. */
public class RuleValidator {

  private static final Pattern RULE_KEY = Pattern.compile("[a-z0-9][a-z0-9_.-]{2,99}");
  private static final Set<String> SCHEDULES =
      Set.of(AutomationRule.DAILY, AutomationRule.HOURLY, AutomationRule.EVENT);

  public void validate(AutomationRule rule) {
    List<String> errors = violations(rule);
    if (!errors.isEmpty()) {
      throw new RuleValidationException(rule.ruleKey(), errors);
    }
  }

  public List<String> violations(AutomationRule rule) {
    List<String> errors = new ArrayList<>();
    if (rule.ruleKey() == null || !RULE_KEY.matcher(rule.ruleKey()).matches()) {
      errors.add("ruleKey must be 3-100 lowercase characters [a-z0-9_.-]");
    }
    if (rule.name() == null || rule.name().isBlank()) {
      errors.add("name is required");
    }
    if (rule.scheduleTag() == null || !SCHEDULES.contains(rule.scheduleTag())) {
      errors.add("scheduleTag must be one of " + SCHEDULES);
    }
    if (rule.condition() == null) {
      errors.add("condition is required");
    } else {
      errors.addAll(rule.condition().validate());
      boolean eventDriven = rule.condition().triggerType().isEventDriven();
      if (eventDriven && !AutomationRule.EVENT.equals(rule.scheduleTag())) {
        errors.add(rule.condition().triggerType() + " rules must use the event schedule");
      }
      if (!eventDriven && AutomationRule.EVENT.equals(rule.scheduleTag())) {
        errors.add(rule.condition().triggerType() + " rules cannot use the event schedule");
      }
    }
    if (rule.actions().isEmpty()) {
      errors.add("at least one action is required");
    }
    for (int i = 0; i < rule.actions().size(); i++) {
      RuleAction action = rule.actions().get(i);
      if (action == null) {
        errors.add("action " + i + " is null");
        continue;
      }
      for (String error : action.validate()) {
        errors.add("action " + i + ": " + error);
      }
    }
    return errors;
  }
}
