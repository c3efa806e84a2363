package com.acme.crm.core;

import java.util.List;

/** Rejects a malformed automation rule at save or seed time. */
public class RuleValidationException extends RuntimeException {

  private final String ruleKey;
  private final List<String> violations;

  public RuleValidationException(String ruleKey, List<String> violations) {
    super("Invalid automation rule '" + ruleKey + "': " + String.join("; ", violations));
    this.ruleKey = ruleKey;
    this.violations = List.copyOf(violations);
  }

  public String getRuleKey() {
    return ruleKey;
  }

  public List<String> getViolations() {
    return violations;
  }
}
