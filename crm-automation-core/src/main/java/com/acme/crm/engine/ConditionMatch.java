package com.acme.crm.engine;

import java.util.Map;

/**
 * Result of checking a rule's condition against a lead. A match names the checkpoint it covers
 * and carries template variables such as the expiring item.
 */
public record ConditionMatch(
    boolean matched, String checkpointKey, String reason, Map<String, String> variables) {

  public ConditionMatch {
    variables = variables == null ? Map.of() : Map.copyOf(variables);
  }

  public static ConditionMatch matched(String checkpointKey, Map<String, String> variables) {
    return new ConditionMatch(true, checkpointKey, null, variables);
  }

  public static ConditionMatch notMatched(String reason) {
    return new ConditionMatch(false, null, reason, Map.of());
  }
}
