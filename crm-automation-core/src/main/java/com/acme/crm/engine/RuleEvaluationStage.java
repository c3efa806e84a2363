package com.acme.crm.engine;

/** How far one (rule, lead) evaluation got. */
public enum RuleEvaluationStage {
  SELECTED,
  CONDITION_CHECKED,
  ACTIONS_EXECUTED,
  LOGGED
}
