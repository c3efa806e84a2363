package com.acme.crm.engine;

public enum ActionStatus {
  /** Side effect committed */
  EXECUTED,

  /** Dry run: the side effect that would have been committed */
  PLANNED,

  /** Nothing to do, e.g. the message is already queued */
  SKIPPED,

  /** Suppressed by the cool-down; the rule is re-evaluated on the next pass */
  DEFERRED,

  FAILED
}
