package com.acme.crm.domain;

/** Outcome recorded in the automation run log. */
public enum RunStatus {
  SUCCESS,
  PARTIAL,
  SKIPPED,
  FAILED;

  /** Statuses that mean a reminder actually went out for the checkpoint. */
  public boolean countsAsReminded() {
    return this == SUCCESS || this == PARTIAL;
  }
}
