package com.acme.crm.domain;

/** Who a created task is routed to. AGENT tasks are escalations to a human. */
public enum TaskAssignee {
  OWNER,
  AGENT
}
