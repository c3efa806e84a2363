package com.acme.crm.rule;

public enum ActionType {
  SEND_AI_REPLY,
  CREATE_TASK,
  SET_NEXT_FOLLOWUP,
  CREATE_AGENT_TASK,
  SET_PRIORITY,
  SCHEDULE_FOLLOWUP_CADENCE
}
