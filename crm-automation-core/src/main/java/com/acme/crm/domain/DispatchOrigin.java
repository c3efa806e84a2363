package com.acme.crm.domain;

/** Who asked for a send. Only automated sends are subject to the conversation cool-down. */
public enum DispatchOrigin {
  AUTOMATION,
  INBOUND_REPLY,
  OPERATOR
}
