package com.acme.crm.domain;

/** Position of a conversation in the qualification lifecycle. Declaration order is the forward order. */
public enum QualificationStage {
  /** First contact, collecting identity and the service requested */
  INTAKE,

  /** Service-specific qualification questions */
  QUALIFYING,

  /** Information or brochure shared with the lead */
  INFO_SHARED,

  /** Quotation sent */
  QUOTED,

  /** Waiting on the lead, follow-ups scheduled */
  FOLLOW_UP,

  /** A human agent owns the conversation */
  HANDED_OFF,

  /** Conversation finished */
  CLOSED;

  public boolean isTerminal() {
    return this == HANDED_OFF || this == CLOSED;
  }

  public boolean isBefore(QualificationStage other) {
    return ordinal() < other.ordinal();
  }

  /** The stage directly after this one, or this stage when already terminal. */
  public QualificationStage next() {
    if (isTerminal()) {
      return this;
    }
    return values()[ordinal() + 1];
  }
}
