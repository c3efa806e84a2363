package com.acme.crm.rule;

/** The condition class that makes a rule eligible for evaluation. */
public enum TriggerType {
  EXPIRY_WINDOW(Category.TIME_WINDOW),
  INFO_SHARED(Category.TIME_WINDOW),
  NO_REPLY_SLA(Category.INACTIVITY),
  FOLLOWUP_OVERDUE(Category.INACTIVITY),
  NO_ACTIVITY(Category.INACTIVITY),
  STAGE_REACHED(Category.STAGE),
  INBOUND_MESSAGE(Category.EVENT);

  public enum Category {
    TIME_WINDOW,
    INACTIVITY,
    STAGE,
    EVENT
  }

  private final Category category;

  TriggerType(Category category) {
    this.category = category;
  }

  public Category category() {
    return category;
  }

  public boolean isEventDriven() {
    return category == Category.EVENT;
  }
}
