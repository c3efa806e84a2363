package com.acme.crm.qualification;

public enum HandOffReason {
  /** The customer asked for a person */
  CUSTOMER_REQUESTED,

  /** Too many questions without completing qualification */
  QUESTION_LIMIT,

  /** The remaining question was asked and still not answered */
  UNANSWERED,

  /** Every candidate reply was banned, including the generic prompt */
  NO_SAFE_PROMPT
}
