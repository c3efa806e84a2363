package com.acme.crm.domain;

/** What gets delivered: channel, recipient address and the rendered text. */
public record OutboundPayload(
    String channel, String recipient, String text, String templateRef, String intent) {

  public OutboundPayload {
    if (recipient == null || recipient.isBlank()) {
      throw new IllegalArgumentException("recipient is required");
    }
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("text is required");
    }
  }
}
