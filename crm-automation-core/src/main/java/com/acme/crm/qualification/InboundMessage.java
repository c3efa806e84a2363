package com.acme.crm.qualification;

import java.time.Instant;
import java.util.Map;

/** A customer message after external field extraction. */
public record InboundMessage(
    long conversationId,
    String providerMessageId,
    String text,
    Map<String, String> extractedFields,
    Instant receivedAt) {

  public InboundMessage {
    extractedFields = extractedFields == null ? Map.of() : Map.copyOf(extractedFields);
  }
}
