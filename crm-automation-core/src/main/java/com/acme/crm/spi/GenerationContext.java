package com.acme.crm.spi;

import java.util.Map;

/**
 * Input for a text generator: the instruction for this reply plus the facts known about the lead.
 */
public record GenerationContext(
    long conversationId,
    String templateKey,
    String instruction,
    String contactName,
    Map<String, String> knownFields) {

  public GenerationContext {
    knownFields = knownFields == null ? Map.of() : Map.copyOf(knownFields);
  }
}
