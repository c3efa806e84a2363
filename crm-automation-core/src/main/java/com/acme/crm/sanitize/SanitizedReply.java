package com.acme.crm.sanitize;

/**
 * Plain text ready to send. {@code wasJson} marks that the generator leaked structured output and
 * the text was extracted or stringified from it.
 */
public record SanitizedReply(String text, boolean wasJson) {

  public boolean isEmpty() {
    return text == null || text.isBlank();
  }
}
