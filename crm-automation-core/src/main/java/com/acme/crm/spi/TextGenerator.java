package com.acme.crm.spi;

/**
 * Free-text generation. Output may be JSON-shaped and is always sanitized before use.
 * Implementations must bound the call with a timeout.
 */
public interface TextGenerator {

  String generate(GenerationContext context);
}
