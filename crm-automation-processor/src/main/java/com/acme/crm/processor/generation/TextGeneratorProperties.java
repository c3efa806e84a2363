package com.acme.crm.processor.generation;

import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ConfigurationProperties("text-generator")
public class TextGeneratorProperties {

  private String baseUrl = "https://api.openai.com/v1";
  private String apiKey;
  private String model = "gpt-4o-mini";
  private double temperature = 0.7;
  private int maxTokens = 300;
  private String systemPrompt =
      "You write short, friendly WhatsApp replies for a business services company. "
          + "Reply with the message text only, no JSON, no greetings longer than one line, "
          + "and never promise approvals, prices or guarantees.";
}
