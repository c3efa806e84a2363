package com.acme.crm.processor.generation;

import com.acme.crm.config.AutomationConfig;
import com.acme.crm.core.Jsons;
import com.acme.crm.core.PermanentException;
import com.acme.crm.core.TransientException;
import com.acme.crm.spi.GenerationContext;
import com.acme.crm.spi.TextGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chat-completions text generator. Output is returned raw; the reply composer sanitizes it and
 * falls back to catalog templates when the call fails.
 */
@Singleton
@Requires(property = "text-generator.api-key")
public class OpenAiTextGenerator implements TextGenerator {

  private static final Logger LOG = LoggerFactory.getLogger(OpenAiTextGenerator.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient client;
  private final TextGeneratorProperties properties;

  public OpenAiTextGenerator(TextGeneratorProperties properties, AutomationConfig config) {
    this.properties = properties;
    this.client =
        new OkHttpClient.Builder()
            .connectTimeout(config.getGenerationTimeout())
            .readTimeout(config.getGenerationTimeout())
            .callTimeout(config.getGenerationTimeout())
            .build();
    LOG.info("Text generator initialized with model {}", properties.getModel());
  }

  @Override
  public String generate(GenerationContext context) {
    Request request =
        new Request.Builder()
            .url(properties.getBaseUrl() + "/chat/completions")
            .post(RequestBody.create(Jsons.toJson(requestBody(context)), JSON))
            .addHeader("Authorization", "Bearer " + properties.getApiKey())
            .build();

    try (Response response = client.newCall(request).execute()) {
      String body = response.body() != null ? response.body().string() : "";
      if (!response.isSuccessful()) {
        String error = "Text generation failed with HTTP " + response.code();
        if (response.code() == 429 || response.code() >= 500) {
          throw new TransientException(error);
        }
        throw new PermanentException(error);
      }
      JsonNode json = Jsons.tryParse(body);
      JsonNode content =
          json == null ? null : json.path("choices").path(0).path("message").path("content");
      if (content == null || !content.isTextual()) {
        throw new PermanentException("Text generation response had no message content");
      }
      LOG.debug(
          "Generated {} chars for conversation {} template {}",
          content.asText().length(),
          context.conversationId(),
          context.templateKey());
      return content.asText().trim();
    } catch (IOException e) {
      throw new TransientException("Text generation request failed: " + e.getMessage(), e);
    }
  }

  Map<String, Object> requestBody(GenerationContext context) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("model", properties.getModel());
    body.put("temperature", properties.getTemperature());
    body.put("max_tokens", properties.getMaxTokens());
    body.put(
        "messages",
        List.of(
            Map.of("role", "system", "content", properties.getSystemPrompt()),
            Map.of("role", "user", "content", userPrompt(context))));
    return body;
  }

  static String userPrompt(GenerationContext context) {
    StringBuilder prompt = new StringBuilder(context.instruction());
    if (context.contactName() != null && !context.contactName().isBlank()) {
      prompt.append("\nCustomer name: ").append(context.contactName());
    }
    if (!context.knownFields().isEmpty()) {
      prompt
          .append("\nKnown details: ")
          .append(
              context.knownFields().entrySet().stream()
                  .sorted(Map.Entry.comparingByKey())
                  .map(e -> e.getKey() + "=" + e.getValue())
                  .collect(Collectors.joining(", ")));
    }
    return prompt.toString();
  }
}
