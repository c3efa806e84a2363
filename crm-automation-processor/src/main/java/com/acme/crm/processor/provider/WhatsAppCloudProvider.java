package com.acme.crm.processor.provider;

import com.acme.crm.config.AutomationConfig;
import com.acme.crm.core.Jsons;
import com.acme.crm.core.PermanentException;
import com.acme.crm.core.TransientException;
import com.acme.crm.spi.ConversationTarget;
import com.acme.crm.spi.MessagingProvider;
import com.acme.crm.spi.ProviderReceipt;
import com.fasterxml.jackson.databind.JsonNode;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends text messages through the WhatsApp Cloud API.
 *
 * <p>Throttling (HTTP 429 or a throttling error code), server errors and I/O failures including
 * timeouts are reported as {@link TransientException} so the job is retried. Any other rejection
 * is a {@link PermanentException}.
 */
@Singleton
@Requires(property = "whatsapp.access-token")
public class WhatsAppCloudProvider implements MessagingProvider {

  private static final Logger LOG = LoggerFactory.getLogger(WhatsAppCloudProvider.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  // Graph API error codes for rate and pair-rate limits, sometimes sent with HTTP 400
  private static final Set<Integer> THROTTLING_CODES = Set.of(4, 80007, 130429, 131048, 131056);

  private final OkHttpClient client;
  private final WhatsAppProperties properties;

  public WhatsAppCloudProvider(WhatsAppProperties properties, AutomationConfig config) {
    this.properties = properties;
    this.client =
        new OkHttpClient.Builder()
            .connectTimeout(config.getSendTimeout())
            .readTimeout(config.getSendTimeout())
            .writeTimeout(config.getSendTimeout())
            .callTimeout(config.getSendTimeout())
            .build();
    LOG.info("WhatsApp provider initialized for phone number id {}", properties.getPhoneNumberId());
  }

  @Override
  public ProviderReceipt send(ConversationTarget target, String text) {
    String url = properties.getBaseUrl() + "/" + properties.getPhoneNumberId() + "/messages";
    Request request =
        new Request.Builder()
            .url(url)
            .post(RequestBody.create(Jsons.toJson(payload(target.recipient(), text)), JSON))
            .addHeader("Authorization", "Bearer " + properties.getAccessToken())
            .build();

    try (Response response = client.newCall(request).execute()) {
      String body = response.body() != null ? response.body().string() : "";
      JsonNode json = Jsons.tryParse(body);

      if (response.isSuccessful()) {
        String messageId = json == null ? null : json.path("messages").path(0).path("id").asText(null);
        if (messageId == null || messageId.isBlank()) {
          // accepted but unidentifiable; retrying could deliver twice
          throw new PermanentException("WhatsApp API did not return a message ID");
        }
        LOG.debug("WhatsApp accepted message {} for conversation {}", messageId, target.conversationId());
        return new ProviderReceipt(messageId);
      }

      String error = errorMessage(json, response.code());
      int code = json == null ? 0 : json.path("error").path("code").asInt(0);
      if (response.code() == 429
          || response.code() == 408
          || response.code() >= 500
          || THROTTLING_CODES.contains(code)) {
        throw new TransientException(error);
      }
      throw new PermanentException(error);
    } catch (IOException e) {
      throw new TransientException("WhatsApp request failed: " + e.getMessage(), e);
    }
  }

  static Map<String, Object> payload(String recipient, String text) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("messaging_product", "whatsapp");
    payload.put("recipient_type", "individual");
    payload.put("to", recipient);
    payload.put("type", "text");
    payload.put("text", Map.of("preview_url", false, "body", text));
    return payload;
  }

  private static String errorMessage(JsonNode json, int status) {
    String message = json == null ? null : json.path("error").path("message").asText(null);
    return message != null ? "WhatsApp API error " + status + ": " + message : "WhatsApp API error " + status;
  }
}
