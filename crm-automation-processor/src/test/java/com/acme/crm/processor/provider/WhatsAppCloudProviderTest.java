package com.acme.crm.processor.provider;

import static org.assertj.core.api.Assertions.*;

import com.acme.crm.config.AutomationConfig;
import com.acme.crm.core.Jsons;
import com.acme.crm.core.PermanentException;
import com.acme.crm.core.TransientException;
import com.acme.crm.spi.ConversationTarget;
import com.acme.crm.spi.ProviderReceipt;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("WhatsAppCloudProvider Tests")
class WhatsAppCloudProviderTest {

  private static final ConversationTarget TARGET = new ConversationTarget(42L, "whatsapp", "+971501234567");

  private MockWebServer server;
  private WhatsAppCloudProvider provider;

  @BeforeEach
  void setup() throws IOException {
    server = new MockWebServer();
    server.start();

    WhatsAppProperties properties = new WhatsAppProperties();
    String base = server.url("/v21.0").toString();
    properties.setBaseUrl(base.endsWith("/") ? base.substring(0, base.length() - 1) : base);
    properties.setPhoneNumberId("12345");
    properties.setAccessToken("token-abc");

    AutomationConfig config = new AutomationConfig();
    config.setSendTimeout(Duration.ofMillis(500));
    provider = new WhatsAppCloudProvider(properties, config);
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Nested
  @DisplayName("successful sends")
  class Success {

    @Test
    @DisplayName("should post a text message and return the provider message id")
    void testSend_ReturnsMessageId() throws Exception {
      // Given
      server.enqueue(
          new MockResponse()
              .setResponseCode(200)
              .setBody("{\"messaging_product\":\"whatsapp\",\"messages\":[{\"id\":\"wamid.XYZ\"}]}"));

      // When
      ProviderReceipt receipt = provider.send(TARGET, "Hello there");

      // Then
      assertThat(receipt.providerMessageId()).isEqualTo("wamid.XYZ");
      RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
      assertThat(request.getMethod()).isEqualTo("POST");
      assertThat(request.getPath()).isEqualTo("/v21.0/12345/messages");
      assertThat(request.getHeader("Authorization")).isEqualTo("Bearer token-abc");
      JsonNode body = Jsons.mapper().readTree(request.getBody().readUtf8());
      assertThat(body.path("messaging_product").asText()).isEqualTo("whatsapp");
      assertThat(body.path("to").asText()).isEqualTo("+971501234567");
      assertThat(body.path("text").path("body").asText()).isEqualTo("Hello there");
    }

    @Test
    @DisplayName("an accepted response without a message id should fail permanently")
    void testSend_MissingId() {
      // Given
      server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"messages\":[]}"));

      // When / Then
      assertThatThrownBy(() -> provider.send(TARGET, "Hi"))
          .isInstanceOf(PermanentException.class)
          .hasMessageContaining("message ID");
    }
  }

  @Nested
  @DisplayName("failure classification")
  class Failures {

    @Test
    @DisplayName("HTTP 429 should be transient")
    void testSend_TooManyRequests() {
      server.enqueue(new MockResponse().setResponseCode(429).setBody("{}"));

      assertThatThrownBy(() -> provider.send(TARGET, "Hi")).isInstanceOf(TransientException.class);
    }

    @Test
    @DisplayName("HTTP 503 should be transient")
    void testSend_ServerError() {
      server.enqueue(new MockResponse().setResponseCode(503));

      assertThatThrownBy(() -> provider.send(TARGET, "Hi"))
          .isInstanceOf(TransientException.class)
          .hasMessageContaining("503");
    }

    @Test
    @DisplayName("a throttling error code on HTTP 400 should be transient")
    void testSend_ThrottlingCode() {
      server.enqueue(
          new MockResponse()
              .setResponseCode(400)
              .setBody("{\"error\":{\"message\":\"Pair rate limit hit\",\"code\":131056}}"));

      assertThatThrownBy(() -> provider.send(TARGET, "Hi"))
          .isInstanceOf(TransientException.class)
          .hasMessageContaining("Pair rate limit hit");
    }

    @Test
    @DisplayName("an invalid recipient should be permanent")
    void testSend_InvalidRecipient() {
      server.enqueue(
          new MockResponse()
              .setResponseCode(400)
              .setBody("{\"error\":{\"message\":\"Invalid parameter\",\"code\":100}}"));

      assertThatThrownBy(() -> provider.send(TARGET, "Hi"))
          .isInstanceOf(PermanentException.class)
          .hasMessageContaining("Invalid parameter");
    }

    @Test
    @DisplayName("rejected credentials should be permanent")
    void testSend_Unauthorized() {
      server.enqueue(new MockResponse().setResponseCode(401).setBody("not json"));

      assertThatThrownBy(() -> provider.send(TARGET, "Hi"))
          .isInstanceOf(PermanentException.class)
          .hasMessageContaining("401");
    }

    @Test
    @DisplayName("a timeout should be transient")
    void testSend_Timeout() {
      server.enqueue(
          new MockResponse()
              .setResponseCode(200)
              .setBody("{\"messages\":[{\"id\":\"late\"}]}")
              .setBodyDelay(2, TimeUnit.SECONDS));

      assertThatThrownBy(() -> provider.send(TARGET, "Hi")).isInstanceOf(TransientException.class);
    }
  }
}
