package com.acme.crm.processor.provider;

import com.acme.crm.spi.ConversationTarget;
import com.acme.crm.spi.MessagingProvider;
import com.acme.crm.spi.ProviderReceipt;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/** Stand-in provider for local runs without WhatsApp credentials. Logs the message and succeeds. */
@Slf4j
@Singleton
@Requires(missingProperty = "whatsapp.access-token")
public class LoggingMessagingProvider implements MessagingProvider {

  @Override
  public ProviderReceipt send(ConversationTarget target, String text) {
    String id = "log-" + UUID.randomUUID();
    log.info(
        "[no provider] {} to {} on conversation {}: {}",
        target.channel(),
        target.recipient(),
        target.conversationId(),
        text);
    return new ProviderReceipt(id);
  }
}
