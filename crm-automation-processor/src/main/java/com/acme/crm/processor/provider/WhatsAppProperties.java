package com.acme.crm.processor.provider;

import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Getter;
import lombok.Setter;

/** WhatsApp Cloud API credentials, bound from whatsapp.* (usually WHATSAPP_* environment variables). */
@Getter
@Setter
@ConfigurationProperties("whatsapp")
public class WhatsAppProperties {

  private String baseUrl = "https://graph.facebook.com/v21.0";
  private String phoneNumberId;
  private String accessToken;
}
