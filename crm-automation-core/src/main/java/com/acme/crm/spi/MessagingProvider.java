package com.acme.crm.spi;

import com.acme.crm.core.PermanentException;
import com.acme.crm.core.TransientException;

/** Outbound messaging channel, e.g. a WhatsApp Business API. */
public interface MessagingProvider {

  /**
   * Deliver a text message. Implementations must bound the call with a timeout.
   *
   * @param target where to deliver
   * @param text plain text body
   * @return the provider's message id
   * @throws TransientException on timeouts, throttling or provider outages
   * @throws PermanentException on invalid recipients or rejected credentials
   */
  ProviderReceipt send(ConversationTarget target, String text);
}
