package com.acme.crm.dispatch;

import com.acme.crm.domain.DispatchOrigin;
import com.acme.crm.domain.OutboundPayload;

/** A request to deliver one logical message, already stamped with its dedupe key. */
public record DispatchRequest(
    long conversationId, DispatchOrigin origin, String dedupeKey, OutboundPayload payload) {

  public DispatchRequest {
    if (dedupeKey == null || dedupeKey.isBlank()) {
      throw new IllegalArgumentException("dedupeKey is required");
    }
  }
}
