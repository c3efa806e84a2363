package com.acme.crm.engine;

import java.time.Instant;

/** An inbound customer message, the trigger for event-driven rules. */
public record InboundEvent(
    long conversationId, String providerMessageId, String text, Instant receivedAt) {}
