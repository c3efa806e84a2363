package com.acme.crm.spi;

/** Where a provider should deliver: the channel and the recipient address on it. */
public record ConversationTarget(long conversationId, String channel, String recipient) {}
