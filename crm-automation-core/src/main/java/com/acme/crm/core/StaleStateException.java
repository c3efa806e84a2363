package com.acme.crm.core;

/**
 * Thrown when a conversation write loses the compare-and-swap on its state version. Callers are
 * expected to re-read and re-apply their change.
 */
public class StaleStateException extends RuntimeException {

  private final long conversationId;
  private final long expectedVersion;

  public StaleStateException(long conversationId, long expectedVersion) {
    super(
        "Conversation "
            + conversationId
            + " changed concurrently; expected state version "
            + expectedVersion);
    this.conversationId = conversationId;
    this.expectedVersion = expectedVersion;
  }

  public long getConversationId() {
    return conversationId;
  }

  public long getExpectedVersion() {
    return expectedVersion;
  }
}
