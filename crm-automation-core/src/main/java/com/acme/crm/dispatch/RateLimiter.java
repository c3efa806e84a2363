package com.acme.crm.dispatch;

import com.acme.crm.conversation.ConversationStateStore;
import com.acme.crm.domain.Conversation;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-conversation cool-down between automated sends, backed by the persisted
 * last-automated-send timestamp so every runner instance sees the same state.
 */
public class RateLimiter {

  private final ConversationStateStore conversations;
  private final Duration cooldown;
  private final Clock clock;

  public RateLimiter(ConversationStateStore conversations, Duration cooldown, Clock clock) {
    this.conversations = conversations;
    this.cooldown = cooldown;
    this.clock = clock;
  }

  public boolean isAllowed(Conversation conversation, Instant now) {
    Instant last = conversation.lastAutomatedSendAt();
    return last == null || !now.isBefore(last.plus(cooldown));
  }

  /** Read-only check, used by dry runs and pre-checks. */
  public boolean check(long conversationId) {
    return isAllowed(conversations.get(conversationId), clock.instant());
  }

  /**
   * Take the send slot: stamps the conversation's last automated send only if it is outside the
   * cool-down. The check and the stamp commit together through the state version.
   *
   * @return false when suppressed
   */
  public boolean tryAcquire(long conversationId) {
    return acquire(conversationId).isPresent();
  }

  /** Like {@link #tryAcquire} but returns the slot so it can be handed back with {@link #release}. */
  public Optional<Slot> acquire(long conversationId) {
    Instant now = clock.instant();
    AtomicReference<Instant> previous = new AtomicReference<>();
    return conversations
        .mutateIf(
            conversationId,
            c -> {
              if (!isAllowed(c, now)) {
                return Optional.empty();
              }
              previous.set(c.lastAutomatedSendAt());
              return Optional.of(c.withLastAutomatedSendAt(now).withUpdatedAt(now));
            })
        .map(c -> new Slot(conversationId, previous.get(), now));
  }

  /**
   * Restores the stamp a slot replaced, for a send that was never queued. No-op once another
   * send has stamped the conversation since.
   */
  public void release(Slot slot) {
    conversations.mutateIf(
        slot.conversationId(),
        c ->
            slot.stampedAt().equals(c.lastAutomatedSendAt())
                ? Optional.of(c.withLastAutomatedSendAt(slot.previous()))
                : Optional.empty());
  }

  public Instant nextAllowedAt(Conversation conversation) {
    Instant last = conversation.lastAutomatedSendAt();
    return last == null ? Instant.MIN : last.plus(cooldown);
  }

  /** A taken cool-down slot: the stamp written and the one it replaced. */
  public record Slot(long conversationId, Instant previous, Instant stampedAt) {}
}
