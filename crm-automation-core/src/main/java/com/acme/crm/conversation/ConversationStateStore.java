package com.acme.crm.conversation;

import com.acme.crm.core.PermanentException;
import com.acme.crm.core.StaleStateException;
import com.acme.crm.domain.Conversation;
import com.acme.crm.repository.ConversationRepository;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The only way conversation state is written. Reads the current snapshot, applies a pure change
 * and commits it with a compare-and-swap on the state version, re-reading and re-applying when
 * another writer committed in between.
 */
public class ConversationStateStore {

  private static final Logger LOG = LoggerFactory.getLogger(ConversationStateStore.class);

  private final ConversationRepository repository;
  private final int maxAttempts;

  public ConversationStateStore(ConversationRepository repository, int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.repository = repository;
    this.maxAttempts = maxAttempts;
  }

  public Conversation get(long conversationId) {
    return repository
        .findById(conversationId)
        .orElseThrow(() -> new PermanentException("Conversation not found: " + conversationId));
  }

  /**
   * Apply {@code change} and commit it.
   *
   * @return the committed state, or the current state unchanged when {@code change} returned the
   *     same instance
   * @throws StaleStateException when every attempt lost the race
   */
  public Conversation mutate(long conversationId, UnaryOperator<Conversation> change) {
    return mutateIf(conversationId, current -> Optional.of(change.apply(current)))
        .orElseThrow(() -> new IllegalStateException("unconditional mutation declined"));
  }

  /**
   * Like {@link #mutate} but {@code change} may decline by returning empty, in which case nothing
   * is written. The decision is re-taken on every attempt against the freshly read state.
   */
  public Optional<Conversation> mutateIf(
      long conversationId, Function<Conversation, Optional<Conversation>> change) {
    long lastVersion = -1;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      Conversation current = get(conversationId);
      Optional<Conversation> next = change.apply(current);
      if (next.isEmpty()) {
        return Optional.empty();
      }
      if (next.get() == current) {
        return next;
      }
      Conversation candidate = next.get().withStateVersion(current.stateVersion());
      Optional<Conversation> stored = repository.compareAndSet(candidate);
      if (stored.isPresent()) {
        return stored;
      }
      lastVersion = current.stateVersion();
      LOG.debug(
          "Stale write on conversation {} at version {} (attempt {}/{})",
          conversationId,
          lastVersion,
          attempt,
          maxAttempts);
    }
    LOG.warn("Giving up on conversation {} after {} stale writes", conversationId, maxAttempts);
    throw new StaleStateException(conversationId, lastVersion);
  }
}
