package com.acme.crm.support;

import com.acme.crm.domain.Conversation;
import com.acme.crm.repository.ConversationRepository;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** Conversation store with the same version check as the JDBC compare-and-set. */
public class InMemoryConversationRepository implements ConversationRepository {

  private final Map<Long, Conversation> rows = new ConcurrentHashMap<>();
  private final AtomicLong ids = new AtomicLong();
  private final AtomicInteger forcedConflicts = new AtomicInteger();

  @Override
  public Optional<Conversation> findById(long id) {
    return Optional.ofNullable(rows.get(id));
  }

  @Override
  public Optional<Conversation> findByContact(String contactId, String channel) {
    return rows.values().stream()
        .filter(c -> c.contactId().equals(contactId) && c.channel().equals(channel))
        .findFirst();
  }

  @Override
  public Conversation create(Conversation conversation) {
    Conversation stored = conversation.withId(ids.incrementAndGet()).withStateVersion(0L);
    rows.put(stored.id(), stored);
    return stored;
  }

  @Override
  public synchronized Optional<Conversation> compareAndSet(Conversation next) {
    if (forcedConflicts.get() > 0) {
      forcedConflicts.decrementAndGet();
      return Optional.empty();
    }
    Conversation current = rows.get(next.id());
    if (current == null || current.stateVersion() != next.stateVersion()) {
      return Optional.empty();
    }
    Conversation stored = next.withStateVersion(next.stateVersion() + 1);
    rows.put(stored.id(), stored);
    return Optional.of(stored);
  }

  /** Makes the next {@code count} compare-and-set calls lose, as if another writer got in first. */
  public void failNextWrites(int count) {
    forcedConflicts.set(count);
  }

  /** Direct write that bypasses the version check, for test setup. */
  public Conversation put(Conversation conversation) {
    rows.put(conversation.id(), conversation);
    return conversation;
  }
}
