package com.acme.crm.repository;

import com.acme.crm.domain.Conversation;
import java.util.Optional;

/** Persistence for conversations. Every update is a compare-and-swap on the state version. */
public interface ConversationRepository {

  /**
   * Find a conversation by id
   *
   * @param id the conversation id
   * @return the conversation, or empty if not found
   */
  Optional<Conversation> findById(long id);

  /**
   * Find the conversation for a contact on a channel
   *
   * @param contactId the contact identifier
   * @param channel the channel, e.g. whatsapp
   * @return the conversation, or empty if none exists yet
   */
  Optional<Conversation> findByContact(String contactId, String channel);

  /**
   * Insert a new conversation
   *
   * @param conversation the unsaved conversation
   * @return the stored conversation with its generated id and state version 0
   */
  Conversation create(Conversation conversation);

  /**
   * Write {@code next} only if the stored state version still equals {@code
   * next.stateVersion()}.
   *
   * @param next the new state, carrying the version it was derived from
   * @return the stored state with the incremented version, or empty if another writer got there
   *     first
   */
  Optional<Conversation> compareAndSet(Conversation next);
}
