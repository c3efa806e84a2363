package com.acme.crm.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.With;

/**
 * Immutable snapshot of a conversation, one per (contact, channel). Each modification returns a
 * new instance; the state version is bumped by the repository when the snapshot is committed.
 */
public record Conversation(
    @With Long id,
    String contactId,
    String channel,
    String recipient,
    QualificationStage stage,
    Map<String, String> knownFields,
    @With String lastQuestionKey,
    @With int questionsAsked,
    @With long stateVersion,
    Instant stageChangedAt,
    @With Instant lastInboundAt,
    @With String lastInboundMessageId,
    @With Instant lastOutboundAt,
    @With Instant lastAutomatedSendAt,
    @With boolean archived,
    Instant createdAt,
    @With Instant updatedAt) {

  public Conversation {
    if (stage == null) {
      throw new IllegalArgumentException("stage is required");
    }
    knownFields =
        knownFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(knownFields));
  }

  /** A fresh conversation at INTAKE, not yet persisted. */
  public static Conversation open(
      String contactId, String channel, String recipient, Instant now) {
    return new Conversation(
        null,
        contactId,
        channel,
        recipient,
        QualificationStage.INTAKE,
        Map.of(),
        null,
        0,
        0L,
        now,
        null,
        null,
        null,
        null,
        false,
        now,
        now);
  }

  public boolean hasField(String field) {
    String value = knownFields.get(field);
    return value != null && !value.isBlank();
  }

  /**
   * Merges extracted values into the known fields. Values only overwrite, blank values are ignored so
   * a field is never cleared.
   */
  public Conversation mergeFields(Map<String, String> extracted) {
    if (extracted == null || extracted.isEmpty()) {
      return this;
    }
    Map<String, String> merged = new LinkedHashMap<>(knownFields);
    boolean changed = false;
    for (Map.Entry<String, String> e : extracted.entrySet()) {
      String value = e.getValue();
      if (e.getKey() == null || value == null || value.isBlank()) {
        continue;
      }
      String trimmed = value.trim();
      if (!trimmed.equals(merged.put(e.getKey(), trimmed))) {
        changed = true;
      }
    }
    if (!changed) {
      return this;
    }
    return new Conversation(
        id,
        contactId,
        channel,
        recipient,
        stage,
        merged,
        lastQuestionKey,
        questionsAsked,
        stateVersion,
        stageChangedAt,
        lastInboundAt,
        lastInboundMessageId,
        lastOutboundAt,
        lastAutomatedSendAt,
        archived,
        createdAt,
        updatedAt);
  }

  /** Moves the stage forward. Moving backwards is only possible through {@link #reopen}. */
  public Conversation advanceTo(QualificationStage target, Instant now) {
    if (target == stage) {
      return this;
    }
    if (target.isBefore(stage)) {
      throw new IllegalStateException(
          "Conversation " + id + " cannot move back from " + stage + " to " + target);
    }
    return withStage(target, now);
  }

  /** Explicit operator action that returns a handed-off or closed conversation to qualification. */
  public Conversation reopen(Instant now) {
    if (!QualificationStage.QUALIFYING.isBefore(stage)) {
      return this;
    }
    return withStage(QualificationStage.QUALIFYING, now).withArchived(false);
  }

  /** True when {@code providerMessageId} is the inbound message this state was last decided on. */
  public boolean hasHandled(String providerMessageId) {
    return providerMessageId != null && providerMessageId.equals(lastInboundMessageId);
  }

  public Conversation recordQuestion(String questionKey) {
    return withLastQuestionKey(questionKey).withQuestionsAsked(questionsAsked + 1);
  }

  private Conversation withStage(QualificationStage target, Instant now) {
    return new Conversation(
        id,
        contactId,
        channel,
        recipient,
        target,
        knownFields,
        lastQuestionKey,
        questionsAsked,
        stateVersion,
        now,
        lastInboundAt,
        lastInboundMessageId,
        lastOutboundAt,
        lastAutomatedSendAt,
        archived,
        createdAt,
        updatedAt);
  }
}
