package com.acme.crm.domain;

import java.time.Instant;
import java.util.List;

/**
 * Read model of a lead and its conversation used for rule evaluation. Reminder history is attached
 * by the engine before conditions are checked so evaluation stays a pure function of the snapshot.
 */
public record LeadSnapshot(
    long leadId,
    Long conversationId,
    String contactName,
    String channel,
    String recipient,
    QualificationStage stage,
    Instant stageChangedAt,
    Instant lastInboundAt,
    Instant lastOutboundAt,
    Instant createdAt,
    Instant nextFollowUpAt,
    Instant infoSharedAt,
    String infoSharedType,
    boolean autopilotEnabled,
    LeadPriority priority,
    List<ExpiryItem> expiryItems,
    List<ReminderRecord> reminderHistory) {

  public LeadSnapshot {
    expiryItems = expiryItems == null ? List.of() : List.copyOf(expiryItems);
    reminderHistory = reminderHistory == null ? List.of() : List.copyOf(reminderHistory);
  }

  /** Most recent message in either direction, falling back to when the lead was created. */
  public Instant lastContactAt() {
    Instant last = lastInboundAt;
    if (lastOutboundAt != null && (last == null || lastOutboundAt.isAfter(last))) {
      last = lastOutboundAt;
    }
    return last != null ? last : createdAt;
  }

  public boolean hasConversation() {
    return conversationId != null && recipient != null && !recipient.isBlank();
  }

  public LeadSnapshot withReminderHistory(List<ReminderRecord> history) {
    return new LeadSnapshot(
        leadId,
        conversationId,
        contactName,
        channel,
        recipient,
        stage,
        stageChangedAt,
        lastInboundAt,
        lastOutboundAt,
        createdAt,
        nextFollowUpAt,
        infoSharedAt,
        infoSharedType,
        autopilotEnabled,
        priority,
        expiryItems,
        history);
  }
}
