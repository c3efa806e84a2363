package com.acme.crm.support;

import com.acme.crm.domain.Conversation;
import com.acme.crm.domain.ExpiryItem;
import com.acme.crm.domain.LeadPriority;
import com.acme.crm.domain.LeadSnapshot;
import com.acme.crm.domain.QualificationStage;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Shared builders for conversations and lead snapshots. */
public final class TestData {

  public static final Instant NOW = Instant.parse("2026-03-10T09:00:00Z");

  private TestData() {}

  public static Conversation conversation(QualificationStage stage, Map<String, String> fields) {
    return new Conversation(
        null,
        "contact-1",
        "whatsapp",
        "+971500000001",
        stage,
        fields,
        null,
        0,
        0L,
        NOW.minusSeconds(86_400),
        null,
        null,
        null,
        null,
        false,
        NOW.minusSeconds(86_400),
        NOW.minusSeconds(86_400));
  }

  public static Conversation intake(Map<String, String> fields) {
    return conversation(QualificationStage.INTAKE, fields);
  }

  /** Lead with autopilot on, linked to {@code conversationId}. */
  public static LeadSnapshot lead(long leadId, Long conversationId) {
    return new LeadSnapshot(
        leadId,
        conversationId,
        "Sara",
        "whatsapp",
        conversationId == null ? null : "+97150000000" + leadId,
        QualificationStage.QUALIFYING,
        NOW.minusSeconds(10 * 86_400),
        null,
        null,
        NOW.minusSeconds(30 * 86_400),
        null,
        null,
        null,
        true,
        LeadPriority.NORMAL,
        List.of(),
        List.of());
  }

  public static LeadSnapshot withExpiry(LeadSnapshot lead, ExpiryItem... items) {
    return new LeadSnapshot(
        lead.leadId(),
        lead.conversationId(),
        lead.contactName(),
        lead.channel(),
        lead.recipient(),
        lead.stage(),
        lead.stageChangedAt(),
        lead.lastInboundAt(),
        lead.lastOutboundAt(),
        lead.createdAt(),
        lead.nextFollowUpAt(),
        lead.infoSharedAt(),
        lead.infoSharedType(),
        lead.autopilotEnabled(),
        lead.priority(),
        List.of(items),
        lead.reminderHistory());
  }

  public static LeadSnapshot withActivity(
      LeadSnapshot lead, Instant lastInbound, Instant lastOutbound, Instant nextFollowUp) {
    return new LeadSnapshot(
        lead.leadId(),
        lead.conversationId(),
        lead.contactName(),
        lead.channel(),
        lead.recipient(),
        lead.stage(),
        lead.stageChangedAt(),
        lastInbound,
        lastOutbound,
        lead.createdAt(),
        nextFollowUp,
        lead.infoSharedAt(),
        lead.infoSharedType(),
        lead.autopilotEnabled(),
        lead.priority(),
        lead.expiryItems(),
        lead.reminderHistory());
  }

  public static LeadSnapshot withInfoShared(LeadSnapshot lead, Instant sharedAt, String type) {
    return new LeadSnapshot(
        lead.leadId(),
        lead.conversationId(),
        lead.contactName(),
        lead.channel(),
        lead.recipient(),
        lead.stage(),
        lead.stageChangedAt(),
        lead.lastInboundAt(),
        lead.lastOutboundAt(),
        lead.createdAt(),
        lead.nextFollowUpAt(),
        sharedAt,
        type,
        lead.autopilotEnabled(),
        lead.priority(),
        lead.expiryItems(),
        lead.reminderHistory());
  }

  public static LeadSnapshot withAutopilot(LeadSnapshot lead, boolean enabled) {
    return new LeadSnapshot(
        lead.leadId(),
        lead.conversationId(),
        lead.contactName(),
        lead.channel(),
        lead.recipient(),
        lead.stage(),
        lead.stageChangedAt(),
        lead.lastInboundAt(),
        lead.lastOutboundAt(),
        lead.createdAt(),
        lead.nextFollowUpAt(),
        lead.infoSharedAt(),
        lead.infoSharedType(),
        enabled,
        lead.priority(),
        lead.expiryItems(),
        lead.reminderHistory());
  }

  public static LeadSnapshot withStage(
      LeadSnapshot lead, QualificationStage stage, Instant stageChangedAt) {
    return new LeadSnapshot(
        lead.leadId(),
        lead.conversationId(),
        lead.contactName(),
        lead.channel(),
        lead.recipient(),
        stage,
        stageChangedAt,
        lead.lastInboundAt(),
        lead.lastOutboundAt(),
        lead.createdAt(),
        lead.nextFollowUpAt(),
        lead.infoSharedAt(),
        lead.infoSharedType(),
        lead.autopilotEnabled(),
        lead.priority(),
        lead.expiryItems(),
        lead.reminderHistory());
  }
}
