package com.acme.crm.domain;

import com.acme.crm.dedupe.DedupeKeyGenerator;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One delivery of one logical message (pure domain object, no persistence annotations). */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundJob {

  private Long id;
  private String dedupeKey;
  private Long conversationId;
  private String channel;
  private String recipient;
  private String body;
  private String templateRef;
  private String intent;
  private JobStatus status;
  private int attempts;
  private int maxAttempts;
  private Instant nextAttemptAt;
  private String claimedBy;
  private Instant claimedAt;
  private String providerMessageId;
  private String lastError;
  private Long parentJobId;
  private int generation;
  private Instant createdAt;
  private Instant updatedAt;

  public OutboundPayload payload() {
    return new OutboundPayload(channel, recipient, body, templateRef, intent);
  }

  public String dedupeKeyPrefix() {
    return DedupeKeyGenerator.prefix(dedupeKey);
  }

  public boolean attemptsRemaining() {
    return attempts < maxAttempts;
  }
}
