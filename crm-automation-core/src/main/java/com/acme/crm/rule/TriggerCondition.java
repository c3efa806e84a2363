package com.acme.crm.rule;

import com.acme.crm.domain.QualificationStage;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed condition parameters, one variant per trigger type. Stored as JSON tagged with {@code
 * triggerType}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "triggerType")
@JsonSubTypes({
  @JsonSubTypes.Type(value = TriggerCondition.ExpiryWindow.class, name = "EXPIRY_WINDOW"),
  @JsonSubTypes.Type(value = TriggerCondition.InfoShared.class, name = "INFO_SHARED"),
  @JsonSubTypes.Type(value = TriggerCondition.NoReplySla.class, name = "NO_REPLY_SLA"),
  @JsonSubTypes.Type(value = TriggerCondition.FollowupOverdue.class, name = "FOLLOWUP_OVERDUE"),
  @JsonSubTypes.Type(value = TriggerCondition.NoActivity.class, name = "NO_ACTIVITY"),
  @JsonSubTypes.Type(value = TriggerCondition.StageReached.class, name = "STAGE_REACHED"),
  @JsonSubTypes.Type(value = TriggerCondition.InboundMessage.class, name = "INBOUND_MESSAGE")
})
public sealed interface TriggerCondition {

  @JsonIgnore
  TriggerType triggerType();

  /** Violations of this condition's own schema; empty when valid. */
  List<String> validate();

  /**
   * An expiry item is within {@code daysBefore} days of expiring (inclusive), optionally filtered
   * by item type. With {@code toleranceDays} set, only items within {@code daysBefore +/-
   * toleranceDays} match, so several checkpoints on the same item do not overlap.
   */
  record ExpiryWindow(int daysBefore, String expiryType, Integer toleranceDays)
      implements TriggerCondition {

    /** First day (in days until expiry) that still matches. */
    @JsonIgnore
    public int lowerBound() {
      return toleranceDays == null ? 0 : Math.max(0, daysBefore - toleranceDays);
    }

    /** Last day (in days until expiry) that matches. */
    @JsonIgnore
    public int upperBound() {
      return toleranceDays == null ? daysBefore : daysBefore + toleranceDays;
    }

    @Override
    public TriggerType triggerType() {
      return TriggerType.EXPIRY_WINDOW;
    }

    @Override
    public List<String> validate() {
      List<String> errors = new ArrayList<>();
      if (daysBefore <= 0) {
        errors.add("daysBefore must be positive");
      }
      if (toleranceDays != null && toleranceDays < 0) {
        errors.add("toleranceDays must not be negative");
      }
      return errors;
    }
  }

  /** {@code daysAfter} days have passed since information was shared, optionally by info type. */
  record InfoShared(int daysAfter, String infoType) implements TriggerCondition {
    @Override
    public TriggerType triggerType() {
      return TriggerType.INFO_SHARED;
    }

    @Override
    public List<String> validate() {
      List<String> errors = new ArrayList<>();
      if (daysAfter <= 0) {
        errors.add("daysAfter must be positive");
      }
      return errors;
    }
  }

  /** The last inbound message has gone unanswered for {@code hoursWithoutReply}. */
  record NoReplySla(int hoursWithoutReply) implements TriggerCondition {
    @Override
    public TriggerType triggerType() {
      return TriggerType.NO_REPLY_SLA;
    }

    @Override
    public List<String> validate() {
      List<String> errors = new ArrayList<>();
      if (hoursWithoutReply <= 0) {
        errors.add("hoursWithoutReply must be positive");
      }
      return errors;
    }
  }

  /** The scheduled follow-up is at least {@code hoursOverdue} past due. */
  record FollowupOverdue(int hoursOverdue) implements TriggerCondition {
    @Override
    public TriggerType triggerType() {
      return TriggerType.FOLLOWUP_OVERDUE;
    }

    @Override
    public List<String> validate() {
      List<String> errors = new ArrayList<>();
      if (hoursOverdue < 0) {
        errors.add("hoursOverdue must not be negative");
      }
      return errors;
    }
  }

  /** No message in either direction for {@code daysWithoutActivity} days. */
  record NoActivity(int daysWithoutActivity) implements TriggerCondition {
    @Override
    public TriggerType triggerType() {
      return TriggerType.NO_ACTIVITY;
    }

    @Override
    public List<String> validate() {
      List<String> errors = new ArrayList<>();
      if (daysWithoutActivity <= 0) {
        errors.add("daysWithoutActivity must be positive");
      }
      return errors;
    }
  }

  /** The conversation has been in {@code stage} for at least {@code minDaysInStage} days. */
  record StageReached(QualificationStage stage, int minDaysInStage) implements TriggerCondition {
    @Override
    public TriggerType triggerType() {
      return TriggerType.STAGE_REACHED;
    }

    @Override
    public List<String> validate() {
      List<String> errors = new ArrayList<>();
      if (stage == null) {
        errors.add("stage is required");
      }
      if (minDaysInStage < 0) {
        errors.add("minDaysInStage must not be negative");
      }
      return errors;
    }
  }

  /** An inbound message contains any of the keywords, optionally only in some stages. */
  record InboundMessage(List<String> keywords, List<QualificationStage> stages)
      implements TriggerCondition {
    public InboundMessage {
      keywords = keywords == null ? List.of() : List.copyOf(keywords);
      stages = stages == null ? List.of() : List.copyOf(stages);
    }

    @Override
    public TriggerType triggerType() {
      return TriggerType.INBOUND_MESSAGE;
    }

    @Override
    public List<String> validate() {
      List<String> errors = new ArrayList<>();
      if (keywords.isEmpty() || keywords.stream().anyMatch(k -> k == null || k.isBlank())) {
        errors.add("keywords must be a non-empty list of non-blank values");
      }
      return errors;
    }
  }
}
