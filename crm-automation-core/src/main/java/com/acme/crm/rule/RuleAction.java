package com.acme.crm.rule;

import com.acme.crm.domain.LeadPriority;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** One step of a rule's ordered action list. Stored as JSON tagged with {@code type}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = RuleAction.SendAiReply.class, name = "SEND_AI_REPLY"),
  @JsonSubTypes.Type(value = RuleAction.CreateTask.class, name = "CREATE_TASK"),
  @JsonSubTypes.Type(value = RuleAction.SetNextFollowup.class, name = "SET_NEXT_FOLLOWUP"),
  @JsonSubTypes.Type(value = RuleAction.CreateAgentTask.class, name = "CREATE_AGENT_TASK"),
  @JsonSubTypes.Type(value = RuleAction.SetPriority.class, name = "SET_PRIORITY"),
  @JsonSubTypes.Type(
      value = RuleAction.ScheduleFollowupCadence.class,
      name = "SCHEDULE_FOLLOWUP_CADENCE")
})
public sealed interface RuleAction {

  @JsonIgnore
  ActionType type();

  List<String> validate();

  /** Generate a reply for the lead's conversation and queue it. */
  record SendAiReply(String templateKey, String instruction) implements RuleAction {
    @Override
    public ActionType type() {
      return ActionType.SEND_AI_REPLY;
    }

    @Override
    public List<String> validate() {
      List<String> errors = new ArrayList<>();
      if (templateKey == null || templateKey.isBlank()) {
        errors.add("SEND_AI_REPLY needs a templateKey");
      }
      return errors;
    }
  }

  /** Create a task for the lead owner, due {@code dueInDays} from now. */
  record CreateTask(String title, String taskType, int dueInDays) implements RuleAction {
    @Override
    public ActionType type() {
      return ActionType.CREATE_TASK;
    }

    @Override
    public List<String> validate() {
      List<String> errors = new ArrayList<>();
      if (title == null || title.isBlank()) {
        errors.add("CREATE_TASK needs a title");
      }
      if (dueInDays < 0) {
        errors.add("CREATE_TASK dueInDays must not be negative");
      }
      return errors;
    }
  }

  /**
   * Move the lead's next follow-up to {@code daysFromNow} after the reply sent earlier in the same
   * rule, or after now. With {@code requireSend} it only applies when a reply was sent.
   */
  record SetNextFollowup(int daysFromNow, boolean requireSend) implements RuleAction {
    @Override
    public ActionType type() {
      return ActionType.SET_NEXT_FOLLOWUP;
    }

    @Override
    public List<String> validate() {
      List<String> errors = new ArrayList<>();
      if (daysFromNow <= 0) {
        errors.add("SET_NEXT_FOLLOWUP daysFromNow must be positive");
      }
      return errors;
    }
  }

  /** Escalate to a human agent. */
  record CreateAgentTask(String reason, LeadPriority priority) implements RuleAction {
    @Override
    public ActionType type() {
      return ActionType.CREATE_AGENT_TASK;
    }

    @Override
    public List<String> validate() {
      List<String> errors = new ArrayList<>();
      if (reason == null || reason.isBlank()) {
        errors.add("CREATE_AGENT_TASK needs a reason");
      }
      return errors;
    }
  }

  record SetPriority(LeadPriority priority) implements RuleAction {
    @Override
    public ActionType type() {
      return ActionType.SET_PRIORITY;
    }

    @Override
    public List<String> validate() {
      List<String> errors = new ArrayList<>();
      if (priority == null) {
        errors.add("SET_PRIORITY needs a priority");
      }
      return errors;
    }
  }

  /**
   * Schedule one owner task per offset, {@code cadenceDays} after the stage change that triggered
   * the rule. Each task is keyed by its offset so re-running the rule never adds a second set.
   */
  record ScheduleFollowupCadence(List<Integer> cadenceDays, String titlePrefix, String taskType)
      implements RuleAction {

    public ScheduleFollowupCadence {
      cadenceDays =
          cadenceDays == null
              ? List.of()
              : Collections.unmodifiableList(new ArrayList<>(cadenceDays));
    }

    @Override
    public ActionType type() {
      return ActionType.SCHEDULE_FOLLOWUP_CADENCE;
    }

    @Override
    public List<String> validate() {
      List<String> errors = new ArrayList<>();
      if (cadenceDays.isEmpty()) {
        errors.add("SCHEDULE_FOLLOWUP_CADENCE needs at least one offset");
      }
      int previous = 0;
      for (Integer days : cadenceDays) {
        if (days == null || days <= previous) {
          errors.add("SCHEDULE_FOLLOWUP_CADENCE offsets must be positive and ascending");
          break;
        }
        previous = days;
      }
      if (titlePrefix == null || titlePrefix.isBlank()) {
        errors.add("SCHEDULE_FOLLOWUP_CADENCE needs a titlePrefix");
      }
      return errors;
    }
  }
}
