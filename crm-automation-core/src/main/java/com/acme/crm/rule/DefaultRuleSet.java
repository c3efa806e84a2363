package com.acme.crm.rule;

import com.acme.crm.domain.LeadPriority;
import com.acme.crm.domain.QualificationStage;
import java.util.ArrayList;
import java.util.List;

/** Rules seeded on first start. Keys are stable so re-seeding updates rather than duplicates. */
public final class DefaultRuleSet {

  private static final int[] EXPIRY_CHECKPOINTS = {90, 60, 30, 7};

  // Bands stay disjoint while this is less than half the smallest gap between checkpoints.
  private static final int CHECKPOINT_TOLERANCE_DAYS = 2;

  private static final List<Integer> QUOTE_FOLLOWUP_CADENCE_DAYS = List.of(3, 5, 7, 9, 12);

  private DefaultRuleSet() {}

  public static List<AutomationRule> rules() {
    List<AutomationRule> rules = new ArrayList<>();
    for (int days : EXPIRY_CHECKPOINTS) {
      rules.add(
          AutomationRule.define(
              "expiry-reminder-" + days,
              "Expiry reminder " + days + " days before",
              AutomationRule.DAILY,
              new TriggerCondition.ExpiryWindow(days, null, CHECKPOINT_TOLERANCE_DAYS),
              List.of(
                  new RuleAction.SendAiReply(
                      "expiry_reminder",
                      "Remind the customer that their document expires soon and offer to handle the renewal."),
                  new RuleAction.CreateTask("Follow up on expiring document", "RENEWAL", 1))));
    }
    rules.add(
        AutomationRule.define(
            "info-shared-followup",
            "Follow up two days after sharing information",
            AutomationRule.DAILY,
            new TriggerCondition.InfoShared(2, null),
            List.of(
                new RuleAction.SendAiReply(
                    "info_followup", "Ask whether the customer had a chance to review the details."),
                new RuleAction.SetNextFollowup(3, true))));
    rules.add(
        AutomationRule.define(
            "no-reply-sla",
            "Escalate unanswered customers",
            AutomationRule.HOURLY,
            new TriggerCondition.NoReplySla(48),
            List.of(
                new RuleAction.CreateAgentTask("Customer waiting for a reply", LeadPriority.HIGH),
                new RuleAction.SetPriority(LeadPriority.HIGH))));
    rules.add(
        AutomationRule.define(
            "followup-overdue",
            "Flag overdue follow-ups",
            AutomationRule.HOURLY,
            new TriggerCondition.FollowupOverdue(24),
            List.of(
                new RuleAction.CreateTask("Overdue follow-up", "FOLLOW_UP", 0),
                new RuleAction.SetPriority(LeadPriority.HIGH))));
    rules.add(
        AutomationRule.define(
            "dormant-lead",
            "Re-engage leads with no activity for two weeks",
            AutomationRule.DAILY,
            new TriggerCondition.NoActivity(14),
            List.of(
                new RuleAction.SendAiReply(
                    "reengagement", "Check in politely and ask if they still need help."),
                new RuleAction.SetNextFollowup(7, true))));
    rules.add(
        AutomationRule.define(
            "quote-followup",
            "Follow up on quotations after three days",
            AutomationRule.DAILY,
            new TriggerCondition.StageReached(QualificationStage.QUOTED, 3),
            List.of(
                new RuleAction.SendAiReply(
                    "quote_followup", "Ask whether the customer wants to proceed with the quote."))));
    rules.add(
        AutomationRule.define(
            "quote-followup-cadence",
            "Schedule owner follow-ups after a quotation",
            AutomationRule.DAILY,
            new TriggerCondition.StageReached(QualificationStage.QUOTED, 0),
            List.of(
                new RuleAction.ScheduleFollowupCadence(
                    QUOTE_FOLLOWUP_CADENCE_DAYS, "Quote follow-up", "FOLLOW_UP"))));
    rules.add(
        AutomationRule.define(
            "urgent-inbound",
            "Escalate urgent or unhappy messages",
            AutomationRule.EVENT,
            new TriggerCondition.InboundMessage(
                List.of("urgent", "complaint", "refund", "not happy"), List.of()),
            List.of(
                new RuleAction.CreateAgentTask("Customer flagged urgency", LeadPriority.URGENT),
                new RuleAction.SetPriority(LeadPriority.URGENT))));
    return rules;
  }
}
