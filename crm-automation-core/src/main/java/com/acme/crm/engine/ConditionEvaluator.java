package com.acme.crm.engine;

import com.acme.crm.domain.ExpiryItem;
import com.acme.crm.domain.LeadSnapshot;
import com.acme.crm.domain.ReminderRecord;
import com.acme.crm.rule.AutomationRule;
import com.acme.crm.rule.TriggerCondition;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pure predicate over a lead snapshot and a rule's condition. No I/O: reminder history must already
 * be attached to the snapshot, which is what makes dry runs exact.
 */
public class ConditionEvaluator {

  private final int reminderWindowDays;
  private final ZoneId zone;

  public ConditionEvaluator(int reminderWindowDays, ZoneId zone) {
    if (reminderWindowDays < 0) {
      throw new IllegalArgumentException("reminderWindowDays must not be negative");
    }
    this.reminderWindowDays = reminderWindowDays;
    this.zone = zone;
  }

  public ConditionEvaluator(int reminderWindowDays) {
    this(reminderWindowDays, ZoneOffset.UTC);
  }

  /**
   * @param event the triggering inbound message for event rules, null for scheduled evaluation
   */
  public ConditionMatch evaluate(
      AutomationRule rule, LeadSnapshot lead, Instant now, InboundEvent event) {
    TriggerCondition condition = rule.condition();
    if (condition instanceof TriggerCondition.ExpiryWindow c) {
      return expiryWindow(rule, c, lead, now);
    }
    if (condition instanceof TriggerCondition.InfoShared c) {
      return infoShared(rule, c, lead, now);
    }
    if (condition instanceof TriggerCondition.NoReplySla c) {
      return noReplySla(rule, c, lead, now);
    }
    if (condition instanceof TriggerCondition.FollowupOverdue c) {
      return followupOverdue(rule, c, lead, now);
    }
    if (condition instanceof TriggerCondition.NoActivity c) {
      return noActivity(rule, c, lead, now);
    }
    if (condition instanceof TriggerCondition.StageReached c) {
      return stageReached(rule, c, lead, now);
    }
    if (condition instanceof TriggerCondition.InboundMessage c) {
      return inboundMessage(rule, c, lead, event);
    }
    throw new IllegalStateException("Unhandled condition " + condition);
  }

  private ConditionMatch expiryWindow(
      AutomationRule rule, TriggerCondition.ExpiryWindow c, LeadSnapshot lead, Instant now) {
    LocalDate today = today(now);
    List<ExpiryItem> candidates =
        lead.expiryItems().stream()
            .filter(item -> item.expiryDate() != null)
            .filter(item -> c.expiryType() == null || c.expiryType().equalsIgnoreCase(item.itemType()))
            .sorted(Comparator.comparing(ExpiryItem::expiryDate))
            .toList();

    boolean anyInWindow = false;
    for (ExpiryItem item : candidates) {
      long daysUntil = ChronoUnit.DAYS.between(today, item.expiryDate());
      if (daysUntil < c.lowerBound() || daysUntil > c.upperBound()) {
        continue;
      }
      anyInWindow = true;
      String checkpoint = "expiry:" + item.id();
      // a reminder anywhere in the band counts, plus the configured grace before it
      LocalDate earliest =
          item.expiryDate().minusDays(c.upperBound()).minusDays(reminderWindowDays);
      boolean reminded =
          lead.reminderHistory().stream()
              .filter(r -> rule.ruleKey().equals(r.ruleKey()))
              .filter(r -> checkpoint.equals(r.checkpointKey()))
              .anyMatch(r -> !date(r.remindedAt()).isBefore(earliest));
      if (reminded) {
        continue;
      }
      Map<String, String> vars = baseVariables(lead);
      vars.put("itemType", humanize(item.itemType()));
      vars.put("expiryDate", item.expiryDate().toString());
      vars.put("daysUntil", Long.toString(daysUntil));
      return ConditionMatch.matched(checkpoint, vars);
    }
    return ConditionMatch.notMatched(
        anyInWindow ? "already reminded this window" : "no item within " + windowText(c) + " days");
  }

  private ConditionMatch infoShared(
      AutomationRule rule, TriggerCondition.InfoShared c, LeadSnapshot lead, Instant now) {
    if (lead.infoSharedAt() == null) {
      return ConditionMatch.notMatched("no information shared");
    }
    if (c.infoType() != null && !c.infoType().equalsIgnoreCase(lead.infoSharedType())) {
      return ConditionMatch.notMatched("info type " + lead.infoSharedType() + " filtered out");
    }
    LocalDate sharedOn = date(lead.infoSharedAt());
    long daysSince = ChronoUnit.DAYS.between(sharedOn, today(now));
    if (daysSince < c.daysAfter() || daysSince > c.daysAfter() + reminderWindowDays) {
      return ConditionMatch.notMatched(daysSince + " days since info shared");
    }
    return checkpointed(rule, lead, "info:" + sharedOn, baseVariables(lead));
  }

  private ConditionMatch noReplySla(
      AutomationRule rule, TriggerCondition.NoReplySla c, LeadSnapshot lead, Instant now) {
    Instant lastInbound = lead.lastInboundAt();
    if (lastInbound == null) {
      return ConditionMatch.notMatched("no inbound message");
    }
    if (lead.lastOutboundAt() != null && !lead.lastOutboundAt().isBefore(lastInbound)) {
      return ConditionMatch.notMatched("already replied");
    }
    long hours = Duration.between(lastInbound, now).toHours();
    if (hours < c.hoursWithoutReply()) {
      return ConditionMatch.notMatched(hours + "h without reply");
    }
    Map<String, String> vars = baseVariables(lead);
    vars.put("hoursWithoutReply", Long.toString(hours));
    return checkpointed(rule, lead, "sla:" + lastInbound.toEpochMilli(), vars);
  }

  private ConditionMatch followupOverdue(
      AutomationRule rule, TriggerCondition.FollowupOverdue c, LeadSnapshot lead, Instant now) {
    Instant due = lead.nextFollowUpAt();
    if (due == null) {
      return ConditionMatch.notMatched("no follow-up scheduled");
    }
    if (now.isBefore(due.plus(Duration.ofHours(c.hoursOverdue())))) {
      return ConditionMatch.notMatched("follow-up not overdue");
    }
    Map<String, String> vars = baseVariables(lead);
    vars.put("followUpDue", due.toString());
    return checkpointed(rule, lead, "followup:" + due.toEpochMilli(), vars);
  }

  private ConditionMatch noActivity(
      AutomationRule rule, TriggerCondition.NoActivity c, LeadSnapshot lead, Instant now) {
    Instant lastContact = lead.lastContactAt();
    if (lastContact == null) {
      return ConditionMatch.notMatched("no activity timestamp");
    }
    LocalDate lastDay = date(lastContact);
    long idleDays = ChronoUnit.DAYS.between(lastDay, today(now));
    if (idleDays < c.daysWithoutActivity()) {
      return ConditionMatch.notMatched(idleDays + " days idle");
    }
    Map<String, String> vars = baseVariables(lead);
    vars.put("idleDays", Long.toString(idleDays));
    return checkpointed(rule, lead, "idle:" + lastDay, vars);
  }

  private ConditionMatch stageReached(
      AutomationRule rule, TriggerCondition.StageReached c, LeadSnapshot lead, Instant now) {
    if (lead.stage() != c.stage() || lead.stageChangedAt() == null) {
      return ConditionMatch.notMatched("not in stage " + c.stage());
    }
    long daysInStage = ChronoUnit.DAYS.between(date(lead.stageChangedAt()), today(now));
    if (daysInStage < c.minDaysInStage()) {
      return ConditionMatch.notMatched(daysInStage + " days in stage");
    }
    return checkpointed(
        rule,
        lead,
        "stage:" + c.stage() + ":" + lead.stageChangedAt().toEpochMilli(),
        baseVariables(lead));
  }

  private ConditionMatch inboundMessage(
      AutomationRule rule, TriggerCondition.InboundMessage c, LeadSnapshot lead, InboundEvent event) {
    if (event == null || event.text() == null) {
      return ConditionMatch.notMatched("no inbound event");
    }
    if (!c.stages().isEmpty() && !c.stages().contains(lead.stage())) {
      return ConditionMatch.notMatched("stage " + lead.stage() + " filtered out");
    }
    String text = event.text().toLowerCase(Locale.ROOT);
    boolean hit =
        c.keywords().stream().anyMatch(k -> text.contains(k.toLowerCase(Locale.ROOT)));
    if (!hit) {
      return ConditionMatch.notMatched("no keyword matched");
    }
    return checkpointed(
        rule, lead, "inbound:" + event.providerMessageId(), baseVariables(lead));
  }

  private ConditionMatch checkpointed(
      AutomationRule rule, LeadSnapshot lead, String checkpoint, Map<String, String> vars) {
    for (ReminderRecord r : lead.reminderHistory()) {
      if (rule.ruleKey().equals(r.ruleKey()) && checkpoint.equals(r.checkpointKey())) {
        return ConditionMatch.notMatched("already handled checkpoint " + checkpoint);
      }
    }
    return ConditionMatch.matched(checkpoint, vars);
  }

  private Map<String, String> baseVariables(LeadSnapshot lead) {
    Map<String, String> vars = new HashMap<>();
    if (lead.contactName() != null) {
      vars.put("name", lead.contactName());
    }
    vars.put("leadId", Long.toString(lead.leadId()));
    return vars;
  }

  private LocalDate today(Instant now) {
    return LocalDate.ofInstant(now, zone);
  }

  private LocalDate date(Instant instant) {
    return LocalDate.ofInstant(instant, zone);
  }

  private static String windowText(TriggerCondition.ExpiryWindow c) {
    if (c.lowerBound() == 0) {
      return Integer.toString(c.upperBound());
    }
    return c.lowerBound() + " to " + c.upperBound();
  }

  private static String humanize(String itemType) {
    if (itemType == null) {
      return "document";
    }
    return itemType.toLowerCase(Locale.ROOT).replace('_', ' ');
  }
}
