package com.acme.crm.engine;

import com.acme.crm.dispatch.RateLimiter;
import com.acme.crm.domain.AutomationRunLog;
import com.acme.crm.domain.LeadSnapshot;
import com.acme.crm.domain.RunStatus;
import com.acme.crm.domain.TriggerSource;
import com.acme.crm.repository.AutomationRuleRepository;
import com.acme.crm.repository.AutomationRunLogRepository;
import com.acme.crm.rule.AutomationRule;
import com.acme.crm.rule.RuleAction;
import com.acme.crm.spi.LeadGateway;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Evaluates enabled rules against candidate leads and executes the actions of every match. Each
 * (rule, lead) pair is isolated: a failure is logged and the run moves on.
 */
@Slf4j
public class AutomationRuleEngine {

  private final AutomationRuleRepository rules;
  private final AutomationRunLogRepository runLogs;
  private final LeadGateway leads;
  private final ConditionEvaluator evaluator;
  private final ActionExecutor executor;
  private final RateLimiter rateLimiter;
  private final int candidateLimit;
  private final Clock clock;

  public AutomationRuleEngine(
      AutomationRuleRepository rules,
      AutomationRunLogRepository runLogs,
      LeadGateway leads,
      ConditionEvaluator evaluator,
      ActionExecutor executor,
      RateLimiter rateLimiter,
      int candidateLimit,
      Clock clock) {
    this.rules = rules;
    this.runLogs = runLogs;
    this.leads = leads;
    this.evaluator = evaluator;
    this.executor = executor;
    this.rateLimiter = rateLimiter;
    this.candidateLimit = candidateLimit;
    this.clock = clock;
  }

  public RuleRunSummary runScheduledRules(String scheduleTag) {
    return runScheduledRules(scheduleTag, false);
  }

  public RuleRunSummary runScheduledRules(String scheduleTag, boolean dryRun) {
    List<AutomationRule> selected =
        rules.findEnabledBySchedule(scheduleTag).stream()
            .filter(AutomationRule::isRunnable)
            .filter(r -> !r.triggerType().isEventDriven())
            .toList();
    return run(
        "schedule:" + scheduleTag,
        TriggerSource.SCHEDULED,
        selected,
        leads.findCandidates(candidateLimit),
        null,
        dryRun);
  }

  /** Manual trigger of a single rule against all candidate leads. */
  public RuleRunSummary runRule(String ruleKey, boolean dryRun) {
    AutomationRule rule =
        rules
            .findByKey(ruleKey)
            .orElseThrow(() -> new IllegalArgumentException("Unknown rule " + ruleKey));
    String runKey = "manual:" + ruleKey;
    if (!rule.isRunnable()) {
      log.info("Rule {} is disabled, nothing to run", ruleKey);
      return RuleRunSummary.empty(runKey, TriggerSource.MANUAL, dryRun);
    }
    return run(
        runKey,
        TriggerSource.MANUAL,
        List.of(rule),
        leads.findCandidates(candidateLimit),
        null,
        dryRun);
  }

  public RuleRunSummary runEventRules(InboundEvent event) {
    String runKey = "event:" + event.providerMessageId();
    Optional<LeadSnapshot> lead = leads.findByConversation(event.conversationId());
    if (lead.isEmpty()) {
      log.debug("No lead for conversation {}, event rules skipped", event.conversationId());
      return RuleRunSummary.empty(runKey, TriggerSource.EVENT, false);
    }
    List<AutomationRule> selected =
        rules.findEnabledBySchedule(AutomationRule.EVENT).stream()
            .filter(AutomationRule::isRunnable)
            .filter(r -> r.triggerType().isEventDriven())
            .toList();
    return run(runKey, TriggerSource.EVENT, selected, List.of(lead.get()), event, false);
  }

  private RuleRunSummary run(
      String runKey,
      TriggerSource source,
      List<AutomationRule> selected,
      List<LeadSnapshot> candidates,
      InboundEvent event,
      boolean dryRun) {
    Instant now = clock.instant();
    List<RuleEvaluation> results = new ArrayList<>();
    int matched = 0;
    int sent = 0;
    int skipped = 0;
    int failed = 0;

    for (AutomationRule rule : selected) {
      for (LeadSnapshot lead : candidates) {
        RuleEvaluation evaluation;
        try {
          evaluation = evaluate(rule, lead, now, event, source, dryRun);
        } catch (RuntimeException e) {
          log.error(
              "Evaluating rule {} for lead {} failed: {}",
              rule.ruleKey(),
              lead.leadId(),
              e.getMessage(),
              e);
          evaluation =
              new RuleEvaluation(
                  rule.ruleKey(),
                  lead.leadId(),
                  false,
                  null,
                  RunStatus.FAILED,
                  RuleEvaluationStage.SELECTED,
                  e.getMessage(),
                  List.of());
        }

        if (evaluation.matched()) {
          matched++;
          sent += evaluation.sends();
        }
        if (evaluation.status() == RunStatus.SKIPPED) {
          skipped++;
        } else if (evaluation.status() == RunStatus.FAILED
            || evaluation.status() == RunStatus.PARTIAL) {
          failed++;
        }
        if (evaluation.status() != null) {
          results.add(evaluation);
        }
      }
    }

    RuleRunSummary summary =
        new RuleRunSummary(
            runKey, source, dryRun, selected.size(), matched, sent, skipped, failed, results);
    log.info(
        "{}{}: {} rules, {} matched, {} sent, {} skipped, {} failed",
        dryRun ? "[dry-run] " : "",
        runKey,
        summary.rulesEvaluated(),
        matched,
        sent,
        skipped,
        failed);
    if (!dryRun && !selected.isEmpty()) {
      appendSafely(
          AutomationRunLog.forRun(
              runKey,
              source,
              runStatus(matched, sent, failed),
              selected.size() + " rules over " + candidates.size() + " leads",
              matched,
              sent,
              skipped,
              failed,
              now));
    }
    return summary;
  }

  RuleEvaluation evaluate(
      AutomationRule rule,
      LeadSnapshot lead,
      Instant now,
      InboundEvent event,
      TriggerSource source,
      boolean dryRun) {
    if (!lead.autopilotEnabled()) {
      return RuleEvaluation.notMatched(rule.ruleKey(), lead.leadId(), "autopilot disabled");
    }
    LeadSnapshot snapshot =
        lead.withReminderHistory(runLogs.findReminders(rule.ruleKey(), lead.leadId()));
    ConditionMatch match = evaluator.evaluate(rule, snapshot, now, event);
    if (!match.matched()) {
      return RuleEvaluation.notMatched(rule.ruleKey(), lead.leadId(), match.reason());
    }

    RuleEvaluation evaluation;
    if (rule.hasSendAction()
        && snapshot.hasConversation()
        && !rateLimiter.check(snapshot.conversationId())) {
      evaluation =
          new RuleEvaluation(
              rule.ruleKey(),
              lead.leadId(),
              true,
              match.checkpointKey(),
              RunStatus.SKIPPED,
              RuleEvaluationStage.CONDITION_CHECKED,
              "conversation in cool-down, deferred",
              List.of());
    } else {
      evaluation = executeActions(rule, snapshot, match, source, dryRun, now);
    }

    if (dryRun) {
      return evaluation;
    }
    appendSafely(
        AutomationRunLog.forLead(
            rule.ruleKey(),
            lead.leadId(),
            evaluation.checkpointKey(),
            source,
            evaluation.status(),
            evaluation.message(),
            evaluation.sends(),
            now));
    return evaluation.logged();
  }

  private RuleEvaluation executeActions(
      AutomationRule rule,
      LeadSnapshot lead,
      ConditionMatch match,
      TriggerSource source,
      boolean dryRun,
      Instant now) {
    ActionContext ctx = new ActionContext(rule, lead, match, source, dryRun, now);
    String failure = null;
    for (RuleAction action : rule.actions()) {
      try {
        ctx.add(executor.execute(action, ctx));
      } catch (RuntimeException e) {
        log.warn(
            "Action {} of rule {} failed for lead {}: {}",
            action.type(),
            rule.ruleKey(),
            lead.leadId(),
            e.getMessage());
        failure = action.type() + " failed: " + e.getMessage();
        ctx.add(ActionOutcome.failed(action.type(), e.getMessage()));
        break;
      }
    }

    List<ActionOutcome> outcomes = ctx.outcomes();
    RunStatus status = statusOf(outcomes, failure != null);
    String message = failure != null ? failure : summarize(outcomes);
    return new RuleEvaluation(
        rule.ruleKey(),
        lead.leadId(),
        true,
        match.checkpointKey(),
        status,
        RuleEvaluationStage.ACTIONS_EXECUTED,
        message,
        outcomes);
  }

  static RunStatus statusOf(List<ActionOutcome> outcomes, boolean aborted) {
    boolean tookEffect = outcomes.stream().anyMatch(ActionOutcome::tookEffect);
    if (aborted) {
      return tookEffect ? RunStatus.PARTIAL : RunStatus.FAILED;
    }
    if (outcomes.stream().anyMatch(o -> o.status() == ActionStatus.DEFERRED)) {
      return RunStatus.SKIPPED;
    }
    return tookEffect ? RunStatus.SUCCESS : RunStatus.SKIPPED;
  }

  private static RunStatus runStatus(int matched, int sent, int failed) {
    if (failed > 0) {
      return sent > 0 ? RunStatus.PARTIAL : RunStatus.FAILED;
    }
    return matched == 0 ? RunStatus.SKIPPED : RunStatus.SUCCESS;
  }

  private static String summarize(List<ActionOutcome> outcomes) {
    StringBuilder sb = new StringBuilder();
    for (ActionOutcome o : outcomes) {
      if (sb.length() > 0) {
        sb.append("; ");
      }
      sb.append(o.type()).append(' ').append(o.status());
      if (o.detail() != null) {
        sb.append(" (").append(o.detail()).append(')');
      }
    }
    return sb.toString();
  }

  private void appendSafely(AutomationRunLog entry) {
    try {
      runLogs.append(entry);
    } catch (RuntimeException e) {
      log.error(
          "Could not append run log for rule {} lead {}: {}",
          entry.ruleKey(),
          entry.leadId(),
          e.getMessage(),
          e);
    }
  }
}
