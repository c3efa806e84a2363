package com.acme.crm.processor;

import com.acme.crm.engine.AutomationRuleEngine;
import com.acme.crm.engine.RuleRunSummary;
import com.acme.crm.rule.AutomationRule;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Fires the scheduled rule passes. Safe to run on several instances at once: repeated sends are
 * absorbed by the job dedupe keys and repeated tasks by the task keys.
 */
@Slf4j
@Singleton
public class AutomationScheduler {

  private final AutomationRuleEngine engine;

  public AutomationScheduler(AutomationRuleEngine engine) {
    this.engine = engine;
  }

  @Scheduled(cron = "${automation.daily-cron:0 0 9 * * ?}")
  public void daily() {
    run(AutomationRule.DAILY);
  }

  @Scheduled(cron = "${automation.hourly-cron:0 5 * * * ?}")
  public void hourly() {
    run(AutomationRule.HOURLY);
  }

  RuleRunSummary run(String scheduleTag) {
    try {
      RuleRunSummary summary = engine.runScheduledRules(scheduleTag);
      log.info(
          "Scheduled pass '{}': evaluated={} matched={} sent={} skipped={} failed={}",
          scheduleTag,
          summary.rulesEvaluated(),
          summary.rulesMatched(),
          summary.sent(),
          summary.skipped(),
          summary.failed());
      return summary;
    } catch (Exception e) {
      log.error("Scheduled pass '{}' failed: {}", scheduleTag, e.getMessage(), e);
      return null;
    }
  }
}
