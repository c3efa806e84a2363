package com.acme.crm.processor;

import com.acme.crm.rule.AutomationRule;
import com.acme.crm.rule.AutomationRuleService;
import com.acme.crm.rule.DefaultRuleSet;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Upserts the default rule set on startup. Rule keys are stable, so restarts do not duplicate. */
@Slf4j
@Singleton
@Requires(property = "automation.seed-default-rules", notEquals = "false")
public class RuleSeeder implements ApplicationEventListener<StartupEvent> {

  private final AutomationRuleService rules;

  public RuleSeeder(AutomationRuleService rules) {
    this.rules = rules;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    List<AutomationRule> seeded = rules.seed(DefaultRuleSet.rules());
    log.info("Default rule set ready: {} rules", seeded.size());
  }
}
