package com.acme.crm.rule;

import com.acme.crm.repository.AutomationRuleRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Validated writes to the rule store: save, idempotent seeding and toggling. */
public class AutomationRuleService {

  private static final Logger LOG = LoggerFactory.getLogger(AutomationRuleService.class);

  private final AutomationRuleRepository repository;
  private final RuleValidator validator;

  public AutomationRuleService(AutomationRuleRepository repository, RuleValidator validator) {
    this.repository = repository;
    this.validator = validator;
  }

  public AutomationRule save(AutomationRule rule) {
    validator.validate(rule);
    AutomationRule stored = repository.upsert(rule);
    LOG.info("Saved automation rule {} ({})", stored.ruleKey(), stored.triggerType());
    return stored;
  }

  /**
   * Upsert rules by key. Every rule is validated before anything is written, and an existing rule
   * keeps its enabled flag so seeding never undoes an operator toggle.
   */
  public List<AutomationRule> seed(List<AutomationRule> rules) {
    rules.forEach(validator::validate);
    List<AutomationRule> stored = new ArrayList<>();
    for (AutomationRule rule : rules) {
      Optional<AutomationRule> existing = repository.findByKey(rule.ruleKey());
      AutomationRule toStore =
          existing.map(e -> rule.withEnabled(e.enabled())).orElse(rule);
      stored.add(repository.upsert(toStore));
    }
    LOG.info("Seeded {} automation rules", stored.size());
    return stored;
  }

  public boolean setEnabled(String ruleKey, boolean enabled) {
    boolean found = repository.setEnabled(ruleKey, enabled);
    if (found) {
      LOG.info("Automation rule {} {}", ruleKey, enabled ? "enabled" : "disabled");
    } else {
      LOG.warn("Cannot toggle unknown automation rule {}", ruleKey);
    }
    return found;
  }

  public Optional<AutomationRule> findByKey(String ruleKey) {
    return repository.findByKey(ruleKey);
  }

  public List<AutomationRule> findAll() {
    return repository.findAll();
  }
}
