package com.acme.crm.repository;

import com.acme.crm.rule.AutomationRule;
import java.util.List;
import java.util.Optional;

/** Persistence for automation rules. Rules are toggled, never deleted. */
public interface AutomationRuleRepository {

  Optional<AutomationRule> findByKey(String ruleKey);

  List<AutomationRule> findAll();

  /**
   * Enabled and active rules carrying the given schedule tag
   *
   * @param scheduleTag e.g. daily, hourly or event
   */
  List<AutomationRule> findEnabledBySchedule(String scheduleTag);

  /**
   * Insert the rule, or update the existing row with the same key
   *
   * @return the stored rule
   */
  AutomationRule upsert(AutomationRule rule);

  /**
   * Flip the enabled flag
   *
   * @return true if a rule with this key exists
   */
  boolean setEnabled(String ruleKey, boolean enabled);
}
