package com.acme.crm.repository;

import com.acme.crm.domain.AutomationRunLog;
import com.acme.crm.domain.ReminderRecord;
import java.util.List;

/** Append-only run ledger. There is deliberately no update or delete. */
public interface AutomationRunLogRepository {

  /**
   * Append an entry
   *
   * @return the generated id
   */
  long append(AutomationRunLog entry);

  /**
   * Reminders that actually went out (SUCCESS or PARTIAL) for a rule and lead
   *
   * @param ruleKey the rule
   * @param leadId the lead
   * @return reminders, newest first
   */
  List<ReminderRecord> findReminders(String ruleKey, long leadId);

  /**
   * Most recent entries for a rule, for operators
   *
   * @param ruleKey the rule
   * @param limit maximum entries
   */
  List<AutomationRunLog> findRecent(String ruleKey, int limit);
}
