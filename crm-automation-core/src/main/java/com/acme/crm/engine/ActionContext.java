package com.acme.crm.engine;

import com.acme.crm.domain.LeadSnapshot;
import com.acme.crm.domain.TriggerSource;
import com.acme.crm.rule.AutomationRule;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * State shared by the actions of one rule evaluation, so a later action sees what an earlier one
 * did (e.g. the time a reply was queued).
 */
public class ActionContext {

  private final AutomationRule rule;
  private final LeadSnapshot lead;
  private final ConditionMatch match;
  private final TriggerSource source;
  private final boolean dryRun;
  private final Instant now;
  private final List<ActionOutcome> outcomes = new ArrayList<>();
  private Instant replySentAt;
  private Long replyJobId;

  public ActionContext(
      AutomationRule rule,
      LeadSnapshot lead,
      ConditionMatch match,
      TriggerSource source,
      boolean dryRun,
      Instant now) {
    this.rule = rule;
    this.lead = lead;
    this.match = match;
    this.source = source;
    this.dryRun = dryRun;
    this.now = now;
  }

  public AutomationRule rule() {
    return rule;
  }

  public LeadSnapshot lead() {
    return lead;
  }

  public String checkpointKey() {
    return match.checkpointKey();
  }

  public Map<String, String> variables() {
    return match.variables();
  }

  public TriggerSource source() {
    return source;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public Instant now() {
    return now;
  }

  /** Position of the action currently executing, used to keep task keys distinct. */
  public int actionIndex() {
    return outcomes.size();
  }

  void recordReply(Instant at, Long jobId) {
    this.replySentAt = at;
    this.replyJobId = jobId;
  }

  public boolean replySent() {
    return replySentAt != null;
  }

  public Instant replySentAt() {
    return replySentAt;
  }

  public Long replyJobId() {
    return replyJobId;
  }

  void add(ActionOutcome outcome) {
    outcomes.add(outcome);
  }

  public List<ActionOutcome> outcomes() {
    return Collections.unmodifiableList(outcomes);
  }
}
