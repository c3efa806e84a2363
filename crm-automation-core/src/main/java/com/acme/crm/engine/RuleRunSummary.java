package com.acme.crm.engine;

import com.acme.crm.domain.TriggerSource;
import java.util.List;

/** Totals for one engine run, with the per-lead evaluations that matched. */
public record RuleRunSummary(
    String runKey,
    TriggerSource source,
    boolean dryRun,
    int rulesEvaluated,
    int rulesMatched,
    int sent,
    int skipped,
    int failed,
    List<RuleEvaluation> results) {

  public RuleRunSummary {
    results = results == null ? List.of() : List.copyOf(results);
  }

  public static RuleRunSummary empty(String runKey, TriggerSource source, boolean dryRun) {
    return new RuleRunSummary(runKey, source, dryRun, 0, 0, 0, 0, 0, List.of());
  }
}
