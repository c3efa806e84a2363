package com.acme.crm.runner;

import java.util.List;

/**
 * Outcome of one runner invocation. {@code processed} counts jobs sent; jobs lost to another
 * runner's claim are only counted in {@code skipped}.
 */
public record JobRunResult(
    int processed, int failed, int requeued, int skipped, int staleFailed, JobIds jobIds) {

  public record JobIds(List<Long> processed, List<Long> failed, List<Long> requeued) {
    public JobIds {
      processed = List.copyOf(processed);
      failed = List.copyOf(failed);
      requeued = List.copyOf(requeued);
    }
  }

  public static JobRunResult empty(int staleFailed) {
    return new JobRunResult(0, 0, 0, 0, staleFailed, new JobIds(List.of(), List.of(), List.of()));
  }
}
