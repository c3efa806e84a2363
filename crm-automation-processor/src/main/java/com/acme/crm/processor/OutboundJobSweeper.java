package com.acme.crm.processor;

import com.acme.crm.config.AutomationConfig;
import com.acme.crm.runner.JobRunResult;
import com.acme.crm.runner.OutboundJobRunner;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Drives the job runner on a fixed delay. Every instance may run one; claims keep them apart. */
@Singleton
public class OutboundJobSweeper {
  private static final Logger LOG = LoggerFactory.getLogger(OutboundJobSweeper.class);

  private final OutboundJobRunner runner;
  private final AutomationConfig config;

  public OutboundJobSweeper(OutboundJobRunner runner, AutomationConfig config) {
    this.runner = runner;
    this.config = config;
  }

  @Scheduled(fixedDelay = "${automation.job-sweep-interval:30s}", initialDelay = "5s")
  public void tick() {
    try {
      JobRunResult result = runner.processOutboundJobs(config.getJobBatchSize());
      if (result.processed() + result.failed() + result.requeued() + result.staleFailed() > 0) {
        LOG.info(
            "Job sweep: sent={} requeued={} failed={} staleFailed={} skipped={}",
            result.processed(),
            result.requeued(),
            result.failed(),
            result.staleFailed(),
            result.skipped());
      }
    } catch (Exception e) {
      LOG.error("Error in OutboundJobSweeper tick: {}", e.getMessage(), e);
    }
  }
}
