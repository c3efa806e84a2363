package com.acme.crm.config;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.UUID;

/**
 * Tuning for dispatch, retries, rate limiting and rule evaluation. Pure POJO - no framework
 * dependencies.
 */
public class AutomationConfig {

  private int cooldownMinutes = 60;
  private int maxAttempts = 3;
  private Duration backoffBase = Duration.ofSeconds(1);
  private Duration maxBackoff = Duration.ofMinutes(5);
  private int jobBatchSize = 10;
  private Duration jobSweepInterval = Duration.ofSeconds(30);
  private Duration staleClaimTimeout = Duration.ofMinutes(5);
  private int reminderWindowDays = 1;
  private int casMaxAttempts = 3;
  private int maxQuestions = 5;
  private int candidateLimit = 500;
  private Duration sendTimeout = Duration.ofSeconds(10);
  private Duration generationTimeout = Duration.ofSeconds(20);
  private String runnerId = defaultRunnerId();

  public int getCooldownMinutes() {
    return cooldownMinutes;
  }

  public void setCooldownMinutes(int cooldownMinutes) {
    this.cooldownMinutes = cooldownMinutes;
  }

  public Duration getCooldown() {
    return Duration.ofMinutes(cooldownMinutes);
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public Duration getBackoffBase() {
    return backoffBase;
  }

  public void setBackoffBase(Duration backoffBase) {
    this.backoffBase = backoffBase;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public void setMaxBackoff(Duration maxBackoff) {
    this.maxBackoff = maxBackoff;
  }

  public int getJobBatchSize() {
    return jobBatchSize;
  }

  public void setJobBatchSize(int jobBatchSize) {
    this.jobBatchSize = jobBatchSize;
  }

  public Duration getJobSweepInterval() {
    return jobSweepInterval;
  }

  public void setJobSweepInterval(Duration jobSweepInterval) {
    this.jobSweepInterval = jobSweepInterval;
  }

  public Duration getStaleClaimTimeout() {
    return staleClaimTimeout;
  }

  public void setStaleClaimTimeout(Duration staleClaimTimeout) {
    this.staleClaimTimeout = staleClaimTimeout;
  }

  public int getReminderWindowDays() {
    return reminderWindowDays;
  }

  public void setReminderWindowDays(int reminderWindowDays) {
    this.reminderWindowDays = reminderWindowDays;
  }

  public int getCasMaxAttempts() {
    return casMaxAttempts;
  }

  public void setCasMaxAttempts(int casMaxAttempts) {
    this.casMaxAttempts = casMaxAttempts;
  }

  public int getMaxQuestions() {
    return maxQuestions;
  }

  public void setMaxQuestions(int maxQuestions) {
    this.maxQuestions = maxQuestions;
  }

  public int getCandidateLimit() {
    return candidateLimit;
  }

  public void setCandidateLimit(int candidateLimit) {
    this.candidateLimit = candidateLimit;
  }

  public Duration getSendTimeout() {
    return sendTimeout;
  }

  public void setSendTimeout(Duration sendTimeout) {
    this.sendTimeout = sendTimeout;
  }

  public Duration getGenerationTimeout() {
    return generationTimeout;
  }

  public void setGenerationTimeout(Duration generationTimeout) {
    this.generationTimeout = generationTimeout;
  }

  public String getRunnerId() {
    return runnerId;
  }

  public void setRunnerId(String runnerId) {
    this.runnerId = runnerId;
  }

  /**
   * Host name plus a random suffix. Containers commonly run every process as PID 1, so the PID
   * alone does not tell runners apart.
   */
  static String defaultRunnerId() {
    String host = System.getenv("HOSTNAME");
    if (host == null || host.isBlank()) {
      try {
        host = InetAddress.getLocalHost().getHostName();
      } catch (UnknownHostException e) {
        host = "runner";
      }
    }
    return host + "-" + UUID.randomUUID().toString().substring(0, 8);
  }
}
