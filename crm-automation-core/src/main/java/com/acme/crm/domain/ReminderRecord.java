package com.acme.crm.domain;

import java.time.Instant;

/** A reminder already sent for a rule checkpoint, read back from the run log. */
public record ReminderRecord(String ruleKey, String checkpointKey, Instant remindedAt) {}
