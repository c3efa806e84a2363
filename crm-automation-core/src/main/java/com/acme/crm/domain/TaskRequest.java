package com.acme.crm.domain;

import java.time.Instant;

/** A task to create in the task store. The task key makes creation idempotent. */
public record TaskRequest(
    String taskKey,
    long leadId,
    Long conversationId,
    String title,
    String taskType,
    TaskAssignee assignee,
    LeadPriority priority,
    Instant dueAt) {}
