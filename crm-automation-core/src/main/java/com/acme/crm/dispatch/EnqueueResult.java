package com.acme.crm.dispatch;

/** Id of the job holding the dedupe key, and whether it already existed. */
public record EnqueueResult(long jobId, boolean duplicate) {}
