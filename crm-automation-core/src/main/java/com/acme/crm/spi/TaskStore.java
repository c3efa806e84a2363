package com.acme.crm.spi;

import com.acme.crm.domain.TaskRequest;

public interface TaskStore {

  /**
   * Create a task unless one with the same task key exists.
   *
   * @return the id of the new or existing task
   */
  long createTask(TaskRequest request);
}
