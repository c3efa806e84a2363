package com.acme.crm.persistence.jdbc.lead;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresTaskStore extends JdbcTaskStore {

  public PostgresTaskStore(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected String getInsertIfAbsentSql() {
    return """
        INSERT INTO crm_task
        (task_key, lead_id, conversation_id, title, task_type, assignee, priority, due_at, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (task_key) DO NOTHING
        """;
  }
}
