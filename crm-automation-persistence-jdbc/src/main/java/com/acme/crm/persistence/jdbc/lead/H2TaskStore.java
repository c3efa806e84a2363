package com.acme.crm.persistence.jdbc.lead;

import com.acme.crm.domain.TaskRequest;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import javax.sql.DataSource;

@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2TaskStore extends JdbcTaskStore {

  public H2TaskStore(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected String getInsertIfAbsentSql() {
    return """
        INSERT INTO crm_task
        (task_key, lead_id, conversation_id, title, task_type, assignee, priority, due_at, created_at)
        SELECT ?, ?, ?, ?, ?, ?, ?, ?, ?
        WHERE NOT EXISTS (SELECT 1 FROM crm_task WHERE task_key = ?)
        """;
  }

  @Override
  protected void bindInsertGuard(PreparedStatement ps, int nextIndex, TaskRequest request)
      throws SQLException {
    ps.setString(nextIndex, request.taskKey());
  }
}
