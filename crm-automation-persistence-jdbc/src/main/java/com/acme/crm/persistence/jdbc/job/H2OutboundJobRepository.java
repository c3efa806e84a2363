package com.acme.crm.persistence.jdbc.job;

import com.acme.crm.domain.OutboundJob;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import javax.sql.DataSource;

/** H2 variant. H2 has no ON CONFLICT, so the insert is guarded by NOT EXISTS on the dedupe key. */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2OutboundJobRepository extends JdbcOutboundJobRepository {

  public H2OutboundJobRepository(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected String getInsertIfAbsentSql() {
    return """
        INSERT INTO outbound_job
        (dedupe_key, conversation_id, channel, recipient, body, template_ref, intent, status,
         attempts, max_attempts, next_attempt_at, parent_job_id, generation, created_at, updated_at)
        SELECT ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?
        WHERE NOT EXISTS (SELECT 1 FROM outbound_job WHERE dedupe_key = ?)
        """;
  }

  @Override
  protected void bindInsertGuard(PreparedStatement ps, int nextIndex, OutboundJob job)
      throws SQLException {
    ps.setString(nextIndex, job.getDedupeKey());
  }
}
