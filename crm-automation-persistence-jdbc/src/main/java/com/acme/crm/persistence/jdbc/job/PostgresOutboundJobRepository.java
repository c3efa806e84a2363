package com.acme.crm.persistence.jdbc.job;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** PostgreSQL variant, relying on the unique dedupe key index for ON CONFLICT DO NOTHING. */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresOutboundJobRepository extends JdbcOutboundJobRepository {

  public PostgresOutboundJobRepository(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected String getInsertIfAbsentSql() {
    return """
        INSERT INTO outbound_job
        (dedupe_key, conversation_id, channel, recipient, body, template_ref, intent, status,
         attempts, max_attempts, next_attempt_at, parent_job_id, generation, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (dedupe_key) DO NOTHING
        """;
  }
}
