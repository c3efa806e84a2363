package com.acme.crm.persistence.jdbc.rule;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresAutomationRuleRepository extends JdbcAutomationRuleRepository {

  public PostgresAutomationRuleRepository(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected String getUpsertSql() {
    return """
        INSERT INTO automation_rule
        (rule_key, name, schedule_tag, trigger_type, condition_json, actions_json, enabled, active,
         created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (rule_key) DO UPDATE SET
            name = EXCLUDED.name, schedule_tag = EXCLUDED.schedule_tag,
            trigger_type = EXCLUDED.trigger_type, condition_json = EXCLUDED.condition_json,
            actions_json = EXCLUDED.actions_json, enabled = EXCLUDED.enabled,
            active = EXCLUDED.active, updated_at = EXCLUDED.updated_at
        """;
  }
}
