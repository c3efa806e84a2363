package com.acme.crm.persistence.jdbc.rule;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2AutomationRuleRepository extends JdbcAutomationRuleRepository {

  public H2AutomationRuleRepository(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected String getUpsertSql() {
    return """
        MERGE INTO automation_rule t
        USING (SELECT CAST(? AS VARCHAR(100)) AS rule_key, CAST(? AS VARCHAR(200)) AS name,
                      CAST(? AS VARCHAR(16)) AS schedule_tag, CAST(? AS VARCHAR(32)) AS trigger_type,
                      CAST(? AS VARCHAR(4000)) AS condition_json,
                      CAST(? AS VARCHAR(8000)) AS actions_json,
                      CAST(? AS BOOLEAN) AS enabled, CAST(? AS BOOLEAN) AS active,
                      CAST(? AS TIMESTAMP) AS created_at, CAST(? AS TIMESTAMP) AS updated_at) s
        ON t.rule_key = s.rule_key
        WHEN MATCHED THEN UPDATE SET
            name = s.name, schedule_tag = s.schedule_tag, trigger_type = s.trigger_type,
            condition_json = s.condition_json, actions_json = s.actions_json,
            enabled = s.enabled, active = s.active, updated_at = s.updated_at
        WHEN NOT MATCHED THEN INSERT
            (rule_key, name, schedule_tag, trigger_type, condition_json, actions_json, enabled,
             active, created_at, updated_at)
            VALUES (s.rule_key, s.name, s.schedule_tag, s.trigger_type, s.condition_json,
                    s.actions_json, s.enabled, s.active, s.created_at, s.updated_at)
        """;
  }
}
