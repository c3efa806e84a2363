package com.acme.crm.persistence.jdbc.rule;

import com.acme.crm.core.Jsons;
import com.acme.crm.persistence.jdbc.ExceptionTranslator;
import com.acme.crm.persistence.jdbc.SqlTimestamps;
import com.acme.crm.repository.AutomationRuleRepository;
import com.acme.crm.rule.AutomationRule;
import com.acme.crm.rule.RuleAction;
import com.acme.crm.rule.TriggerCondition;
import io.micronaut.transaction.annotation.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Abstract JDBC implementation of AutomationRuleRepository using the Template Method pattern.
 * Condition and actions are stored as type-tagged JSON documents; subclasses supply the upsert.
 */
public abstract class JdbcAutomationRuleRepository implements AutomationRuleRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcAutomationRuleRepository.class);

    private static final String COLUMNS = """
            id, rule_key, name, schedule_tag, trigger_type, condition_json, actions_json, enabled,
            active, created_at, updated_at
            """;

    protected final DataSource dataSource;

    protected JdbcAutomationRuleRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AutomationRule> findByKey(String ruleKey) {
        List<AutomationRule> rules =
                query("SELECT " + COLUMNS + " FROM automation_rule WHERE rule_key = ?", ruleKey,
                        "find automation rule by key");
        return rules.stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public List<AutomationRule> findAll() {
        return query("SELECT " + COLUMNS + " FROM automation_rule ORDER BY rule_key", null,
                "find all automation rules");
    }

    @Override
    @Transactional(readOnly = true)
    public List<AutomationRule> findEnabledBySchedule(String scheduleTag) {
        return query("SELECT " + COLUMNS + " FROM automation_rule "
                        + "WHERE schedule_tag = ? AND enabled = TRUE AND active = TRUE ORDER BY rule_key",
                scheduleTag, "find enabled automation rules by schedule");
    }

    @Override
    @Transactional
    public AutomationRule upsert(AutomationRule rule) {
        String sql = getUpsertSql();
        Instant now = Instant.now();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, rule.ruleKey());
            ps.setString(2, rule.name());
            ps.setString(3, rule.scheduleTag());
            ps.setString(4, rule.triggerType().name());
            ps.setString(5, Jsons.toJson(rule.condition()));
            ps.setString(6, serializeActions(rule.actions()));
            ps.setBoolean(7, rule.enabled());
            ps.setBoolean(8, rule.active());
            SqlTimestamps.set(ps, 9, rule.createdAt() != null ? rule.createdAt() : now);
            SqlTimestamps.set(ps, 10, now);
            ps.executeUpdate();
            LOG.debug("Upserted automation rule {}", rule.ruleKey());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "upsert automation rule", LOG);
        }

        return findByKey(rule.ruleKey())
                .orElseThrow(() -> new IllegalStateException("Rule vanished after upsert: " + rule.ruleKey()));
    }

    @Override
    @Transactional
    public boolean setEnabled(String ruleKey, boolean enabled) {
        String sql = "UPDATE automation_rule SET enabled = ?, updated_at = ? WHERE rule_key = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setBoolean(1, enabled);
            SqlTimestamps.set(ps, 2, Instant.now());
            ps.setString(3, ruleKey);
            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "toggle automation rule", LOG);
        }
    }

    // Template method for database-specific SQL

    /**
     * Insert-or-update keyed by rule_key. Parameters: rule_key, name, schedule_tag, trigger_type,
     * condition_json, actions_json, enabled, active, created_at, updated_at. An existing row keeps
     * its id and created_at.
     */
    protected abstract String getUpsertSql();

    private List<AutomationRule> query(String sql, String param, String operation) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            if (param != null) {
                ps.setString(1, param);
            }
            List<AutomationRule> rules = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rules.add(mapResultSetToRule(rs));
                }
            }
            return rules;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, operation, LOG);
        }
    }

    static String serializeActions(List<RuleAction> actions) {
        // element type must be explicit or the type tag is dropped
        try {
            return Jsons.mapper()
                    .writerFor(Jsons.mapper().getTypeFactory().constructCollectionType(List.class, RuleAction.class))
                    .writeValueAsString(actions);
        } catch (Exception e) {
            throw new IllegalArgumentException("Cannot serialize actions", e);
        }
    }

    protected AutomationRule mapResultSetToRule(ResultSet rs) throws SQLException {
        return new AutomationRule(
                rs.getLong("id"),
                rs.getString("rule_key"),
                rs.getString("name"),
                rs.getString("schedule_tag"),
                Jsons.fromJson(rs.getString("condition_json"), TriggerCondition.class),
                Jsons.listFromJson(rs.getString("actions_json"), RuleAction.class),
                rs.getBoolean("enabled"),
                rs.getBoolean("active"),
                SqlTimestamps.get(rs, "created_at"),
                SqlTimestamps.get(rs, "updated_at"));
    }
}
