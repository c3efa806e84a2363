package com.acme.crm.persistence.jdbc.rule;

import com.acme.crm.domain.AutomationRunLog;
import com.acme.crm.domain.ReminderRecord;
import com.acme.crm.domain.RunStatus;
import com.acme.crm.domain.TriggerSource;
import com.acme.crm.persistence.jdbc.ExceptionTranslator;
import com.acme.crm.persistence.jdbc.SqlTimestamps;
import com.acme.crm.repository.AutomationRunLogRepository;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/** Append-only run ledger; portable SQL, no dialect split. */
@Singleton
public class JdbcAutomationRunLogRepository implements AutomationRunLogRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcAutomationRunLogRepository.class);

    private static final int MAX_MESSAGE_LENGTH = 2000;

    private final DataSource dataSource;

    public JdbcAutomationRunLogRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public long append(AutomationRunLog entry) {
        String sql = """
                INSERT INTO automation_run_log
                (rule_key, lead_id, checkpoint_key, source, status, message, matched, sent, skipped,
                 failed, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, entry.ruleKey());
            SqlTimestamps.setLong(ps, 2, entry.leadId());
            ps.setString(3, entry.checkpointKey());
            ps.setString(4, entry.source().name());
            ps.setString(5, entry.status().name());
            ps.setString(6, truncate(entry.message()));
            ps.setInt(7, entry.matched());
            ps.setInt(8, entry.sent());
            ps.setInt(9, entry.skipped());
            ps.setInt(10, entry.failed());
            SqlTimestamps.set(ps, 11, entry.createdAt());
            ps.executeUpdate();

            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) {
                    return rs.getLong(1);
                }
            }
            throw ExceptionTranslator.translateException(
                    new SQLException("No generated key returned for run log"), "append run log", LOG);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "append run log", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReminderRecord> findReminders(String ruleKey, long leadId) {
        String sql = """
                SELECT rule_key, checkpoint_key, created_at
                FROM automation_run_log
                WHERE rule_key = ? AND lead_id = ? AND checkpoint_key IS NOT NULL
                  AND status IN ('SUCCESS', 'PARTIAL')
                ORDER BY created_at DESC
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ruleKey);
            ps.setLong(2, leadId);
            List<ReminderRecord> reminders = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    reminders.add(new ReminderRecord(
                            rs.getString("rule_key"),
                            rs.getString("checkpoint_key"),
                            SqlTimestamps.get(rs, "created_at")));
                }
            }
            return reminders;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find reminders", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<AutomationRunLog> findRecent(String ruleKey, int limit) {
        String sql = """
                SELECT id, rule_key, lead_id, checkpoint_key, source, status, message, matched, sent,
                       skipped, failed, created_at
                FROM automation_run_log
                WHERE rule_key = ?
                ORDER BY created_at DESC, id DESC
                LIMIT ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ruleKey);
            ps.setInt(2, limit);
            List<AutomationRunLog> entries = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new AutomationRunLog(
                            rs.getLong("id"),
                            rs.getString("rule_key"),
                            SqlTimestamps.getLong(rs, "lead_id"),
                            rs.getString("checkpoint_key"),
                            TriggerSource.valueOf(rs.getString("source")),
                            RunStatus.valueOf(rs.getString("status")),
                            rs.getString("message"),
                            rs.getInt("matched"),
                            rs.getInt("sent"),
                            rs.getInt("skipped"),
                            rs.getInt("failed"),
                            SqlTimestamps.get(rs, "created_at")));
                }
            }
            return entries;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find recent run logs", LOG);
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH);
    }
}
