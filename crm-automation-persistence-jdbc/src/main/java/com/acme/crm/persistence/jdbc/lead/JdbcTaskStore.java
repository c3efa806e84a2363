package com.acme.crm.persistence.jdbc.lead;

import com.acme.crm.domain.TaskRequest;
import com.acme.crm.persistence.jdbc.ExceptionTranslator;
import com.acme.crm.persistence.jdbc.SqlTimestamps;
import com.acme.crm.spi.TaskStore;
import io.micronaut.transaction.annotation.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;

/**
 * Abstract JDBC task store. A task key that already exists returns the existing task instead of
 * creating a second one.
 */
public abstract class JdbcTaskStore implements TaskStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcTaskStore.class);

    protected final DataSource dataSource;

    protected JdbcTaskStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public long createTask(TaskRequest request) {
        String sql = getInsertIfAbsentSql();

        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, request.taskKey());
                ps.setLong(2, request.leadId());
                SqlTimestamps.setLong(ps, 3, request.conversationId());
                ps.setString(4, request.title());
                ps.setString(5, request.taskType());
                ps.setString(6, request.assignee().name());
                ps.setString(7, request.priority().name());
                SqlTimestamps.set(ps, 8, request.dueAt());
                SqlTimestamps.set(ps, 9, Instant.now());
                bindInsertGuard(ps, 10, request);

                if (ps.executeUpdate() > 0) {
                    try (ResultSet rs = ps.getGeneratedKeys()) {
                        if (rs.next()) {
                            long id = rs.getLong(1);
                            LOG.info("Created {} task {} for lead {}", request.assignee(), id, request.leadId());
                            return id;
                        }
                    }
                }
            } catch (SQLException e) {
                if (!ExceptionTranslator.isUniqueViolation(e)) {
                    throw e;
                }
            }
            return findIdByTaskKey(conn, request.taskKey());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "create task", LOG);
        }
    }

    private long findIdByTaskKey(Connection conn, String taskKey) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT id FROM crm_task WHERE task_key = ?")) {
            ps.setString(1, taskKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    LOG.debug("Task key already used, returning existing task {}", rs.getLong(1));
                    return rs.getLong(1);
                }
            }
        }
        throw new SQLException("Task neither inserted nor found for key " + taskKey);
    }

    // Template methods for database-specific SQL

    /** Insert of the 9 task columns that affects no row when the task key is taken. */
    protected abstract String getInsertIfAbsentSql();

    protected void bindInsertGuard(PreparedStatement ps, int nextIndex, TaskRequest request) throws SQLException {
    }
}
