package com.acme.crm.persistence.jdbc.job;

import com.acme.crm.domain.JobStatus;
import com.acme.crm.domain.OutboundJob;
import com.acme.crm.persistence.jdbc.ExceptionTranslator;
import com.acme.crm.persistence.jdbc.SqlTimestamps;
import com.acme.crm.repository.OutboundJobRepository;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Abstract JDBC implementation of OutboundJobRepository using the Template Method pattern.
 * Subclasses supply the dialect-specific insert-if-absent statement. Every status change is a
 * single conditional UPDATE, so concurrent runners never both win the same transition.
 */
public abstract class JdbcOutboundJobRepository implements OutboundJobRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcOutboundJobRepository.class);

    static final int MAX_ERROR_LENGTH = 2000;

    protected static final String COLUMNS = """
            id, dedupe_key, conversation_id, channel, recipient, body, template_ref, intent,
            status, attempts, max_attempts, next_attempt_at, claimed_by, claimed_at,
            provider_message_id, last_error, parent_job_id, generation, created_at, updated_at
            """;

    protected final DataSource dataSource;

    protected JdbcOutboundJobRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public Optional<Long> insertIfAbsent(OutboundJob job) {
        String sql = getInsertIfAbsentSql();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, job.getDedupeKey());
            ps.setLong(2, job.getConversationId());
            ps.setString(3, job.getChannel());
            ps.setString(4, job.getRecipient());
            ps.setString(5, job.getBody());
            ps.setString(6, job.getTemplateRef());
            ps.setString(7, job.getIntent());
            ps.setString(8, job.getStatus().name());
            ps.setInt(9, job.getAttempts());
            ps.setInt(10, job.getMaxAttempts());
            SqlTimestamps.set(ps, 11, job.getNextAttemptAt());
            SqlTimestamps.setLong(ps, 12, job.getParentJobId());
            ps.setInt(13, job.getGeneration());
            SqlTimestamps.set(ps, 14, job.getCreatedAt());
            SqlTimestamps.set(ps, 15, job.getUpdatedAt());
            bindInsertGuard(ps, 16, job);

            if (ps.executeUpdate() == 0) {
                LOG.debug("Outbound job already exists for key={}", job.dedupeKeyPrefix());
                return Optional.empty();
            }
            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) {
                    long id = rs.getLong(1);
                    LOG.debug("Inserted outbound job {} key={}", id, job.dedupeKeyPrefix());
                    return Optional.of(id);
                }
            }
            throw ExceptionTranslator.translateException(
                    new SQLException("No generated key returned for outbound job"),
                    "insert outbound job",
                    LOG);

        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                // lost the race between the existence check and the insert
                LOG.debug("Concurrent insert won for key={}", job.dedupeKeyPrefix());
                return Optional.empty();
            }
            throw ExceptionTranslator.translateException(e, "insert outbound job", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OutboundJob> findById(long id) {
        return findOne("SELECT " + COLUMNS + " FROM outbound_job WHERE id = ?", ps -> ps.setLong(1, id),
                "find outbound job by id");
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OutboundJob> findByDedupeKey(String dedupeKey) {
        return findOne("SELECT " + COLUMNS + " FROM outbound_job WHERE dedupe_key = ?",
                ps -> ps.setString(1, dedupeKey), "find outbound job by dedupe key");
    }

    @Override
    @Transactional(readOnly = true)
    public List<Long> findDueQueuedIds(int max, Instant now) {
        String sql = getFindDueSql();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            SqlTimestamps.set(ps, 1, now);
            ps.setInt(2, max);

            List<Long> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getLong(1));
                }
            }
            return ids;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find due outbound jobs", LOG);
        }
    }

    @Override
    @Transactional
    public boolean claim(long id, String claimedBy, Instant now) {
        String sql = """
                UPDATE outbound_job
                SET status = 'PROCESSING', claimed_by = ?, claimed_at = ?, attempts = attempts + 1,
                    updated_at = ?
                WHERE id = ? AND status = 'QUEUED'
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, claimedBy);
            SqlTimestamps.set(ps, 2, now);
            SqlTimestamps.set(ps, 3, now);
            ps.setLong(4, id);
            return ps.executeUpdate() == 1;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "claim outbound job", LOG);
        }
    }

    @Override
    @Transactional
    public boolean markSent(long id, String claimedBy, String providerMessageId, Instant now) {
        String sql = """
                UPDATE outbound_job
                SET status = 'SENT', provider_message_id = ?, last_error = NULL, updated_at = ?
                WHERE id = ? AND status = 'PROCESSING' AND claimed_by = ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, providerMessageId);
            SqlTimestamps.set(ps, 2, now);
            ps.setLong(3, id);
            ps.setString(4, claimedBy);
            return logTransition(ps.executeUpdate(), "markSent", id);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark outbound job sent", LOG);
        }
    }

    @Override
    @Transactional
    public boolean requeue(long id, String claimedBy, String error, Instant nextAttemptAt, Instant now) {
        String sql = """
                UPDATE outbound_job
                SET status = 'QUEUED', last_error = ?, next_attempt_at = ?, claimed_by = NULL,
                    claimed_at = NULL, updated_at = ?
                WHERE id = ? AND status = 'PROCESSING' AND claimed_by = ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, truncate(error));
            SqlTimestamps.set(ps, 2, nextAttemptAt);
            SqlTimestamps.set(ps, 3, now);
            ps.setLong(4, id);
            ps.setString(5, claimedBy);
            return logTransition(ps.executeUpdate(), "requeue", id);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "requeue outbound job", LOG);
        }
    }

    @Override
    @Transactional
    public boolean markFailed(long id, String claimedBy, String error, Instant now) {
        String sql = """
                UPDATE outbound_job
                SET status = 'FAILED', last_error = ?, updated_at = ?
                WHERE id = ? AND status = 'PROCESSING' AND claimed_by = ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, truncate(error));
            SqlTimestamps.set(ps, 2, now);
            ps.setLong(3, id);
            ps.setString(4, claimedBy);
            return logTransition(ps.executeUpdate(), "markFailed", id);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark outbound job failed", LOG);
        }
    }

    @Override
    @Transactional
    public int failStaleClaims(Instant claimedBefore, String error, Instant now) {
        String sql = """
                UPDATE outbound_job
                SET status = 'FAILED', last_error = ?, updated_at = ?
                WHERE status = 'PROCESSING' AND claimed_at < ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, truncate(error));
            SqlTimestamps.set(ps, 2, now);
            SqlTimestamps.set(ps, 3, claimedBefore);
            return ps.executeUpdate();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "fail stale outbound job claims", LOG);
        }
    }

    // Template methods for database-specific SQL

    /**
     * Insert of the 15 job columns in declaration order that affects no row when the dedupe key
     * is taken.
     */
    protected abstract String getInsertIfAbsentSql();

    /** Binds any parameters the dialect's insert guard needs after the column values. */
    protected void bindInsertGuard(PreparedStatement ps, int nextIndex, OutboundJob job) throws SQLException {
    }

    protected String getFindDueSql() {
        return """
                SELECT id FROM outbound_job
                WHERE status = 'QUEUED' AND next_attempt_at <= ?
                ORDER BY next_attempt_at, id
                LIMIT ?
                """;
    }

    // Helpers

    @FunctionalInterface
    protected interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private Optional<OutboundJob> findOne(String sql, Binder binder, String operation) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToJob(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, operation, LOG);
        }
    }

    private static boolean logTransition(int updated, String transition, long id) {
        if (updated == 0) {
            LOG.warn("No rows updated for {}: id={} (not PROCESSING or claimed by another runner)",
                    transition, id);
            return false;
        }
        return true;
    }

    static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    protected OutboundJob mapResultSetToJob(ResultSet rs) throws SQLException {
        return OutboundJob.builder()
                .id(rs.getLong("id"))
                .dedupeKey(rs.getString("dedupe_key"))
                .conversationId(rs.getLong("conversation_id"))
                .channel(rs.getString("channel"))
                .recipient(rs.getString("recipient"))
                .body(rs.getString("body"))
                .templateRef(rs.getString("template_ref"))
                .intent(rs.getString("intent"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .attempts(rs.getInt("attempts"))
                .maxAttempts(rs.getInt("max_attempts"))
                .nextAttemptAt(SqlTimestamps.get(rs, "next_attempt_at"))
                .claimedBy(rs.getString("claimed_by"))
                .claimedAt(SqlTimestamps.get(rs, "claimed_at"))
                .providerMessageId(rs.getString("provider_message_id"))
                .lastError(rs.getString("last_error"))
                .parentJobId(SqlTimestamps.getLong(rs, "parent_job_id"))
                .generation(rs.getInt("generation"))
                .createdAt(SqlTimestamps.get(rs, "created_at"))
                .updatedAt(SqlTimestamps.get(rs, "updated_at"))
                .build();
    }
}
