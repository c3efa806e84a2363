package com.acme.crm.persistence.jdbc.conversation;

import com.acme.crm.core.Jsons;
import com.acme.crm.domain.Conversation;
import com.acme.crm.domain.QualificationStage;
import com.acme.crm.persistence.jdbc.ExceptionTranslator;
import com.acme.crm.persistence.jdbc.SqlTimestamps;
import com.acme.crm.repository.ConversationRepository;
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
import java.util.Optional;

/**
 * Conversation persistence. The SQL is portable across H2 and PostgreSQL, so there is no
 * dialect split. Updates only go through {@link #compareAndSet}.
 */
@Singleton
public class JdbcConversationRepository implements ConversationRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcConversationRepository.class);

    private static final String COLUMNS = """
            id, contact_id, channel, recipient, stage, known_fields, last_question_key,
            questions_asked, state_version, stage_changed_at, last_inbound_at,
            last_inbound_message_id, last_outbound_at, last_automated_send_at, archived,
            created_at, updated_at
            """;

    private final DataSource dataSource;

    public JdbcConversationRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Conversation> findById(long id) {
        String sql = "SELECT " + COLUMNS + " FROM conversation WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapResultSetToConversation(rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find conversation by id", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Conversation> findByContact(String contactId, String channel) {
        String sql = "SELECT " + COLUMNS + " FROM conversation WHERE contact_id = ? AND channel = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, contactId);
            ps.setString(2, channel);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapResultSetToConversation(rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find conversation by contact", LOG);
        }
    }

    @Override
    @Transactional
    public Conversation create(Conversation conversation) {
        String sql = """
                INSERT INTO conversation
                (contact_id, channel, recipient, stage, known_fields, last_question_key, questions_asked,
                 state_version, stage_changed_at, last_inbound_at, last_inbound_message_id,
                 last_outbound_at, last_automated_send_at, archived, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, 0, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, conversation.contactId());
            ps.setString(2, conversation.channel());
            ps.setString(3, conversation.recipient());
            ps.setString(4, conversation.stage().name());
            ps.setString(5, Jsons.toJson(conversation.knownFields()));
            ps.setString(6, conversation.lastQuestionKey());
            ps.setInt(7, conversation.questionsAsked());
            SqlTimestamps.set(ps, 8, conversation.stageChangedAt());
            SqlTimestamps.set(ps, 9, conversation.lastInboundAt());
            ps.setString(10, conversation.lastInboundMessageId());
            SqlTimestamps.set(ps, 11, conversation.lastOutboundAt());
            SqlTimestamps.set(ps, 12, conversation.lastAutomatedSendAt());
            ps.setBoolean(13, conversation.archived());
            SqlTimestamps.set(ps, 14, conversation.createdAt());
            SqlTimestamps.set(ps, 15, conversation.updatedAt());
            ps.executeUpdate();

            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) {
                    long id = rs.getLong(1);
                    LOG.info("Opened conversation {} for contact {} on {}", id,
                            conversation.contactId(), conversation.channel());
                    return conversation.withId(id).withStateVersion(0L);
                }
            }
            throw ExceptionTranslator.translateException(
                    new SQLException("No generated key returned for conversation"), "create conversation", LOG);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "create conversation", LOG);
        }
    }

    @Override
    @Transactional
    public Optional<Conversation> compareAndSet(Conversation next) {
        String sql = """
                UPDATE conversation
                SET stage = ?, known_fields = ?, last_question_key = ?, questions_asked = ?,
                    stage_changed_at = ?, last_inbound_at = ?, last_inbound_message_id = ?,
                    last_outbound_at = ?, last_automated_send_at = ?, archived = ?, updated_at = ?,
                    state_version = state_version + 1
                WHERE id = ? AND state_version = ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, next.stage().name());
            ps.setString(2, Jsons.toJson(next.knownFields()));
            ps.setString(3, next.lastQuestionKey());
            ps.setInt(4, next.questionsAsked());
            SqlTimestamps.set(ps, 5, next.stageChangedAt());
            SqlTimestamps.set(ps, 6, next.lastInboundAt());
            ps.setString(7, next.lastInboundMessageId());
            SqlTimestamps.set(ps, 8, next.lastOutboundAt());
            SqlTimestamps.set(ps, 9, next.lastAutomatedSendAt());
            ps.setBoolean(10, next.archived());
            SqlTimestamps.set(ps, 11, next.updatedAt());
            ps.setLong(12, next.id());
            ps.setLong(13, next.stateVersion());

            if (ps.executeUpdate() == 0) {
                LOG.debug("Conversation {} moved past version {}", next.id(), next.stateVersion());
                return Optional.empty();
            }
            return Optional.of(next.withStateVersion(next.stateVersion() + 1));

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "compare-and-set conversation", LOG);
        }
    }

    private Conversation mapResultSetToConversation(ResultSet rs) throws SQLException {
        return new Conversation(
                rs.getLong("id"),
                rs.getString("contact_id"),
                rs.getString("channel"),
                rs.getString("recipient"),
                QualificationStage.valueOf(rs.getString("stage")),
                Jsons.toStringMap(rs.getString("known_fields")),
                rs.getString("last_question_key"),
                rs.getInt("questions_asked"),
                rs.getLong("state_version"),
                SqlTimestamps.get(rs, "stage_changed_at"),
                SqlTimestamps.get(rs, "last_inbound_at"),
                rs.getString("last_inbound_message_id"),
                SqlTimestamps.get(rs, "last_outbound_at"),
                SqlTimestamps.get(rs, "last_automated_send_at"),
                rs.getBoolean("archived"),
                SqlTimestamps.get(rs, "created_at"),
                SqlTimestamps.get(rs, "updated_at"));
    }
}
