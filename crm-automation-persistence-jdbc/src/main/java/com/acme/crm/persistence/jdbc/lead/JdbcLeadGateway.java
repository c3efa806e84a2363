package com.acme.crm.persistence.jdbc.lead;

import com.acme.crm.domain.ExpiryItem;
import com.acme.crm.domain.LeadPriority;
import com.acme.crm.domain.LeadSnapshot;
import com.acme.crm.domain.QualificationStage;
import com.acme.crm.persistence.jdbc.ExceptionTranslator;
import com.acme.crm.persistence.jdbc.SqlTimestamps;
import com.acme.crm.spi.LeadGateway;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
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
 * Lead read model over the CRM lead table joined to its conversation. Reminder history is not
 * loaded here; the engine attaches it per rule.
 */
@Singleton
public class JdbcLeadGateway implements LeadGateway {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcLeadGateway.class);

    private static final String SELECT = """
            SELECT l.id, l.conversation_id, l.contact_name,
                   COALESCE(c.channel, l.channel) AS channel,
                   COALESCE(c.recipient, l.recipient) AS recipient,
                   c.stage, c.stage_changed_at, c.last_inbound_at, c.last_outbound_at,
                   l.created_at, l.next_follow_up_at, l.info_shared_at, l.info_shared_type,
                   l.autopilot_enabled, l.priority
            FROM crm_lead l
            LEFT JOIN conversation c ON c.id = l.conversation_id
            """;

    private final DataSource dataSource;

    public JdbcLeadGateway(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public List<LeadSnapshot> findCandidates(int limit) {
        String sql = SELECT + " WHERE l.status = 'OPEN' ORDER BY l.id LIMIT ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<LeadSnapshot> leads = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    leads.add(mapResultSetToLead(rs, List.of()));
                }
            }

            List<LeadSnapshot> withItems = new ArrayList<>(leads.size());
            for (LeadSnapshot lead : leads) {
                withItems.add(withExpiryItems(conn, lead));
            }
            return withItems;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find candidate leads", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LeadSnapshot> findById(long leadId) {
        return findOne(SELECT + " WHERE l.id = ?", leadId, "find lead by id");
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LeadSnapshot> findByConversation(long conversationId) {
        return findOne(SELECT + " WHERE l.conversation_id = ? AND l.status = 'OPEN' ORDER BY l.id LIMIT 1",
                conversationId, "find lead by conversation");
    }

    @Override
    @Transactional
    public void updateNextFollowUp(long leadId, Instant nextFollowUpAt) {
        String sql = "UPDATE crm_lead SET next_follow_up_at = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            SqlTimestamps.set(ps, 1, nextFollowUpAt);
            SqlTimestamps.set(ps, 2, Instant.now());
            ps.setLong(3, leadId);
            if (ps.executeUpdate() == 0) {
                LOG.warn("No lead updated for next follow-up: id={}", leadId);
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "update lead next follow-up", LOG);
        }
    }

    @Override
    @Transactional
    public void updatePriority(long leadId, LeadPriority priority) {
        String sql = "UPDATE crm_lead SET priority = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, priority.name());
            SqlTimestamps.set(ps, 2, Instant.now());
            ps.setLong(3, leadId);
            if (ps.executeUpdate() == 0) {
                LOG.warn("No lead updated for priority: id={}", leadId);
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "update lead priority", LOG);
        }
    }

    private Optional<LeadSnapshot> findOne(String sql, long param, String operation) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, param);
            LeadSnapshot lead = null;
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    lead = mapResultSetToLead(rs, List.of());
                }
            }
            return lead == null ? Optional.empty() : Optional.of(withExpiryItems(conn, lead));

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, operation, LOG);
        }
    }

    private LeadSnapshot withExpiryItems(Connection conn, LeadSnapshot lead) throws SQLException {
        String sql = "SELECT id, item_type, expiry_date FROM expiry_item WHERE lead_id = ? ORDER BY expiry_date";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, lead.leadId());
            List<ExpiryItem> items = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    items.add(new ExpiryItem(
                            rs.getLong("id"),
                            rs.getString("item_type"),
                            rs.getDate("expiry_date").toLocalDate()));
                }
            }
            if (items.isEmpty()) {
                return lead;
            }
            return new LeadSnapshot(
                    lead.leadId(), lead.conversationId(), lead.contactName(), lead.channel(),
                    lead.recipient(), lead.stage(), lead.stageChangedAt(), lead.lastInboundAt(),
                    lead.lastOutboundAt(), lead.createdAt(), lead.nextFollowUpAt(), lead.infoSharedAt(),
                    lead.infoSharedType(), lead.autopilotEnabled(), lead.priority(), items,
                    lead.reminderHistory());
        }
    }

    private LeadSnapshot mapResultSetToLead(ResultSet rs, List<ExpiryItem> items) throws SQLException {
        String stage = rs.getString("stage");
        return new LeadSnapshot(
                rs.getLong("id"),
                SqlTimestamps.getLong(rs, "conversation_id"),
                rs.getString("contact_name"),
                rs.getString("channel"),
                rs.getString("recipient"),
                stage == null ? null : QualificationStage.valueOf(stage),
                SqlTimestamps.get(rs, "stage_changed_at"),
                SqlTimestamps.get(rs, "last_inbound_at"),
                SqlTimestamps.get(rs, "last_outbound_at"),
                SqlTimestamps.get(rs, "created_at"),
                SqlTimestamps.get(rs, "next_follow_up_at"),
                SqlTimestamps.get(rs, "info_shared_at"),
                rs.getString("info_shared_type"),
                rs.getBoolean("autopilot_enabled"),
                LeadPriority.valueOf(rs.getString("priority")),
                items,
                List.of());
    }
}
