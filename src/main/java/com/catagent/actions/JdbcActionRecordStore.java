package com.catagent.actions;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class JdbcActionRecordStore implements ActionRecordStore {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String COLUMNS = "id, user_id, actor_id, action_id, category, parameters, conversation_id, "
        + "message_id, status, description, result_summary, error_message, value_sats, created_at, resolved_at, expires_at";

    private final DataSource dataSource;

    public JdbcActionRecordStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(ActionExecutionRecord r) {
        var sql = "INSERT INTO cat_action_log (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, r.id());
            ps.setString(2, r.userId());
            ps.setString(3, r.actorId());
            ps.setString(4, r.actionId());
            ps.setString(5, r.category() != null ? r.category().id() : null);
            ps.setString(6, MAPPER.writeValueAsString(r.parameters()));
            ps.setString(7, r.conversationId());
            ps.setString(8, r.messageId());
            ps.setString(9, r.status().id());
            ps.setString(10, r.description());
            ps.setString(11, r.resultSummary());
            ps.setString(12, r.errorMessage());
            if (r.valueSats() != null) {
                ps.setLong(13, r.valueSats());
            } else {
                ps.setNull(13, Types.BIGINT);
            }
            ps.setTimestamp(14, Timestamp.from(r.createdAt()));
            ps.setTimestamp(15, toTimestamp(r.resolvedAt()));
            ps.setTimestamp(16, toTimestamp(r.expiresAt()));
            ps.executeUpdate();
        } catch (Exception e) {
            throw new RuntimeException("Failed to insert action record: " + r.id(), e);
        }
    }

    @Override
    public boolean transition(ActionExecutionRecord updated, ActionStatus expected) {
        var sql = """
            UPDATE cat_action_log
               SET status = ?, result_summary = ?, error_message = ?, resolved_at = ?
             WHERE id = ? AND status = ?
            """;
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, updated.status().id());
            ps.setString(2, updated.resultSummary());
            ps.setString(3, updated.errorMessage());
            ps.setTimestamp(4, toTimestamp(updated.resolvedAt()));
            ps.setString(5, updated.id());
            ps.setString(6, expected.id());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update action record: " + updated.id(), e);
        }
    }

    @Override
    public Optional<ActionExecutionRecord> find(String userId, String recordId) {
        var sql = "SELECT " + COLUMNS + " FROM cat_action_log WHERE id = ? AND user_id = ?";
        var rows = query(sql, recordId, userId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<ActionExecutionRecord> listPending(String userId) {
        var sql = "SELECT " + COLUMNS + " FROM cat_action_log WHERE user_id = ? AND status = ? ORDER BY created_at DESC";
        return query(sql, userId, ActionStatus.PENDING_CONFIRMATION.id());
    }

    @Override
    public List<ActionExecutionRecord> history(String userId, HistoryFilter filter) {
        var sql = new StringBuilder("SELECT " + COLUMNS + " FROM cat_action_log WHERE user_id = ?");
        var args = new ArrayList<Object>();
        args.add(userId);
        if (filter.actionId() != null) {
            sql.append(" AND action_id = ?");
            args.add(filter.actionId());
        }
        if (filter.status() != null) {
            sql.append(" AND status = ?");
            args.add(filter.status().id());
        }
        sql.append(" ORDER BY created_at DESC LIMIT ?");
        args.add(filter.limit());
        return query(sql.toString(), args.toArray());
    }

    private List<ActionExecutionRecord> query(String sql, Object... args) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) {
                ps.setObject(i + 1, args[i]);
            }
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<ActionExecutionRecord>();
                while (rs.next()) {
                    out.add(map(rs));
                }
                return out;
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to query action records", e);
        }
    }

    private ActionExecutionRecord map(ResultSet rs) throws Exception {
        var category = rs.getString("category");
        var params = rs.getString("parameters");
        var value = rs.getLong("value_sats");
        var valueSats = rs.wasNull() ? null : value;
        return new ActionExecutionRecord(
            rs.getString("id"),
            rs.getString("user_id"),
            rs.getString("actor_id"),
            rs.getString("action_id"),
            category != null ? ActionCategory.fromId(category) : null,
            params != null ? MAPPER.readValue(params, MAP_TYPE) : Map.of(),
            rs.getString("conversation_id"),
            rs.getString("message_id"),
            ActionStatus.fromId(rs.getString("status")),
            rs.getString("description"),
            rs.getString("result_summary"),
            rs.getString("error_message"),
            valueSats,
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("resolved_at")),
            toInstant(rs.getTimestamp("expires_at"))
        );
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
