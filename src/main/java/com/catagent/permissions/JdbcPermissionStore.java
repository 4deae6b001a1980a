package com.catagent.permissions;

import com.catagent.actions.ActionCategory;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class JdbcPermissionStore implements PermissionStore {

    private static final String COLUMNS =
        "user_id, action_id, category, requires_confirmation, daily_limit, max_value_per_action, granted_at, revoked_at";

    private final DataSource dataSource;

    public JdbcPermissionStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<PermissionGrant> findSpecific(String userId, String actionId) {
        var sql = "SELECT " + COLUMNS + " FROM cat_permissions WHERE user_id = ? AND action_id = ?";
        return queryOne(sql, userId, actionId);
    }

    @Override
    public Optional<PermissionGrant> findWildcard(String userId, ActionCategory category) {
        var sql = "SELECT " + COLUMNS + " FROM cat_permissions WHERE user_id = ? AND action_id = '*' AND category = ?";
        return queryOne(sql, userId, category.id());
    }

    @Override
    public void save(PermissionGrant g) {
        var sql = """
            INSERT INTO cat_permissions (user_id, action_id, category, requires_confirmation,
                                         daily_limit, max_value_per_action, granted_at, revoked_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (user_id, action_id, category)
            DO UPDATE SET requires_confirmation = EXCLUDED.requires_confirmation,
                          daily_limit = EXCLUDED.daily_limit,
                          max_value_per_action = EXCLUDED.max_value_per_action,
                          granted_at = EXCLUDED.granted_at,
                          revoked_at = EXCLUDED.revoked_at
            """;
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, g.userId());
            ps.setString(2, g.actionId());
            ps.setString(3, g.category().id());
            ps.setBoolean(4, g.requiresConfirmation());
            if (g.dailyLimit() != null) ps.setInt(5, g.dailyLimit()); else ps.setNull(5, Types.INTEGER);
            if (g.maxValuePerAction() != null) ps.setLong(6, g.maxValuePerAction()); else ps.setNull(6, Types.BIGINT);
            ps.setTimestamp(7, Timestamp.from(g.grantedAt()));
            ps.setTimestamp(8, g.revokedAt() != null ? Timestamp.from(g.revokedAt()) : null);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save permission " + g.actionId() + " for user: " + g.userId(), e);
        }
    }

    @Override
    public List<PermissionGrant> list(String userId) {
        var sql = "SELECT " + COLUMNS + " FROM cat_permissions WHERE user_id = ? ORDER BY category, action_id";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, userId);
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<PermissionGrant>();
                while (rs.next()) out.add(map(rs));
                return out;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list permissions for user: " + userId, e);
        }
    }

    private Optional<PermissionGrant> queryOne(String sql, String userId, String key) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, userId);
            ps.setString(2, key);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read permission " + key + " for user: " + userId, e);
        }
    }

    private static PermissionGrant map(ResultSet rs) throws SQLException {
        var dailyLimit = rs.getInt("daily_limit");
        var noDailyLimit = rs.wasNull();
        var maxValue = rs.getLong("max_value_per_action");
        var noMaxValue = rs.wasNull();
        var revokedAt = rs.getTimestamp("revoked_at");
        return new PermissionGrant(
            rs.getString("user_id"),
            rs.getString("action_id"),
            ActionCategory.fromId(rs.getString("category")),
            rs.getBoolean("requires_confirmation"),
            noDailyLimit ? null : dailyLimit,
            noMaxValue ? null : maxValue,
            rs.getTimestamp("granted_at").toInstant(),
            revokedAt != null ? revokedAt.toInstant() : null
        );
    }
}
