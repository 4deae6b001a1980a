package com.catagent.usage;

import javax.sql.DataSource;
import java.sql.Date;
import java.sql.SQLException;
import java.time.LocalDate;

public class JdbcUsageLedger implements UsageLedger {

    private static final String INCREMENT_USAGE = """
        INSERT INTO platform_usage (user_id, usage_date, tier, request_count, token_count)
        VALUES (?, ?, ?, ?, ?)
        ON CONFLICT (user_id, usage_date, tier)
        DO UPDATE SET request_count = platform_usage.request_count + EXCLUDED.request_count,
                      token_count = platform_usage.token_count + EXCLUDED.token_count
        RETURNING request_count, token_count
        """;

    private static final String INCREMENT_ACTION = """
        INSERT INTO cat_action_usage (user_id, usage_date, action_id, execution_count)
        VALUES (?, ?, ?, 1)
        ON CONFLICT (user_id, usage_date, action_id)
        DO UPDATE SET execution_count = cat_action_usage.execution_count + 1
        RETURNING execution_count
        """;

    private final DataSource dataSource;

    public JdbcUsageLedger(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public UsageCounter increment(String userId, LocalDate day, UsageTier tier, long requests, long tokens) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(INCREMENT_USAGE)) {
            ps.setString(1, userId);
            ps.setDate(2, Date.valueOf(day));
            ps.setString(3, tier.id());
            ps.setLong(4, requests);
            ps.setLong(5, tokens);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalStateException("Upsert returned no row");
                }
                return new UsageCounter(userId, day, tier, rs.getLong(1), rs.getLong(2));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to increment usage for user: " + userId, e);
        }
    }

    @Override
    public UsageCounter get(String userId, LocalDate day, UsageTier tier) {
        var sql = "SELECT request_count, token_count FROM platform_usage WHERE user_id = ? AND usage_date = ? AND tier = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, userId);
            ps.setDate(2, Date.valueOf(day));
            ps.setString(3, tier.id());
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) return UsageCounter.empty(userId, day, tier);
                return new UsageCounter(userId, day, tier, rs.getLong(1), rs.getLong(2));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read usage for user: " + userId, e);
        }
    }

    @Override
    public long incrementActionCount(String userId, LocalDate day, String actionId) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(INCREMENT_ACTION)) {
            ps.setString(1, userId);
            ps.setDate(2, Date.valueOf(day));
            ps.setString(3, actionId);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalStateException("Upsert returned no row");
                }
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to increment action count: " + actionId, e);
        }
    }

    @Override
    public long actionCount(String userId, LocalDate day, String actionId) {
        var sql = "SELECT execution_count FROM cat_action_usage WHERE user_id = ? AND usage_date = ? AND action_id = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, userId);
            ps.setDate(2, Date.valueOf(day));
            ps.setString(3, actionId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read action count: " + actionId, e);
        }
    }
}
