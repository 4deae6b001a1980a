package com.catagent.actions;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JdbcActionRecordStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private PreparedStatement ps;
    private Connection conn;
    private JdbcActionRecordStore store;

    @BeforeEach
    void setUp() throws Exception {
        ps = mock(PreparedStatement.class);
        conn = mock(Connection.class);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenReturn(conn);
        store = new JdbcActionRecordStore(ds);
    }

    @Test
    void insertWritesParametersAsJson() throws Exception {
        store.insert(record(ActionStatus.PENDING_CONFIRMATION));

        verify(conn).prepareStatement(contains("?::jsonb"));
        verify(ps).setString(1, "rec-1");
        verify(ps).setString(5, "payments");
        verify(ps).setString(6, "{\"amount_sats\":500}");
        verify(ps).setString(9, "pending_confirmation");
        verify(ps).setLong(13, 500L);
        verify(ps).executeUpdate();
    }

    @Test
    void transitionIsConditionalOnExpectedStatus() throws Exception {
        when(ps.executeUpdate()).thenReturn(1, 0);
        var executing = record(ActionStatus.EXECUTING);

        assertTrue(store.transition(executing, ActionStatus.PENDING_CONFIRMATION));
        assertFalse(store.transition(executing, ActionStatus.PENDING_CONFIRMATION));

        verify(conn, times(2)).prepareStatement(contains("WHERE id = ? AND status = ?"));
        verify(ps, times(2)).setString(6, "pending_confirmation");
    }

    @Test
    void historyAppliesFiltersAndLimit() throws Exception {
        var rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(false);
        when(ps.executeQuery()).thenReturn(rs);

        var rows = store.history("u1", new HistoryFilter("send_payment", ActionStatus.DENIED, 20));

        assertTrue(rows.isEmpty());
        verify(conn).prepareStatement(
            "SELECT id, user_id, actor_id, action_id, category, parameters, conversation_id, message_id, status, "
                + "description, result_summary, error_message, value_sats, created_at, resolved_at, expires_at "
                + "FROM cat_action_log WHERE user_id = ? AND action_id = ? AND status = ? "
                + "ORDER BY created_at DESC LIMIT ?");
        verify(ps).setObject(1, "u1");
        verify(ps).setObject(2, "send_payment");
        verify(ps).setObject(3, "denied");
        verify(ps).setObject(4, 20);
    }

    private static ActionExecutionRecord record(ActionStatus status) {
        return new ActionExecutionRecord("rec-1", "u1", "u1", "send_payment", ActionCategory.PAYMENTS,
            Map.of("amount_sats", 500), null, null, status, "Send 500 sats", null, null, 500L, NOW, null,
            NOW.plusSeconds(86_400));
    }
}
