package com.catagent.usage;

import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JdbcUsageLedgerTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 1);

    @Test
    void incrementUpsertsAndReturnsStoredTotals() throws Exception {
        var rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(true);
        when(rs.getLong(1)).thenReturn(4L);
        when(rs.getLong(2)).thenReturn(900L);
        var ps = mock(PreparedStatement.class);
        when(ps.executeQuery()).thenReturn(rs);
        var conn = mock(Connection.class);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenReturn(conn);

        var counter = new JdbcUsageLedger(ds).increment("u1", DAY, UsageTier.PLATFORM, 1, 250);

        verify(conn).prepareStatement(contains("ON CONFLICT (user_id, usage_date, tier)"));
        verify(ps).setString(1, "u1");
        verify(ps).setDate(2, Date.valueOf(DAY));
        verify(ps).setString(3, "platform");
        verify(ps).setLong(4, 1);
        verify(ps).setLong(5, 250);
        assertEquals(4, counter.requestCount());
        assertEquals(900, counter.tokenCount());
    }

    @Test
    void getReturnsEmptyCounterWhenNoRow() throws Exception {
        var rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(false);
        var ps = mock(PreparedStatement.class);
        when(ps.executeQuery()).thenReturn(rs);
        var conn = mock(Connection.class);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenReturn(conn);

        var counter = new JdbcUsageLedger(ds).get("u1", DAY, UsageTier.OWN_KEY);

        verify(ps).setString(3, "own_key");
        assertEquals(0, counter.requestCount());
        assertEquals(0, counter.tokenCount());
    }

    @Test
    void actionCountIncrementsAtomically() throws Exception {
        var rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(true);
        when(rs.getLong(1)).thenReturn(3L);
        var ps = mock(PreparedStatement.class);
        when(ps.executeQuery()).thenReturn(rs);
        var conn = mock(Connection.class);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenReturn(conn);

        assertEquals(3, new JdbcUsageLedger(ds).incrementActionCount("u1", DAY, "create_product"));
        verify(conn).prepareStatement(contains("execution_count = cat_action_usage.execution_count + 1"));
    }

    @Test
    void wrapsSqlFailures() throws Exception {
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenThrow(new SQLException("down"));
        var ex = assertThrows(RuntimeException.class,
            () -> new JdbcUsageLedger(ds).actionCount("u1", DAY, "create_product"));
        assertInstanceOf(SQLException.class, ex.getCause());
    }
}
