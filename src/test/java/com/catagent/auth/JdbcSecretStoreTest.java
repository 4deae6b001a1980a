package com.catagent.auth;

import com.catagent.providers.ProviderKind;
import com.catagent.security.KeyCipher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JdbcSecretStoreTest {

    private final KeyCipher cipher = new KeyCipher("test-master-key");

    private PreparedStatement ps;
    private JdbcSecretStore store;

    @BeforeEach
    void setUp() throws Exception {
        ps = mock(PreparedStatement.class);
        var conn = mock(Connection.class);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenReturn(conn);
        store = new JdbcSecretStore(ds, cipher);
    }

    @Test
    void storesOnlyCiphertext() throws Exception {
        store.store("u1", ProviderKind.OPENROUTER, "sk-or-secret");

        var written = ArgumentCaptor.forClass(String.class);
        verify(ps).setString(eq(3), written.capture());
        assertNotEquals("sk-or-secret", written.getValue());
        assertFalse(written.getValue().contains("sk-or-secret"));
        assertEquals("sk-or-secret", cipher.decrypt(written.getValue()));
        verify(ps).setString(2, "openrouter");
    }

    @Test
    void findDecryptsStoredValue() throws Exception {
        var rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(true);
        when(rs.getString(1)).thenReturn(cipher.encrypt("gsk-1"));
        when(ps.executeQuery()).thenReturn(rs);

        assertEquals("gsk-1", store.find("u1", ProviderKind.GROQ).orElseThrow());
    }

    @Test
    void findReturnsEmptyWithoutRow() throws Exception {
        var rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(false);
        when(ps.executeQuery()).thenReturn(rs);

        assertTrue(store.find("u1", ProviderKind.GROQ).isEmpty());
        assertFalse(store.hasAny("u1"));
    }
}
