package com.catagent.providers;

import com.catagent.auth.InMemorySecretStore;
import com.catagent.auth.JdbcSecretStore;
import com.catagent.auth.SecretStore;
import com.catagent.security.KeyCipher;
import com.catagent.shared.config.ProvidersConfig;
import com.catagent.shared.error.NoProviderAvailableException;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CredentialResolverTest {

    private final InMemorySecretStore secrets = new InMemorySecretStore(new KeyCipher("test-master"));

    @Test
    void suppliedOpenRouterKeyWinsOverEverything() {
        secrets.store("u1", ProviderKind.GROQ, "stored-groq");
        var resolver = new CredentialResolver(secrets, providers("platform-or", "platform-groq"));

        var selection = resolver.resolve("u1", "supplied-or", "supplied-groq");

        assertEquals(ProviderKind.OPENROUTER, selection.provider());
        assertEquals("supplied-or", selection.apiKey());
        assertTrue(selection.usesOwnKey());
    }

    @Test
    void storedOpenRouterBeatsSuppliedGroq() {
        secrets.store("u1", ProviderKind.OPENROUTER, "stored-or");
        var resolver = new CredentialResolver(secrets, providers("platform-or", ""));

        var selection = resolver.resolve("u1", null, "supplied-groq");

        assertEquals(ProviderKind.OPENROUTER, selection.provider());
        assertEquals("stored-or", selection.apiKey());
    }

    @Test
    void ownGroqKeyBeatsPlatformOpenRouter() {
        secrets.store("u1", ProviderKind.GROQ, "stored-groq");
        var resolver = new CredentialResolver(secrets, providers("platform-or", ""));

        var selection = resolver.resolve("u1", " ", null);

        assertEquals(ProviderKind.GROQ, selection.provider());
        assertTrue(selection.usesOwnKey());
    }

    @Test
    void fallsBackToPlatformKeysInOrder() {
        var both = new CredentialResolver(secrets, providers("platform-or", "platform-groq"));
        var selection = both.resolve("u1", null, null);
        assertEquals(ProviderKind.OPENROUTER, selection.provider());
        assertFalse(selection.usesOwnKey());

        var groqOnly = new CredentialResolver(secrets, providers("", "platform-groq"));
        assertEquals(ProviderKind.GROQ, groqOnly.resolve("u1", null, null).provider());
    }

    @Test
    void failsWhenNothingConfigured() {
        var resolver = new CredentialResolver(secrets, providers("", ""));
        assertThrows(NoProviderAvailableException.class, () -> resolver.resolve("u1", null, null));
        assertFalse(resolver.hasOwnKey("u1", null, null));
    }

    @Test
    void undecryptableStoredKeyIsSkipped() {
        var broken = mock(SecretStore.class);
        when(broken.find(anyString(), any())).thenThrow(new IllegalStateException("bad key"));
        var resolver = new CredentialResolver(broken, providers("platform-or", ""));

        var selection = resolver.resolve("u1", null, null);

        assertFalse(selection.usesOwnKey());
    }

    @Test
    void corruptStoredCiphertextFallsThroughToPlatformKey() throws Exception {
        var rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(true);
        when(rs.getString(1)).thenReturn("AAAA", "%%not-base64%%");
        var ps = mock(PreparedStatement.class);
        when(ps.executeQuery()).thenReturn(rs);
        var conn = mock(Connection.class);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenReturn(conn);
        var store = new JdbcSecretStore(ds, new KeyCipher("test-master"));
        var resolver = new CredentialResolver(store, providers("platform-or", ""));

        var selection = resolver.resolve("u1", null, null);

        assertEquals(ProviderKind.OPENROUTER, selection.provider());
        assertEquals("platform-or", selection.apiKey());
        assertFalse(selection.usesOwnKey());
    }

    @Test
    void selectionNeverPrintsTheKey() {
        var resolver = new CredentialResolver(secrets, providers("", ""));
        assertFalse(resolver.resolve("u1", "sk-or-secret", null).toString().contains("sk-or-secret"));
    }

    private static ProvidersConfig providers(String openRouterKey, String groqKey) {
        var defaults = ProvidersConfig.defaults();
        return new ProvidersConfig(
            new ProvidersConfig.Endpoint(defaults.openRouter().baseUrl(), openRouterKey),
            new ProvidersConfig.Endpoint(defaults.groq().baseUrl(), groqKey),
            defaults.timeoutSeconds());
    }
}
