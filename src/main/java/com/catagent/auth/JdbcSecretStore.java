package com.catagent.auth;

import com.catagent.providers.ProviderKind;
import com.catagent.security.KeyCipher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Optional;

public class JdbcSecretStore implements SecretStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSecretStore.class);

    private final DataSource dataSource;
    private final KeyCipher cipher;

    public JdbcSecretStore(DataSource dataSource, KeyCipher cipher) {
        this.dataSource = dataSource;
        this.cipher = cipher;
    }

    @Override
    public void store(String userId, ProviderKind provider, String apiKey) {
        var sql = """
            INSERT INTO user_api_keys (user_id, provider, encrypted_key, updated_at)
            VALUES (?, ?, ?, now())
            ON CONFLICT (user_id, provider)
            DO UPDATE SET encrypted_key = EXCLUDED.encrypted_key, updated_at = now()
            """;
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, userId);
            ps.setString(2, provider.id());
            ps.setString(3, cipher.encrypt(apiKey));
            ps.executeUpdate();
            log.info("Stored {} key for user {}", provider.id(), userId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to store api key for user: " + userId, e);
        }
    }

    @Override
    public Optional<String> find(String userId, ProviderKind provider) {
        var sql = "SELECT encrypted_key FROM user_api_keys WHERE user_id = ? AND provider = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, userId);
            ps.setString(2, provider.id());
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(cipher.decrypt(rs.getString(1)));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load api key for user: " + userId, e);
        }
    }

    @Override
    public void delete(String userId, ProviderKind provider) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("DELETE FROM user_api_keys WHERE user_id = ? AND provider = ?")) {
            ps.setString(1, userId);
            ps.setString(2, provider.id());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete api key for user: " + userId, e);
        }
    }
}
