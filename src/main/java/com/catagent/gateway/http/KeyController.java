package com.catagent.gateway.http;

import com.catagent.auth.CurrentUser;
import com.catagent.auth.SecretStore;
import com.catagent.providers.ProviderKind;
import com.catagent.shared.error.InvalidRequestException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Explicit opt-in storage of a user's own provider key. Keys sent per request in headers are
 * never stored.
 */
@RestController
@RequestMapping("/api/cat/keys")
public class KeyController {

    public record KeyBody(String provider, String apiKey) {}

    private final SecretStore secretStore;

    public KeyController(SecretStore secretStore) {
        this.secretStore = secretStore;
    }

    @PostMapping
    public Map<String, Object> store(CurrentUser user, @RequestBody KeyBody body) {
        var provider = provider(body.provider());
        if (body.apiKey() == null || body.apiKey().isBlank()) {
            throw new InvalidRequestException("apiKey is required");
        }
        secretStore.store(user.userId(), provider, body.apiKey().trim());
        return Map.of("provider", provider.id(), "stored", true);
    }

    @DeleteMapping("/{provider}")
    public Map<String, Object> delete(CurrentUser user, @PathVariable String provider) {
        var kind = provider(provider);
        secretStore.delete(user.userId(), kind);
        return Map.of("provider", kind.id(), "stored", false);
    }

    private static ProviderKind provider(String id) {
        try {
            return ProviderKind.fromId(id);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
    }
}
