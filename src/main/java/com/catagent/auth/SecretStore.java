package com.catagent.auth;

import com.catagent.providers.ProviderKind;

import java.util.Optional;

public interface SecretStore {

    void store(String userId, ProviderKind provider, String apiKey);

    Optional<String> find(String userId, ProviderKind provider);

    void delete(String userId, ProviderKind provider);

    default boolean hasAny(String userId) {
        for (var kind : ProviderKind.values()) {
            if (find(userId, kind).isPresent()) return true;
        }
        return false;
    }
}
