package com.catagent.auth;

import com.catagent.providers.ProviderKind;
import com.catagent.security.KeyCipher;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySecretStore implements SecretStore {

    private final KeyCipher cipher;
    private final ConcurrentHashMap<String, String> encrypted = new ConcurrentHashMap<>();

    public InMemorySecretStore(KeyCipher cipher) {
        this.cipher = cipher;
    }

    @Override
    public void store(String userId, ProviderKind provider, String apiKey) {
        encrypted.put(key(userId, provider), cipher.encrypt(apiKey));
    }

    @Override
    public Optional<String> find(String userId, ProviderKind provider) {
        return Optional.ofNullable(encrypted.get(key(userId, provider))).map(cipher::decrypt);
    }

    @Override
    public void delete(String userId, ProviderKind provider) {
        encrypted.remove(key(userId, provider));
    }

    private static String key(String userId, ProviderKind provider) {
        return userId + ":" + provider.id();
    }
}
