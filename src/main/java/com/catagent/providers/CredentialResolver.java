package com.catagent.providers;

import com.catagent.auth.SecretStore;
import com.catagent.shared.config.ProvidersConfig;
import com.catagent.shared.error.NoProviderAvailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Chooses the provider family and credential for one request. Own keys win over platform
 * keys and OpenRouter wins over Groq at each level.
 */
public class CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    private final SecretStore secretStore;
    private final ProvidersConfig providers;

    public CredentialResolver(SecretStore secretStore, ProvidersConfig providers) {
        this.secretStore = secretStore;
        this.providers = providers;
    }

    public ProviderSelection resolve(String userId, String suppliedOpenRouterKey, String suppliedGroqKey) {
        var own = ownKey(userId, ProviderKind.OPENROUTER, suppliedOpenRouterKey)
            .or(() -> ownKey(userId, ProviderKind.GROQ, suppliedGroqKey));
        if (own.isPresent()) {
            log.debug("Using own {} key for user {}", own.get().provider().id(), userId);
            return own.get();
        }
        if (providers.openRouter().hasPlatformKey()) {
            return new ProviderSelection(ProviderKind.OPENROUTER, providers.openRouter().platformKey(), false);
        }
        if (providers.groq().hasPlatformKey()) {
            return new ProviderSelection(ProviderKind.GROQ, providers.groq().platformKey(), false);
        }
        log.warn("No model credential available for user {}", userId);
        throw new NoProviderAvailableException();
    }

    public boolean hasOwnKey(String userId, String suppliedOpenRouterKey, String suppliedGroqKey) {
        return ownKey(userId, ProviderKind.OPENROUTER, suppliedOpenRouterKey).isPresent()
            || ownKey(userId, ProviderKind.GROQ, suppliedGroqKey).isPresent();
    }

    private Optional<ProviderSelection> ownKey(String userId, ProviderKind kind, String supplied) {
        if (supplied != null && !supplied.isBlank()) {
            return Optional.of(new ProviderSelection(kind, supplied.trim(), true));
        }
        return stored(userId, kind).map(key -> new ProviderSelection(kind, key, true));
    }

    private Optional<String> stored(String userId, ProviderKind kind) {
        try {
            return secretStore.find(userId, kind).filter(k -> !k.isBlank());
        } catch (IllegalStateException e) {
            log.warn("Stored {} key for user {} could not be decrypted, ignoring it", kind.id(), userId);
            return Optional.empty();
        }
    }
}
