package com.catagent.providers;

public record ProviderSelection(ProviderKind provider, String apiKey, boolean usesOwnKey) {

    @Override
    public String toString() {
        return "ProviderSelection[provider=" + provider.id() + ", apiKey=****, usesOwnKey=" + usesOwnKey + "]";
    }
}
