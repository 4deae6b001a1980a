package com.catagent.providers;

@FunctionalInterface
public interface ProviderFactory {
    ModelProvider create(ProviderSelection selection);
}
