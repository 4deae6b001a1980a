package com.catagent.providers;

import com.catagent.shared.config.ProvidersConfig;

import java.net.http.HttpClient;
import java.time.Duration;

public class HttpProviderFactory implements ProviderFactory {

    private final ProvidersConfig config;
    private final HttpClient httpClient;

    public HttpProviderFactory(ProvidersConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Override
    public ModelProvider create(ProviderSelection selection) {
        var timeout = Duration.ofSeconds(config.timeoutSeconds());
        return switch (selection.provider()) {
            case OPENROUTER -> new OpenRouterProvider(selection.apiKey(), config.openRouter().baseUrl(), timeout, httpClient);
            case GROQ -> new GroqProvider(selection.apiKey(), config.groq().baseUrl(), timeout, httpClient);
        };
    }
}
