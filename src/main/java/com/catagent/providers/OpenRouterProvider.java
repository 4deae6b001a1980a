package com.catagent.providers;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;

public class OpenRouterProvider extends OpenAiCompatibleProvider {

    public OpenRouterProvider(String apiKey, String baseUrl, Duration timeout, HttpClient httpClient) {
        super(apiKey, baseUrl, timeout, httpClient);
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.OPENROUTER;
    }

    @Override
    protected void decorate(HttpRequest.Builder builder) {
        builder.header("HTTP-Referer", "https://orangecat.app")
            .header("X-Title", "OrangeCat");
    }
}
