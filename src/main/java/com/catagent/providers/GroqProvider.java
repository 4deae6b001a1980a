package com.catagent.providers;

import java.net.http.HttpClient;
import java.time.Duration;

public class GroqProvider extends OpenAiCompatibleProvider {

    public GroqProvider(String apiKey, String baseUrl, Duration timeout, HttpClient httpClient) {
        super(apiKey, baseUrl, timeout, httpClient);
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.GROQ;
    }
}
