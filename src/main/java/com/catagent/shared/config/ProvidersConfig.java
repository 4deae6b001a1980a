package com.catagent.shared.config;

public record ProvidersConfig(Endpoint openRouter, Endpoint groq, int timeoutSeconds) {

    public record Endpoint(String baseUrl, String platformKey) {
        public boolean hasPlatformKey() {
            return platformKey != null && !platformKey.isBlank();
        }

        @Override
        public String toString() {
            return "Endpoint[baseUrl=" + baseUrl + ", platformKey=" + (hasPlatformKey() ? "****" : "<unset>") + "]";
        }
    }

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(
            new Endpoint("https://openrouter.ai/api/v1", ""),
            new Endpoint("https://api.groq.com/openai/v1", ""),
            60
        );
    }
}
