package com.catagent.shared.config;

public record EngineConfig(
    UsageConfig usage,
    ChatConfig chat,
    RateLimitConfig rateLimit,
    ActionsConfig actions
) {
    public record UsageConfig(int dailyFreeRequests) {
        public static UsageConfig defaults() {
            return new UsageConfig(10);
        }
    }

    public record ChatConfig(double temperature, int maxMessageLength) {
        public static ChatConfig defaults() {
            return new ChatConfig(0.7, 10_000);
        }
    }

    public record RateLimitConfig(int writesPerMinute) {
        public static RateLimitConfig defaults() {
            return new RateLimitConfig(30);
        }
    }

    public record ActionsConfig(int pendingTtlHours, String entityServiceUrl) {
        public static ActionsConfig defaults() {
            return new ActionsConfig(24, "http://localhost:3000");
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(
            UsageConfig.defaults(),
            ChatConfig.defaults(),
            RateLimitConfig.defaults(),
            ActionsConfig.defaults()
        );
    }
}
