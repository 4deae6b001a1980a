package com.catagent.shared.error;

import java.time.Instant;
import java.util.Map;

public class RateLimitedException extends CatAgentException {

    private final int limit;
    private final long retryAfterSeconds;
    private final Instant resetAt;

    public RateLimitedException(int limit, long retryAfterSeconds, Instant resetAt) {
        super(ErrorCode.RATE_LIMIT_EXCEEDED, "Rate limit exceeded",
                Map.of("limit", limit, "remaining", 0, "retryAfter", retryAfterSeconds,
                        "resetTime", resetAt.toEpochMilli()));
        this.limit = limit;
        this.retryAfterSeconds = retryAfterSeconds;
        this.resetAt = resetAt;
    }

    public int limit() { return limit; }

    public long retryAfterSeconds() { return retryAfterSeconds; }

    public Instant resetAt() { return resetAt; }
}
