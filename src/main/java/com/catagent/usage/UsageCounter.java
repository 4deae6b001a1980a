package com.catagent.usage;

import java.time.LocalDate;

public record UsageCounter(String userId, LocalDate day, UsageTier tier, long requestCount, long tokenCount) {

    public static UsageCounter empty(String userId, LocalDate day, UsageTier tier) {
        return new UsageCounter(userId, day, tier, 0, 0);
    }

    UsageCounter plus(long requests, long tokens) {
        return new UsageCounter(userId, day, tier, requestCount + requests, tokenCount + tokens);
    }
}
