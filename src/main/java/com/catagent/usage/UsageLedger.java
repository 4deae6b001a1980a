package com.catagent.usage;

import java.time.LocalDate;

/**
 * Per-user daily counters. Every mutation is a single atomic increment that returns the
 * value after the update; there is no separate read-modify-write path.
 */
public interface UsageLedger {

    UsageCounter increment(String userId, LocalDate day, UsageTier tier, long requests, long tokens);

    UsageCounter get(String userId, LocalDate day, UsageTier tier);

    long incrementActionCount(String userId, LocalDate day, String actionId);

    long actionCount(String userId, LocalDate day, String actionId);
}
