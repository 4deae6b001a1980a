package com.catagent.usage;

import java.time.LocalDate;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryUsageLedger implements UsageLedger {

    private record CounterKey(String userId, LocalDate day, UsageTier tier) {}

    private record ActionKey(String userId, LocalDate day, String actionId) {}

    private final ConcurrentHashMap<CounterKey, UsageCounter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ActionKey, Long> actionCounts = new ConcurrentHashMap<>();

    @Override
    public UsageCounter increment(String userId, LocalDate day, UsageTier tier, long requests, long tokens) {
        return counters.compute(new CounterKey(userId, day, tier), (k, current) ->
            (current != null ? current : UsageCounter.empty(userId, day, tier)).plus(requests, tokens));
    }

    @Override
    public UsageCounter get(String userId, LocalDate day, UsageTier tier) {
        var counter = counters.get(new CounterKey(userId, day, tier));
        return counter != null ? counter : UsageCounter.empty(userId, day, tier);
    }

    @Override
    public long incrementActionCount(String userId, LocalDate day, String actionId) {
        return actionCounts.merge(new ActionKey(userId, day, actionId), 1L, Long::sum);
    }

    @Override
    public long actionCount(String userId, LocalDate day, String actionId) {
        return actionCounts.getOrDefault(new ActionKey(userId, day, actionId), 0L);
    }
}
