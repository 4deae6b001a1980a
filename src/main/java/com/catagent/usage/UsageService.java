package com.catagent.usage;

import com.catagent.observability.EngineMetrics;
import com.catagent.shared.error.DailyQuotaExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

public class UsageService {

    private static final Logger log = LoggerFactory.getLogger(UsageService.class);

    private final UsageLedger ledger;
    private final int dailyFreeRequests;
    private final Clock clock;
    private final EngineMetrics metrics;

    public UsageService(UsageLedger ledger, int dailyFreeRequests, Clock clock, EngineMetrics metrics) {
        this.ledger = ledger;
        this.dailyFreeRequests = dailyFreeRequests;
        this.clock = clock;
        this.metrics = metrics;
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    public PlatformQuota quota(String userId) {
        var counter = ledger.get(userId, today(), UsageTier.PLATFORM);
        return new PlatformQuota(dailyFreeRequests, counter.requestCount());
    }

    public PlatformQuota ensurePlatformQuota(String userId) {
        var quota = quota(userId);
        if (!quota.canUsePlatform()) {
            log.info("Daily free quota reached for user {}", userId);
            throw new DailyQuotaExceededException(quota.used(), dailyFreeRequests);
        }
        return quota;
    }

    public UsageCounter recordModelCall(String userId, boolean usesOwnKey, long tokens) {
        var tier = UsageTier.of(usesOwnKey);
        var counter = ledger.increment(userId, today(), tier, 1, tokens);
        metrics.tokensUsed(tier.id()).increment(tokens);
        log.debug("Recorded model call for user {} tier={} requests={} tokens={}",
            userId, tier.id(), counter.requestCount(), counter.tokenCount());
        return counter;
    }

    public long actionCountToday(String userId, String actionId) {
        return ledger.actionCount(userId, today(), actionId);
    }

    public long countActionExecution(String userId, String actionId) {
        return ledger.incrementActionCount(userId, today(), actionId);
    }

    public int dailyFreeRequests() {
        return dailyFreeRequests;
    }
}
