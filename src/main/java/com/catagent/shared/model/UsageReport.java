package com.catagent.shared.model;

import com.catagent.providers.TokenUsage;

public record UsageReport(long inputTokens, long outputTokens, long totalTokens, boolean usedOwnKey) {

    public static UsageReport of(TokenUsage usage, boolean usedOwnKey) {
        return new UsageReport(usage.inputTokens(), usage.outputTokens(), usage.totalTokens(), usedOwnKey);
    }
}
