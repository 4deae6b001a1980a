package com.catagent.usage;

public record PlatformQuota(int dailyLimit, long used) {

    public long remaining() {
        return Math.max(0, dailyLimit - used);
    }

    public boolean canUsePlatform() {
        return used < dailyLimit;
    }
}
