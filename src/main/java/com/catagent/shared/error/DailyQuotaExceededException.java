package com.catagent.shared.error;

import java.util.Map;

public class DailyQuotaExceededException extends CatAgentException {
    public DailyQuotaExceededException(long used, int dailyLimit) {
        super(ErrorCode.DAILY_QUOTA_EXCEEDED, "Daily limit reached",
                Map.of("message", "You have reached your daily free message limit. "
                                + "Add your own API key for unlimited usage.",
                        "dailyLimit", dailyLimit,
                        "used", used));
    }
}
