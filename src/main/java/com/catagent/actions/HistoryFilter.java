package com.catagent.actions;

public record HistoryFilter(String actionId, ActionStatus status, int limit) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    public HistoryFilter {
        if (limit <= 0) limit = DEFAULT_LIMIT;
        limit = Math.min(limit, MAX_LIMIT);
    }

    public static HistoryFilter recent() {
        return new HistoryFilter(null, null, DEFAULT_LIMIT);
    }

    public boolean matches(ActionExecutionRecord record) {
        return (actionId == null || actionId.equals(record.actionId()))
            && (status == null || status == record.status());
    }
}
