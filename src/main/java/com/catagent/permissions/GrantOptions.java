package com.catagent.permissions;

public record GrantOptions(Boolean requiresConfirmation, Integer dailyLimit, Long maxValuePerAction) {

    public GrantOptions {
        if (requiresConfirmation == null) requiresConfirmation = true;
        if (dailyLimit != null && dailyLimit < 0) {
            throw new IllegalArgumentException("dailyLimit must not be negative");
        }
        if (maxValuePerAction != null && maxValuePerAction < 0) {
            throw new IllegalArgumentException("maxValuePerAction must not be negative");
        }
    }

    public static GrantOptions defaults() {
        return new GrantOptions(true, null, null);
    }

    public static GrantOptions withoutConfirmation() {
        return new GrantOptions(false, null, null);
    }
}
