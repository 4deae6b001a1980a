package com.catagent.permissions;

import com.catagent.actions.ActionCategory;

import java.time.Instant;

public record PermissionGrant(
    String userId,
    String actionId,
    ActionCategory category,
    boolean requiresConfirmation,
    Integer dailyLimit,
    Long maxValuePerAction,
    Instant grantedAt,
    Instant revokedAt
) {
    public static final String WILDCARD = "*";

    public boolean isWildcard() {
        return WILDCARD.equals(actionId);
    }

    public boolean isActive() {
        return revokedAt == null;
    }

    public PermissionGrant revoke(Instant at) {
        return new PermissionGrant(userId, actionId, category, requiresConfirmation, dailyLimit,
            maxValuePerAction, grantedAt, at);
    }
}
