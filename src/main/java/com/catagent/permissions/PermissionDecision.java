package com.catagent.permissions;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermissionDecision(
    Outcome outcome,
    String reason,
    @JsonIgnore PermissionGrant grant,
    Long dailyUsage,
    Integer dailyLimit
) {
    public enum Outcome { ALLOWED, ALLOWED_WITH_CONFIRMATION, DENIED }

    public static final String UNKNOWN_ACTION = "unknown_action";
    public static final String ACTION_DISABLED = "action_disabled";
    public static final String NO_GRANT = "no_grant";
    public static final String REVOKED = "revoked";
    public static final String DAILY_LIMIT_REACHED = "daily_limit_reached";

    public static PermissionDecision denied(String reason) {
        return new PermissionDecision(Outcome.DENIED, reason, null, null, null);
    }

    public static PermissionDecision denied(String reason, PermissionGrant grant, long usage) {
        return new PermissionDecision(Outcome.DENIED, reason, grant, usage, grant.dailyLimit());
    }

    public static PermissionDecision allowed(PermissionGrant grant, boolean confirm, Long usage) {
        return new PermissionDecision(confirm ? Outcome.ALLOWED_WITH_CONFIRMATION : Outcome.ALLOWED,
            null, grant, usage, grant.dailyLimit());
    }

    public boolean isAllowed() {
        return outcome != Outcome.DENIED;
    }

    public boolean requiresConfirmation() {
        return outcome == Outcome.ALLOWED_WITH_CONFIRMATION;
    }
}
