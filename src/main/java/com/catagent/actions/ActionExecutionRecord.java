package com.catagent.actions;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit entry for one requested action. Records are never deleted and a terminal status is
 * never changed again.
 */
public record ActionExecutionRecord(
    String id,
    String userId,
    String actorId,
    String actionId,
    ActionCategory category,
    Map<String, Object> parameters,
    String conversationId,
    String messageId,
    ActionStatus status,
    String description,
    String resultSummary,
    String errorMessage,
    Long valueSats,
    Instant createdAt,
    Instant resolvedAt,
    Instant expiresAt
) {
    public ActionExecutionRecord {
        parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
    }

    public ActionExecutionRecord executing() {
        return withStatus(ActionStatus.EXECUTING, null, null, null);
    }

    public ActionExecutionRecord succeeded(String summary, Instant at) {
        return withStatus(ActionStatus.SUCCEEDED, summary, null, at);
    }

    public ActionExecutionRecord failed(String error, Instant at) {
        return withStatus(ActionStatus.FAILED, null, error, at);
    }

    public ActionExecutionRecord denied(String reason, Instant at) {
        return withStatus(ActionStatus.DENIED, null, reason, at);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    private ActionExecutionRecord withStatus(ActionStatus next, String summary, String error, Instant at) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Record " + id + " is already " + status.id());
        }
        return new ActionExecutionRecord(id, userId, actorId, actionId, category, parameters,
            conversationId, messageId, next, description, summary, error, valueSats, createdAt, at, expiresAt);
    }
}
