package com.catagent.actions;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionResult(
    String recordId,
    String actionId,
    ActionStatus status,
    String description,
    String resultSummary,
    String error,
    Instant expiresAt
) {
    public static ActionResult of(ActionExecutionRecord record) {
        return new ActionResult(record.id(), record.actionId(), record.status(), record.description(),
            record.resultSummary(), record.errorMessage(), record.expiresAt());
    }

    public boolean requiresConfirmation() {
        return status == ActionStatus.PENDING_CONFIRMATION;
    }
}
