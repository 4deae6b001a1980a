package com.catagent.shared.model;

import com.catagent.actions.ActionResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatTurnResponse(
    String message,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ActionResult> actions,
    String modelUsed,
    String provider,
    UsageReport usage,
    UserStatus userStatus
) {}
