package com.catagent.shared.model;

import com.catagent.actions.ActionResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamSummary(
    boolean done,
    String message,
    UsageReport usage,
    String model,
    String provider,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ActionResult> actions,
    UserStatus userStatus
) {}
