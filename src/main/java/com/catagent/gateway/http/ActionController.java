package com.catagent.gateway.http;

import com.catagent.actions.ActionExecutionRecord;
import com.catagent.actions.ActionExecutor;
import com.catagent.actions.ActionRequest;
import com.catagent.actions.ActionResult;
import com.catagent.actions.ActionStatus;
import com.catagent.actions.HistoryFilter;
import com.catagent.auth.CurrentUser;
import com.catagent.permissions.PermissionDecision;
import com.catagent.shared.error.ActionLimitExceededException;
import com.catagent.shared.error.ExecutionFailedException;
import com.catagent.shared.error.InvalidRequestException;
import com.catagent.shared.error.PermissionDeniedException;
import com.catagent.shared.error.UnknownActionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Direct action execution and the confirmation queue. Every call is recorded by the executor;
 * this layer only maps the recorded outcome to an HTTP status.
 */
@RestController
@RequestMapping("/api/cat/actions")
public class ActionController {

    private final ActionExecutor executor;

    public ActionController(ActionExecutor executor) {
        this.executor = executor;
    }

    @GetMapping("/pending")
    public List<ActionExecutionRecord> pending(CurrentUser user) {
        return executor.listPending(user.userId());
    }

    @GetMapping("/history")
    public List<ActionExecutionRecord> history(CurrentUser user,
                                               @RequestParam(required = false) String actionId,
                                               @RequestParam(required = false) String status,
                                               @RequestParam(defaultValue = "50") int limit) {
        ActionStatus parsed = null;
        if (status != null && !status.isBlank()) {
            try {
                parsed = ActionStatus.fromId(status.trim());
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestException("Unknown status: " + status);
            }
        }
        return executor.history(user.userId(), new HistoryFilter(actionId, parsed, limit));
    }

    @PostMapping
    public ResponseEntity<ActionResult> execute(CurrentUser user, @RequestBody ActionRequest request) {
        if (request.actionId() == null || request.actionId().isBlank()) {
            throw new InvalidRequestException("actionId is required");
        }
        return respond(executor.execute(user.userId(), user.actorId(), request));
    }

    @PostMapping("/{id}/confirm")
    public ResponseEntity<ActionResult> confirm(CurrentUser user, @PathVariable String id) {
        return respond(executor.confirm(user.userId(), user.actorId(), id));
    }

    @PostMapping("/{id}/reject")
    public ActionResult reject(CurrentUser user, @PathVariable String id) {
        return executor.reject(user.userId(), id);
    }

    private static ResponseEntity<ActionResult> respond(ActionResult result) {
        var details = new LinkedHashMap<String, Object>();
        details.put("recordId", result.recordId());
        details.put("actionId", result.actionId());
        if (result.error() != null) {
            details.put("reason", result.error());
        }
        return switch (result.status()) {
            case SUCCEEDED -> ResponseEntity.ok(result);
            case PENDING_CONFIRMATION -> ResponseEntity.status(HttpStatus.ACCEPTED).body(result);
            case DENIED -> throw denial(result, details);
            case FAILED -> throw failure(result, details);
            case EXECUTING -> ResponseEntity.status(HttpStatus.ACCEPTED).body(result);
        };
    }

    private static RuntimeException denial(ActionResult result, Map<String, Object> details) {
        var reason = result.error();
        if (PermissionDecision.UNKNOWN_ACTION.equals(reason)) {
            return new UnknownActionException(result.actionId(), details);
        }
        if (ActionExecutor.EXCEEDS_LIMIT.equals(reason)) {
            return new ActionLimitExceededException(result.actionId(), details);
        }
        return new PermissionDeniedException(result.actionId(), reason, details);
    }

    private static RuntimeException failure(ActionResult result, Map<String, Object> details) {
        var error = result.error() != null ? result.error() : "execution failed";
        if (error.startsWith(ActionExecutor.INVALID_PARAMETERS)) {
            return new InvalidRequestException(error, details);
        }
        return new ExecutionFailedException(error, details);
    }
}
