package com.catagent.actions;

import com.catagent.observability.EngineMetrics;
import com.catagent.permissions.PermissionDecision;
import com.catagent.permissions.PermissionService;
import com.catagent.security.UserLocks;
import com.catagent.shared.error.ActionNotPendingException;
import com.catagent.usage.UsageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs requested actions through validation, permission and value checks, then either
 * parks them for confirmation or performs them. Every outcome is written to the
 * {@link ActionRecordStore}; nothing is retried.
 */
public class ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    public static final String EXCEEDS_LIMIT = "exceeds_limit";
    public static final String EXPIRED = "expired";
    public static final String REJECTED = "rejected";
    public static final String INVALID_PARAMETERS = "invalid_parameters";

    private final ActionCatalog catalog;
    private final PermissionService permissions;
    private final ActionRecordStore records;
    private final ActionHandlerRegistry handlers;
    private final UsageService usage;
    private final UserLocks locks;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final Duration pendingTtl;
    private final ParameterValidator validator = new ParameterValidator();
    private final ActionDescriber describer = new ActionDescriber();

    public ActionExecutor(ActionCatalog catalog, PermissionService permissions, ActionRecordStore records,
                          ActionHandlerRegistry handlers, UsageService usage, UserLocks locks,
                          EngineMetrics metrics, Clock clock, Duration pendingTtl) {
        this.catalog = catalog;
        this.permissions = permissions;
        this.records = records;
        this.handlers = handlers;
        this.usage = usage;
        this.locks = locks;
        this.metrics = metrics;
        this.clock = clock;
        this.pendingTtl = pendingTtl;
    }

    public ActionResult execute(String userId, String actorId, ActionRequest request) {
        var definition = catalog.find(request.actionId());
        if (definition.isEmpty()) {
            var record = newRecord(userId, actorId, request, null, request.parameters(), request.actionId(), null);
            return ActionResult.of(store(record.denied(PermissionDecision.UNKNOWN_ACTION, clock.instant())));
        }
        var def = definition.get();
        var validation = validator.validate(def, request.parameters());
        if (!validation.valid()) {
            var record = newRecord(userId, actorId, request, def, request.parameters(), def.name(), null);
            return ActionResult.of(store(record.failed(
                INVALID_PARAMETERS + ": " + String.join("; ", validation.errors()), clock.instant())));
        }
        var params = validation.parameters();
        var valueSats = def.hasValueParameter() ? (Long) params.get(def.valueParameter()) : null;
        var base = newRecord(userId, actorId, request, def, params, describer.describe(def, params), valueSats);

        var admitted = locks.withLock(userId, () -> {
            var decision = permissions.check(userId, def.id());
            if (!decision.isAllowed()) {
                return store(base.denied(decision.reason(), clock.instant()));
            }
            if (decision.requiresConfirmation()) {
                var pending = new ActionExecutionRecord(base.id(), userId, base.actorId(), def.id(), def.category(),
                    params, request.conversationId(), request.messageId(), ActionStatus.PENDING_CONFIRMATION,
                    base.description(), null, null, valueSats, base.createdAt(), null,
                    base.createdAt().plus(pendingTtl));
                return store(pending);
            }
            // Pending actions meet the ceiling at confirmation.
            if (exceedsCeiling(decision, valueSats)) {
                return store(base.denied(EXCEEDS_LIMIT, clock.instant()));
            }
            records.insert(base);
            usage.countActionExecution(userId, def.id());
            return base;
        });

        if (admitted.status() != ActionStatus.EXECUTING) {
            return ActionResult.of(admitted);
        }
        return perform(admitted, def);
    }

    public ActionResult confirm(String userId, String actorId, String recordId) {
        var existing = records.find(userId, recordId)
            .filter(r -> r.status() == ActionStatus.PENDING_CONFIRMATION)
            .orElseThrow(() -> new ActionNotPendingException(recordId));
        var def = catalog.find(existing.actionId()).orElseThrow(() -> new ActionNotPendingException(recordId));

        var admitted = locks.withLock(userId, () -> {
            var current = records.find(userId, recordId)
                .filter(r -> r.status() == ActionStatus.PENDING_CONFIRMATION)
                .orElseThrow(() -> new ActionNotPendingException(recordId));
            var now = clock.instant();
            if (current.isExpired(now)) {
                return resolvePending(current.denied(EXPIRED, now));
            }
            var decision = permissions.check(userId, def.id());
            if (!decision.isAllowed()) {
                return resolvePending(current.denied(decision.reason(), now));
            }
            if (exceedsCeiling(decision, current.valueSats())) {
                return resolvePending(current.denied(EXCEEDS_LIMIT, now));
            }
            var executing = current.executing();
            if (!records.transition(executing, ActionStatus.PENDING_CONFIRMATION)) {
                throw new ActionNotPendingException(recordId);
            }
            usage.countActionExecution(userId, def.id());
            log.info("Action {} ({}) confirmed by actor {}", recordId, def.id(), actorId);
            return executing;
        });

        if (admitted.status() != ActionStatus.EXECUTING) {
            return ActionResult.of(admitted);
        }
        return perform(admitted, def);
    }

    public ActionResult reject(String userId, String recordId) {
        var rejected = locks.withLock(userId, () -> {
            var current = records.find(userId, recordId)
                .filter(r -> r.status() == ActionStatus.PENDING_CONFIRMATION)
                .orElseThrow(() -> new ActionNotPendingException(recordId));
            return resolvePending(current.denied(REJECTED, clock.instant()));
        });
        return ActionResult.of(rejected);
    }

    /** Pending actions still awaiting a decision; expired ones can only be denied and are left out. */
    public List<ActionExecutionRecord> listPending(String userId) {
        var now = clock.instant();
        return records.listPending(userId).stream()
            .filter(r -> !r.isExpired(now))
            .toList();
    }

    public List<ActionExecutionRecord> history(String userId, HistoryFilter filter) {
        return records.history(userId, filter);
    }

    private ActionResult perform(ActionExecutionRecord executing, ActionDefinition def) {
        ActionExecutionRecord outcome;
        try {
            var summary = handlers.get(def.id())
                .execute(new ActionContext(executing.userId(), executing.actorId(), def, executing.parameters()));
            outcome = executing.succeeded(summary, clock.instant());
        } catch (RuntimeException e) {
            log.warn("Action {} ({}) failed: {}", executing.id(), def.id(), e.getMessage());
            outcome = executing.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                clock.instant());
        }
        if (!records.transition(outcome, ActionStatus.EXECUTING)) {
            log.error("Action {} left executing state unexpectedly", executing.id());
        }
        metrics.actions(outcome.status().id()).increment();
        log.info("Action {} ({}) for user {} -> {}", executing.id(), def.id(), executing.userId(),
            outcome.status().id());
        return ActionResult.of(outcome);
    }

    private ActionExecutionRecord resolvePending(ActionExecutionRecord resolved) {
        if (!records.transition(resolved, ActionStatus.PENDING_CONFIRMATION)) {
            throw new ActionNotPendingException(resolved.id());
        }
        metrics.actions(resolved.status().id()).increment();
        log.info("Pending action {} ({}) -> {} ({})", resolved.id(), resolved.actionId(),
            resolved.status().id(), resolved.errorMessage());
        return resolved;
    }

    private ActionExecutionRecord store(ActionExecutionRecord record) {
        records.insert(record);
        metrics.actions(record.status().id()).increment();
        log.info("Action {} ({}) for user {} -> {}{}", record.id(), record.actionId(), record.userId(),
            record.status().id(), record.errorMessage() != null ? " (" + record.errorMessage() + ")" : "");
        return record;
    }

    private static boolean exceedsCeiling(PermissionDecision decision, Long valueSats) {
        var ceiling = decision.grant() != null ? decision.grant().maxValuePerAction() : null;
        return ceiling != null && valueSats != null && valueSats > ceiling;
    }

    // Built as executing; denied, failed and pending records are derived from it.
    private ActionExecutionRecord newRecord(String userId, String actorId, ActionRequest request,
                                            ActionDefinition def, Map<String, Object> params,
                                            String description, Long valueSats) {
        return new ActionExecutionRecord(UUID.randomUUID().toString(), userId,
            actorId != null ? actorId : userId, request.actionId(), def != null ? def.category() : null,
            params, request.conversationId(), request.messageId(), ActionStatus.EXECUTING, description,
            null, null, valueSats, clock.instant(), null, null);
    }
}
