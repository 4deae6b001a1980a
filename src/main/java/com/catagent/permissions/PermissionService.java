package com.catagent.permissions;

import com.catagent.actions.ActionCatalog;
import com.catagent.actions.ActionCategory;
import com.catagent.actions.ActionDefinition;
import com.catagent.actions.RiskLevel;
import com.catagent.security.UserLocks;
import com.catagent.shared.error.InvalidRequestException;
import com.catagent.shared.error.UnknownActionException;
import com.catagent.usage.UsageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;

import static com.catagent.permissions.PermissionDecision.ACTION_DISABLED;
import static com.catagent.permissions.PermissionDecision.DAILY_LIMIT_REACHED;
import static com.catagent.permissions.PermissionDecision.NO_GRANT;
import static com.catagent.permissions.PermissionDecision.REVOKED;
import static com.catagent.permissions.PermissionDecision.UNKNOWN_ACTION;
import static com.catagent.permissions.PermissionGrant.WILDCARD;

/**
 * Grants, revocations and checks for what the assistant may do on a user's behalf.
 * A record for a specific action always takes precedence over the category wildcard,
 * whether that record is active or revoked.
 */
public class PermissionService {

    private static final Logger log = LoggerFactory.getLogger(PermissionService.class);

    private final PermissionStore store;
    private final ActionCatalog catalog;
    private final UsageService usage;
    private final UserLocks locks;
    private final Clock clock;

    public PermissionService(PermissionStore store, ActionCatalog catalog, UsageService usage,
                             UserLocks locks, Clock clock) {
        this.store = store;
        this.catalog = catalog;
        this.usage = usage;
        this.locks = locks;
        this.clock = clock;
    }

    public PermissionDecision check(String userId, String actionId) {
        return locks.withLock(userId, () -> evaluate(userId, actionId));
    }

    private PermissionDecision evaluate(String userId, String actionId) {
        var definition = catalog.find(actionId);
        if (definition.isEmpty()) return PermissionDecision.denied(UNKNOWN_ACTION);
        var def = definition.get();
        if (!def.enabled()) return PermissionDecision.denied(ACTION_DISABLED);

        var specific = store.findSpecific(userId, actionId);
        PermissionGrant grant;
        if (specific.isPresent()) {
            if (!specific.get().isActive()) return PermissionDecision.denied(REVOKED);
            grant = specific.get();
        } else {
            var wildcard = store.findWildcard(userId, def.category()).filter(PermissionGrant::isActive);
            if (wildcard.isEmpty()) return PermissionDecision.denied(NO_GRANT);
            grant = wildcard.get();
        }

        Long used = null;
        if (grant.dailyLimit() != null) {
            used = usage.actionCountToday(userId, actionId);
            if (used >= grant.dailyLimit()) {
                return PermissionDecision.denied(DAILY_LIMIT_REACHED, grant, used);
            }
        }
        var confirm = grant.requiresConfirmation() || def.mandatoryConfirmation();
        return PermissionDecision.allowed(grant, confirm, used);
    }

    public PermissionGrant grant(String userId, String actionId, ActionCategory category, GrantOptions options) {
        validateKey(actionId, category);
        var grant = new PermissionGrant(userId, actionId, category, options.requiresConfirmation(),
            options.dailyLimit(), options.maxValuePerAction(), clock.instant(), null);
        locks.withLock(userId, () -> store.save(grant));
        log.info("Granted {}/{} to user {} (confirm={}, dailyLimit={}, maxValue={})", category.id(), actionId,
            userId, grant.requiresConfirmation(), grant.dailyLimit(), grant.maxValuePerAction());
        return grant;
    }

    /**
     * Soft-deletes one key. Revoking a specific action with no record stores a revoked
     * placeholder so the category wildcard no longer applies to it. Revoking the wildcard
     * leaves specific grants untouched.
     */
    public void revoke(String userId, String actionId, ActionCategory category) {
        validateKey(actionId, category);
        locks.withLock(userId, () -> {
            var now = clock.instant();
            var existing = WILDCARD.equals(actionId)
                ? store.findWildcard(userId, category)
                : store.findSpecific(userId, actionId);
            if (existing.isPresent()) {
                if (existing.get().isActive()) {
                    store.save(existing.get().revoke(now));
                }
            } else if (!WILDCARD.equals(actionId)) {
                store.save(new PermissionGrant(userId, actionId, category, true, null, null, now, now));
            }
        });
        log.info("Revoked {}/{} for user {}", category.id(), actionId, userId);
    }

    public int revokeCategory(String userId, ActionCategory category) {
        int revoked = locks.withLock(userId, () -> {
            var now = clock.instant();
            int count = 0;
            for (var grant : store.list(userId)) {
                if (grant.category() == category && grant.isActive()) {
                    store.save(grant.revoke(now));
                    count++;
                }
            }
            return count;
        });
        log.info("Revoked {} grants in category {} for user {}", revoked, category.id(), userId);
        return revoked;
    }

    public void initializeDefaults(String userId) {
        for (var category : ActionCategory.values()) {
            if (category.defaultEnabled() && store.findWildcard(userId, category).isEmpty()) {
                grant(userId, WILDCARD, category, GrantOptions.defaults());
            }
        }
    }

    public PermissionSummary summary(String userId) {
        return locks.withLock(userId, () -> {
            var grants = store.list(userId);
            var categories = new ArrayList<CategorySummary>();
            int enabledTotal = 0;
            for (var category : ActionCategory.values()) {
                var actions = catalog.byCategory(category);
                var wildcard = store.findWildcard(userId, category).filter(PermissionGrant::isActive).isPresent();
                int enabled = (int) actions.stream().filter(a -> effectiveGrant(userId, a).isPresent()).count();
                enabledTotal += enabled;
                categories.add(new CategorySummary(category, category.displayName(), category.description(),
                    enabled > 0, wildcard, category.defaultEnabled(), actions.size(), enabled));
            }
            var highRisk = catalog.enabled().stream()
                .anyMatch(a -> a.riskLevel() == RiskLevel.HIGH && effectiveGrant(userId, a).isPresent());
            return new PermissionSummary(grants, categories, catalog.enabled().size(), enabledTotal, highRisk);
        });
    }

    private Optional<PermissionGrant> effectiveGrant(String userId, ActionDefinition def) {
        var specific = store.findSpecific(userId, def.id());
        if (specific.isPresent()) return specific.filter(PermissionGrant::isActive);
        return store.findWildcard(userId, def.category()).filter(PermissionGrant::isActive);
    }

    private void validateKey(String actionId, ActionCategory category) {
        if (actionId == null || actionId.isBlank()) {
            throw new InvalidRequestException("actionId must not be empty");
        }
        if (category == null) {
            throw new InvalidRequestException("category must not be empty");
        }
        if (WILDCARD.equals(actionId)) return;
        var def = catalog.find(actionId)
            .orElseThrow(() -> new UnknownActionException(actionId, Map.of("actionId", actionId)));
        if (def.category() != category) {
            throw new InvalidRequestException("Action " + actionId + " belongs to category " + def.category().id(),
                Map.of("actionId", actionId, "category", def.category().id()));
        }
    }
}
