package com.catagent.permissions;

import com.catagent.actions.ActionCategory;

import java.util.List;
import java.util.Optional;

/**
 * Two independent keyspaces: per-action grants keyed by (user, actionId) and category
 * wildcards keyed by (user, category). Lookups never mix them.
 */
public interface PermissionStore {

    Optional<PermissionGrant> findSpecific(String userId, String actionId);

    Optional<PermissionGrant> findWildcard(String userId, ActionCategory category);

    void save(PermissionGrant grant);

    List<PermissionGrant> list(String userId);
}
