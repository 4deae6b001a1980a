package com.catagent.permissions;

import com.catagent.actions.ActionCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPermissionStore implements PermissionStore {

    private final Map<String, Map<String, PermissionGrant>> byAction = new ConcurrentHashMap<>();
    private final Map<String, Map<ActionCategory, PermissionGrant>> byCategory = new ConcurrentHashMap<>();

    @Override
    public Optional<PermissionGrant> findSpecific(String userId, String actionId) {
        return Optional.ofNullable(byAction.getOrDefault(userId, Map.of()).get(actionId));
    }

    @Override
    public Optional<PermissionGrant> findWildcard(String userId, ActionCategory category) {
        return Optional.ofNullable(byCategory.getOrDefault(userId, Map.of()).get(category));
    }

    @Override
    public void save(PermissionGrant grant) {
        if (grant.isWildcard()) {
            byCategory.computeIfAbsent(grant.userId(), k -> new ConcurrentHashMap<>()).put(grant.category(), grant);
        } else {
            byAction.computeIfAbsent(grant.userId(), k -> new ConcurrentHashMap<>()).put(grant.actionId(), grant);
        }
    }

    @Override
    public List<PermissionGrant> list(String userId) {
        var out = new ArrayList<PermissionGrant>(byCategory.getOrDefault(userId, Map.of()).values());
        out.addAll(byAction.getOrDefault(userId, Map.of()).values());
        return out;
    }
}
