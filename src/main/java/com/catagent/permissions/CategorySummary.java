package com.catagent.permissions;

import com.catagent.actions.ActionCategory;

public record CategorySummary(
    ActionCategory category,
    String name,
    String description,
    boolean enabled,
    boolean wildcardGranted,
    boolean defaultEnabled,
    int actionCount,
    int enabledActionCount
) {}
