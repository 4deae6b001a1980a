package com.catagent.permissions;

import java.util.List;

public record PermissionSummary(
    List<PermissionGrant> grants,
    List<CategorySummary> categories,
    int totalActions,
    int enabledActions,
    boolean highRiskEnabled
) {}
