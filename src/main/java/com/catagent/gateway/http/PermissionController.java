package com.catagent.gateway.http;

import com.catagent.actions.ActionCatalog;
import com.catagent.actions.ActionCategory;
import com.catagent.auth.CurrentUser;
import com.catagent.permissions.GrantOptions;
import com.catagent.permissions.PermissionGrant;
import com.catagent.permissions.PermissionService;
import com.catagent.shared.error.InvalidRequestException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/cat/permissions")
public class PermissionController {

    public record GrantBody(String actionId, String category, Boolean requiresConfirmation,
                            Integer dailyLimit, Long maxValuePerAction) {}

    private final PermissionService permissions;
    private final ActionCatalog catalog;

    public PermissionController(PermissionService permissions, ActionCatalog catalog) {
        this.permissions = permissions;
        this.catalog = catalog;
    }

    @GetMapping
    public Map<String, Object> list(CurrentUser user) {
        var summary = permissions.summary(user.userId());
        var body = new LinkedHashMap<String, Object>();
        body.put("grants", summary.grants());
        body.put("summary", summary);
        body.put("catalog", catalog.all());
        return body;
    }

    @PostMapping
    public PermissionGrant grant(CurrentUser user, @RequestBody GrantBody body) {
        if (body.actionId() == null || body.actionId().isBlank()) {
            throw new InvalidRequestException("actionId is required");
        }
        var options = new GrantOptions(body.requiresConfirmation(), body.dailyLimit(), body.maxValuePerAction());
        return permissions.grant(user.userId(), body.actionId().trim(), category(body.category()), options);
    }

    @PostMapping("/defaults")
    public Map<String, Object> initializeDefaults(CurrentUser user) {
        permissions.initializeDefaults(user.userId());
        return list(user);
    }

    @DeleteMapping
    public Map<String, Object> revoke(CurrentUser user,
                                      @RequestParam(required = false) String actionId,
                                      @RequestParam String category,
                                      @RequestParam(defaultValue = "false") boolean cascade) {
        var resolved = category(category);
        var target = actionId == null || actionId.isBlank() ? PermissionGrant.WILDCARD : actionId.trim();
        if (cascade && PermissionGrant.WILDCARD.equals(target)) {
            var revoked = permissions.revokeCategory(user.userId(), resolved);
            return Map.of("revoked", revoked);
        }
        permissions.revoke(user.userId(), target, resolved);
        return Map.of("revoked", 1);
    }

    private static ActionCategory category(String id) {
        if (id == null || id.isBlank()) {
            throw new InvalidRequestException("category is required");
        }
        try {
            return ActionCategory.fromId(id.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
    }
}
