package com.catagent.shared.error;

import java.util.Map;

public class PermissionDeniedException extends CatAgentException {
    public PermissionDeniedException(String actionId, String reason, Map<String, Object> details) {
        super(ErrorCode.PERMISSION_DENIED, "Permission denied for action " + actionId + ": " + reason, details);
    }
}
