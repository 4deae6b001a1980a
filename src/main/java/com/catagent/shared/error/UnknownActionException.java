package com.catagent.shared.error;

import java.util.Map;

public class UnknownActionException extends CatAgentException {
    public UnknownActionException(String actionId, Map<String, Object> details) {
        super(ErrorCode.UNKNOWN_ACTION, "Unknown action: " + actionId, details);
    }
}
