package com.catagent.shared.error;

import java.util.Map;

public class ActionLimitExceededException extends CatAgentException {
    public ActionLimitExceededException(String actionId, Map<String, Object> details) {
        super(ErrorCode.ACTION_LIMIT_EXCEEDED, "Value ceiling exceeded for action " + actionId, details);
    }
}
