package com.catagent.shared.error;

import java.util.Map;

public class ExecutionFailedException extends CatAgentException {
    public ExecutionFailedException(String message, Map<String, Object> details) {
        super(ErrorCode.EXECUTION_FAILED, message, details);
    }
}
