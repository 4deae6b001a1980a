package com.catagent.shared.error;

import java.util.Map;

public class InvalidRequestException extends CatAgentException {
    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }

    public InvalidRequestException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_REQUEST, message, details);
    }
}
