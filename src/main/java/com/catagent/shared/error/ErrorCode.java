package com.catagent.shared.error;

public enum ErrorCode {
    AUTHENTICATION_REQUIRED(401),
    INVALID_REQUEST(400),
    NO_PROVIDER_AVAILABLE(503),
    RATE_LIMIT_EXCEEDED(429),
    DAILY_QUOTA_EXCEEDED(429),
    PERMISSION_DENIED(403),
    ACTION_LIMIT_EXCEEDED(403),
    UNKNOWN_ACTION(404),
    ACTION_NOT_PENDING(409),
    PROVIDER_ERROR(502),
    PROVIDER_AUTH_ERROR(401),
    EXECUTION_FAILED(502);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
