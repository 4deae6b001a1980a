package com.catagent.shared.error;

import java.util.Map;

/**
 * Base of every failure the engine surfaces to callers. The {@link ErrorCode} decides
 * the HTTP status and the machine-readable code in error bodies.
 */
public abstract class CatAgentException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> details;

    protected CatAgentException(ErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    protected CatAgentException(ErrorCode code, String message, Map<String, Object> details) {
        this(code, message, details, null);
    }

    protected CatAgentException(ErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public ErrorCode code() {
        return code;
    }

    public Map<String, Object> details() {
        return details;
    }
}
