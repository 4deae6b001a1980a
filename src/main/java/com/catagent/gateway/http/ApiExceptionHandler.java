package com.catagent.gateway.http;

import com.catagent.shared.error.CatAgentException;
import com.catagent.shared.error.ErrorCode;
import com.catagent.shared.error.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders every failure as {@code {error, code, details}}. The content type is fixed to JSON
 * so event-stream requests rejected before streaming still get a readable body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimited(RateLimitedException e) {
        return ResponseEntity.status(e.code().httpStatus())
            .header("Retry-After", String.valueOf(e.retryAfterSeconds()))
            .header("X-RateLimit-Limit", String.valueOf(e.limit()))
            .header("X-RateLimit-Remaining", "0")
            .header("X-RateLimit-Reset", String.valueOf(e.resetAt().getEpochSecond()))
            .contentType(MediaType.APPLICATION_JSON)
            .body(body(e.getMessage(), e.code().name(), e.details()));
    }

    @ExceptionHandler(CatAgentException.class)
    public ResponseEntity<Map<String, Object>> handleEngine(CatAgentException e) {
        if (e.code().httpStatus() >= 500) {
            log.warn("{}: {}", e.code(), e.getMessage());
        }
        return ResponseEntity.status(e.code().httpStatus()).contentType(MediaType.APPLICATION_JSON)
            .body(body(e.getMessage(), e.code().name(), e.details()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON).body(body(e.getMessage(), ErrorCode.INVALID_REQUEST.name(), Map.of()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("Unhandled request failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).contentType(MediaType.APPLICATION_JSON)
            .body(body("Internal error", "INTERNAL_ERROR", Map.of()));
    }

    private static Map<String, Object> body(String error, String code, Map<String, Object> details) {
        var body = new LinkedHashMap<String, Object>();
        body.put("error", error != null ? error : code);
        body.put("code", code);
        body.put("details", details);
        return body;
    }
}
