package com.catagent.gateway.http;

import com.catagent.security.RateLimitStatus;
import com.catagent.security.WriteRateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Set;

/**
 * Counts POST and DELETE requests per user against the per-minute write budget and
 * reports the budget in {@code X-RateLimit-*} headers.
 */
public class WriteRateLimitInterceptor implements HandlerInterceptor {

    private static final Set<String> WRITE_METHODS = Set.of("POST", "PUT", "DELETE");

    private final WriteRateLimiter limiter;

    public WriteRateLimitInterceptor(WriteRateLimiter limiter) {
        this.limiter = limiter;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!WRITE_METHODS.contains(request.getMethod())) {
            return true;
        }
        var userId = request.getHeader(CurrentUserArgumentResolver.USER_HEADER);
        if (userId == null || userId.isBlank()) {
            return true;
        }
        writeHeaders(response, limiter.acquire(userId.trim()));
        return true;
    }

    static void writeHeaders(HttpServletResponse response, RateLimitStatus status) {
        response.setHeader("X-RateLimit-Limit", String.valueOf(status.limit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(status.remaining()));
        response.setHeader("X-RateLimit-Reset", String.valueOf(status.resetAt().getEpochSecond()));
    }
}
