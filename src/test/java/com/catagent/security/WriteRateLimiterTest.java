package com.catagent.security;

import com.catagent.shared.error.RateLimitedException;
import com.catagent.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class WriteRateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));

    @Test
    void allowsWithinLimit() {
        var limiter = new WriteRateLimiter(3, clock);
        assertEquals(2, limiter.acquire("u1").remaining());
        assertEquals(1, limiter.acquire("u1").remaining());
        assertEquals(0, limiter.acquire("u1").remaining());
        assertEquals(3, limiter.count("u1"));
    }

    @Test
    void rejectsWithRetryAfterWhenLimitExceeded() {
        var limiter = new WriteRateLimiter(2, clock);
        limiter.acquire("u1");
        clock.advance(Duration.ofSeconds(20));
        limiter.acquire("u1");

        var ex = assertThrows(RateLimitedException.class, () -> limiter.acquire("u1"));
        assertEquals(2, ex.limit());
        assertEquals(40, ex.retryAfterSeconds());
        assertEquals(Instant.parse("2026-03-01T10:01:00Z"), ex.resetAt());
    }

    @Test
    void windowSlides() {
        var limiter = new WriteRateLimiter(1, clock);
        limiter.acquire("u1");
        assertThrows(RateLimitedException.class, () -> limiter.acquire("u1"));
        clock.advance(Duration.ofSeconds(60));
        assertDoesNotThrow(() -> limiter.acquire("u1"));
    }

    @Test
    void usersAreIndependent() {
        var limiter = new WriteRateLimiter(1, clock);
        limiter.acquire("u1");
        assertDoesNotThrow(() -> limiter.acquire("u2"));
        assertEquals(0, limiter.count("nobody"));
    }

    @Test
    void idleUsersAreForgottenOnceTheirWindowPasses() {
        var limiter = new WriteRateLimiter(5, clock);
        for (int i = 0; i < 100; i++) {
            limiter.acquire("user-" + i);
        }
        assertEquals(100, limiter.trackedUsers());

        clock.advance(Duration.ofSeconds(61));
        assertEquals(0, limiter.count("user-0"));
        assertEquals(99, limiter.trackedUsers());

        limiter.evictIdle();
        assertEquals(0, limiter.trackedUsers());
        assertEquals(4, limiter.acquire("user-1").remaining());
    }

    @Test
    void rejectedAcquireKeepsExistingWindow() {
        var limiter = new WriteRateLimiter(1, clock);
        limiter.acquire("u1");

        assertThrows(RateLimitedException.class, () -> limiter.acquire("u1"));

        assertEquals(1, limiter.count("u1"));
        assertEquals(1, limiter.trackedUsers());
    }
}
