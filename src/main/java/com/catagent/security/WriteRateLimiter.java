package com.catagent.security;

import com.catagent.shared.error.RateLimitedException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sliding-window limiter for mutating endpoints, keyed by user id. A user's window is
 * dropped once every timestamp in it has aged out.
 */
public class WriteRateLimiter {

    private static final Duration WINDOW = Duration.ofMinutes(1);
    private static final int SWEEP_EVERY = 1024;

    private final int maxWritesPerMinute;
    private final Clock clock;
    private final ConcurrentHashMap<String, ArrayDeque<Instant>> windows = new ConcurrentHashMap<>();
    private final AtomicLong acquisitions = new AtomicLong();

    public WriteRateLimiter(int maxWritesPerMinute) {
        this(maxWritesPerMinute, Clock.systemUTC());
    }

    public WriteRateLimiter(int maxWritesPerMinute, Clock clock) {
        this.maxWritesPerMinute = maxWritesPerMinute;
        this.clock = clock;
    }

    public RateLimitStatus acquire(String userId) {
        if (acquisitions.incrementAndGet() % SWEEP_EVERY == 0) {
            evictIdle();
        }
        var now = clock.instant();
        var status = new RateLimitStatus[1];
        // compute() runs under the map's lock for this key; a throw leaves the mapping as it was.
        windows.compute(userId, (k, existing) -> {
            var times = existing != null ? existing : new ArrayDeque<Instant>();
            evict(times, now);
            if (times.size() >= maxWritesPerMinute) {
                var resetAt = times.peekFirst().plus(WINDOW);
                var retryAfter = Math.max(1, Duration.between(now, resetAt).toSeconds());
                throw new RateLimitedException(maxWritesPerMinute, retryAfter, resetAt);
            }
            times.addLast(now);
            status[0] = new RateLimitStatus(maxWritesPerMinute, maxWritesPerMinute - times.size(),
                times.peekFirst().plus(WINDOW));
            return times;
        });
        return status[0];
    }

    public int count(String userId) {
        var now = clock.instant();
        var size = new int[1];
        windows.computeIfPresent(userId, (k, times) -> {
            evict(times, now);
            size[0] = times.size();
            return times.isEmpty() ? null : times;
        });
        return size[0];
    }

    /** Drops the windows of users with no write inside the last minute. */
    public void evictIdle() {
        var now = clock.instant();
        for (var userId : windows.keySet()) {
            windows.computeIfPresent(userId, (k, times) -> {
                evict(times, now);
                return times.isEmpty() ? null : times;
            });
        }
    }

    int trackedUsers() {
        return windows.size();
    }

    private static void evict(ArrayDeque<Instant> times, Instant now) {
        var cutoff = now.minus(WINDOW);
        while (!times.isEmpty() && !times.peekFirst().isAfter(cutoff)) {
            times.pollFirst();
        }
    }
}
