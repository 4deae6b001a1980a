package com.catagent.security;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped reentrant locks keyed by user id. Permission changes and the executor's
 * check-then-execute step share a user's stripe so they never interleave for that user.
 * Unrelated users may share a stripe; the lock count stays fixed however many users are seen.
 */
public class UserLocks {

    static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public UserLocks() {
        this(DEFAULT_STRIPES);
    }

    public UserLocks(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String userId, Supplier<T> body) {
        var lock = stripeFor(userId);
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String userId, Runnable body) {
        withLock(userId, () -> {
            body.run();
            return null;
        });
    }

    ReentrantLock stripeFor(String userId) {
        return stripes[Math.floorMod(userId.hashCode(), stripes.length)];
    }
}
