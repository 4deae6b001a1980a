package com.catagent.auth;

/**
 * Identity of the caller as established upstream. {@code actorId} is the profile the user
 * is acting as and defaults to the user itself.
 */
public record CurrentUser(String userId, String actorId) {

    public CurrentUser {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be empty");
        }
        if (actorId == null || actorId.isBlank()) {
            actorId = userId;
        }
    }

    public static CurrentUser of(String userId) {
        return new CurrentUser(userId, userId);
    }
}
