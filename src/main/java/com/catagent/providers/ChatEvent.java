package com.catagent.providers;

/**
 * One element of a streamed completion. Text deltas carry {@code content}; the single
 * terminal event has {@code done} set and carries the aggregate usage.
 */
public record ChatEvent(String content, boolean done, TokenUsage usage) {

    public static ChatEvent delta(String content) {
        return new ChatEvent(content, false, null);
    }

    public static ChatEvent done(TokenUsage usage) {
        return new ChatEvent("", true, usage);
    }
}
