package com.catagent.providers;

public record TokenUsage(long inputTokens, long outputTokens) {

    public static final TokenUsage ZERO = new TokenUsage(0, 0);

    public long totalTokens() {
        return inputTokens + outputTokens;
    }

    /** Rough count used when the provider reports nothing: four characters per token. */
    public static TokenUsage estimate(long promptChars, long outputChars) {
        return new TokenUsage(ceilQuarter(promptChars), ceilQuarter(outputChars));
    }

    private static long ceilQuarter(long chars) {
        return (chars + 3) / 4;
    }
}
