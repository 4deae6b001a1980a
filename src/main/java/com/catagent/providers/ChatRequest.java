package com.catagent.providers;

import java.util.List;
import java.util.Map;

public record ChatRequest(
    String model,
    List<Map<String, Object>> messages,
    double temperature
) {
    public long promptChars() {
        return messages.stream()
            .mapToLong(m -> String.valueOf(m.getOrDefault("content", "")).length())
            .sum();
    }
}
