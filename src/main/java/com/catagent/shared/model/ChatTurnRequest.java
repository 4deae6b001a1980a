package com.catagent.shared.model;

import java.util.List;
import java.util.Map;

public record ChatTurnRequest(
    String message,
    String model,
    Boolean stream,
    String conversationId,
    List<Map<String, Object>> history
) {
    public ChatTurnRequest(String message, String model) {
        this(message, model, false, null, List.of());
    }
}
