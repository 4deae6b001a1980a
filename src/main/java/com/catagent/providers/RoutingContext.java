package com.catagent.providers;

import java.util.List;
import java.util.Map;

public record RoutingContext(String message, List<Map<String, Object>> history) {

    public RoutingContext {
        message = message != null ? message : "";
        history = history != null ? history : List.of();
    }

    public static RoutingContext of(String message) {
        return new RoutingContext(message, List.of());
    }
}
