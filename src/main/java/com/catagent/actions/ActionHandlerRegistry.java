package com.catagent.actions;

import java.util.LinkedHashMap;
import java.util.Map;

public class ActionHandlerRegistry {

    private final Map<String, ActionHandler> handlers = new LinkedHashMap<>();
    private final ActionHandler fallback;

    public ActionHandlerRegistry(ActionHandler fallback) {
        this.fallback = fallback;
    }

    public void register(String actionId, ActionHandler handler) {
        if (handlers.containsKey(actionId)) {
            throw new IllegalArgumentException("Duplicate handler: " + actionId);
        }
        handlers.put(actionId, handler);
    }

    public ActionHandler get(String actionId) {
        return handlers.getOrDefault(actionId, fallback);
    }
}
