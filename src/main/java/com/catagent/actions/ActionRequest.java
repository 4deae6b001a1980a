package com.catagent.actions;

import java.util.Map;

public record ActionRequest(String actionId, Map<String, Object> parameters, String conversationId, String messageId) {

    public ActionRequest {
        parameters = parameters != null ? parameters : Map.of();
    }

    public static ActionRequest of(String actionId, Map<String, Object> parameters) {
        return new ActionRequest(actionId, parameters, null, null);
    }
}
