package com.catagent.actions;

import java.util.Map;

public record ActionContext(String userId, String actorId, ActionDefinition definition, Map<String, Object> parameters) {}
