package com.catagent.actions.parse;

import java.util.Map;

public record ProposedAction(String actionId, Map<String, Object> parameters) {}
