package com.catagent.actions.gateway;

public record EntityResult(String entityType, String entityId, String summary) {}
