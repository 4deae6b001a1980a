package com.catagent.actions.gateway;

import java.util.Map;

/**
 * Mutations on the business entities the assistant manages. Implementations report
 * failures by throwing; the caller records them.
 */
public interface EntityGateway {

    EntityResult create(String entityType, String userId, String actorId, Map<String, Object> fields);

    EntityResult update(String entityType, String entityId, String userId, String actorId, Map<String, Object> fields);

    EntityResult delete(String entityType, String entityId, String userId, String actorId);
}
