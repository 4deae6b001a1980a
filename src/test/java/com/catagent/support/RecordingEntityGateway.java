package com.catagent.support;

import com.catagent.actions.gateway.EntityGateway;
import com.catagent.actions.gateway.EntityResult;
import com.catagent.shared.error.ExecutionFailedException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingEntityGateway implements EntityGateway {

    public record Call(String operation, String entityType, String entityId, String userId, String actorId,
                       Map<String, Object> fields) {}

    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private volatile String failWith;

    public List<Call> calls() {
        return calls;
    }

    public void failWith(String message) {
        this.failWith = message;
    }

    @Override
    public EntityResult create(String entityType, String userId, String actorId, Map<String, Object> fields) {
        record("create", entityType, null, userId, actorId, fields);
        var id = entityType + "-" + calls.size();
        return new EntityResult(entityType, id, "Created " + entityType + " " + id);
    }

    @Override
    public EntityResult update(String entityType, String entityId, String userId, String actorId,
                               Map<String, Object> fields) {
        record("update", entityType, entityId, userId, actorId, fields);
        return new EntityResult(entityType, entityId, "Updated " + entityType + " " + entityId);
    }

    @Override
    public EntityResult delete(String entityType, String entityId, String userId, String actorId) {
        record("delete", entityType, entityId, userId, actorId, Map.of());
        return new EntityResult(entityType, entityId, "Deleted " + entityType + " " + entityId);
    }

    private void record(String operation, String entityType, String entityId, String userId, String actorId,
                        Map<String, Object> fields) {
        calls.add(new Call(operation, entityType, entityId, userId, actorId, fields));
        if (failWith != null) {
            throw new ExecutionFailedException(failWith, Map.of("entityType", entityType));
        }
    }
}
