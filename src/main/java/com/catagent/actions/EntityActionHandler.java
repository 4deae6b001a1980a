package com.catagent.actions;

import com.catagent.actions.gateway.EntityGateway;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Default handler: maps an action definition's entity type and operation onto the
 * {@link EntityGateway}.
 */
public class EntityActionHandler implements ActionHandler {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final EntityGateway gateway;

    public EntityActionHandler(EntityGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public String execute(ActionContext ctx) {
        var def = ctx.definition();
        var params = ctx.parameters();
        return switch (def.operation()) {
            case CREATE -> gateway.create(def.entityType(), ctx.userId(), ctx.actorId(), params).summary();
            case UPDATE -> gateway.update(entityType(def, params), required(params, "entity_id"),
                ctx.userId(), ctx.actorId(), updates(params.get("updates"))).summary();
            case PUBLISH -> gateway.update(entityType(def, params), required(params, "entity_id"),
                ctx.userId(), ctx.actorId(), Map.of("status", "active")).summary();
            case DELETE -> gateway.delete(entityType(def, params), required(params, "entity_id"),
                ctx.userId(), ctx.actorId()).summary();
        };
    }

    private static String entityType(ActionDefinition def, Map<String, Object> params) {
        if (def.entityType() != null) return def.entityType();
        return required(params, "entity_type").trim().toLowerCase(Locale.ROOT);
    }

    private static String required(Map<String, Object> params, String name) {
        var value = params.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing parameter: " + name);
        }
        return String.valueOf(value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> updates(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        try {
            return MAPPER.readValue(String.valueOf(raw), new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("updates must be a JSON object", e);
        }
    }
}
