package com.catagent.actions;

import java.util.List;
import java.util.Map;

/** Builds the one-line text shown to a user asked to confirm an action. */
public class ActionDescriber {

    private static final int MAX_SNIPPET = 80;
    private static final List<String> SUBJECT_KEYS = List.of("title", "name", "recipient", "recipient_id",
        "user_id", "project_id", "entity_id", "content", "message");

    public String describe(ActionDefinition definition, Map<String, Object> parameters) {
        var text = new StringBuilder(definition.name());
        for (var key : SUBJECT_KEYS) {
            var value = parameters.get(key);
            if (value != null) {
                text.append(": \"").append(snippet(String.valueOf(value))).append('"');
                break;
            }
        }
        if (definition.hasValueParameter() && parameters.get(definition.valueParameter()) != null) {
            text.append(" (").append(parameters.get(definition.valueParameter())).append(" sats)");
        }
        return text.toString();
    }

    private static String snippet(String value) {
        var flat = value.replaceAll("\\s+", " ").trim();
        return flat.length() > MAX_SNIPPET ? flat.substring(0, MAX_SNIPPET - 3) + "..." : flat;
    }
}
