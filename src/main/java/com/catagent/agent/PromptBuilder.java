package com.catagent.agent;

import com.catagent.actions.ActionCatalog;
import com.catagent.actions.ActionDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class PromptBuilder {

    private static final String SYSTEM_PROMPT = """
            You are My Cat, a helpful assistant inside OrangeCat, a Bitcoin-native platform where people \
            sell products and services, fund projects and support causes. \
            Reply in the same language the user uses. Keep answers short and practical.

            When the user clearly asks you to do something you can do, include one block per action, \
            each starting on its own line:

            ```action
            {"action": "<action id>", "parameters": {"<name>": <value>}}
            ```

            Only use the actions listed below and only the listed parameters. Amounts are whole sats. \
            Never invent ids. The user may need to confirm before anything happens, so describe what \
            you proposed in plain words outside the block.

            Available actions:
            %s""";

    private final ActionCatalog catalog;

    public PromptBuilder(ActionCatalog catalog) {
        this.catalog = catalog;
    }

    public List<Map<String, Object>> build(String userMessage, List<Map<String, Object>> history) {
        if (userMessage == null || userMessage.isBlank()) {
            throw new IllegalArgumentException("userMessage must not be empty");
        }
        var messages = new ArrayList<Map<String, Object>>();
        messages.add(Map.of("role", "system", "content", systemPrompt()));
        if (history != null) {
            for (var turn : history) {
                var role = String.valueOf(turn.get("role"));
                if (("user".equals(role) || "assistant".equals(role)) && turn.get("content") != null) {
                    messages.add(Map.of("role", role, "content", String.valueOf(turn.get("content"))));
                }
            }
        }
        messages.add(Map.of("role", "user", "content", userMessage));
        return messages;
    }

    String systemPrompt() {
        var actions = catalog.enabled().stream()
            .map(PromptBuilder::describe)
            .collect(Collectors.joining("\n"));
        return SYSTEM_PROMPT.formatted(actions);
    }

    private static String describe(ActionDefinition def) {
        var params = def.parameters().stream()
            .map(p -> p.name() + (p.required() ? "" : "?") + ":" + p.type().name().toLowerCase())
            .collect(Collectors.joining(", "));
        return "- " + def.id() + " (" + def.description() + "): " + params;
    }
}
