package com.catagent.actions.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pulls {@code ```action} blocks out of model output. A block opens with a fence at the
 * start of a line and closes at the next {@code ```}. Every closed block is removed from
 * the display text; only blocks holding a JSON object with a non-empty {@code action}
 * (or {@code type}) and a {@code parameters} object become actions. Text without a closed
 * block is returned untouched; blank lines are only collapsed where a block was cut out.
 * Never throws.
 */
public class ResponseActionParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseActionParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String OPEN = "```action";
    private static final String CLOSE = "```";

    public ParsedResponse parse(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return new ParsedResponse(rawText == null ? "" : rawText, List.of());
        }
        try {
            return scan(rawText);
        } catch (RuntimeException e) {
            log.warn("Action extraction failed, returning text unchanged", e);
            return new ParsedResponse(rawText, List.of());
        }
    }

    private ParsedResponse scan(String text) {
        var display = new StringBuilder();
        var actions = new ArrayList<ProposedAction>();
        var removed = false;
        int pos = 0;

        while (pos < text.length()) {
            int open = findOpeningFence(text, pos);
            if (open < 0) break;
            int bodyStart = open + OPEN.length();
            int close = text.indexOf(CLOSE, bodyStart);
            if (close < 0) break;

            display.append(text, pos, open);
            stripTrailingNewlines(display);
            parseBlock(text.substring(bodyStart, close)).ifPresent(actions::add);
            pos = skipNewlines(text, close + CLOSE.length());
            if (display.length() > 0 && pos < text.length()) {
                display.append("\n\n");
            }
            removed = true;
        }
        if (!removed) {
            return new ParsedResponse(text, List.of());
        }
        display.append(text, pos, text.length());
        return new ParsedResponse(display.toString(), List.copyOf(actions));
    }

    private static int findOpeningFence(String text, int from) {
        int idx = text.indexOf(OPEN, from);
        while (idx >= 0) {
            boolean lineStart = idx == 0 || text.charAt(idx - 1) == '\n';
            int after = idx + OPEN.length();
            boolean tagEnds = after >= text.length() || Character.isWhitespace(text.charAt(after));
            if (lineStart && tagEnds) return idx;
            idx = text.indexOf(OPEN, idx + 1);
        }
        return -1;
    }

    private Optional<ProposedAction> parseBlock(String body) {
        JsonNode node;
        try {
            node = MAPPER.readTree(body.trim());
        } catch (JsonProcessingException e) {
            log.debug("Dropping action block with invalid JSON");
            return Optional.empty();
        }
        if (node == null || !node.isObject()) return Optional.empty();

        var id = node.path("action");
        if (!id.isTextual() || id.asText().isBlank()) id = node.path("type");
        if (!id.isTextual() || id.asText().isBlank()) return Optional.empty();

        var params = node.path("parameters");
        if (!params.isObject()) return Optional.empty();

        Map<String, Object> parameters = MAPPER.convertValue(params, MAP_TYPE);
        return Optional.of(new ProposedAction(id.asText().trim(), parameters));
    }

    private static void stripTrailingNewlines(StringBuilder sb) {
        while (sb.length() > 0 && isNewline(sb.charAt(sb.length() - 1))) {
            sb.setLength(sb.length() - 1);
        }
    }

    private static int skipNewlines(String text, int from) {
        int pos = from;
        while (pos < text.length() && isNewline(text.charAt(pos))) pos++;
        return pos;
    }

    private static boolean isNewline(char c) {
        return c == '\n' || c == '\r';
    }
}
