package com.catagent.providers;

import com.catagent.shared.error.ProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Turns the {@code data:} lines of an OpenAI-style event stream into {@link ChatEvent}s.
 */
class SseCompletionStream implements CompletionStream {

    private static final Logger log = LoggerFactory.getLogger(SseCompletionStream.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String provider;
    private final Iterator<String> lines;
    private final Runnable onClose;
    private final long promptChars;

    private final StringBuilder emitted = new StringBuilder();
    private TokenUsage reported;
    private ChatEvent next;
    private boolean finished;
    private boolean closed;

    SseCompletionStream(String provider, Iterator<String> lines, Runnable onClose, long promptChars) {
        this.provider = provider;
        this.lines = lines;
        this.onClose = onClose;
        this.promptChars = promptChars;
    }

    @Override
    public boolean hasNext() {
        if (next != null) return true;
        if (finished || closed) return false;
        next = advance();
        return next != null;
    }

    @Override
    public ChatEvent next() {
        if (!hasNext()) throw new NoSuchElementException();
        var event = next;
        next = null;
        return event;
    }

    @Override
    public TokenUsage usageSoFar() {
        return reported != null ? reported : TokenUsage.estimate(promptChars, emitted.length());
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        onClose.run();
    }

    private ChatEvent advance() {
        try {
            while (lines.hasNext()) {
                var line = lines.next().trim();
                if (!line.startsWith("data:")) continue;
                var data = line.substring(5).trim();
                if (data.isEmpty()) continue;
                if ("[DONE]".equals(data)) {
                    return finish();
                }
                var delta = parseChunk(data);
                if (delta != null && !delta.isEmpty()) {
                    emitted.append(delta);
                    return ChatEvent.delta(delta);
                }
            }
        } catch (UncheckedIOException e) {
            if (closed) return null;
            throw new ProviderException(provider, "Stream interrupted: " + e.getMessage(), e);
        }
        return finish();
    }

    private ChatEvent finish() {
        finished = true;
        return ChatEvent.done(usageSoFar());
    }

    private String parseChunk(String data) {
        JsonNode node;
        try {
            node = MAPPER.readTree(data);
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed {} stream chunk", provider);
            return null;
        }
        if (node.hasNonNull("error")) {
            throw new ProviderException(provider, node.path("error").path("message").asText("Upstream stream error"));
        }
        captureUsage(node.path("usage"));
        captureUsage(node.path("x_groq").path("usage"));
        return node.path("choices").path(0).path("delta").path("content").asText(null);
    }

    private void captureUsage(JsonNode u) {
        if (u.isObject() && u.has("prompt_tokens")) {
            reported = new TokenUsage(u.path("prompt_tokens").asLong(0), u.path("completion_tokens").asLong(0));
        }
    }
}
