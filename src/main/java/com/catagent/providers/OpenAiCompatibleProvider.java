package com.catagent.providers;

import com.catagent.shared.error.ProviderAuthException;
import com.catagent.shared.error.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public abstract class OpenAiCompatibleProvider implements ModelProvider {

    private static final int MAX_ERROR_BODY = 300;

    private final String apiKey;
    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    protected OpenAiCompatibleProvider(String apiKey, String baseUrl, Duration timeout, HttpClient httpClient) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.timeout = timeout;
        this.httpClient = httpClient;
    }

    protected void decorate(HttpRequest.Builder builder) {
    }

    @Override
    public ChatResponse chat(ChatRequest request) {
        try {
            var resp = httpClient.send(buildRequest(request, false), HttpResponse.BodyHandlers.ofString());
            checkStatus(resp.statusCode(), resp.body());
            return parseResponse(request, mapper.readTree(resp.body()));
        } catch (IOException e) {
            throw new ProviderException(kind().id(), "Request to " + kind().id() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(kind().id(), "Request to " + kind().id() + " interrupted", e);
        }
    }

    @Override
    public CompletionStream chatStream(ChatRequest request) {
        HttpResponse<Stream<String>> resp;
        try {
            resp = httpClient.send(buildRequest(request, true), HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw new ProviderException(kind().id(), "Stream to " + kind().id() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(kind().id(), "Stream to " + kind().id() + " interrupted", e);
        }
        var body = resp.body();
        if (resp.statusCode() != 200) {
            String text;
            try (body) {
                text = body.collect(Collectors.joining("\n"));
            }
            checkStatus(resp.statusCode(), text);
        }
        return new SseCompletionStream(kind().id(), body.iterator(), body::close, request.promptChars());
    }

    private HttpRequest buildRequest(ChatRequest request, boolean stream) throws IOException {
        var body = new LinkedHashMap<String, Object>();
        body.put("model", request.model());
        body.put("messages", request.messages());
        body.put("temperature", request.temperature());
        if (stream) {
            body.put("stream", true);
            body.put("stream_options", Map.of("include_usage", true));
        }

        var builder = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/chat/completions"))
            .header("Content-Type", "application/json")
            .header("Authorization", "Bearer " + apiKey)
            .timeout(timeout)
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)));
        decorate(builder);
        return builder.build();
    }

    private void checkStatus(int status, String body) {
        if (status == 200) return;
        if (status == 401 || status == 403) {
            throw new ProviderAuthException(kind().id(), status);
        }
        var snippet = body == null ? "" : body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) : body;
        throw new ProviderException(kind().id(), kind().id() + " API error " + status + ": " + snippet);
    }

    private ChatResponse parseResponse(ChatRequest request, JsonNode root) {
        if (root.hasNonNull("error")) {
            throw new ProviderException(kind().id(), root.path("error").path("message").asText("Upstream error"));
        }
        var content = root.path("choices").path(0).path("message").path("content").asText("");
        var model = root.path("model").asText(request.model());
        var u = root.path("usage");
        var usage = u.has("prompt_tokens")
            ? new TokenUsage(u.path("prompt_tokens").asLong(0), u.path("completion_tokens").asLong(0))
            : TokenUsage.estimate(request.promptChars(), content.length());
        return new ChatResponse(model, content, usage);
    }
}
