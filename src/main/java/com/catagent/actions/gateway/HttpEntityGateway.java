package com.catagent.actions.gateway;

import com.catagent.shared.error.ExecutionFailedException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Talks to the entity services over their REST endpoints, forwarding the caller's identity.
 */
public class HttpEntityGateway implements EntityGateway {

    private static final Logger log = LoggerFactory.getLogger(HttpEntityGateway.class);

    private static final Map<String, String> ENDPOINTS = Map.ofEntries(
        Map.entry("product", "/api/products"),
        Map.entry("service", "/api/services"),
        Map.entry("project", "/api/projects"),
        Map.entry("cause", "/api/causes"),
        Map.entry("event", "/api/events"),
        Map.entry("post", "/api/posts"),
        Map.entry("message", "/api/messages"),
        Map.entry("payment", "/api/payments/send"),
        Map.entry("contribution", "/api/contributions"),
        Map.entry("organization", "/api/organizations"),
        Map.entry("organization_member", "/api/organizations/members"),
        Map.entry("document", "/api/documents"),
        Map.entry("reminder", "/api/reminders")
    );

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public HttpEntityGateway(String baseUrl) {
        this(baseUrl, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    public HttpEntityGateway(String baseUrl, HttpClient httpClient) {
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.httpClient = httpClient;
    }

    @Override
    public EntityResult create(String entityType, String userId, String actorId, Map<String, Object> fields) {
        var json = send(entityType, "POST", endpoint(entityType), userId, actorId, fields);
        var id = extractId(json);
        return new EntityResult(entityType, id, "Created " + entityType + (id != null ? " " + id : ""));
    }

    @Override
    public EntityResult update(String entityType, String entityId, String userId, String actorId,
                               Map<String, Object> fields) {
        send(entityType, "PUT", endpoint(entityType) + "/" + encode(entityId), userId, actorId, fields);
        return new EntityResult(entityType, entityId, "Updated " + entityType + " " + entityId);
    }

    @Override
    public EntityResult delete(String entityType, String entityId, String userId, String actorId) {
        send(entityType, "DELETE", endpoint(entityType) + "/" + encode(entityId), userId, actorId, null);
        return new EntityResult(entityType, entityId, "Deleted " + entityType + " " + entityId);
    }

    private String endpoint(String entityType) {
        var path = ENDPOINTS.get(entityType);
        if (path == null) {
            throw new ExecutionFailedException("Unsupported entity type: " + entityType, Map.of("entityType", entityType));
        }
        return path;
    }

    private JsonNode send(String entityType, String method, String path, String userId, String actorId,
                          Map<String, Object> fields) {
        try {
            var body = fields != null
                ? HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(fields))
                : HttpRequest.BodyPublishers.noBody();
            var request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .header("X-User-Id", userId)
                .header("X-Actor-Id", actorId)
                .timeout(Duration.ofSeconds(30))
                .method(method, body)
                .build();
            var resp = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() / 100 != 2) {
                log.warn("{} {} returned {}", method, path, resp.statusCode());
                throw new ExecutionFailedException(errorMessage(resp.statusCode(), resp.body()),
                    Map.of("entityType", entityType, "status", resp.statusCode()));
            }
            var text = resp.body();
            return text == null || text.isBlank() ? mapper.createObjectNode() : mapper.readTree(text);
        } catch (IOException e) {
            throw new ExecutionFailedException("Entity service unreachable: " + e.getMessage(), Map.of("entityType", entityType));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionFailedException("Entity service call interrupted", Map.of("entityType", entityType));
        }
    }

    private String errorMessage(int status, String body) {
        try {
            var node = mapper.readTree(body);
            var error = node.path("error");
            if (error.isTextual()) return error.asText();
            if (error.path("message").isTextual()) return error.path("message").asText();
        } catch (IOException | RuntimeException e) {
            log.debug("Entity service error body was not JSON");
        }
        return "Entity service returned " + status;
    }

    private static String extractId(JsonNode json) {
        if (json.path("id").isValueNode()) return json.path("id").asText();
        if (json.path("data").path("id").isValueNode()) return json.path("data").path("id").asText();
        return null;
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}
