package com.catagent.actions.gateway;

import com.catagent.shared.error.ExecutionFailedException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class HttpEntityGatewayTest {

    private final HttpClient client = mock(HttpClient.class);
    private final HttpEntityGateway gateway = new HttpEntityGateway("http://entities:3000/", client);

    @Test
    void createPostsToEntityEndpointWithIdentityHeaders() throws Exception {
        respond(201, "{\"data\":{\"id\":\"prod-42\"}}");

        var result = gateway.create("product", "u1", "agent-7", Map.of("title", "Mug"));

        var captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(client).send(captor.capture(), any());
        var request = captor.getValue();
        assertEquals("POST", request.method());
        assertEquals("http://entities:3000/api/products", request.uri().toString());
        assertEquals("u1", request.headers().firstValue("X-User-Id").orElseThrow());
        assertEquals("agent-7", request.headers().firstValue("X-Actor-Id").orElseThrow());
        assertEquals("prod-42", result.entityId());
        assertEquals("Created product prod-42", result.summary());
    }

    @Test
    void updatePutsToEntityPath() throws Exception {
        respond(200, "");

        var result = gateway.update("project", "p 1", "u1", "u1", Map.of("status", "active"));

        var captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(client).send(captor.capture(), any());
        assertEquals("PUT", captor.getValue().method());
        assertEquals("http://entities:3000/api/projects/p+1", captor.getValue().uri().toString());
        assertEquals("Updated project p 1", result.summary());
    }

    @Test
    void errorStatusBecomesExecutionFailure() throws Exception {
        respond(402, "{\"error\":\"Insufficient balance\"}");

        var ex = assertThrows(ExecutionFailedException.class,
            () -> gateway.create("payment", "u1", "u1", Map.of("amount_sats", 100)));

        assertEquals("Insufficient balance", ex.getMessage());
        assertEquals(402, ex.details().get("status"));
    }

    @Test
    void unknownEntityTypeFailsWithoutCall() throws Exception {
        assertThrows(ExecutionFailedException.class, () -> gateway.create("spaceship", "u1", "u1", Map.of()));
        verify(client, never()).send(any(), any());
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        when(client.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn((HttpResponse) response);
    }
}
