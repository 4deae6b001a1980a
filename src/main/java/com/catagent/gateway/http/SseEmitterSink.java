package com.catagent.gateway.http;

import com.catagent.agent.StreamSink;
import com.catagent.shared.model.StreamSummary;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;

class SseEmitterSink implements StreamSink {

    private final SseEmitter emitter;

    SseEmitterSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void start(String model, String provider) throws IOException {
        send(SseEmitter.event().data(Map.of("model", model, "provider", provider), MediaType.APPLICATION_JSON));
    }

    @Override
    public void delta(String content) throws IOException {
        send(SseEmitter.event().data(Map.of("content", content), MediaType.APPLICATION_JSON));
    }

    @Override
    public void done(StreamSummary summary) throws IOException {
        send(SseEmitter.event().data(summary, MediaType.APPLICATION_JSON));
    }

    @Override
    public void error(String code, String message) throws IOException {
        send(SseEmitter.event().name("error")
            .data(Map.of("code", code, "error", message != null ? message : code), MediaType.APPLICATION_JSON));
    }

    private void send(SseEmitter.SseEventBuilder event) throws IOException {
        try {
            emitter.send(event);
        } catch (IllegalStateException e) {
            // emitter already completed, the client is gone
            throw new IOException("Stream closed", e);
        }
    }
}
