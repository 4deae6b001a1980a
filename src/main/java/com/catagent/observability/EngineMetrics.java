package com.catagent.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class EngineMetrics {

    private final MeterRegistry registry;

    public EngineMetrics() {
        this(new SimpleMeterRegistry());
    }

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Timer llmLatency(String provider) {
        return Timer.builder("catagent.llm.latency").tag("provider", provider).register(registry);
    }

    public Counter llmCalls(String provider) {
        return Counter.builder("catagent.llm.calls").tag("provider", provider).register(registry);
    }

    public Counter tokensUsed(String tier) {
        return Counter.builder("catagent.tokens.total").tag("tier", tier).register(registry);
    }

    public Counter actions(String status) {
        return Counter.builder("catagent.actions").tag("status", status).register(registry);
    }
}
