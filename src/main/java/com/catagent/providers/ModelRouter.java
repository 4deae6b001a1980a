package com.catagent.providers;

import com.catagent.observability.EngineMetrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

public class ModelRouter {

    private static final Logger log = LoggerFactory.getLogger(ModelRouter.class);

    public static final String AUTO = "auto";

    private final ModelCatalog catalog;
    private final AutoRouter autoRouter;
    private final ProviderFactory providerFactory;
    private final EngineMetrics metrics;
    private final double temperature;

    public ModelRouter(ModelCatalog catalog, AutoRouter autoRouter, ProviderFactory providerFactory,
                       EngineMetrics metrics, double temperature) {
        this.catalog = catalog;
        this.autoRouter = autoRouter;
        this.providerFactory = providerFactory;
        this.metrics = metrics;
        this.temperature = temperature;
    }

    public ModelInfo selectModel(RoutingContext context, String hint, boolean usesOwnKey, ProviderKind provider) {
        var allowed = usesOwnKey ? catalog.forProvider(provider) : catalog.freeFor(provider);

        if (hint == null || hint.isBlank() || AUTO.equalsIgnoreCase(hint)) {
            return autoRouter.route(context, allowed).model();
        }

        var requested = catalog.find(hint.trim()).filter(m -> m.provider() == provider);
        if (requested.isEmpty()) {
            log.info("Model hint {} not in catalog for {}, using default free model", hint, provider.id());
            return catalog.defaultFree(provider);
        }
        if (!allowed.contains(requested.get())) {
            log.info("Model {} not allowed on platform credential, routing among free models", hint);
            return autoRouter.route(context, allowed).model();
        }
        return requested.get();
    }

    public ChatResponse complete(ProviderSelection selection, ModelInfo model, List<Map<String, Object>> messages) {
        var provider = providerFactory.create(selection);
        metrics.llmCalls(selection.provider().id()).increment();
        var sample = Timer.start(metrics.registry());
        try {
            return provider.chat(new ChatRequest(model.id(), messages, temperature));
        } finally {
            sample.stop(metrics.llmLatency(selection.provider().id()));
        }
    }

    public CompletionStream stream(ProviderSelection selection, ModelInfo model, List<Map<String, Object>> messages) {
        var provider = providerFactory.create(selection);
        metrics.llmCalls(selection.provider().id()).increment();
        return provider.chatStream(new ChatRequest(model.id(), messages, temperature));
    }
}
