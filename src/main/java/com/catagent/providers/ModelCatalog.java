package com.catagent.providers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.catagent.providers.ModelInfo.FAST;
import static com.catagent.providers.ModelInfo.REASONING;
import static com.catagent.providers.ModelTier.ECONOMY;
import static com.catagent.providers.ModelTier.FREE;
import static com.catagent.providers.ModelTier.PREMIUM;
import static com.catagent.providers.ModelTier.STANDARD;
import static com.catagent.providers.ProviderKind.GROQ;
import static com.catagent.providers.ProviderKind.OPENROUTER;

/**
 * Static model metadata. Order matters: it breaks ties between models of equal cost.
 */
public class ModelCatalog {

    public static final String DEFAULT_OPENROUTER_FREE = "meta-llama/llama-3.3-70b-instruct:free";
    public static final String DEFAULT_GROQ_FREE = "llama-3.3-70b-versatile";

    private final Map<String, ModelInfo> models = new LinkedHashMap<>();

    public ModelCatalog() {
        this(defaultModels());
    }

    public ModelCatalog(List<ModelInfo> entries) {
        entries.forEach(m -> models.put(m.id(), m));
    }

    public Optional<ModelInfo> find(String id) {
        return Optional.ofNullable(id).map(models::get);
    }

    public List<ModelInfo> all() {
        return List.copyOf(models.values());
    }

    public List<ModelInfo> forProvider(ProviderKind provider) {
        return models.values().stream().filter(m -> m.provider() == provider).toList();
    }

    public List<ModelInfo> freeFor(ProviderKind provider) {
        return forProvider(provider).stream().filter(ModelInfo::isFree).toList();
    }

    public ModelInfo defaultFree(ProviderKind provider) {
        var id = provider == GROQ ? DEFAULT_GROQ_FREE : DEFAULT_OPENROUTER_FREE;
        return models.get(id);
    }

    private static List<ModelInfo> defaultModels() {
        return List.of(
            // OpenRouter free tier
            new ModelInfo(DEFAULT_OPENROUTER_FREE, "Llama 3.3 70B (Free)", OPENROUTER, FREE, 0, 0, 128_000, Set.of(REASONING)),
            new ModelInfo("google/gemini-2.0-flash-exp:free", "Gemini 2.0 Flash (Free)", OPENROUTER, FREE, 0, 0, 1_000_000, Set.of(FAST)),
            new ModelInfo("google/gemma-3-27b-it:free", "Gemma 3 27B (Free)", OPENROUTER, FREE, 0, 0, 128_000, Set.of()),
            new ModelInfo("deepseek/deepseek-r1-0528:free", "DeepSeek R1 (Free)", OPENROUTER, FREE, 0, 0, 64_000, Set.of(REASONING)),
            new ModelInfo("mistralai/mistral-small-3.1-24b-instruct:free", "Mistral Small 3.1 (Free)", OPENROUTER, FREE, 0, 0, 128_000, Set.of(FAST)),
            new ModelInfo("qwen/qwen3-4b:free", "Qwen 3 4B (Free)", OPENROUTER, FREE, 0, 0, 32_000, Set.of(FAST)),
            // OpenRouter paid
            new ModelInfo("google/gemini-2.0-flash-lite", "Gemini 2.0 Flash Lite", OPENROUTER, ECONOMY, 0.075, 0.3, 128_000, Set.of(FAST)),
            new ModelInfo("anthropic/claude-3-haiku", "Claude 3 Haiku", OPENROUTER, ECONOMY, 0.25, 1.25, 200_000, Set.of(FAST)),
            new ModelInfo("anthropic/claude-3.5-haiku", "Claude 3.5 Haiku", OPENROUTER, ECONOMY, 1.0, 5.0, 200_000, Set.of(FAST)),
            new ModelInfo("openai/gpt-4o-mini", "GPT-4o Mini", OPENROUTER, ECONOMY, 0.15, 0.6, 128_000, Set.of(FAST)),
            new ModelInfo("anthropic/claude-3.5-sonnet", "Claude 3.5 Sonnet", OPENROUTER, STANDARD, 3.0, 15.0, 200_000, Set.of(REASONING)),
            new ModelInfo("anthropic/claude-sonnet-4", "Claude Sonnet 4", OPENROUTER, STANDARD, 3.0, 15.0, 200_000, Set.of(REASONING)),
            new ModelInfo("openai/gpt-4o", "GPT-4o", OPENROUTER, STANDARD, 2.5, 10.0, 128_000, Set.of()),
            new ModelInfo("google/gemini-2.0-flash", "Gemini 2.0 Flash", OPENROUTER, STANDARD, 0.1, 0.4, 1_000_000, Set.of(FAST)),
            new ModelInfo("anthropic/claude-3-opus", "Claude 3 Opus", OPENROUTER, PREMIUM, 15.0, 75.0, 200_000, Set.of(REASONING)),
            new ModelInfo("anthropic/claude-opus-4", "Claude Opus 4", OPENROUTER, PREMIUM, 15.0, 75.0, 200_000, Set.of(REASONING)),
            new ModelInfo("openai/gpt-4-turbo", "GPT-4 Turbo", OPENROUTER, PREMIUM, 10.0, 30.0, 128_000, Set.of()),
            new ModelInfo("google/gemini-2.0-pro", "Gemini 2.0 Pro", OPENROUTER, PREMIUM, 1.25, 5.0, 2_000_000, Set.of(REASONING)),
            new ModelInfo("x-ai/grok-2", "Grok 2", OPENROUTER, PREMIUM, 2.0, 10.0, 131_072, Set.of()),
            // Groq, free tier
            new ModelInfo(DEFAULT_GROQ_FREE, "Llama 3.3 70B Versatile", GROQ, FREE, 0, 0, 128_000, Set.of(REASONING)),
            new ModelInfo("llama-3.1-8b-instant", "Llama 3.1 8B Instant", GROQ, FREE, 0, 0, 128_000, Set.of(FAST)),
            new ModelInfo("mixtral-8x7b-32768", "Mixtral 8x7B", GROQ, FREE, 0, 0, 32_768, Set.of()),
            new ModelInfo("gemma2-9b-it", "Gemma 2 9B", GROQ, FREE, 0, 0, 8_192, Set.of(FAST))
        );
    }
}
