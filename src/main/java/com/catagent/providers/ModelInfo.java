package com.catagent.providers;

import java.util.Set;

public record ModelInfo(
    String id,
    String name,
    ProviderKind provider,
    ModelTier tier,
    double inputCostPer1M,
    double outputCostPer1M,
    int contextWindow,
    Set<String> traits
) {
    public static final String REASONING = "reasoning";
    public static final String FAST = "fast";

    public boolean isFree() {
        return tier == ModelTier.FREE;
    }

    public boolean has(String trait) {
        return traits.contains(trait);
    }
}
