package com.catagent.providers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Picks a model from a candidate list by scoring how demanding the prompt looks.
 */
public class AutoRouter {

    private static final Logger log = LoggerFactory.getLogger(AutoRouter.class);

    private static final Pattern NUMBERED_ITEM = Pattern.compile("(?m)^\\d+\\.");

    private static final Map<String, Double> KEYWORDS = new LinkedHashMap<>();

    static {
        // coding
        KEYWORDS.put("code", 0.2);
        KEYWORDS.put("programming", 0.2);
        KEYWORDS.put("debug", 0.25);
        KEYWORDS.put("algorithm", 0.3);
        KEYWORDS.put("refactor", 0.25);
        KEYWORDS.put("function", 0.15);
        // analysis
        KEYWORDS.put("analyze", 0.25);
        KEYWORDS.put("compare", 0.2);
        KEYWORDS.put("evaluate", 0.25);
        KEYWORDS.put("assess", 0.2);
        // research
        KEYWORDS.put("research", 0.3);
        KEYWORDS.put("thesis", 0.35);
        KEYWORDS.put("academic", 0.3);
        KEYWORDS.put("scientific", 0.3);
        // reasoning
        KEYWORDS.put("step by step", 0.25);
        KEYWORDS.put("in detail", 0.2);
        KEYWORDS.put("comprehensive", 0.25);
        KEYWORDS.put("thorough", 0.2);
        KEYWORDS.put("explain", 0.15);
        KEYWORDS.put("legal", 0.35);
        KEYWORDS.put("medical", 0.35);
        KEYWORDS.put("financial", 0.3);
        KEYWORDS.put("contract", 0.3);
        // creative and light tasks
        KEYWORDS.put("write", 0.15);
        KEYWORDS.put("story", 0.2);
        KEYWORDS.put("essay", 0.2);
        KEYWORDS.put("translate", 0.15);
        KEYWORDS.put("summarize", 0.1);
    }

    public record Routing(ModelInfo model, double complexity, String reason) {}

    public double complexity(RoutingContext context) {
        var message = context.message();
        var lower = message.toLowerCase(Locale.ROOT);
        double score = 0;

        if (message.length() > 2000) {
            score += 0.3;
        } else if (message.length() > 500) {
            score += 0.15;
        }

        for (var entry : KEYWORDS.entrySet()) {
            if (lower.contains(entry.getKey())) score += entry.getValue();
        }

        var historyTokens = context.history().stream()
            .mapToDouble(m -> String.valueOf(m.getOrDefault("content", "")).length() / 4.0)
            .sum();
        if (historyTokens > 4000) {
            score += 0.2;
        } else if (historyTokens > 1000) {
            score += 0.1;
        }

        var questions = message.chars().filter(c -> c == '?').count();
        if (questions > 3) {
            score += 0.2;
        } else if (questions > 1) {
            score += 0.1;
        }

        var fences = countOccurrences(message, "```") / 2;
        if (fences > 0) {
            score += 0.15 * Math.min(fences, 3);
        }

        if (NUMBERED_ITEM.matcher(message).results().count() > 3) {
            score += 0.15;
        }

        return Math.min(1.0, Math.max(0.0, score));
    }

    public Routing route(RoutingContext context, List<ModelInfo> allowed) {
        if (allowed.isEmpty()) {
            throw new IllegalArgumentException("No candidate models");
        }
        var score = complexity(context);
        var target = score < 0.3 ? ModelTier.ECONOMY : score < 0.7 ? ModelTier.STANDARD : ModelTier.PREMIUM;

        var candidates = new ArrayList<>(allowed.stream().filter(m -> m.tier() == target).toList());
        if (candidates.isEmpty()) {
            candidates.addAll(allowed);
        }
        candidates.sort(Comparator.comparingDouble(ModelInfo::inputCostPer1M));

        var selected = candidates.get(0);
        if (candidates.stream().allMatch(ModelInfo::isFree)) {
            var preferred = score >= 0.5 ? ModelInfo.REASONING : score < 0.3 ? ModelInfo.FAST : null;
            if (preferred != null) {
                selected = candidates.stream().filter(m -> m.has(preferred)).findFirst().orElse(selected);
            }
        }

        var reason = (score < 0.3 ? "Simple task" : score < 0.7 ? "Moderate complexity" : "Complex task")
            + " -> " + selected.name() + " (" + selected.tier().id() + ")";
        log.debug("Auto-routed to {} score={}", selected.id(), score);
        return new Routing(selected, score, reason);
    }

    private static int countOccurrences(String text, String token) {
        int count = 0;
        int idx = text.indexOf(token);
        while (idx >= 0) {
            count++;
            idx = text.indexOf(token, idx + token.length());
        }
        return count;
    }
}
