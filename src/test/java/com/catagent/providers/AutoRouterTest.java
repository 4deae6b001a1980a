package com.catagent.providers;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AutoRouterTest {

    private final AutoRouter router = new AutoRouter();
    private final ModelCatalog catalog = new ModelCatalog();

    @Test
    void shortGreetingScoresLow() {
        assertEquals(0.0, router.complexity(RoutingContext.of("hi there")));
    }

    @Test
    void keywordsAndStructureRaiseScore() {
        var message = """
            Please analyze this algorithm step by step and debug it:
            ```
            int f(int x) { return x; }
            ```
            """;
        assertTrue(router.complexity(RoutingContext.of(message)) >= 0.7);
    }

    @Test
    void scoreIsCappedAtOne() {
        var message = "research thesis academic scientific legal medical financial contract algorithm".repeat(3);
        assertEquals(1.0, router.complexity(RoutingContext.of(message)));
    }

    @Test
    void simpleTaskPicksCheapestEconomyModel() {
        var routing = router.route(RoutingContext.of("hello"), catalog.forProvider(ProviderKind.OPENROUTER));
        assertEquals(ModelTier.ECONOMY, routing.model().tier());
        assertEquals("google/gemini-2.0-flash-lite", routing.model().id());
        assertTrue(routing.reason().startsWith("Simple task"));
    }

    @Test
    void freeCandidatesPreferFastModelForSimpleTasks() {
        var routing = router.route(RoutingContext.of("hello"), catalog.freeFor(ProviderKind.OPENROUTER));
        assertTrue(routing.model().isFree());
        assertTrue(routing.model().has(ModelInfo.FAST));
    }

    @Test
    void freeCandidatesPreferReasoningModelForHardTasks() {
        var routing = router.route(
            RoutingContext.of("Analyze and evaluate this legal contract in detail, step by step"),
            catalog.freeFor(ProviderKind.GROQ));
        assertTrue(routing.model().isFree());
        assertTrue(routing.model().has(ModelInfo.REASONING));
    }

    @Test
    void rejectsEmptyCandidateList() {
        assertThrows(IllegalArgumentException.class, () -> router.route(RoutingContext.of("hi"), List.of()));
    }
}
