package com.catagent.agent;

import com.catagent.actions.ActionCatalog;
import com.catagent.actions.ActionCategory;
import com.catagent.actions.ActionExecutor;
import com.catagent.actions.ActionHandlerRegistry;
import com.catagent.actions.ActionStatus;
import com.catagent.actions.EntityActionHandler;
import com.catagent.actions.InMemoryActionRecordStore;
import com.catagent.actions.parse.ResponseActionParser;
import com.catagent.auth.CurrentUser;
import com.catagent.auth.InMemorySecretStore;
import com.catagent.observability.EngineMetrics;
import com.catagent.permissions.GrantOptions;
import com.catagent.permissions.InMemoryPermissionStore;
import com.catagent.permissions.PermissionService;
import com.catagent.providers.AutoRouter;
import com.catagent.providers.CredentialResolver;
import com.catagent.providers.ModelCatalog;
import com.catagent.providers.ModelRouter;
import com.catagent.providers.ProviderKind;
import com.catagent.providers.TokenUsage;
import com.catagent.security.KeyCipher;
import com.catagent.security.UserLocks;
import com.catagent.shared.config.ProvidersConfig;
import com.catagent.shared.error.DailyQuotaExceededException;
import com.catagent.shared.error.InvalidRequestException;
import com.catagent.shared.model.ChatTurnRequest;
import com.catagent.shared.model.ChatTurnResponse;
import com.catagent.shared.model.StreamSummary;
import com.catagent.shared.model.SuppliedKeys;
import com.catagent.support.MutableClock;
import com.catagent.support.RecordingEntityGateway;
import com.catagent.support.ScriptedProvider;
import com.catagent.usage.InMemoryUsageLedger;
import com.catagent.usage.UsageService;
import com.catagent.usage.UsageTier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChatServiceTest {

    private static final CurrentUser USER = CurrentUser.of("u1");

    private MutableClock clock;
    private InMemoryUsageLedger ledger;
    private UsageService usage;
    private PermissionService permissions;
    private RecordingEntityGateway gateway;
    private ModelCatalog models;
    private ScriptedProvider provider;
    private ChatService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        var metrics = new EngineMetrics();
        ledger = new InMemoryUsageLedger();
        usage = new UsageService(ledger, 10, clock, metrics);
        var locks = new UserLocks();
        var catalog = new ActionCatalog();
        permissions = new PermissionService(new InMemoryPermissionStore(), catalog, usage, locks, clock);
        gateway = new RecordingEntityGateway();
        var executor = new ActionExecutor(catalog, permissions, new InMemoryActionRecordStore(),
            new ActionHandlerRegistry(new EntityActionHandler(gateway)), usage, locks, metrics, clock,
            Duration.ofHours(24));

        var providersConfig = new ProvidersConfig(
            new ProvidersConfig.Endpoint("https://openrouter.test/api/v1", "platform-key"),
            new ProvidersConfig.Endpoint("https://groq.test/openai/v1", ""),
            30);
        var credentials = new CredentialResolver(
            new InMemorySecretStore(new KeyCipher("test-master-key")), providersConfig);

        models = new ModelCatalog();
        provider = new ScriptedProvider(ProviderKind.OPENROUTER)
            .reply("Hello ", "from ", "your ", "cat", "!")
            .usage(new TokenUsage(120, 30));
        var router = new ModelRouter(models, new AutoRouter(), selection -> provider, metrics, 0.7);

        service = new ChatService(credentials, usage, router, new PromptBuilder(catalog),
            new ResponseActionParser(), executor, 100);
    }

    @Test
    void platformTurnConsumesOneFreeRequestOnFreeModel() {
        var response = service.chat(USER, new ChatTurnRequest("hi there", "anthropic/claude-3-opus"), null);

        assertEquals("Hello from your cat!", response.message());
        assertEquals("openrouter", response.provider());
        assertTrue(models.find(provider.requests().get(0).model()).orElseThrow().isFree());
        assertEquals(150, response.usage().totalTokens());
        assertFalse(response.usage().usedOwnKey());
        assertEquals(9, response.userStatus().freeQuotaRemaining());
        assertEquals(1, usage.quota("u1").used());
    }

    @Test
    void ownKeyTurnLeavesFreeQuotaUntouched() {
        var response = service.chat(USER, new ChatTurnRequest("hi", "anthropic/claude-3-opus"),
            new SuppliedKeys("sk-or-own", null));

        assertEquals("anthropic/claude-3-opus", provider.requests().get(0).model());
        assertTrue(response.usage().usedOwnKey());
        assertTrue(response.userStatus().hasOwnKey());
        assertEquals(0, usage.quota("u1").used());
        assertEquals(1, ledger.get("u1", usage.today(), UsageTier.OWN_KEY).requestCount());
    }

    @Test
    void exhaustedQuotaRejectsBeforeCallingModel() {
        for (int i = 0; i < 10; i++) {
            usage.recordModelCall("u1", false, 10);
        }

        assertThrows(DailyQuotaExceededException.class,
            () -> service.prepare(USER, new ChatTurnRequest("hi", null), null));
        assertTrue(provider.requests().isEmpty());
    }

    @Test
    void rejectsEmptyAndOverlongMessages() {
        assertThrows(InvalidRequestException.class,
            () -> service.chat(USER, new ChatTurnRequest(" ", null), null));
        assertThrows(InvalidRequestException.class,
            () -> service.chat(USER, new ChatTurnRequest("x".repeat(101), null), null));
        assertEquals(0, usage.quota("u1").used());
    }

    @Test
    void proposedActionsAreRunAndStrippedFromText() {
        permissions.grant("u1", "create_product", ActionCategory.ENTITY_MANAGEMENT, GrantOptions.withoutConfirmation());
        provider.reply("Done, listing it now.\n```action\n"
            + "{\"action\": \"create_product\", \"parameters\": {\"title\": \"Mug\", \"price_sats\": 21000}}\n```");

        var response = service.chat(USER, new ChatTurnRequest("sell my mug for 21000 sats", null), null);

        assertFalse(response.message().contains("```"));
        assertTrue(response.message().contains("Done, listing it now."));
        assertEquals(1, response.actions().size());
        assertEquals(ActionStatus.SUCCEEDED, response.actions().get(0).status());
        assertEquals(1, gateway.calls().size());
        assertEquals("Mug", gateway.calls().get(0).fields().get("title"));
    }

    @Test
    void deniedActionDoesNotFailTheTurn() {
        provider.reply("Sending it.\n```action\n"
            + "{\"action\": \"send_payment\", \"parameters\": {\"amount_sats\": 500, \"recipient\": \"bob\"}}\n```");

        var response = service.chat(USER, new ChatTurnRequest("pay bob 500 sats", null), null);

        assertEquals("Sending it.", response.message().trim());
        assertEquals(ActionStatus.DENIED, response.actions().get(0).status());
        assertTrue(gateway.calls().isEmpty());
        assertEquals(1, usage.quota("u1").used());
    }

    @Test
    void replyMadeOnlyOfAnActionBlockStillHasAMessage() throws Exception {
        permissions.grant("u1", "create_product", ActionCategory.ENTITY_MANAGEMENT, GrantOptions.withoutConfirmation());
        provider.reply("```action\n"
            + "{\"action\": \"create_product\", \"parameters\": {\"title\": \"Mug\", \"price_sats\": 21000}}\n```");

        var response = service.chat(USER, new ChatTurnRequest("sell my mug", null), null);

        assertFalse(response.message().isBlank());
        assertTrue(response.message().startsWith("Done: "));
        assertEquals(ActionStatus.SUCCEEDED, response.actions().get(0).status());
        var mapper = new ObjectMapper().findAndRegisterModules();
        var json = mapper.readTree(mapper.writeValueAsString(response));
        assertTrue(json.hasNonNull("message"));
        assertEquals(1, json.get("actions").size());
    }

    @Test
    void blankReplyWithoutActionsFallsBackToApology() {
        provider.reply("  \n");

        var response = service.chat(USER, new ChatTurnRequest("hi", null), null);

        assertEquals(ChatService.EMPTY_REPLY, response.message());
        assertTrue(response.actions().isEmpty());
    }

    @Test
    void emptyActionListIsLeftOutOfTheJson() throws Exception {
        var mapper = new ObjectMapper().findAndRegisterModules();
        var response = new ChatTurnResponse("Meow", List.of(), "m", "openrouter", null, null);

        var json = mapper.readTree(mapper.writeValueAsString(response));

        assertEquals("Meow", json.get("message").asText());
        assertFalse(json.has("actions"));
    }

    @Test
    void streamSummaryCarriesMessageForActionOnlyReply() {
        provider.reply("```action\n"
            + "{\"action\": \"send_payment\", \"parameters\": {\"amount_sats\": 500, \"recipient\": \"bob\"}}\n```");
        var sink = new RecordingSink(-1);

        service.stream(service.prepare(USER, new ChatTurnRequest("pay bob", null), null), sink);

        assertNotNull(sink.summary);
        assertTrue(sink.summary.message().startsWith("Not allowed: "));
        assertEquals(ActionStatus.DENIED, sink.summary.actions().get(0).status());
    }

    @Test
    void streamDeliversDeltasThenSummary() {
        var sink = new RecordingSink(-1);

        service.stream(service.prepare(USER, new ChatTurnRequest("hi", null), null), sink);

        assertEquals(List.of("Hello ", "from ", "your ", "cat", "!"), sink.deltas);
        assertNotNull(sink.model);
        assertEquals("openrouter", sink.provider);
        assertNotNull(sink.summary);
        assertTrue(sink.summary.done());
        assertEquals("Hello from your cat!", sink.summary.message());
        assertEquals(150, sink.summary.usage().totalTokens());
        assertEquals(9, sink.summary.userStatus().freeQuotaRemaining());
        assertTrue(provider.lastStream().closed());
        assertEquals(1, usage.quota("u1").used());
    }

    @Test
    void clientDisconnectStopsForwardingAndStillRecordsUsage() {
        provider.usage(null);
        var sink = new RecordingSink(2);

        service.stream(service.prepare(USER, new ChatTurnRequest("hi", null), null), sink);

        assertEquals(List.of("Hello ", "from "), sink.deltas);
        assertNull(sink.summary);
        assertNull(sink.errorCode);
        assertTrue(provider.lastStream().closed());
        assertEquals(3, provider.lastStream().delivered());
        var counter = ledger.get("u1", usage.today(), UsageTier.PLATFORM);
        assertEquals(1, counter.requestCount());
        assertTrue(counter.tokenCount() > 0);
    }

    @Test
    void providerFailureMidStreamSendsErrorEventAndRecordsUsage() {
        provider.failAfter(2);
        var sink = new RecordingSink(-1);

        service.stream(service.prepare(USER, new ChatTurnRequest("hi", null), null), sink);

        assertEquals(2, sink.deltas.size());
        assertEquals("PROVIDER_ERROR", sink.errorCode);
        assertEquals("upstream reset", sink.errorMessage);
        assertNull(sink.summary);
        assertTrue(provider.lastStream().closed());
        assertEquals(1, usage.quota("u1").used());
    }

    private static class RecordingSink implements StreamSink {

        private final int acceptDeltas;
        private final List<String> deltas = new ArrayList<>();
        private String model;
        private String provider;
        private StreamSummary summary;
        private String errorCode;
        private String errorMessage;

        RecordingSink(int acceptDeltas) {
            this.acceptDeltas = acceptDeltas;
        }

        @Override
        public void start(String model, String provider) {
            this.model = model;
            this.provider = provider;
        }

        @Override
        public void delta(String content) throws IOException {
            if (acceptDeltas >= 0 && deltas.size() >= acceptDeltas) {
                throw new IOException("Broken pipe");
            }
            deltas.add(content);
        }

        @Override
        public void done(StreamSummary summary) {
            this.summary = summary;
        }

        @Override
        public void error(String code, String message) {
            this.errorCode = code;
            this.errorMessage = message;
        }
    }
}
