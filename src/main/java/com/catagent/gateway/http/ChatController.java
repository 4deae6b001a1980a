package com.catagent.gateway.http;

import com.catagent.agent.ChatService;
import com.catagent.auth.CurrentUser;
import com.catagent.auth.SecretStore;
import com.catagent.shared.model.ChatTurnRequest;
import com.catagent.shared.model.ChatTurnResponse;
import com.catagent.shared.model.SuppliedKeys;
import com.catagent.shared.model.UserStatus;
import com.catagent.usage.UsageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.concurrent.Executor;

@RestController
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);
    private static final long STREAM_TIMEOUT_MS = 300_000;

    private final ChatService chatService;
    private final UsageService usageService;
    private final SecretStore secretStore;
    private final Executor streamExecutor;

    public ChatController(ChatService chatService, UsageService usageService, SecretStore secretStore,
                          @Qualifier("streamExecutor") Executor streamExecutor) {
        this.chatService = chatService;
        this.usageService = usageService;
        this.secretStore = secretStore;
        this.streamExecutor = streamExecutor;
    }

    @PostMapping("/api/cat/chat")
    public ChatTurnResponse chat(CurrentUser user, @RequestBody ChatTurnRequest request,
                                 @RequestHeader(value = "X-OpenRouter-Key", required = false) String openRouterKey,
                                 @RequestHeader(value = "X-Groq-Key", required = false) String groqKey) {
        return chatService.chat(user, request, new SuppliedKeys(openRouterKey, groqKey));
    }

    @PostMapping(value = "/api/cat/chat", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter chatStream(CurrentUser user, @RequestBody ChatTurnRequest request,
                                 @RequestHeader(value = "X-OpenRouter-Key", required = false) String openRouterKey,
                                 @RequestHeader(value = "X-Groq-Key", required = false) String groqKey) {
        var prepared = chatService.prepare(user, request, new SuppliedKeys(openRouterKey, groqKey));
        var emitter = new SseEmitter(STREAM_TIMEOUT_MS);
        streamExecutor.execute(() -> {
            try {
                chatService.stream(prepared, new SseEmitterSink(emitter));
                emitter.complete();
            } catch (RuntimeException e) {
                log.error("Chat stream for user {} failed", user.userId(), e);
                emitter.completeWithError(e);
            }
        });
        return emitter;
    }

    @GetMapping("/api/cat/usage")
    public Map<String, Object> usage(CurrentUser user) {
        var quota = usageService.quota(user.userId());
        var status = new UserStatus(secretStore.hasAny(user.userId()), quota.remaining(), quota.dailyLimit());
        return Map.of("date", usageService.today().toString(), "used", quota.used(), "userStatus", status);
    }
}
