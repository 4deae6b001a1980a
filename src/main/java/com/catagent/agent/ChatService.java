package com.catagent.agent;

import com.catagent.actions.ActionExecutor;
import com.catagent.actions.ActionRequest;
import com.catagent.actions.ActionResult;
import com.catagent.actions.ActionStatus;
import com.catagent.actions.parse.ParsedResponse;
import com.catagent.actions.parse.ResponseActionParser;
import com.catagent.auth.CurrentUser;
import com.catagent.providers.CompletionStream;
import com.catagent.providers.CredentialResolver;
import com.catagent.providers.ModelRouter;
import com.catagent.providers.RoutingContext;
import com.catagent.providers.TokenUsage;
import com.catagent.shared.error.CatAgentException;
import com.catagent.shared.error.InvalidRequestException;
import com.catagent.shared.model.ChatTurnRequest;
import com.catagent.shared.model.ChatTurnResponse;
import com.catagent.shared.model.StreamSummary;
import com.catagent.shared.model.SuppliedKeys;
import com.catagent.shared.model.UsageReport;
import com.catagent.shared.model.UserStatus;
import com.catagent.usage.UsageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One chat turn: credential, quota, model, completion, then the actions the model proposed.
 * The model call and the actions are recorded separately; a failing action never fails the turn.
 */
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);
    static final String EMPTY_REPLY = "Sorry, I have no answer to that. Could you rephrase?";

    private final CredentialResolver credentials;
    private final UsageService usage;
    private final ModelRouter router;
    private final PromptBuilder promptBuilder;
    private final ResponseActionParser parser;
    private final ActionExecutor executor;
    private final int maxMessageLength;

    public ChatService(CredentialResolver credentials, UsageService usage, ModelRouter router,
                       PromptBuilder promptBuilder, ResponseActionParser parser, ActionExecutor executor,
                       int maxMessageLength) {
        this.credentials = credentials;
        this.usage = usage;
        this.router = router;
        this.promptBuilder = promptBuilder;
        this.parser = parser;
        this.executor = executor;
        this.maxMessageLength = maxMessageLength;
    }

    public ChatTurnResponse chat(CurrentUser user, ChatTurnRequest request, SuppliedKeys keys) {
        return complete(prepare(user, request, keys));
    }

    /** Everything that can reject the turn runs here, before any output is produced. */
    public PreparedChat prepare(CurrentUser user, ChatTurnRequest request, SuppliedKeys keys) {
        var message = request.message();
        if (message == null || message.isBlank()) {
            throw new InvalidRequestException("message must not be empty");
        }
        if (message.length() > maxMessageLength) {
            throw new InvalidRequestException("message exceeds " + maxMessageLength + " characters");
        }
        var supplied = keys != null ? keys : SuppliedKeys.none();
        var selection = credentials.resolve(user.userId(), supplied.openRouterKey(), supplied.groqKey());
        if (!selection.usesOwnKey()) {
            usage.ensurePlatformQuota(user.userId());
        }
        var model = router.selectModel(new RoutingContext(message, request.history()), request.model(),
            selection.usesOwnKey(), selection.provider());
        var messages = promptBuilder.build(message, request.history());
        log.info("Chat turn for user {} via {} model {} (own key: {})", user.userId(),
            selection.provider().id(), model.id(), selection.usesOwnKey());
        return new PreparedChat(user, selection, model, messages, request.conversationId());
    }

    public ChatTurnResponse complete(PreparedChat chat) {
        var response = router.complete(chat.selection(), chat.model(), chat.messages());
        var tokens = response.usage() != null ? response.usage() : TokenUsage.ZERO;
        record(chat, tokens);

        var parsed = parser.parse(response.content());
        var actions = runActions(chat, parsed);
        return new ChatTurnResponse(displayable(parsed.displayText(), actions), actions,
            response.model() != null ? response.model() : chat.model().id(),
            chat.selection().provider().id(), UsageReport.of(tokens, chat.usesOwnKey()), userStatus(chat));
    }

    /**
     * Forwards deltas to the sink in order. A sink failure means the client left: forwarding
     * stops, the upstream is closed and the usage seen so far is still recorded.
     */
    public void stream(PreparedChat chat, StreamSink sink) {
        var provider = chat.selection().provider().id();
        var text = new StringBuilder();
        CompletionStream upstream = null;
        var recorded = false;
        try {
            upstream = router.stream(chat.selection(), chat.model(), chat.messages());
            sink.start(chat.model().id(), provider);
            TokenUsage finalUsage = null;
            while (upstream.hasNext()) {
                var event = upstream.next();
                if (event.done()) {
                    finalUsage = event.usage();
                    break;
                }
                if (event.content() != null && !event.content().isEmpty()) {
                    text.append(event.content());
                    sink.delta(event.content());
                }
            }
            var tokens = finalUsage != null ? finalUsage : upstream.usageSoFar();
            record(chat, tokens);
            recorded = true;

            var parsed = parser.parse(text.toString());
            var actions = runActions(chat, parsed);
            sink.done(new StreamSummary(true, displayable(parsed.displayText(), actions),
                UsageReport.of(tokens, chat.usesOwnKey()), chat.model().id(), provider, actions, userStatus(chat)));
        } catch (IOException e) {
            log.info("Client left stream for user {} after {} chars", chat.user().userId(), text.length());
            if (!recorded) {
                recordPartial(chat, upstream);
            }
        } catch (CatAgentException e) {
            log.warn("Stream for user {} failed: {}", chat.user().userId(), e.getMessage());
            if (!recorded) {
                recordPartial(chat, upstream);
            }
            sendError(sink, e.code().name(), e.getMessage());
        } finally {
            if (upstream != null) {
                upstream.close();
            }
        }
    }

    private void recordPartial(PreparedChat chat, CompletionStream upstream) {
        if (upstream == null) {
            return;
        }
        upstream.close();
        record(chat, upstream.usageSoFar());
    }

    private void sendError(StreamSink sink, String code, String message) {
        try {
            sink.error(code, message);
        } catch (IOException e) {
            log.debug("Could not deliver stream error: {}", e.getMessage());
        }
    }

    private void record(PreparedChat chat, TokenUsage tokens) {
        usage.recordModelCall(chat.user().userId(), chat.usesOwnKey(), tokens.totalTokens());
    }

    private List<ActionResult> runActions(PreparedChat chat, ParsedResponse parsed) {
        var results = new ArrayList<ActionResult>();
        for (var proposed : parsed.actions()) {
            var request = new ActionRequest(proposed.actionId(), proposed.parameters(), chat.conversationId(), null);
            try {
                results.add(executor.execute(chat.user().userId(), chat.user().actorId(), request));
            } catch (RuntimeException e) {
                log.error("Proposed action {} could not be processed", proposed.actionId(), e);
                results.add(new ActionResult(null, proposed.actionId(), ActionStatus.FAILED, null, null,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), null));
            }
        }
        return results;
    }

    /** Replies made only of action blocks still need something to show. */
    static String displayable(String text, List<ActionResult> actions) {
        if (text != null && !text.isBlank()) {
            return text;
        }
        if (actions.isEmpty()) {
            return EMPTY_REPLY;
        }
        return actions.stream().map(ChatService::describe).collect(Collectors.joining("\n"));
    }

    private static String describe(ActionResult result) {
        var what = result.description() != null ? result.description() : result.actionId();
        return switch (result.status()) {
            case PENDING_CONFIRMATION -> "Waiting for your confirmation: " + what;
            case EXECUTING -> "In progress: " + what;
            case SUCCEEDED -> "Done: " + (result.resultSummary() != null ? result.resultSummary() : what);
            case DENIED -> "Not allowed: " + what + " (" + result.error() + ")";
            case FAILED -> "Failed: " + what + " (" + result.error() + ")";
        };
    }

    private UserStatus userStatus(PreparedChat chat) {
        var quota = usage.quota(chat.user().userId());
        return new UserStatus(chat.usesOwnKey(), quota.remaining(), quota.dailyLimit());
    }
}
