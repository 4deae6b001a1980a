package com.catagent.support;

import com.catagent.providers.ChatEvent;
import com.catagent.providers.ChatRequest;
import com.catagent.providers.ChatResponse;
import com.catagent.providers.CompletionStream;
import com.catagent.providers.ModelProvider;
import com.catagent.providers.ProviderKind;
import com.catagent.providers.TokenUsage;
import com.catagent.shared.error.ProviderException;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Model provider that replays a fixed reply, either whole or as deltas.
 */
public class ScriptedProvider implements ModelProvider {

    private final ProviderKind kind;
    private final List<String> deltas = new ArrayList<>();
    private TokenUsage usage;
    private int failAfter = -1;
    private final List<ChatRequest> requests = new ArrayList<>();
    private ScriptedStream lastStream;

    public ScriptedProvider(ProviderKind kind) {
        this.kind = kind;
    }

    public ScriptedProvider reply(String... parts) {
        deltas.clear();
        deltas.addAll(List.of(parts));
        return this;
    }

    public ScriptedProvider usage(TokenUsage usage) {
        this.usage = usage;
        return this;
    }

    /** Throws a provider error after this many deltas have been streamed. */
    public ScriptedProvider failAfter(int count) {
        this.failAfter = count;
        return this;
    }

    public List<ChatRequest> requests() {
        return requests;
    }

    public ScriptedStream lastStream() {
        return lastStream;
    }

    @Override
    public ProviderKind kind() {
        return kind;
    }

    @Override
    public ChatResponse chat(ChatRequest request) {
        requests.add(request);
        return new ChatResponse(request.model(), String.join("", deltas), usage);
    }

    @Override
    public CompletionStream chatStream(ChatRequest request) {
        requests.add(request);
        lastStream = new ScriptedStream(request.promptChars());
        return lastStream;
    }

    public class ScriptedStream implements CompletionStream {

        private final long promptChars;
        private int index;
        private long emittedChars;
        private boolean finished;
        private boolean closed;

        ScriptedStream(long promptChars) {
            this.promptChars = promptChars;
        }

        public boolean closed() {
            return closed;
        }

        public int delivered() {
            return index;
        }

        @Override
        public boolean hasNext() {
            return !closed && !finished;
        }

        @Override
        public ChatEvent next() {
            if (!hasNext()) throw new NoSuchElementException();
            if (failAfter >= 0 && index == failAfter) {
                throw new ProviderException(kind.id(), "upstream reset");
            }
            if (index < deltas.size()) {
                var delta = deltas.get(index++);
                emittedChars += delta.length();
                return ChatEvent.delta(delta);
            }
            finished = true;
            return ChatEvent.done(usageSoFar());
        }

        @Override
        public TokenUsage usageSoFar() {
            return usage != null ? usage : TokenUsage.estimate(promptChars, emittedChars);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
