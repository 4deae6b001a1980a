package com.catagent.providers;

public interface ModelProvider {
    ProviderKind kind();
    ChatResponse chat(ChatRequest request);
    CompletionStream chatStream(ChatRequest request);
}
