package com.catagent.providers;

public record ChatResponse(String model, String content, TokenUsage usage) {}
