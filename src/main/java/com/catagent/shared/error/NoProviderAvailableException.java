package com.catagent.shared.error;

import java.util.Map;

public class NoProviderAvailableException extends CatAgentException {
    public NoProviderAvailableException() {
        super(ErrorCode.NO_PROVIDER_AVAILABLE, "AI chat not configured",
                Map.of("message", "No model credential is available. Add your own OpenRouter or Groq API key."));
    }
}
