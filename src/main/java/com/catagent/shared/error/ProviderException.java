package com.catagent.shared.error;

import java.util.Map;

public class ProviderException extends CatAgentException {
    public ProviderException(String provider, String message) {
        this(provider, message, null);
    }

    public ProviderException(String provider, String message, Throwable cause) {
        super(ErrorCode.PROVIDER_ERROR, message, Map.of("provider", provider), cause);
    }

    protected ProviderException(ErrorCode code, String provider, String message) {
        super(code, message, Map.of("provider", provider));
    }
}
