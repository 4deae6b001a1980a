package com.catagent.shared.error;

public class ProviderAuthException extends ProviderException {
    public ProviderAuthException(String provider, int status) {
        super(ErrorCode.PROVIDER_AUTH_ERROR, provider, "Provider rejected the credential (" + status + ")");
    }
}
