package com.catagent.shared.error;

public class AuthenticationRequiredException extends CatAgentException {
    public AuthenticationRequiredException() {
        super(ErrorCode.AUTHENTICATION_REQUIRED, "Unauthorized");
    }
}
