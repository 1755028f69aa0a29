package com.fractionax.propertyEngine.auth.exception;

import com.fractionax.propertyEngine.provider.ProviderId;

/**
 * Exception thrown when a provider access token cannot be obtained: the provider rejected
 * the client credentials or the token endpoint was unreachable.
 */
public class AuthException extends RuntimeException {

    private final ProviderId providerId;

    public AuthException(ProviderId providerId, String message) {
        super(message);
        this.providerId = providerId;
    }

    public AuthException(ProviderId providerId, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }

    public ProviderId getProviderId() {
        return providerId;
    }
}
