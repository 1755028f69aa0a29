package com.fractionax.propertyEngine.provider.exception;

import com.fractionax.propertyEngine.provider.ProviderId;

/**
 * Exception thrown when a provider call times out or the connection fails.
 */
public class ProviderTimeoutException extends ProviderException {

    public ProviderTimeoutException(ProviderId providerId, String operation, Throwable cause) {
        super(providerId, operation,
                providerId + " " + operation + " timed out or was unreachable: "
                        + (cause != null ? cause.getMessage() : "no response"),
                cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
