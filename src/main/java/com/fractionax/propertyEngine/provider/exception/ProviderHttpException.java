package com.fractionax.propertyEngine.provider.exception;

import com.fractionax.propertyEngine.provider.ProviderId;

/**
 * Exception thrown when a provider answers with an HTTP error status.
 */
public class ProviderHttpException extends ProviderException {

    private final int status;

    public ProviderHttpException(ProviderId providerId, String operation, int status) {
        this(providerId, operation, status, null);
    }

    public ProviderHttpException(ProviderId providerId, String operation, int status, Throwable cause) {
        super(providerId, operation,
                providerId + " " + operation + " failed with HTTP status " + status, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    @Override
    public boolean isRetryable() {
        return status >= 500;
    }
}
