package com.fractionax.propertyEngine.provider.exception;

import com.fractionax.propertyEngine.provider.ProviderId;

/**
 * Base class of the errors a provider client surfaces to the orchestrator.
 */
public abstract class ProviderException extends RuntimeException {

    private final ProviderId providerId;
    private final String operation;

    protected ProviderException(ProviderId providerId, String operation, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
        this.operation = operation;
    }

    public ProviderId getProviderId() {
        return providerId;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * Whether the failure is worth one immediate retry.
     */
    public abstract boolean isRetryable();
}
